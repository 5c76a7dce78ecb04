package com.elclab.components.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Describes which fields of an existing component to overwrite.
 *
 * <p>A null price or quantity leaves the stored value as it is. The
 * description is written only when {@link #isDescriptionSet()} is true,
 * in which case a null description clears it.
 */
public final class ComponentUpdate {

    private final boolean    descriptionSet;
    private final String     description;
    private final BigDecimal price;
    private final Integer    quantity;

    private ComponentUpdate(boolean descriptionSet, String description,
                            BigDecimal price, Integer quantity) {
        if (price != null && price.signum() < 0) {
            throw new IllegalArgumentException("price must not be negative: " + price);
        }
        this.descriptionSet = descriptionSet;
        this.description    = Component.normaliseDescription(description);
        this.price          = price;
        this.quantity       = quantity;
    }

    /**
     * Overwrites both price and description. Used when an imported record
     * carries a strictly higher price.
     *
     * @param description new description, null to clear
     * @param price       new price, not null
     * @return the update
     */
    public static ComponentUpdate priceAndDescription(String description, BigDecimal price) {
        Objects.requireNonNull(price, "price");
        return new ComponentUpdate(true, description, price, null);
    }

    /**
     * Overwrites only the description.
     *
     * @param description new description, null to clear
     * @return the update
     */
    public static ComponentUpdate descriptionOnly(String description) {
        return new ComponentUpdate(true, description, null, null);
    }

    /**
     * Full manual edit of the editable fields.
     *
     * @param description new description, null to clear
     * @param price       new price, not null
     * @param quantity    new stock level
     * @return the update
     */
    public static ComponentUpdate of(String description, BigDecimal price, int quantity) {
        Objects.requireNonNull(price, "price");
        return new ComponentUpdate(true, description, price, quantity);
    }

    public boolean isDescriptionSet() { return descriptionSet; }
    public String getDescription()    { return description; }
    public BigDecimal getPrice()      { return price; }
    public Integer getQuantity()      { return quantity; }

    /**
     * Applies this update to an in-memory component.
     *
     * @param target component to modify
     */
    public void applyTo(Component target) {
        if (descriptionSet) {
            target.setDescription(description);
        }
        if (price != null) {
            target.setPrice(price);
        }
        if (quantity != null) {
            target.setQuantity(quantity);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComponentUpdate other)) return false;
        return descriptionSet == other.descriptionSet
                && Objects.equals(description, other.description)
                && (price == null ? other.price == null
                        : other.price != null && price.compareTo(other.price) == 0)
                && Objects.equals(quantity, other.quantity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(descriptionSet, description,
                price == null ? null : price.stripTrailingZeros(), quantity);
    }

    @Override
    public String toString() {
        return "ComponentUpdate{"
                + (descriptionSet ? "description='" + description + "', " : "")
                + (price != null ? "price=" + price + ", " : "")
                + (quantity != null ? "quantity=" + quantity : "")
                + "}";
    }
}
