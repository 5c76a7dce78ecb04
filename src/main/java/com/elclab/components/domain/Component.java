package com.elclab.components.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Component - Core Domain Entity
 *
 * <p>One row of the component catalog. The {@code identifier} is the business
 * key: it is unique across the catalog and compared case-sensitively. The
 * surrogate {@code id} is assigned by the store and is only used to address
 * link rows.
 *
 * <p>FIELD OVERVIEW:
 * <pre>
 *   id           Auto-incremented surrogate PK from SQLite (0 = unsaved)
 *   identifier   Business key, e.g. "R10K", "LM317", "74LS00"
 *   description  Optional free text; absent is null, never ""
 *   price        Non-negative unit price
 *   quantity     Units in stock (may go negative through stock tracking)
 *   categoryId   Current category (denormalised from the link table), or null
 *   categoryName Display name of the current category, or null
 *   createdAt    Set by the store on insert
 *   updatedAt    Set by the store on every write
 * </pre>
 *
 * <p>The current category is a cache of the link table maintained by the
 * repositories inside the same transaction as the link writes. It is never
 * written directly by callers.
 */
public class Component {

    /**
     * Format used to persist timestamps as TEXT in SQLite.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /** Most digits a price may carry before or after the decimal point. */
    public static final int PRICE_MAX_DIGITS = 18;

    private int id;
    private String identifier = "";
    private String description;
    private BigDecimal price = BigDecimal.ZERO;
    private int quantity;
    private Integer categoryId;
    private String categoryName;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /**
     * Creates an empty, unsaved component.
     */
    public Component() {
    }

    /**
     * Creates an unsaved component with the fields a caller supplies on a
     * manual add or an import insert.
     *
     * @param identifier  business key
     * @param description optional description (blank is treated as absent)
     * @param price       unit price
     * @param quantity    initial stock
     */
    public Component(String identifier, String description,
                     BigDecimal price, int quantity) {
        setIdentifier(identifier);
        setDescription(description);
        setPrice(price);
        setQuantity(quantity);
    }

    // -----------------------------------------------------------------------
    // GETTERS
    // -----------------------------------------------------------------------

    /** @return surrogate DB key (0 if not yet persisted) */
    public int getId()                    { return id; }

    /** @return business identifier */
    public String getIdentifier()         { return identifier; }

    /** @return description, or null when absent */
    public String getDescription()        { return description; }

    /** @return unit price, never null */
    public BigDecimal getPrice()          { return price; }

    /** @return units in stock */
    public int getQuantity()              { return quantity; }

    /** @return id of the current category, or null when unset */
    public Integer getCategoryId()        { return categoryId; }

    /** @return name of the current category, or null when unset */
    public String getCategoryName()       { return categoryName; }

    /** @return store-assigned creation timestamp */
    public LocalDateTime getCreatedAt()   { return createdAt; }

    /** @return store-assigned last-modification timestamp */
    public LocalDateTime getUpdatedAt()   { return updatedAt; }

    /**
     * Returns true if this component carries a description.
     *
     * @return true when the description is present
     */
    public boolean hasDescription() {
        return description != null;
    }

    /**
     * Returns true if the component currently points at a category.
     *
     * @return true when a current category is set
     */
    public boolean hasCategory() {
        return categoryId != null;
    }

    // -----------------------------------------------------------------------
    // SETTERS
    // -----------------------------------------------------------------------

    /** @param id surrogate DB key */
    public void setId(int id) { this.id = id; }

    /** @param identifier business key (trimmed; null becomes "") */
    public void setIdentifier(String identifier) {
        this.identifier = identifier == null ? "" : identifier.trim();
    }

    /** @param description description text; null or blank is stored as absent */
    public void setDescription(String description) {
        this.description = normaliseDescription(description);
    }

    /** @param price unit price; null is treated as zero */
    public void setPrice(BigDecimal price) {
        this.price = price == null ? BigDecimal.ZERO : price;
    }

    /** @param quantity units in stock */
    public void setQuantity(int quantity) { this.quantity = quantity; }

    /** @param categoryId current category id, or null */
    public void setCategoryId(Integer categoryId) { this.categoryId = categoryId; }

    /** @param categoryName current category display name, or null */
    public void setCategoryName(String categoryName) { this.categoryName = categoryName; }

    /** @param createdAt creation timestamp */
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    /** @param updatedAt last-modification timestamp */
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    // -----------------------------------------------------------------------
    // CONVENIENCE METHODS
    // -----------------------------------------------------------------------

    /**
     * Returns the price with two decimal places for display.
     *
     * @return price string (e.g., "0.05")
     */
    public String getPriceFormatted() {
        return price.setScale(2, java.math.RoundingMode.HALF_UP).toPlainString();
    }

    /**
     * Trims a description and maps empty text to absent.
     *
     * @param description raw description
     * @return trimmed description, or null if nothing is left
     */
    public static String normaliseDescription(String description) {
        if (description == null) {
            return null;
        }
        String trimmed = description.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Checks that a price can be stored as plain decimal text.
     *
     * @param price price to check, not null
     * @return false if the integer part or the fraction has more than
     *         {@link #PRICE_MAX_DIGITS} digits
     */
    public static boolean isPriceInRange(BigDecimal price) {
        long integerDigits = (long) price.precision() - price.scale();
        return integerDigits <= PRICE_MAX_DIGITS && price.scale() <= PRICE_MAX_DIGITS;
    }

    // -----------------------------------------------------------------------
    // OBJECT IDENTITY
    // -----------------------------------------------------------------------

    /**
     * Components are equal when they share the same identifier.
     *
     * @param o the other object
     * @return true if both components share the same identifier
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Component other)) return false;
        return Objects.equals(identifier, other.identifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier);
    }

    @Override
    public String toString() {
        return "Component{" +
               "id=" + id +
               ", identifier='" + identifier + '\'' +
               ", price=" + price +
               ", quantity=" + quantity +
               ", description=" + (description == null ? "<absent>" : "'" + description + "'") +
               ", category=" + (categoryName == null ? "<unset>" : categoryName) +
               '}';
    }
}
