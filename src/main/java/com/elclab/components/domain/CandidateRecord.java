package com.elclab.components.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * CandidateRecord - a parsed CSV row that has not yet been reconciled
 * against the store.
 *
 * <p>Immutable. The parser guarantees a non-blank identifier and a
 * non-negative price; the description is either trimmed text or null.
 */
public final class CandidateRecord {

    private final String identifier;
    private final BigDecimal price;
    private final String description;

    /**
     * @param identifier  business key; must not be blank
     * @param price       non-negative price
     * @param description description, or null when absent
     * @throws IllegalArgumentException if the identifier is blank or the
     *         price is null or negative
     */
    public CandidateRecord(String identifier, BigDecimal price, String description) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Candidate identifier must not be blank.");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException(
                    "Candidate price must be non-negative, got: " + price);
        }
        this.identifier  = identifier.trim();
        this.price       = price;
        this.description = Component.normaliseDescription(description);
    }

    public String getIdentifier()  { return identifier; }
    public BigDecimal getPrice()   { return price; }
    public String getDescription() { return description; }

    public boolean hasDescription() {
        return description != null;
    }

    /**
     * Builds the unsaved component this candidate becomes when it is
     * inserted. New components start with zero stock.
     *
     * @return a new unsaved {@link Component}
     */
    public Component toComponent() {
        return new Component(identifier, description, price, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateRecord other)) return false;
        return identifier.equals(other.identifier)
               && price.compareTo(other.price) == 0
               && Objects.equals(description, other.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, price.stripTrailingZeros(), description);
    }

    @Override
    public String toString() {
        return "CandidateRecord{identifier='" + identifier + "'"
               + ", price=" + price
               + ", description=" + (description == null ? "<absent>" : "'" + description + "'")
               + "}";
    }
}
