package com.elclab.components.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * CategoryLink - one row of the {@code component_category} table.
 *
 * <p>Immutable value object. Identity is the (componentId, categoryId) pair;
 * {@code linkedAt} is informational and is excluded from equality.
 */
public final class CategoryLink {

    private final int componentId;
    private final int categoryId;
    private final LocalDateTime linkedAt;

    /**
     * @param componentId surrogate id of the linked component
     * @param categoryId  surrogate id of the linked category
     * @param linkedAt    store timestamp of link creation (may be null)
     */
    public CategoryLink(int componentId, int categoryId, LocalDateTime linkedAt) {
        this.componentId = componentId;
        this.categoryId  = categoryId;
        this.linkedAt    = linkedAt;
    }

    public int getComponentId()        { return componentId; }
    public int getCategoryId()         { return categoryId; }
    public LocalDateTime getLinkedAt() { return linkedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoryLink other)) return false;
        return componentId == other.componentId && categoryId == other.categoryId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(componentId, categoryId);
    }

    @Override
    public String toString() {
        return "CategoryLink{component=" + componentId + ", category=" + categoryId + "}";
    }
}
