package com.elclab.components.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Category - Domain Entity
 *
 * <p>A named grouping of components (e.g., "RESISTOR", "IC"). The name is
 * unique across the catalog. Components are attached to categories through
 * link rows; see {@link CategoryLink}.
 */
public class Category {

    private int id;
    private String name = "";
    private String description;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public Category() {
    }

    /**
     * @param name        unique category name
     * @param description optional description
     */
    public Category(String name, String description) {
        setName(name);
        setDescription(description);
    }

    public int getId()                  { return id; }
    public String getName()             { return name; }
    public String getDescription()      { return description; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    public void setId(int id)           { this.id = id; }

    public void setName(String name) {
        this.name = name == null ? "" : name.trim();
    }

    public void setDescription(String description) {
        this.description = Component.normaliseDescription(description);
    }

    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    /**
     * Categories are equal when they share the same name.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Category other)) return false;
        return Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "Category{id=" + id + ", name='" + name + "'}";
    }
}
