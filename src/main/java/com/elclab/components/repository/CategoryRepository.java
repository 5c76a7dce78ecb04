package com.elclab.components.repository;

import com.elclab.components.domain.Category;

import java.util.List;
import java.util.Optional;

/**
 * Record Store contract for categories.
 *
 * <p>Category names are unique without regard to case. All methods throw
 * {@link RepositoryException} on storage failure.
 */
public interface CategoryRepository {

    Optional<Category> findById(int id);

    /**
     * @param name category name, matched case-insensitively
     * @return the category, or empty if none has that name
     */
    Optional<Category> findByName(String name);

    /** @return every category ordered by name */
    List<Category> findAll();

    /**
     * Persists a new category; the generated id and timestamps are written
     * back onto {@code category}.
     *
     * @param category the category to insert
     * @return the same instance
     * @throws RepositoryException on a duplicate name or any SQL error
     */
    Category insert(Category category);

    /**
     * Writes name and description of an existing category.
     *
     * @param category category carrying the id to update
     * @return true if a row was updated
     */
    boolean update(Category category);

    /**
     * Deletes a category together with all of its links, and recomputes the
     * current category of every component that pointed at it. Runs in a
     * single transaction.
     *
     * @param id category id
     * @return true if a category was deleted
     */
    boolean delete(int id);

    int countAll();
}
