package com.elclab.components.service;

import com.elclab.components.domain.Category;

import java.util.List;
import java.util.Optional;

/**
 * CategoryService - creation and editing of categories.
 *
 * <p>Deleting a category is a {@link LinkManager} operation because it
 * must also remove links and recompute current categories.
 */
public interface CategoryService {

    /**
     * @param name        required, at most 100 characters, unique ignoring case
     * @param description optional
     * @return the stored category
     * @throws DuplicateNameException if the name is already taken
     * @throws ValidationException    if the name is blank or too long
     */
    Category createCategory(String name, String description) throws ValidationException;

    /**
     * Renames and/or re-describes a category.
     *
     * @throws NotFoundException      if no category has that id
     * @throws DuplicateNameException if another category already has the name
     * @throws ValidationException    if the name is blank or too long
     */
    Category updateCategory(int id, String name, String description) throws ValidationException;

    /** @throws NotFoundException if no category has that id */
    Category getById(int id) throws NotFoundException;

    Optional<Category> findByName(String name);

    List<Category> getAllCategories();

    /**
     * Creates every standard category that does not exist yet.
     *
     * @return number of categories created
     */
    int seedStandardCategories();
}
