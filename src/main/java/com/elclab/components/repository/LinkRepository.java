package com.elclab.components.repository;

import com.elclab.components.domain.Category;
import com.elclab.components.domain.CategoryLink;
import com.elclab.components.domain.Component;

import java.util.List;
import java.util.Optional;

/**
 * Record Store contract for the component/category association.
 *
 * <p>Every write keeps {@code components.category_id}, the cached current
 * category, consistent with the link rows inside the same transaction.
 */
public interface LinkRepository {

    /**
     * Creates the link and makes the category the component's current
     * category. An existing link is left as it is.
     *
     * @return true if a link was created
     * @throws RepositoryException if either side does not exist
     */
    boolean link(int componentId, int categoryId);

    /**
     * Removes the link if present. When it was the current category, the
     * most recently linked remaining category becomes current, or none.
     *
     * @return true if a link was removed
     */
    boolean unlink(int componentId, int categoryId);

    Optional<CategoryLink> findLink(int componentId, int categoryId);

    /** @return categories linked to the component, most recently linked first */
    List<Category> categoriesFor(int componentId);

    /** @return components linked to the category, ordered by identifier */
    List<Component> componentsFor(int categoryId);
}
