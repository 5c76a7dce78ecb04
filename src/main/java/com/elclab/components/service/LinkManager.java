package com.elclab.components.service;

import com.elclab.components.domain.Category;
import com.elclab.components.domain.Component;
import com.elclab.components.repository.CategoryRepository;
import com.elclab.components.repository.ComponentRepository;
import com.elclab.components.repository.LinkRepository;
import com.elclab.components.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * LinkManager - maintains the many-to-many association between components
 * and categories and the referential rules around it.
 *
 * <p>INVARIANTS:
 * <ul>
 *   <li>No link references a missing component or category.</li>
 *   <li>A component's current category is always one of its linked
 *       categories (the most recently linked) or unset when it has none.</li>
 * </ul>
 *
 * <p>Assign and unassign are idempotent. Each write, including the
 * current-category maintenance, runs as one store transaction. Missing
 * endpoints are reported as {@link NotFoundException} before anything is
 * written.
 */
public class LinkManager {

    private static final Logger log = LoggerFactory.getLogger(LinkManager.class);

    private final ComponentRepository componentRepository;
    private final CategoryRepository  categoryRepository;
    private final LinkRepository      linkRepository;

    public LinkManager(ComponentRepository componentRepository,
                       CategoryRepository categoryRepository,
                       LinkRepository linkRepository) {
        if (componentRepository == null || categoryRepository == null || linkRepository == null) {
            throw new IllegalArgumentException("Repositories must not be null.");
        }
        this.componentRepository = componentRepository;
        this.categoryRepository  = categoryRepository;
        this.linkRepository      = linkRepository;
    }

    // -----------------------------------------------------------------------
    // ASSIGNMENT
    // -----------------------------------------------------------------------

    /**
     * Links the component to the category and makes it the current category.
     * Assigning an existing link changes nothing, the current category
     * included.
     *
     * @param componentId component surrogate key
     * @param categoryId  category surrogate key
     * @return true if a link was created; false if it already existed
     * @throws NotFoundException if either side does not exist
     */
    public boolean assignCategory(int componentId, int categoryId) throws NotFoundException {
        Component component = requireComponent(componentId);
        Category category = requireCategory(categoryId);

        boolean changed = linkRepository.link(componentId, categoryId);
        if (changed) {
            AppLogger.logEvent("CATEGORY_ASSIGNED",
                    "component=" + component.getIdentifier() + ", category=" + category.getName());
        } else {
            log.debug("assignCategory({}, {}) was a no-op.", componentId, categoryId);
        }
        return changed;
    }

    /**
     * Removes the link. If it was the current category, the most recently
     * linked remaining category becomes current, or none.
     *
     * @return true if a link was removed
     * @throws NotFoundException if either side does not exist
     */
    public boolean unassignCategory(int componentId, int categoryId) throws NotFoundException {
        Component component = requireComponent(componentId);
        Category category = requireCategory(categoryId);

        boolean removed = linkRepository.unlink(componentId, categoryId);
        if (removed) {
            AppLogger.logEvent("CATEGORY_UNASSIGNED",
                    "component=" + component.getIdentifier() + ", category=" + category.getName());
        }
        return removed;
    }

    // -----------------------------------------------------------------------
    // DELETION
    // -----------------------------------------------------------------------

    /**
     * Deletes a component together with all of its links.
     *
     * @throws NotFoundException if the component does not exist
     */
    public void removeComponent(int componentId) throws NotFoundException {
        Component component = requireComponent(componentId);
        componentRepository.deleteByIdentifier(component.getIdentifier());
        AppLogger.logEvent("COMPONENT_REMOVED", "identifier=" + component.getIdentifier());
    }

    /**
     * Deletes a category together with all of its links. Components whose
     * current category it was fall back to their most recently linked
     * remaining category, or none.
     *
     * @throws NotFoundException if the category does not exist
     */
    public void removeCategory(int categoryId) throws NotFoundException {
        Category category = requireCategory(categoryId);
        categoryRepository.delete(categoryId);
        AppLogger.logEvent("CATEGORY_REMOVED", "name=" + category.getName());
    }

    // -----------------------------------------------------------------------
    // QUERIES
    // -----------------------------------------------------------------------

    /** @return linked categories, most recently linked first */
    public List<Category> categoriesFor(int componentId) throws NotFoundException {
        requireComponent(componentId);
        return linkRepository.categoriesFor(componentId);
    }

    /** @return linked components ordered by identifier */
    public List<Component> componentsFor(int categoryId) throws NotFoundException {
        requireCategory(categoryId);
        return linkRepository.componentsFor(categoryId);
    }

    private Component requireComponent(int componentId) throws NotFoundException {
        return componentRepository.findById(componentId)
                .orElseThrow(() -> new NotFoundException("componentId", componentId));
    }

    private Category requireCategory(int categoryId) throws NotFoundException {
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> new NotFoundException("categoryId", categoryId));
    }
}
