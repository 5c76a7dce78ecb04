package com.elclab.components.repository;

import com.elclab.components.domain.Component;
import com.elclab.components.domain.ComponentUpdate;

import java.util.List;
import java.util.Optional;

/**
 * ComponentRepository - Record Store contract for components.
 *
 * <p>The reconciliation engine and the services depend on this interface,
 * never on the SQLite implementation, so they can be unit tested against
 * a mock.
 *
 * <p>RETURN TYPE STRATEGY:
 * <ul>
 *   <li>Single-result lookups return {@link Optional}.</li>
 *   <li>Multi-result queries return a {@link List}, empty when nothing
 *       matches, never null.</li>
 *   <li>Updates keyed by identifier return {@link Optional}; empty means
 *       no component has that identifier.</li>
 * </ul>
 *
 * <p>All methods throw the unchecked {@link RepositoryException} on any
 * storage failure. Timestamps are always set by the store.
 */
public interface ComponentRepository {

    /**
     * Looks up a component by its exact, case-sensitive identifier.
     *
     * @param identifier business key
     * @return the component, or empty if none exists
     */
    Optional<Component> findByIdentifier(String identifier);

    /**
     * @param id surrogate key
     * @return the component, or empty if none exists
     */
    Optional<Component> findById(int id);

    /**
     * @return every component ordered by identifier
     */
    List<Component> findAll();

    /**
     * Case-insensitive substring match over identifier, description and
     * current category name. A blank keyword returns every component.
     *
     * @param keyword search term
     * @return matching components ordered by identifier
     */
    List<Component> search(String keyword);

    /**
     * Persists a new component. The generated id and both timestamps are
     * written back onto {@code component}.
     *
     * @param component the component to insert
     * @return the same instance, now carrying its id
     * @throws RepositoryException on a duplicate identifier or any SQL error
     */
    Component insert(Component component);

    /**
     * Applies {@code update} to the component with the given identifier
     * and refreshes its {@code updated_at}.
     *
     * @param identifier business key
     * @param update     fields to overwrite
     * @return the updated component, or empty if no such component exists
     */
    Optional<Component> update(String identifier, ComponentUpdate update);

    /**
     * Adds {@code delta} to the stock quantity. The result may be negative
     * (back-ordered stock).
     *
     * @param identifier business key
     * @param delta      units to add, negative to remove
     * @return the updated component, or empty if no such component exists
     */
    Optional<Component> adjustQuantity(String identifier, int delta);

    /**
     * Deletes a component and all of its category links in one transaction.
     *
     * @param identifier business key
     * @return true if a component was deleted
     */
    boolean deleteByIdentifier(String identifier);

    /** @return total number of components */
    int countAll();
}
