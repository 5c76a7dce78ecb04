package com.elclab.components.service;

import com.elclab.components.domain.Component;
import com.elclab.components.domain.ComponentUpdate;

import java.util.List;
import java.util.Optional;

/**
 * ComponentService - manual maintenance of catalog components.
 *
 * <p>Bulk loading goes through the CSV import path and the reconciliation
 * rules instead; this service is the validated single-record path used by
 * the command line. Deleting a component is a {@link LinkManager}
 * operation because it must also remove links.
 */
public interface ComponentService {

    /**
     * Validates and persists a new component.
     *
     * <p>Rules: identifier required and at most 64 characters, price
     * present and non-negative, quantity non-negative, identifier not
     * already in use.
     *
     * @param component the component to add
     * @return the stored component with its id
     * @throws ValidationException listing every rule that failed
     */
    Component addComponent(Component component) throws ValidationException;

    /**
     * @param identifier business key of the component to edit
     * @param update     fields to overwrite
     * @return the component as now stored
     * @throws NotFoundException   if no component has that identifier
     * @throws ValidationException if the update carries invalid values
     */
    Component updateComponent(String identifier, ComponentUpdate update) throws ValidationException;

    /**
     * Adds {@code delta} units to stock. Stock may go negative to record
     * back orders.
     *
     * @throws NotFoundException if no component has that identifier
     */
    Component adjustStock(String identifier, int delta) throws NotFoundException;

    /**
     * @throws NotFoundException if no component has that identifier
     */
    Component getByIdentifier(String identifier) throws NotFoundException;

    Optional<Component> findByIdentifier(String identifier);

    List<Component> getAllComponents();

    /** @param keyword matched against identifier, description and category name */
    List<Component> searchComponents(String keyword);

    int getComponentCount();
}
