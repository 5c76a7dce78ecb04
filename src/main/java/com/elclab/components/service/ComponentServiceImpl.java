package com.elclab.components.service;

import com.elclab.components.domain.Component;
import com.elclab.components.domain.ComponentUpdate;
import com.elclab.components.repository.ComponentRepository;
import com.elclab.components.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link ComponentService}, validating input and delegating
 * persistence to a {@link ComponentRepository}.
 *
 * <p>All field errors are collected before throwing so the caller sees
 * every problem at once. The uniqueness check runs only once the
 * identifier itself is well formed.
 */
public class ComponentServiceImpl implements ComponentService {

    private static final Logger log = LoggerFactory.getLogger(ComponentServiceImpl.class);

    // -----------------------------------------------------------------------
    // VALIDATION CONSTANTS
    // -----------------------------------------------------------------------

    static final int IDENTIFIER_MAX_LENGTH  = 64;
    static final int DESCRIPTION_MAX_LENGTH = 500;

    private final ComponentRepository repository;

    public ComponentServiceImpl(ComponentRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("ComponentRepository must not be null.");
        }
        this.repository = repository;
        log.debug("ComponentServiceImpl instantiated with repository: {}",
                repository.getClass().getSimpleName());
    }

    // -----------------------------------------------------------------------
    // WRITE OPERATIONS
    // -----------------------------------------------------------------------

    @Override
    public Component addComponent(Component component) throws ValidationException {
        log.debug("addComponent() called for: {}", component);

        Map<String, String> errors = new LinkedHashMap<>();
        validateIdentifier(component.getIdentifier(), errors);
        validatePrice(component.getPrice(), errors);
        validateDescription(component.getDescription(), errors);
        if (component.getQuantity() < 0) {
            errors.put("quantity", "Quantity must not be negative. Got: "
                    + component.getQuantity() + ".");
        }

        if (!errors.containsKey("identifier")) {
            repository.findByIdentifier(component.getIdentifier()).ifPresent(existing ->
                    errors.put("identifier",
                            "Identifier '" + component.getIdentifier() + "' is already in use."));
        }

        if (!errors.isEmpty()) {
            log.warn("addComponent() validation failed: {}", errors);
            throw new ValidationException(errors);
        }

        Component stored = repository.insert(component);
        AppLogger.logEvent("COMPONENT_ADDED", "identifier=" + stored.getIdentifier());
        return stored;
    }

    @Override
    public Component updateComponent(String identifier, ComponentUpdate update)
            throws ValidationException {
        log.debug("updateComponent() called for '{}'.", identifier);

        Map<String, String> errors = new LinkedHashMap<>();
        if (update.getPrice() != null) {
            validatePrice(update.getPrice(), errors);
        }
        if (update.isDescriptionSet()) {
            validateDescription(update.getDescription(), errors);
        }
        if (update.getQuantity() != null && update.getQuantity() < 0) {
            errors.put("quantity", "Quantity must not be negative.");
        }
        if (!errors.isEmpty()) {
            log.warn("updateComponent() validation failed for '{}': {}", identifier, errors);
            throw new ValidationException(errors);
        }

        Component updated = repository.update(identifier, update)
                .orElseThrow(() -> new NotFoundException("identifier", identifier));
        log.info("Component '{}' updated.", identifier);
        return updated;
    }

    @Override
    public Component adjustStock(String identifier, int delta) throws NotFoundException {
        Component updated = repository.adjustQuantity(identifier, delta)
                .orElseThrow(() -> new NotFoundException("identifier", identifier));
        if (updated.getQuantity() < 0) {
            AppLogger.logWarningEvent("STOCK_NEGATIVE",
                    "identifier=" + identifier + ", quantity=" + updated.getQuantity());
        } else {
            AppLogger.logEvent("STOCK_ADJUSTED",
                    "identifier=" + identifier + ", delta=" + delta
                            + ", quantity=" + updated.getQuantity());
        }
        return updated;
    }

    // -----------------------------------------------------------------------
    // READ OPERATIONS
    // -----------------------------------------------------------------------

    @Override
    public Component getByIdentifier(String identifier) throws NotFoundException {
        return repository.findByIdentifier(identifier)
                .orElseThrow(() -> new NotFoundException("identifier", identifier));
    }

    @Override
    public Optional<Component> findByIdentifier(String identifier) {
        return repository.findByIdentifier(identifier);
    }

    @Override
    public List<Component> getAllComponents() {
        return repository.findAll();
    }

    @Override
    public List<Component> searchComponents(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return repository.findAll();
        }
        return repository.search(keyword);
    }

    @Override
    public int getComponentCount() {
        return repository.countAll();
    }

    // -----------------------------------------------------------------------
    // FIELD VALIDATORS
    // -----------------------------------------------------------------------

    private void validateIdentifier(String identifier, Map<String, String> errors) {
        if (identifier == null || identifier.isBlank()) {
            errors.put("identifier", "Identifier must not be blank.");
            return;
        }
        if (identifier.length() > IDENTIFIER_MAX_LENGTH) {
            errors.put("identifier",
                    "Identifier must not exceed " + IDENTIFIER_MAX_LENGTH
                    + " characters. Got: " + identifier.length() + ".");
        }
    }

    private void validatePrice(BigDecimal price, Map<String, String> errors) {
        if (price == null) {
            errors.put("price", "Price is required.");
        } else if (!Component.isPriceInRange(price)) {
            errors.put("price", "Price is out of range.");
        } else if (price.signum() < 0) {
            errors.put("price", "Price must not be negative. Got: " + price.toPlainString() + ".");
        }
    }

    private void validateDescription(String description, Map<String, String> errors) {
        if (description != null && description.length() > DESCRIPTION_MAX_LENGTH) {
            errors.put("description",
                    "Description must not exceed " + DESCRIPTION_MAX_LENGTH + " characters.");
        }
    }
}
