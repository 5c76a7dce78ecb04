package com.elclab.components.service;

import com.elclab.components.domain.Category;
import com.elclab.components.domain.StandardCategory;
import com.elclab.components.repository.CategoryRepository;
import com.elclab.components.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Default {@link CategoryService}.
 */
public class CategoryServiceImpl implements CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryServiceImpl.class);

    static final int NAME_MAX_LENGTH = 100;

    private final CategoryRepository repository;

    public CategoryServiceImpl(CategoryRepository repository) {
        if (repository == null) {
            throw new IllegalArgumentException("CategoryRepository must not be null.");
        }
        this.repository = repository;
    }

    @Override
    public Category createCategory(String name, String description) throws ValidationException {
        String trimmed = validateName(name);
        if (repository.findByName(trimmed).isPresent()) {
            throw new DuplicateNameException(trimmed);
        }
        Category stored = repository.insert(new Category(trimmed, description));
        AppLogger.logEvent("CATEGORY_CREATED", "name=" + stored.getName());
        return stored;
    }

    @Override
    public Category updateCategory(int id, String name, String description)
            throws ValidationException {
        Category category = getById(id);
        String trimmed = validateName(name);

        Optional<Category> clash = repository.findByName(trimmed);
        if (clash.isPresent() && clash.get().getId() != id) {
            throw new DuplicateNameException(trimmed);
        }

        category.setName(trimmed);
        category.setDescription(description);
        repository.update(category);
        log.info("Category id={} updated to '{}'.", id, trimmed);
        return category;
    }

    @Override
    public Category getById(int id) throws NotFoundException {
        return repository.findById(id)
                .orElseThrow(() -> new NotFoundException("categoryId", id));
    }

    @Override
    public Optional<Category> findByName(String name) {
        return repository.findByName(name);
    }

    @Override
    public List<Category> getAllCategories() {
        return repository.findAll();
    }

    @Override
    public int seedStandardCategories() {
        int created = 0;
        for (StandardCategory standard : StandardCategory.values()) {
            if (repository.findByName(standard.getDisplayName()).isEmpty()) {
                repository.insert(new Category(standard.getDisplayName(), standard.getDescription()));
                created++;
            }
        }
        if (created > 0) {
            log.info("Seeded {} standard categor{}.", created, created == 1 ? "y" : "ies");
        }
        return created;
    }

    private String validateName(String name) throws ValidationException {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "Category name must not be blank.");
        }
        String trimmed = name.trim();
        if (trimmed.length() > NAME_MAX_LENGTH) {
            throw new ValidationException("name",
                    "Category name must not exceed " + NAME_MAX_LENGTH + " characters.");
        }
        return trimmed;
    }
}
