package com.elclab.components.cli;

import com.elclab.components.repository.CategoryRepository;
import com.elclab.components.repository.ComponentRepository;
import com.elclab.components.repository.LinkRepository;
import com.elclab.components.repository.SqliteCategoryRepository;
import com.elclab.components.repository.SqliteComponentRepository;
import com.elclab.components.repository.SqliteLinkRepository;
import com.elclab.components.service.CategoryService;
import com.elclab.components.service.CategoryServiceImpl;
import com.elclab.components.service.ComponentService;
import com.elclab.components.service.ComponentServiceImpl;
import com.elclab.components.service.LinkManager;
import com.elclab.components.service.ReconciliationEngine;
import com.elclab.components.util.AppConfig;
import com.elclab.components.util.CsvImporter;
import com.elclab.components.util.DatabaseManager;

import java.nio.file.Path;

/**
 * Wires the catalog's layers together over one database for the duration
 * of a CLI invocation.
 */
public final class CatalogContext implements AutoCloseable {

    private final AppConfig            config;
    private final DatabaseManager      database;
    private final ComponentRepository  componentRepository;
    private final CategoryRepository   categoryRepository;
    private final LinkRepository       linkRepository;
    private final ComponentService     componentService;
    private final CategoryService      categoryService;
    private final LinkManager          linkManager;
    private final ReconciliationEngine reconciliationEngine;

    private CatalogContext(AppConfig config, DatabaseManager database) {
        this.config               = config;
        this.database             = database;
        this.componentRepository  = new SqliteComponentRepository(database);
        this.categoryRepository   = new SqliteCategoryRepository(database);
        this.linkRepository       = new SqliteLinkRepository(database);
        this.componentService     = new ComponentServiceImpl(componentRepository);
        this.categoryService      = new CategoryServiceImpl(categoryRepository);
        this.linkManager          = new LinkManager(componentRepository, categoryRepository, linkRepository);
        this.reconciliationEngine = new ReconciliationEngine(componentRepository);
    }

    /**
     * Opens the catalog database and seeds the standard categories when
     * {@code startup.seed.categories} is enabled.
     *
     * @param config     application configuration
     * @param dbOverride database file to use instead of {@code database.path}; may be null
     * @return the wired context; close it to release the database
     */
    public static CatalogContext open(AppConfig config, Path dbOverride) {
        Path dbPath = dbOverride != null ? dbOverride : config.getDatabasePath();
        CatalogContext context = new CatalogContext(config, new DatabaseManager(dbPath));
        if (config.isSeedCategories()) {
            context.categoryService.seedStandardCategories();
        }
        return context;
    }

    /**
     * @return an importer configured from {@code import.auto.categorize} and
     *         {@code import.write.report}
     */
    public CsvImporter newImporter() {
        CsvImporter importer = new CsvImporter(reconciliationEngine, categoryService, linkManager);
        importer.setAutoCategorize(config.isAutoCategorize());
        importer.setWriteReportFile(config.isWriteImportReport());
        return importer;
    }

    public DatabaseManager getDatabase()         { return database; }
    public ComponentService getComponentService() { return componentService; }
    public CategoryService getCategoryService()  { return categoryService; }
    public LinkManager getLinkManager()          { return linkManager; }

    @Override
    public void close() {
        database.shutdown();
    }
}
