package com.elclab.components.cli;

import com.elclab.components.domain.Category;
import com.elclab.components.service.ValidationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * Category maintenance commands.
 */
final class CategoryCommands {

    private CategoryCommands() {
    }

    static void printCategories(CatalogCommand command, List<Category> categories) {
        if (categories.isEmpty()) {
            command.out().println("No categories.");
            return;
        }
        for (Category c : categories) {
            command.out().printf("%-6d %-20s %s%n", c.getId(), c.getName(),
                    c.getDescription() == null ? "" : c.getDescription());
        }
    }

    @Command(name = "categories", description = "List categories",
            mixinStandardHelpOptions = true)
    static class ListCategories extends CatalogCommand {

        @Override
        protected int execute(CatalogContext context) {
            printCategories(this, context.getCategoryService().getAllCategories());
            return EXIT_OK;
        }
    }

    @Command(name = "category-add", description = "Create a category",
            mixinStandardHelpOptions = true)
    static class Add extends CatalogCommand {

        @Parameters(index = "0", description = "Category name")
        String name;

        @Option(names = {"-d", "--description"}, description = "Description")
        String description;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            Category created = context.getCategoryService().createCategory(name, description);
            out().printf("Created category %s (id %d).%n", created.getName(), created.getId());
            return EXIT_OK;
        }
    }

    @Command(name = "category-remove",
            description = "Delete a category; linked components fall back to their previous category",
            mixinStandardHelpOptions = true)
    static class Remove extends CatalogCommand {

        @Parameters(index = "0", description = "Category id")
        int categoryId;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            context.getLinkManager().removeCategory(categoryId);
            out().printf("Removed category %d.%n", categoryId);
            return EXIT_OK;
        }
    }
}
