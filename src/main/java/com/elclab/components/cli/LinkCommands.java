package com.elclab.components.cli;

import com.elclab.components.domain.Component;
import com.elclab.components.service.ValidationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * Commands for assigning components to categories.
 */
final class LinkCommands {

    private LinkCommands() {
    }

    @Command(name = "link", description = "Assign a component to a category",
            mixinStandardHelpOptions = true)
    static class Link extends CatalogCommand {

        @Parameters(index = "0", description = "Component identifier")
        String identifier;

        @Parameters(index = "1", description = "Category id")
        int categoryId;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            Component component = context.getComponentService().getByIdentifier(identifier);
            boolean changed = context.getLinkManager().assignCategory(component.getId(), categoryId);
            out().println(changed
                    ? identifier + " assigned to category " + categoryId + "."
                    : identifier + " was already in category " + categoryId + ".");
            return EXIT_OK;
        }
    }

    @Command(name = "unlink", description = "Remove a component from a category",
            mixinStandardHelpOptions = true)
    static class Unlink extends CatalogCommand {

        @Parameters(index = "0", description = "Component identifier")
        String identifier;

        @Parameters(index = "1", description = "Category id")
        int categoryId;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            Component component = context.getComponentService().getByIdentifier(identifier);
            boolean removed = context.getLinkManager().unassignCategory(component.getId(), categoryId);
            out().println(removed
                    ? identifier + " removed from category " + categoryId + "."
                    : identifier + " was not in category " + categoryId + ".");
            return EXIT_OK;
        }
    }

    @Command(name = "links", description = "List the categories of a component",
            mixinStandardHelpOptions = true)
    static class Links extends CatalogCommand {

        @Parameters(index = "0", description = "Component identifier")
        String identifier;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            Component component = context.getComponentService().getByIdentifier(identifier);
            CategoryCommands.printCategories(this,
                    context.getLinkManager().categoriesFor(component.getId()));
            return EXIT_OK;
        }
    }

    @Command(name = "members", description = "List the components of a category",
            mixinStandardHelpOptions = true)
    static class Members extends CatalogCommand {

        @Parameters(index = "0", description = "Category id")
        int categoryId;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            ComponentCommands.printComponents(this,
                    context.getLinkManager().componentsFor(categoryId));
            return EXIT_OK;
        }
    }
}
