package com.elclab.components.cli;

import com.elclab.components.domain.Component;
import com.elclab.components.service.ComponentService;
import com.elclab.components.service.ValidationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.math.BigDecimal;
import java.util.List;

/**
 * Component maintenance commands.
 */
final class ComponentCommands {

    private ComponentCommands() {
    }

    static void printComponents(CatalogCommand command, List<Component> components) {
        if (components.isEmpty()) {
            command.out().println("No components.");
            return;
        }
        command.out().printf("%-6s %-20s %10s %6s  %-18s %s%n",
                "ID", "IDENTIFIER", "PRICE", "QTY", "CATEGORY", "DESCRIPTION");
        for (Component c : components) {
            command.out().printf("%-6d %-20s %10s %6d  %-18s %s%n",
                    c.getId(),
                    c.getIdentifier(),
                    c.getPrice().toPlainString(),
                    c.getQuantity(),
                    c.hasCategory() ? c.getCategoryName() : "-",
                    c.hasDescription() ? c.getDescription() : "");
        }
    }

    @Command(name = "components", description = "List or search components",
            mixinStandardHelpOptions = true)
    static class ListComponents extends CatalogCommand {

        @Option(names = {"-s", "--search"},
                description = "Match identifier, description or category name")
        String keyword;

        @Override
        protected int execute(CatalogContext context) {
            ComponentService service = context.getComponentService();
            List<Component> found = service.searchComponents(keyword);
            printComponents(this, found);
            if (keyword == null && !found.isEmpty()) {
                out().printf("%d component(s) in the catalog.%n", service.getComponentCount());
            }
            return EXIT_OK;
        }
    }

    @Command(name = "add", description = "Add a component manually",
            mixinStandardHelpOptions = true)
    static class Add extends CatalogCommand {

        @Parameters(index = "0", description = "Component identifier")
        String identifier;

        @Option(names = {"-p", "--price"}, required = true, description = "Unit price")
        BigDecimal price;

        @Option(names = {"-d", "--description"}, description = "Description")
        String description;

        @Option(names = {"-q", "--quantity"}, defaultValue = "0", description = "Initial stock")
        int quantity;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            Component stored = context.getComponentService()
                    .addComponent(new Component(identifier, description, price, quantity));
            out().printf("Added %s (id %d).%n", stored.getIdentifier(), stored.getId());
            return EXIT_OK;
        }
    }

    @Command(name = "remove", description = "Delete a component and its category links",
            mixinStandardHelpOptions = true)
    static class Remove extends CatalogCommand {

        @Parameters(index = "0", description = "Component identifier")
        String identifier;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            Component component = context.getComponentService().getByIdentifier(identifier);
            context.getLinkManager().removeComponent(component.getId());
            out().printf("Removed %s.%n", identifier);
            return EXIT_OK;
        }
    }

    @Command(name = "stock", description = "Adjust stock by a positive or negative delta",
            mixinStandardHelpOptions = true)
    static class Stock extends CatalogCommand {

        @Parameters(index = "0", description = "Component identifier")
        String identifier;

        @Parameters(index = "1", description = "Units to add (negative to remove)")
        int delta;

        @Override
        protected int execute(CatalogContext context) throws ValidationException {
            Component updated = context.getComponentService().adjustStock(identifier, delta);
            out().printf("%s now has %d in stock.%n", identifier, updated.getQuantity());
            return EXIT_OK;
        }
    }
}
