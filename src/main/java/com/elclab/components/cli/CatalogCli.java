package com.elclab.components.cli;

import ch.qos.logback.classic.Level;
import com.elclab.components.util.AppConfig;
import com.elclab.components.util.AppLogger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Command-line entry point of the component catalog.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code import} - reconcile a CSV file into the catalog</li>
 *   <li>{@code components}, {@code add}, {@code remove}, {@code stock} - components</li>
 *   <li>{@code categories}, {@code category-add}, {@code category-remove} - categories</li>
 *   <li>{@code link}, {@code unlink}, {@code links}, {@code members} - category assignment</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * component-catalog import parts.csv --auto-categorize
 * component-catalog components --search 10k
 * component-catalog --db /tmp/test.db link R10K 1
 * }</pre>
 */
@Command(
    name = "component-catalog",
    mixinStandardHelpOptions = true,
    version = "Component Catalog 1.0.0-SNAPSHOT",
    description = "Electronic component catalog with CSV import reconciliation",
    subcommands = {
        ImportCommand.class,
        ComponentCommands.ListComponents.class,
        ComponentCommands.Add.class,
        ComponentCommands.Remove.class,
        ComponentCommands.Stock.class,
        CategoryCommands.ListCategories.class,
        CategoryCommands.Add.class,
        CategoryCommands.Remove.class,
        LinkCommands.Link.class,
        LinkCommands.Unlink.class,
        LinkCommands.Links.class,
        LinkCommands.Members.class
    }
)
public class CatalogCli implements Runnable {

    @Option(names = "--db", description = "Catalog database file (overrides database.path)")
    Path databasePath;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    boolean verbose;

    @Spec
    CommandSpec spec;

    private final AppConfig config;

    public CatalogCli() {
        this(AppConfig.getInstance());
    }

    /** @param config configuration to run with; tests pass one over a temp file */
    public CatalogCli(AppConfig config) {
        this.config = config;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    CatalogContext openContext() {
        configureLogging();
        CatalogContext context = CatalogContext.open(config, databasePath);
        AppLogger.logStartup(context.getDatabase().getDbPath());
        return context;
    }

    /** {@code -v} wins over {@code logging.level}. */
    private void configureLogging() {
        ch.qos.logback.classic.Logger appLogger = (ch.qos.logback.classic.Logger)
                LoggerFactory.getLogger("com.elclab.components");
        if (verbose) {
            appLogger.setLevel(Level.DEBUG);
        } else {
            appLogger.setLevel(Level.toLevel(config.getString(AppConfig.KEY_LOG_LEVEL), Level.INFO));
        }
    }

    /**
     * Builds the command line for {@code cli}. Unknown option-like arguments
     * are read as positional parameters so {@code stock R10K -5} works.
     *
     * @param cli root command instance
     * @return the configured command line
     */
    public static CommandLine newCommandLine(CatalogCli cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setUnmatchedOptionsArePositionalParams(true);
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        LocalDateTime start = LocalDateTime.now();
        int exitCode = newCommandLine(new CatalogCli()).execute(args);
        AppLogger.logShutdown(start);
        System.exit(exitCode);
    }
}
