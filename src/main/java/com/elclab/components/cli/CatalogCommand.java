package com.elclab.components.cli;

import com.elclab.components.repository.RepositoryException;
import com.elclab.components.service.ValidationException;
import com.elclab.components.util.DatabaseManager;
import com.elclab.components.util.ImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Base class of the catalog subcommands.
 *
 * <p>Opens a {@link CatalogContext} for the invocation and maps failures
 * to exit codes: {@value #EXIT_OK} on success, {@value #EXIT_BUSINESS_ERROR}
 * for validation, not-found and duplicate-name errors, and
 * {@value #EXIT_STORE_ERROR} for import and storage failures.
 */
abstract class CatalogCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CatalogCommand.class);

    static final int EXIT_OK             = 0;
    static final int EXIT_BUSINESS_ERROR = 1;
    static final int EXIT_STORE_ERROR    = 2;

    @ParentCommand
    CatalogCli root;

    @Spec
    CommandSpec spec;

    @Override
    public final Integer call() {
        try (CatalogContext context = root.openContext()) {
            return execute(context);
        } catch (ValidationException ex) {
            printFieldErrors(ex.getFieldErrors());
            return EXIT_BUSINESS_ERROR;
        } catch (ImportException ex) {
            err().println("Import failed: " + ex.getMessage());
            if (ex.getPartialReport().getTotalRows() > 0) {
                err().println("Rows processed before the failure: " + ex.getPartialReport().getSummary());
            }
            return EXIT_STORE_ERROR;
        } catch (RepositoryException | DatabaseManager.DatabaseInitException ex) {
            log.error("Storage failure in '{}'.", spec.name(), ex);
            err().println("Storage error: " + ex.getMessage());
            return EXIT_STORE_ERROR;
        }
    }

    /**
     * Runs the command against an open catalog.
     *
     * @return exit code
     */
    protected abstract int execute(CatalogContext context)
            throws ValidationException, ImportException;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    private void printFieldErrors(Map<String, String> errors) {
        errors.forEach((field, message) -> err().println("Error: " + message));
    }
}
