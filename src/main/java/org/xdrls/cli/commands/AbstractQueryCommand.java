package org.xdrls.cli.commands;

import org.xdrls.cli.CommandLineInterface;
import org.xdrls.index.IndexerOptions;
import org.xdrls.index.SchemaIndex;
import org.xdrls.index.SourceLocation;
import org.xdrls.index.WorkspaceInitializationException;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Shared arguments of the one-shot query commands: index a workspace, then resolve the
 * identifier at a position.
 */
abstract class AbstractQueryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workspace root directory")
    Path root;

    @Parameters(index = "1", description = "Schema file containing the cursor")
    Path file;

    @Parameters(index = "2", description = "Zero-based line")
    int line;

    @Parameters(index = "3", description = "Zero-based column")
    int column;

    @ParentCommand
    CommandLineInterface parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        SchemaIndex index = new SchemaIndex(IndexerOptions.fromConfig(parent.getConfig()));
        try {
            index.discoverAndIndex(root);
        } catch (WorkspaceInitializationException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return CommandLineInterface.EXIT_FATAL;
        }

        Optional<String> name = index.identifierAt(file, line, column);
        if (name.isEmpty()) {
            spec.commandLine().getErr().println("No identifier at " + file + ":" + line + ":" + column);
            return 1;
        }
        return query(index, name.get(), spec.commandLine().getOut());
    }

    /**
     * Runs the query for the identifier under the cursor.
     *
     * @param index The built index.
     * @param name The identifier under the cursor.
     * @param out Where to print results.
     * @return The exit code.
     */
    abstract int query(SchemaIndex index, String name, PrintWriter out);

    static String format(SourceLocation location) {
        return location.file() + ":" + location.startLine() + ":" + location.startColumn() + "-" + location.endColumn();
    }
}
