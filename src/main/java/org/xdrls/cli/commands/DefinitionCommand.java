package org.xdrls.cli.commands;

import org.xdrls.index.SchemaIndex;
import org.xdrls.index.SourceLocation;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.Optional;

@Command(
    name = "definition",
    description = "Print where the identifier at a position is defined"
)
public class DefinitionCommand extends AbstractQueryCommand {

    @Override
    int query(SchemaIndex index, String name, PrintWriter out) {
        Optional<SourceLocation> definition = index.definitionOf(name);
        if (definition.isEmpty()) {
            spec.commandLine().getErr().println("No definition of '" + name + "'");
            return 1;
        }
        out.println(format(definition.get()));
        return 0;
    }
}
