package org.xdrls.cli.commands;

import org.xdrls.index.SchemaIndex;
import org.xdrls.index.SourceLocation;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;

@Command(
    name = "references",
    description = "Print every use of the identifier at a position"
)
public class ReferencesCommand extends AbstractQueryCommand {

    @Option(
        names = {"-d", "--include-declaration"},
        description = "Also print the definition site"
    )
    boolean includeDeclaration;

    @Override
    int query(SchemaIndex index, String name, PrintWriter out) {
        Optional<List<SourceLocation>> references = index.referencesOf(name, includeDeclaration);
        if (references.isEmpty()) {
            spec.commandLine().getErr().println("No references to '" + name + "'");
            return 1;
        }
        references.get().forEach(location -> out.println(format(location)));
        return 0;
    }
}
