package org.xdrls.cli.commands;

import org.xdrls.cli.CommandLineInterface;
import org.xdrls.index.IndexerOptions;
import org.xdrls.lsp.XdrLanguageServerLauncher;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "serve",
    description = "Run the language server on stdin/stdout"
)
public class ServeCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws Exception {
        IndexerOptions options = IndexerOptions.fromConfig(parent.getConfig());
        XdrLanguageServerLauncher.serve(options, System.in, System.out);
        return 0;
    }
}
