package org.xdrls.lsp;

import org.eclipse.lsp4j.DefinitionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xdrls.index.IndexerOptions;
import org.xdrls.index.SchemaIndex;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Serves {@code textDocument/definition} and {@code textDocument/references} from the
 * {@link SchemaIndex}. Document contents sent by the client are ignored unless
 * re-indexing on save is enabled.
 */
public class XdrTextDocumentService implements TextDocumentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(XdrTextDocumentService.class);

    private final SchemaIndex index;
    private final IndexerOptions options;
    private final Executor executor;

    public XdrTextDocumentService(SchemaIndex index, IndexerOptions options, Executor executor) {
        this.index = index;
        this.options = options;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Either<List<? extends Location>, List<? extends LocationLink>>> definition(DefinitionParams params) {
        String uri = params.getTextDocument().getUri();
        Position position = params.getPosition();
        return CompletableFuture.supplyAsync(() -> {
            Path file = requireFile(uri);
            return index.identifierAt(file, position.getLine(), position.getCharacter())
                    .flatMap(index::definitionOf)
                    .<Either<List<? extends Location>, List<? extends LocationLink>>>map(
                            location -> Either.forLeft(List.of(LspConverters.toLocation(location))))
                    .orElse(null);
        }, executor);
    }

    @Override
    public CompletableFuture<List<? extends Location>> references(ReferenceParams params) {
        String uri = params.getTextDocument().getUri();
        Position position = params.getPosition();
        boolean includeDeclaration = params.getContext() != null && params.getContext().isIncludeDeclaration();
        return CompletableFuture.supplyAsync(() -> {
            Path file = requireFile(uri);
            return index.identifierAt(file, position.getLine(), position.getCharacter())
                    .flatMap(name -> index.referencesOf(name, includeDeclaration))
                    .map(LspConverters::toLocations)
                    .orElse(null);
        }, executor);
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        // Contents are read from disk at initialization.
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        // Unsaved edits are not indexed.
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        // Nothing is held per open document.
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        if (!options.reindexOnSave()) {
            return;
        }
        Optional<Path> file = LspConverters.toPath(params.getTextDocument().getUri());
        if (file.isEmpty()) {
            LOGGER.debug("Ignoring save of non-file document {}", params.getTextDocument().getUri());
            return;
        }
        boolean reindexed = params.getText() != null
                ? index.reindex(file.get(), params.getText())
                : index.reindex(file.get());
        LOGGER.debug("Save of {} {}", file.get(), reindexed ? "re-indexed" : "left the previous index in place");
    }

    private static Path requireFile(String uri) {
        return LspConverters.toPath(uri).orElseThrow(() -> new ResponseErrorException(
                new ResponseError(ResponseErrorCode.InvalidParams, "Could not open file", uri)));
    }
}
