package org.xdrls.lsp;

import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.MessageParams;
import org.eclipse.lsp4j.MessageType;
import org.eclipse.lsp4j.SaveOptions;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.TextDocumentSyncOptions;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.eclipse.lsp4j.jsonrpc.ResponseErrorException;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseError;
import org.eclipse.lsp4j.jsonrpc.messages.ResponseErrorCode;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xdrls.index.IndexerOptions;
import org.xdrls.index.SchemaIndex;
import org.xdrls.index.WorkspaceIndexer;
import org.xdrls.index.WorkspaceInitializationException;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Language server for XDR schema files. {@code initialize} indexes every schema file below
 * the workspace root; afterwards the server answers definition and reference requests.
 */
public class XdrLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger LOGGER = LoggerFactory.getLogger(XdrLanguageServer.class);

    private final SchemaIndex index;
    private final IndexerOptions options;
    private final Executor executor;
    private final XdrTextDocumentService textDocumentService;
    private final XdrWorkspaceService workspaceService = new XdrWorkspaceService();
    private final Runnable onExit;
    private volatile LanguageClient client;

    /**
     * Creates a server with its own empty index.
     * @param options Indexing settings.
     * @param onExit Invoked when the client sends {@code exit}.
     */
    public XdrLanguageServer(IndexerOptions options, Runnable onExit) {
        this(new SchemaIndex(options), options, ForkJoinPool.commonPool(), onExit);
    }

    /**
     * @param index The index to fill and query.
     * @param options Indexing settings.
     * @param executor Runs initialization and queries off the message thread.
     * @param onExit Invoked when the client sends {@code exit}.
     */
    public XdrLanguageServer(SchemaIndex index, IndexerOptions options, Executor executor, Runnable onExit) {
        this.index = index;
        this.options = options;
        this.executor = executor;
        this.onExit = onExit;
        this.textDocumentService = new XdrTextDocumentService(index, options, executor);
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
    }

    @Override
    @SuppressWarnings("deprecation")
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        return CompletableFuture.supplyAsync(() -> {
            Path root = workspaceRoot(params.getRootUri(), params.getWorkspaceFolders());
            try {
                WorkspaceIndexer.IndexSummary summary = index.discoverAndIndex(root);
                LOGGER.info("Initialized with {} indexed schema files.", summary.indexed());
            } catch (WorkspaceInitializationException e) {
                LOGGER.error("Initialization failed: {}", e.getMessage());
                throw initializationError(e.getMessage());
            }
            InitializeResult result = new InitializeResult(capabilities());
            result.setServerInfo(new ServerInfo("xdr-language-server"));
            return result;
        }, executor);
    }

    @Override
    public void initialized(InitializedParams params) {
        LanguageClient current = client;
        if (current != null) {
            current.logMessage(new MessageParams(MessageType.Info, "server initialized!"));
        }
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        onExit.run();
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return textDocumentService;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return workspaceService;
    }

    ServerCapabilities capabilities() {
        ServerCapabilities capabilities = new ServerCapabilities();
        capabilities.setDefinitionProvider(true);
        capabilities.setReferencesProvider(true);
        if (options.reindexOnSave()) {
            TextDocumentSyncOptions sync = new TextDocumentSyncOptions();
            sync.setChange(TextDocumentSyncKind.None);
            sync.setSave(new SaveOptions(true));
            capabilities.setTextDocumentSync(sync);
        } else {
            capabilities.setTextDocumentSync(TextDocumentSyncKind.None);
        }
        return capabilities;
    }

    /**
     * Picks the workspace root: {@code rootUri}, else the first workspace folder.
     */
    private static Path workspaceRoot(String rootUri, List<WorkspaceFolder> folders) {
        String uri = rootUri;
        if (uri == null && folders != null && !folders.isEmpty()) {
            uri = folders.get(0).getUri();
        }
        if (uri == null) {
            throw initializationError("This language server requires root_uri to be set");
        }
        Optional<Path> root = LspConverters.toPath(uri);
        if (root.isEmpty()) {
            throw initializationError("root_uri doesn't seem to be a valid filepath");
        }
        return root.get();
    }

    private static ResponseErrorException initializationError(String message) {
        return new ResponseErrorException(new ResponseError(ResponseErrorCode.InvalidParams, message, null));
    }
}
