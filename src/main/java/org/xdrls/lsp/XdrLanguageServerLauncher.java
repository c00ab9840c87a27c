package org.xdrls.lsp;

import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.xdrls.index.IndexerOptions;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs an {@link XdrLanguageServer} over a pair of streams, normally stdin and stdout.
 */
public final class XdrLanguageServerLauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(XdrLanguageServerLauncher.class);

    private XdrLanguageServerLauncher() {}

    /**
     * Serves until the client sends {@code exit} or closes the input stream.
     *
     * @param options Indexing settings.
     * @param in Messages from the client.
     * @param out Messages to the client.
     * @throws InterruptedException if the serving thread is interrupted.
     */
    public static void serve(IndexerOptions options, InputStream in, OutputStream out) throws InterruptedException {
        CountDownLatch exitRequested = new CountDownLatch(1);
        XdrLanguageServer server = new XdrLanguageServer(options, exitRequested::countDown);
        Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, in, out);
        server.connect(launcher.getRemoteProxy());

        Future<Void> listening = launcher.startListening();
        LOGGER.info("Language server listening.");
        Thread watcher = new Thread(() -> {
            try {
                listening.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (CancellationException e) {
                LOGGER.debug("Message loop cancelled after exit.");
            } catch (ExecutionException e) {
                LOGGER.warn("Message loop ended with an error: {}", e.getCause().getMessage());
            }
            exitRequested.countDown();
        }, "lsp-listener-watch");
        watcher.setDaemon(true);
        watcher.start();

        exitRequested.await();
        listening.cancel(true);
        LOGGER.info("Language server stopped.");
    }
}
