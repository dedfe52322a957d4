package org.operaton.nostrpub.relay;

import lombok.extern.slf4j.Slf4j;
import org.operaton.nostrpub.config.NostrPubProperties;
import org.operaton.nostrpub.exception.TransportTransientException;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Relay transport on the JDK WebSocket client.
 */
@Component
@Slf4j
public class JdkWebSocketRelayTransport implements RelayTransport {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);

    private final HttpClient httpClient;
    private final String userAgent;

    public JdkWebSocketRelayTransport(NostrPubProperties properties) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .build();
        this.userAgent = properties.getUserAgent();
    }

    @Override
    public CompletableFuture<RelaySocket> connect(String url, RelayListener listener) {
        return httpClient.newWebSocketBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .header("User-Agent", userAgent)
            .buildAsync(URI.create(url), new ListenerAdapter(listener))
            .<RelaySocket>thenApply(JdkRelaySocket::new)
            .exceptionally(error -> {
                throw new TransportTransientException("Cannot connect to " + url, error);
            });
    }

    /**
     * Reassembles partial text frames and requests one message at a time.
     */
    private static final class ListenerAdapter implements WebSocket.Listener {
        private final RelayListener listener;
        private final StringBuilder partial = new StringBuilder();

        private ListenerAdapter(RelayListener listener) {
            this.listener = listener;
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String message = partial.toString();
                partial.setLength(0);
                try {
                    listener.onMessage(message);
                } catch (RuntimeException e) {
                    log.error("Relay listener failed on message", e);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            listener.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            listener.onError(error);
        }
    }

    /**
     * The JDK client rejects a send while the previous one is pending, so sends are chained.
     */
    private static final class JdkRelaySocket implements RelaySocket {
        private final WebSocket webSocket;
        private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

        private JdkRelaySocket(WebSocket webSocket) {
            this.webSocket = webSocket;
        }

        @Override
        public synchronized CompletableFuture<Void> send(String text) {
            CompletableFuture<Void> sent = tail
                .handle((ignored, previousError) -> null)
                .thenCompose(ignored -> webSocket.sendText(text, true))
                .thenApply(ws -> null);
            tail = sent;
            return sent;
        }

        @Override
        public void close() {
            if (!webSocket.isOutputClosed()) {
                webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
            }
            webSocket.abort();
        }
    }
}
