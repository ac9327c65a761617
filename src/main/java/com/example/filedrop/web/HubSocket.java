package com.example.filedrop.web;

import com.example.filedrop.access.AccessControl;
import com.example.filedrop.access.OwnerOrigin;
import com.example.filedrop.core.Settings;
import com.example.filedrop.session.Notifier;
import com.example.filedrop.session.ProtocolHandler;
import com.example.filedrop.session.SessionRegistry;
import com.example.filedrop.session.Transport;
import com.example.filedrop.util.Net;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WebSocketException;
import org.eclipse.jetty.websocket.api.WriteCallback;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketConnect;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;

/**
 * Jetty endpoint for {@code /ws}. Each connection gets a {@link ProtocolHandler};
 * the owner-origin flag is fixed here from the socket's peer address.
 */
@WebSocket(maxTextMessageSize = Settings.MAX_MESSAGE_BYTES)
public class HubSocket {

    private final SessionRegistry registry;
    private final Notifier notifier;
    private final AccessControl access;
    private final Map<Session, ProtocolHandler> handlers = new ConcurrentHashMap<>();

    public HubSocket(SessionRegistry registry, Notifier notifier, AccessControl access) {
        this.registry = registry;
        this.notifier = notifier;
        this.access = access;
    }

    @OnWebSocketConnect
    public void onConnect(Session ws) {
        JettyTransport transport = new JettyTransport(ws, OwnerOrigin.isOwner(ws.getRemoteAddress()));
        ProtocolHandler handler = new ProtocolHandler(transport, registry, notifier, access);
        handlers.put(ws, handler);
        handler.onOpen();
    }

    @OnWebSocketMessage
    public void onMessage(Session ws, String text) {
        ProtocolHandler handler = handlers.get(ws);
        if (handler != null) {
            handler.onMessage(text);
        }
    }

    @OnWebSocketClose
    public void onClose(Session ws, int statusCode, String reason) {
        ProtocolHandler handler = handlers.remove(ws);
        if (handler != null) {
            handler.onClose();
        }
    }

    @OnWebSocketError
    public void onError(Session ws, Throwable cause) {
        System.err.println("WebSocket error from " + Net.formatRemote(ws.getRemoteAddress()) + ": " + cause.getMessage());
    }

    /**
     * Adapts a Jetty session to {@link Transport}. Frames wait in a bounded
     * queue and are written one at a time with Jetty's async
     * {@code sendString}, so a peer that stops reading costs its own queue
     * and nothing else.
     */
    static final class JettyTransport implements Transport {

        private final Session ws;
        private final boolean ownerOrigin;
        private final String remote;
        private final Deque<String> outbound = new ArrayDeque<>();
        private final WriteCallback written = new WriteCallback() {
            @Override
            public void writeFailed(Throwable cause) {
                fail(cause);
            }

            @Override
            public void writeSuccess() {
                writeNext();
            }
        };
        private boolean writing;
        private boolean failed;
        // thread inside send(); failures seen there are reported by throwing
        private volatile Thread sender;

        JettyTransport(Session ws, boolean ownerOrigin) {
            this.ws = ws;
            this.ownerOrigin = ownerOrigin;
            this.remote = Net.formatRemote(ws.getRemoteAddress());
        }

        @Override
        public boolean ownerOrigin() {
            return ownerOrigin;
        }

        @Override
        public String remoteAddress() {
            return remote;
        }

        @Override
        public void send(String text) throws IOException {
            synchronized (outbound) {
                if (failed || !ws.isOpen()) throw new IOException("Connection closed");
                if (outbound.size() >= Settings.MAX_OUTBOUND_FRAMES) {
                    failed = true;
                    outbound.clear();
                    throw new IOException("Peer not reading, " + Settings.MAX_OUTBOUND_FRAMES + " frames queued");
                }
                outbound.add(text);
                if (writing) return;
                writing = true;
            }
            sender = Thread.currentThread();
            try {
                writeNext();
            } finally {
                sender = null;
            }
            synchronized (outbound) {
                if (failed) throw new IOException("Send failed");
            }
        }

        private void writeNext() {
            String next;
            synchronized (outbound) {
                next = failed ? null : outbound.poll();
                if (next == null) {
                    writing = false;
                    return;
                }
            }
            try {
                ws.getRemote().sendString(next, written);
            } catch (WebSocketException e) {
                fail(e);
            }
        }

        private void fail(Throwable cause) {
            synchronized (outbound) {
                if (failed && !writing) return;
                failed = true;
                writing = false;
                outbound.clear();
            }
            System.err.println("Send to " + remote + " failed: " + cause.getMessage());
            if (sender != Thread.currentThread()) {
                close(Settings.CLOSE_SEND_FAILED, "Send failed");
            }
        }

        @Override
        public void close(int code, String reason) {
            if (ws.isOpen()) {
                ws.close(code, reason);
            }
        }

        @Override
        public boolean isOpen() {
            return ws.isOpen();
        }
    }
}
