package com.example.filedrop.session;

import com.example.filedrop.access.AccessControl;
import com.example.filedrop.core.Settings;
import com.example.filedrop.protocol.Errors;
import com.example.filedrop.protocol.Frames;
import com.example.filedrop.protocol.InboundMessage;
import com.example.filedrop.protocol.ProtocolException;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-connection state machine: {@code CONNECTING -> HANDSHAKING -> ACTIVE -> CLOSED}.
 * The transport delivers messages for one connection in order; a close may
 * arrive from another thread at any time.
 */
public class ProtocolHandler {

    public enum State {
        CONNECTING,
        HANDSHAKING,
        ACTIVE,
        CLOSED
    }

    private final Transport transport;
    private final SessionRegistry registry;
    private final Notifier notifier;
    private final AccessControl access;
    private final AtomicReference<State> state = new AtomicReference<>(State.CONNECTING);

    private volatile Session session;

    public ProtocolHandler(Transport transport, SessionRegistry registry, Notifier notifier, AccessControl access) {
        this.transport = transport;
        this.registry = registry;
        this.notifier = notifier;
        this.access = access;
    }

    public State state() {
        return state.get();
    }

    public Session session() {
        return session;
    }

    public void onOpen() {
        if (state.compareAndSet(State.CONNECTING, State.HANDSHAKING)) {
            System.out.println("Connection opened: " + transport.remoteAddress());
        }
    }

    public void onMessage(String raw) {
        State current = state.get();
        if (current == State.HANDSHAKING) {
            handleHandshake(raw);
        } else if (current == State.ACTIVE) {
            handleActive(raw);
        }
    }

    public void onClose() {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) return;
        Session s = session;
        if (previous == State.ACTIVE && s != null) {
            registry.unregister(s.sessionId);
        }
        System.out.println("Connection closed: " + transport.remoteAddress());
    }

    private void handleHandshake(String raw) {
        InboundMessage msg;
        try {
            msg = InboundMessage.parse(raw);
        } catch (ProtocolException e) {
            closeWithError(e.code(), e.getMessage(), e.closeCode());
            return;
        }
        if (!(msg instanceof InboundMessage.Hello hello)) {
            closeWithError(Errors.BAD_MESSAGE, "Expected hello", Settings.CLOSE_PROTOCOL_ERROR);
            return;
        }
        if (!access.validateHandshake(hello.code)) {
            System.out.println("Handshake rejected (bad code): " + transport.remoteAddress());
            closeWithError(Errors.UNAUTHORIZED, "Invalid access code", Settings.CLOSE_POLICY_VIOLATION);
            return;
        }

        String deviceId = hello.deviceId == null || hello.deviceId.isBlank()
                ? UUID.randomUUID().toString()
                : hello.deviceId.trim();
        Session s = registry.register(
                deviceId,
                sanitizeName(hello.name),
                hello.canReceive,
                transport.ownerOrigin(),
                transport,
                registered -> Frames.welcome(registered, access.requiresCode()).toString()
        );
        session = s;
        if (!state.compareAndSet(State.HANDSHAKING, State.ACTIVE)) {
            // closed while registering
            registry.unregister(s.sessionId);
        }
    }

    private void handleActive(String raw) {
        InboundMessage msg;
        try {
            msg = InboundMessage.parse(raw);
        } catch (ProtocolException e) {
            closeWithError(e.code(), e.getMessage(), e.closeCode());
            return;
        }
        Session s = session;

        if (msg instanceof InboundMessage.Note note) {
            notifier.sendNote(s, truncate(note.text, Settings.MAX_NOTE_LENGTH), note.to);
        } else if (msg instanceof InboundMessage.Mode mode) {
            registry.updateCapability(s.sessionId, mode.canReceive);
        } else if (msg instanceof InboundMessage.Kick kick) {
            handleKick(s, kick);
        } else if (msg instanceof InboundMessage.Ping) {
            registry.sendTo(s, Frames.pong().toString());
        } else {
            closeWithError(Errors.BAD_MESSAGE, "Unexpected " + msg.kind(), Settings.CLOSE_PROTOCOL_ERROR);
        }
    }

    // Denied kicks are answered with an error; the sender stays connected.
    private void handleKick(Session sender, InboundMessage.Kick kick) {
        if (!sender.admin) {
            registry.sendTo(sender, Errors.buildError(Errors.FORBIDDEN, "Only the host can remove clients").toString());
            return;
        }
        if (!access.validateHandshake(kick.code)) {
            registry.sendTo(sender, Errors.buildError(Errors.UNAUTHORIZED, "Invalid access code").toString());
            return;
        }
        if (kick.target == null) return;
        registry.kick(kick.target, Settings.CLOSE_KICKED);
    }

    private void closeWithError(String code, String detail, int closeCode) {
        State previous = state.getAndSet(State.CLOSED);
        if (previous == State.CLOSED) return;
        try {
            transport.send(Errors.buildError(code, detail).toString());
        } catch (IOException e) {
            System.err.println("Could not send error to " + transport.remoteAddress() + ": " + e.getMessage());
        } finally {
            transport.close(closeCode, detail);
        }
        Session s = session;
        if (previous == State.ACTIVE && s != null) {
            registry.unregister(s.sessionId);
        }
        System.out.println("Protocol error from " + transport.remoteAddress() + ": " + detail);
    }

    static String sanitizeName(String name) {
        String n = name == null ? "" : name.trim();
        if (n.isEmpty()) return Settings.DEFAULT_NAME;
        return truncate(n, Settings.MAX_NAME_LENGTH);
    }

    private static String truncate(String s, int max) {
        if (s == null) return "";
        return s.length() <= max ? s : s.substring(0, max);
    }
}
