package com.example.filedrop.session;

import com.example.filedrop.core.Settings;
import com.example.filedrop.protocol.Frames;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Live set of handshaken sessions. Every mutation and the roster broadcast it
 * causes run under one lock, so broadcasts reach clients in mutation order and
 * each one carries exactly the sessions alive at that point. Sends under the
 * lock only queue frames on the {@link Transport}; they never wait on a peer.
 */
public class SessionRegistry {

    private final Object lock = new Object();
    private final Map<String, Session> sessions = new LinkedHashMap<>();

    /**
     * Adds a session and announces it. {@code greeting}, when non-null, is sent
     * to the new session before the roster broadcast.
     */
    public Session register(
            String deviceId,
            String name,
            boolean canReceive,
            boolean admin,
            Transport transport,
            Function<Session, String> greeting
    ) {
        Session session;
        List<Session> dead = new ArrayList<>();
        synchronized (lock) {
            String id = UUID.randomUUID().toString();
            while (sessions.containsKey(id)) {
                id = UUID.randomUUID().toString();
            }
            session = new Session(id, deviceId, name, canReceive, admin, transport);
            sessions.put(id, session);
            if (greeting != null && !trySend(session, greeting.apply(session))) {
                dead.add(session);
            }
            broadcastRosterLocked(dead);
        }
        closeDead(dead);
        System.out.println("Session registered: " + session + " from " + transport.remoteAddress());
        return session;
    }

    /** Idempotent; only an actual removal is broadcast. */
    public boolean unregister(String sessionId) {
        if (sessionId == null) return false;
        Session removed;
        List<Session> dead = new ArrayList<>();
        synchronized (lock) {
            removed = sessions.remove(sessionId);
            if (removed == null) return false;
            broadcastRosterLocked(dead);
        }
        closeDead(dead);
        System.out.println("Session removed: " + removed);
        return true;
    }

    /**
     * Removes the target and force-closes its transport. The roster broadcast
     * without the target goes out before the close.
     */
    public boolean kick(String sessionId, int closeCode) {
        if (sessionId == null) return false;
        Session removed;
        List<Session> dead = new ArrayList<>();
        synchronized (lock) {
            removed = sessions.remove(sessionId);
            if (removed == null) return false;
            broadcastRosterLocked(dead);
        }
        removed.transport.close(closeCode, "Kicked");
        closeDead(dead);
        System.out.println("Session kicked: " + removed);
        return true;
    }

    public boolean updateCapability(String sessionId, boolean canReceive) {
        List<Session> dead = new ArrayList<>();
        synchronized (lock) {
            Session s = sessions.get(sessionId);
            if (s == null) return false;
            s.canReceive = canReceive;
            broadcastRosterLocked(dead);
        }
        closeDead(dead);
        return true;
    }

    public Session get(String sessionId) {
        if (sessionId == null) return null;
        synchronized (lock) {
            return sessions.get(sessionId);
        }
    }

    public List<Session> list() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(sessions.values()));
        }
    }

    public int size() {
        synchronized (lock) {
            return sessions.size();
        }
    }

    /** Sends one frame; a failing transport is closed and its session dropped. */
    public void sendTo(Session session, String text) {
        if (!trySend(session, text)) {
            closeDead(List.of(session));
        }
    }

    private void broadcastRosterLocked(List<Session> dead) {
        String frame = Frames.clients(sessions.values()).toString();
        for (Session s : sessions.values()) {
            if (!trySend(s, frame) && !dead.contains(s)) {
                dead.add(s);
            }
        }
    }

    private static boolean trySend(Session session, String text) {
        if (!session.transport.isOpen()) return false;
        try {
            session.transport.send(text);
            return true;
        } catch (IOException e) {
            System.err.println("Send to " + session.sessionId + " failed: " + e.getMessage());
            return false;
        }
    }

    private void closeDead(List<Session> dead) {
        for (Session s : dead) {
            s.transport.close(Settings.CLOSE_SEND_FAILED, "Send failed");
            unregister(s.sessionId);
        }
    }
}
