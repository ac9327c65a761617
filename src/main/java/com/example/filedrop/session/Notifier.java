package com.example.filedrop.session;

import com.example.filedrop.protocol.Frames;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Routes note, file and settings frames to the addressed sessions. Works on a
 * roster snapshot; sends happen outside the registry lock.
 */
public class Notifier {

    private final SessionRegistry registry;

    public Notifier(SessionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Empty {@code to} means every other session. Ids not in the roster are
     * skipped, and the sender never gets its own note.
     *
     * @return number of sessions the note was handed to
     */
    public int sendNote(Session from, String text, List<String> to) {
        List<Session> recipients = noteRecipients(from, to);
        String frame = Frames.note(from, text, to, System.currentTimeMillis() / 1000).toString();
        for (Session s : recipients) {
            registry.sendTo(s, frame);
        }
        return recipients.size();
    }

    List<Session> noteRecipients(Session from, List<String> to) {
        Set<String> wanted = to == null ? Set.of() : new HashSet<>(to);
        List<Session> out = new ArrayList<>();
        for (Session s : registry.list()) {
            if (s.sessionId.equals(from.sessionId)) continue;
            if (!wanted.isEmpty() && !wanted.contains(s.sessionId)) continue;
            out.add(s);
        }
        return out;
    }

    /**
     * Every receive-capable session of the targeted devices (all devices when
     * {@code targetDeviceIds} is empty), minus the uploader's own device.
     */
    public List<Session> fileRecipients(String uploaderDeviceId, List<String> targetDeviceIds) {
        Set<String> targets = targetDeviceIds == null ? Set.of() : new HashSet<>(targetDeviceIds);
        List<Session> out = new ArrayList<>();
        for (Session s : registry.list()) {
            if (!s.canReceive()) continue;
            if (uploaderDeviceId != null && uploaderDeviceId.equals(s.deviceId)) continue;
            if (!targets.isEmpty() && !targets.contains(s.deviceId)) continue;
            out.add(s);
        }
        return out;
    }

    public int notifyFile(String name, long size, String from, String uploaderDeviceId, List<String> targetDeviceIds) {
        List<Session> recipients = fileRecipients(uploaderDeviceId, targetDeviceIds);
        String frame = Frames.file(name, size, from, uploaderDeviceId, targetDeviceIds, System.currentTimeMillis() / 1000).toString();
        for (Session s : recipients) {
            registry.sendTo(s, frame);
        }
        return recipients.size();
    }

    public void broadcastSettings(String saveDir, boolean requiresCode) {
        String frame = Frames.settings(saveDir, requiresCode).toString();
        for (Session s : registry.list()) {
            registry.sendTo(s, frame);
        }
    }
}
