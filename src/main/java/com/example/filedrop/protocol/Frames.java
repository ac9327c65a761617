package com.example.filedrop.protocol;

import com.example.filedrop.session.Session;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.Collection;
import java.util.List;

/** Builders for server-to-client frames. */
public final class Frames {

    private Frames() {
    }

    public static JsonObject welcome(Session session, boolean requiresCode) {
        JsonObject frame = frame(MessageType.WELCOME);
        frame.addProperty("session_id", session.sessionId);
        frame.addProperty("name", session.name);
        frame.addProperty("device_id", session.deviceId);
        frame.addProperty("admin", session.admin);
        frame.addProperty("requires_code", requiresCode);
        return frame;
    }

    public static JsonObject clients(Collection<Session> roster) {
        JsonArray items = new JsonArray();
        for (Session s : roster) {
            JsonObject item = new JsonObject();
            item.addProperty("session_id", s.sessionId);
            item.addProperty("device_id", s.deviceId);
            item.addProperty("name", s.name);
            item.addProperty("can_receive", s.canReceive());
            item.addProperty("admin", s.admin);
            items.add(item);
        }
        JsonObject frame = frame(MessageType.CLIENTS);
        frame.add("items", items);
        return frame;
    }

    public static JsonObject note(Session from, String text, List<String> to, long ts) {
        JsonObject frame = frame(MessageType.NOTE);
        frame.addProperty("text", text);
        frame.addProperty("from", from.name);
        frame.addProperty("session_id", from.sessionId);
        frame.addProperty("device_id", from.deviceId);
        if (to != null && !to.isEmpty()) frame.add("to", array(to));
        frame.addProperty("ts", ts);
        return frame;
    }

    public static JsonObject file(String name, long size, String from, String deviceId, List<String> targets, long ts) {
        JsonObject frame = frame(MessageType.FILE);
        frame.addProperty("name", name);
        frame.addProperty("size", size);
        if (from != null) frame.addProperty("from", from);
        if (deviceId != null) frame.addProperty("device_id", deviceId);
        if (targets != null && !targets.isEmpty()) frame.add("targets", array(targets));
        frame.addProperty("ts", ts);
        return frame;
    }

    public static JsonObject settings(String saveDir, boolean requiresCode) {
        JsonObject frame = frame(MessageType.SETTINGS);
        frame.addProperty("save_dir", saveDir);
        frame.addProperty("requires_code", requiresCode);
        return frame;
    }

    public static JsonObject pong() {
        return frame(MessageType.PONG);
    }

    private static JsonObject frame(String kind) {
        JsonObject frame = new JsonObject();
        frame.addProperty("kind", kind);
        return frame;
    }

    private static JsonArray array(List<String> values) {
        JsonArray arr = new JsonArray();
        for (String v : values) arr.add(v);
        return arr;
    }
}
