package com.example.filedrop.protocol;

import com.example.filedrop.core.Settings;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A client-to-server frame. Each accepted {@code kind} has its own subclass;
 * {@link #parse(String)} rejects anything else.
 */
public abstract class InboundMessage {

    private InboundMessage() {
    }

    public abstract String kind();

    public static final class Hello extends InboundMessage {
        public final String name;
        public final String code;
        public final String deviceId;
        public final boolean canReceive;

        Hello(String name, String code, String deviceId, boolean canReceive) {
            this.name = name;
            this.code = code;
            this.deviceId = deviceId;
            this.canReceive = canReceive;
        }

        @Override
        public String kind() {
            return MessageType.HELLO;
        }
    }

    public static final class Note extends InboundMessage {
        public final String text;
        public final List<String> to;

        Note(String text, List<String> to) {
            this.text = text;
            this.to = to;
        }

        @Override
        public String kind() {
            return MessageType.NOTE;
        }
    }

    public static final class Mode extends InboundMessage {
        public final boolean canReceive;

        Mode(boolean canReceive) {
            this.canReceive = canReceive;
        }

        @Override
        public String kind() {
            return MessageType.MODE;
        }
    }

    public static final class Kick extends InboundMessage {
        public final String target;
        public final String code;

        Kick(String target, String code) {
            this.target = target;
            this.code = code;
        }

        @Override
        public String kind() {
            return MessageType.KICK;
        }
    }

    public static final class Ping extends InboundMessage {
        Ping() {
        }

        @Override
        public String kind() {
            return MessageType.PING;
        }
    }

    public static InboundMessage parse(String raw) throws ProtocolException {
        if (raw == null) throw badMessage("Empty frame");
        if (raw.getBytes(StandardCharsets.UTF_8).length > Settings.MAX_MESSAGE_BYTES) {
            throw new ProtocolException(Errors.TOO_LARGE, Settings.CLOSE_TOO_LARGE, "Frame too large");
        }

        JsonObject obj;
        try {
            JsonElement el = JsonParser.parseString(raw);
            if (!el.isJsonObject()) throw badMessage("Expected a JSON object");
            obj = el.getAsJsonObject();
        } catch (JsonParseException e) {
            throw badMessage("Malformed JSON");
        }

        String kind = str(obj, "kind");
        if (kind == null) throw badMessage("Missing kind");
        switch (kind) {
            case MessageType.HELLO:
                return new Hello(str(obj, "name"), str(obj, "code"), str(obj, "device_id"), bool(obj, "can_receive", true));
            case MessageType.NOTE:
                String text = str(obj, "text");
                return new Note(text == null ? "" : text, strList(obj, "to"));
            case MessageType.MODE:
                return new Mode(bool(obj, "can_receive", true));
            case MessageType.KICK:
                return new Kick(str(obj, "target"), str(obj, "code"));
            case MessageType.PING:
                return new Ping();
            default:
                throw badMessage("Unknown kind: " + kind);
        }
    }

    private static ProtocolException badMessage(String message) {
        return new ProtocolException(Errors.BAD_MESSAGE, Settings.CLOSE_PROTOCOL_ERROR, message);
    }

    private static String str(JsonObject obj, String key) throws ProtocolException {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return null;
        if (!el.isJsonPrimitive()) throw badMessage("Field " + key + " must be a string");
        return el.getAsString();
    }

    private static boolean bool(JsonObject obj, String key, boolean def) throws ProtocolException {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return def;
        if (!el.isJsonPrimitive() || !el.getAsJsonPrimitive().isBoolean()) {
            throw badMessage("Field " + key + " must be a boolean");
        }
        return el.getAsBoolean();
    }

    private static List<String> strList(JsonObject obj, String key) throws ProtocolException {
        JsonElement el = obj.get(key);
        if (el == null || el.isJsonNull()) return Collections.emptyList();
        if (!el.isJsonArray()) throw badMessage("Field " + key + " must be an array");
        JsonArray arr = el.getAsJsonArray();
        List<String> out = new ArrayList<>(arr.size());
        for (JsonElement item : arr) {
            if (item != null && item.isJsonPrimitive()) {
                String v = item.getAsString().trim();
                if (!v.isEmpty()) out.add(v);
            }
        }
        return out;
    }
}
