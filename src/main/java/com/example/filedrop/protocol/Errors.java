package com.example.filedrop.protocol;

import com.google.gson.JsonObject;

public final class Errors {

    public static final String UNAUTHORIZED = "unauthorized";
    public static final String FORBIDDEN = "forbidden";
    public static final String BAD_MESSAGE = "bad_message";
    public static final String TOO_LARGE = "too_large";

    private Errors() {
    }

    public static JsonObject buildError(String code, String detail) {
        JsonObject frame = new JsonObject();
        frame.addProperty("kind", MessageType.ERROR);
        frame.addProperty("code", code);
        frame.addProperty("detail", detail);
        return frame;
    }
}
