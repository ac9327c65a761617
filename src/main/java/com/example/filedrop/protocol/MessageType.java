package com.example.filedrop.protocol;

public final class MessageType {
    // client -> server
    public static final String HELLO = "hello";
    public static final String NOTE = "note";
    public static final String MODE = "mode";
    public static final String KICK = "kick";
    public static final String PING = "ping";

    // server -> client
    public static final String WELCOME = "welcome";
    public static final String ERROR = "error";
    public static final String CLIENTS = "clients";
    public static final String FILE = "file";
    public static final String SETTINGS = "settings";
    public static final String PONG = "pong";

    private MessageType() {
    }
}
