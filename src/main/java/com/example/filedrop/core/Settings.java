package com.example.filedrop.core;

public class Settings {
    public static final String APP_NAME = "FileDrop Web";

    // Web Port (HTTP + WebSocket)
    public static final int DEFAULT_PORT = 8000;
    public static final String DEFAULT_HOST = "0.0.0.0";

    // Default save directory, relative to user.home
    public static final String DEFAULT_SAVE_SUBDIR = "Downloads/FileDrop";

    // Upload index; in memory unless --index-db is given
    public static final String DEFAULT_INDEX_DB = ":memory:";

    // Identity
    public static final String DEFAULT_NAME = "Guest";
    public static final int MAX_NAME_LENGTH = 40;

    // Notes
    public static final int MAX_NOTE_LENGTH = 4000;

    // Inbound WebSocket frame limit
    public static final int MAX_MESSAGE_BYTES = 64 * 1024;
    public static final int WS_IDLE_TIMEOUT_MS = 60 * 60 * 1000; // 1 hour

    // Frames queued for a peer that is not reading before it is dropped
    public static final int MAX_OUTBOUND_FRAMES = 256;

    // WebSocket close codes
    public static final int CLOSE_PROTOCOL_ERROR = 1002;
    public static final int CLOSE_POLICY_VIOLATION = 1008;
    public static final int CLOSE_TOO_LARGE = 1009;
    public static final int CLOSE_SEND_FAILED = 1011;
    public static final int CLOSE_KICKED = 4000;

    // Request headers
    public static final String CODE_HEADER = "X-FileDrop-Code";
    public static final String CLIENT_HEADER = "X-FileDrop-Client";

    // Uploads
    public static final String TEMP_PREFIX = ".upload-";
    public static final String TEMP_SUFFIX = ".part";
}
