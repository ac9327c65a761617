package com.example.filedrop.core;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Runtime configuration of the hub. Save directory and access code can be
 * changed by the admin while the server is running.
 */
public class ServerConfig {

    private final String host;
    private final int port;
    private final String indexDb;
    private volatile Path saveDir;
    private volatile String accessCode;

    public ServerConfig(String host, int port, Path saveDir, String accessCode, String indexDb) {
        this.host = host;
        this.port = port;
        this.saveDir = saveDir;
        this.accessCode = normalizeCode(accessCode);
        this.indexDb = indexDb;
    }

    /**
     * Parses {@code --host --port --save-dir --access-code --index-db}.
     * Environment variables fill in whatever the flags leave unset.
     */
    public static ServerConfig fromArgs(String[] args) {
        String host = Settings.DEFAULT_HOST;
        int port = envInt("FILEDROP_PORT", Settings.DEFAULT_PORT);
        String saveDir = env("FILEDROP_SAVE_DIR");
        String accessCode = env("FILEDROP_ACCESS_CODE");
        String indexDb = Settings.DEFAULT_INDEX_DB;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String value = i + 1 < args.length ? args[i + 1] : null;
            switch (arg) {
                case "--host":
                    host = require(arg, value);
                    i++;
                    break;
                case "--port":
                    port = parsePort(require(arg, value));
                    i++;
                    break;
                case "--save-dir":
                    saveDir = require(arg, value);
                    i++;
                    break;
                case "--access-code":
                    accessCode = require(arg, value);
                    i++;
                    break;
                case "--index-db":
                    indexDb = require(arg, value);
                    i++;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        Path dir = saveDir == null || saveDir.isBlank() ? defaultSaveDir() : Paths.get(saveDir);
        return new ServerConfig(host, port, dir, accessCode, indexDb);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String indexDb() {
        return indexDb;
    }

    public Path saveDir() {
        return saveDir;
    }

    public void setSaveDir(Path saveDir) {
        this.saveDir = saveDir;
    }

    public String accessCode() {
        return accessCode;
    }

    public void setAccessCode(String accessCode) {
        this.accessCode = normalizeCode(accessCode);
    }

    public boolean requiresCode() {
        return !accessCode.isEmpty();
    }

    private static String normalizeCode(String code) {
        return code == null ? "" : code.trim();
    }

    private static Path defaultSaveDir() {
        return Paths.get(System.getProperty("user.home"), Settings.DEFAULT_SAVE_SUBDIR);
    }

    private static String require(String option, String value) {
        if (value == null) throw new IllegalArgumentException("Missing value for " + option);
        return value;
    }

    private static int parsePort(String value) {
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port: " + value);
        }
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("Invalid port: " + value);
        return port;
    }

    private static String env(String key) {
        String v = System.getenv(key);
        return v == null || v.isBlank() ? null : v;
    }

    private static int envInt(String key, int def) {
        String v = env(key);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
