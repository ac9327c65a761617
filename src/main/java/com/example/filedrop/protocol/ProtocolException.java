package com.example.filedrop.protocol;

/**
 * Malformed or out-of-state WebSocket message. Always ends the connection.
 */
public class ProtocolException extends Exception {

    private final String code;
    private final int closeCode;

    public ProtocolException(String code, int closeCode, String message) {
        super(message);
        this.code = code;
        this.closeCode = closeCode;
    }

    public String code() {
        return code;
    }

    public int closeCode() {
        return closeCode;
    }
}
