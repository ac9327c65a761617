package com.example.filedrop.session;

public class Session {
    public final String sessionId;
    public final String deviceId;
    public final String name;
    public final boolean admin;
    public final Transport transport;
    volatile boolean canReceive;

    Session(String sessionId, String deviceId, String name, boolean canReceive, boolean admin, Transport transport) {
        this.sessionId = sessionId;
        this.deviceId = deviceId;
        this.name = name;
        this.canReceive = canReceive;
        this.admin = admin;
        this.transport = transport;
    }

    public boolean canReceive() {
        return canReceive;
    }

    @Override
    public String toString() {
        return name + " (" + sessionId + ", device " + deviceId + (admin ? ", admin" : "") + ")";
    }
}
