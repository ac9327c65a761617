package com.example.filedrop.access;

import com.example.filedrop.core.ServerConfig;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Access code checks. The code only unlocks content; admin rights come from
 * {@link OwnerOrigin} and are never granted here.
 */
public class AccessControl {

    private final ServerConfig config;

    public AccessControl(ServerConfig config) {
        this.config = config;
    }

    public boolean requiresCode() {
        return config.requiresCode();
    }

    public boolean validateHandshake(String code) {
        return matches(code);
    }

    public void validateOperation(String code) {
        if (!matches(code)) throw new AuthException();
    }

    public void requireAdmin(boolean admin, String message) {
        if (!admin) throw new AuthorizationException(message);
    }

    private boolean matches(String supplied) {
        String configured = config.accessCode();
        if (configured.isEmpty()) return true;
        if (supplied == null) return false;
        return MessageDigest.isEqual(
                configured.getBytes(StandardCharsets.UTF_8),
                supplied.trim().getBytes(StandardCharsets.UTF_8));
    }
}
