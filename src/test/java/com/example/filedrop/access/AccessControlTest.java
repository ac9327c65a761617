package com.example.filedrop.access;

import com.example.filedrop.core.ServerConfig;
import java.nio.file.Paths;
import org.junit.Test;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AccessControlTest {

    private final ServerConfig config = new ServerConfig("0.0.0.0", 8000, Paths.get("unused"), "", ":memory:");
    private final AccessControl access = new AccessControl(config);

    @Test
    public void openHubAcceptsAnything() {
        assertFalse(access.requiresCode());
        assertTrue(access.validateHandshake(null));
        assertTrue(access.validateHandshake("whatever"));
        access.validateOperation(null);
    }

    @Test
    public void configuredCodeMustMatch() {
        config.setAccessCode("1234");
        assertTrue(access.requiresCode());
        assertTrue(access.validateHandshake("1234"));
        assertTrue(access.validateHandshake(" 1234 "));
        assertFalse(access.validateHandshake("12345"));
        assertFalse(access.validateHandshake(""));
        assertFalse(access.validateHandshake(null));
    }

    @Test(expected = AuthException.class)
    public void operationWithoutCodeFails() {
        config.setAccessCode("1234");
        access.validateOperation(null);
    }

    @Test(expected = AuthorizationException.class)
    public void correctCodeDoesNotMakeAnAdmin() {
        config.setAccessCode("1234");
        access.validateOperation("1234");
        access.requireAdmin(false, "Only the server can remove files");
    }

    @Test
    public void clearingTheCodeReopensTheHub() {
        config.setAccessCode("1234");
        config.setAccessCode("  ");
        assertFalse(access.requiresCode());
        assertTrue(access.validateHandshake(null));
    }
}
