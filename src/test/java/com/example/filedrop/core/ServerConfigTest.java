package com.example.filedrop.core;

import java.nio.file.Paths;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ServerConfigTest {

    @Test
    public void flagsOverrideDefaults() {
        ServerConfig c = ServerConfig.fromArgs(new String[]{
                "--host", "127.0.0.1",
                "--port", "9001",
                "--save-dir", "/tmp/drop",
                "--access-code", " 7777 ",
                "--index-db", "uploads.db"
        });
        assertEquals("127.0.0.1", c.host());
        assertEquals(9001, c.port());
        assertEquals(Paths.get("/tmp/drop"), c.saveDir());
        assertEquals("7777", c.accessCode());
        assertTrue(c.requiresCode());
        assertEquals("uploads.db", c.indexDb());
    }

    @Test
    public void hostAndIndexDefaults() {
        ServerConfig c = ServerConfig.fromArgs(new String[]{"--save-dir", "/tmp/x", "--access-code", "c"});
        assertEquals(Settings.DEFAULT_HOST, c.host());
        assertEquals(Settings.DEFAULT_INDEX_DB, c.indexDb());
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownOptionIsRejected() {
        ServerConfig.fromArgs(new String[]{"--verbose"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingValueIsRejected() {
        ServerConfig.fromArgs(new String[]{"--port"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonNumericPortIsRejected() {
        ServerConfig.fromArgs(new String[]{"--port", "eighty"});
    }

    @Test(expected = IllegalArgumentException.class)
    public void outOfRangePortIsRejected() {
        ServerConfig.fromArgs(new String[]{"--port", "70000"});
    }

    @Test
    public void blankCodeMeansOpen() {
        ServerConfig c = new ServerConfig("0.0.0.0", 8000, Paths.get("x"), "   ", ":memory:");
        assertFalse(c.requiresCode());
        c.setAccessCode("s3cret");
        assertTrue(c.requiresCode());
        c.setAccessCode(null);
        assertEquals("", c.accessCode());
    }
}
