package com.example.filedrop.service;

import com.example.filedrop.access.AccessControl;
import com.example.filedrop.access.AuthException;
import com.example.filedrop.access.AuthorizationException;
import com.example.filedrop.core.BadRequestException;
import com.example.filedrop.core.ServerConfig;
import com.example.filedrop.service.SettingsService.SettingsView;
import com.example.filedrop.session.FakeTransport;
import com.example.filedrop.session.Notifier;
import com.example.filedrop.session.SessionRegistry;
import com.google.gson.JsonObject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SettingsServiceTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static final class StubChooser implements DirectoryChooser {
        boolean available = true;
        Path answer;
        boolean broken;

        @Override
        public boolean isAvailable() {
            return available;
        }

        @Override
        public Optional<Path> choose(Path current) {
            if (broken) throw new IllegalStateException("display went away");
            return Optional.ofNullable(answer);
        }
    }

    private ServerConfig config;
    private SessionRegistry registry;
    private StubChooser chooser;
    private SettingsService service;
    private FakeTransport watcher;

    @Before
    public void setUp() throws Exception {
        config = new ServerConfig("0.0.0.0", 8123, tmp.newFolder("initial").toPath(), "", ":memory:");
        registry = new SessionRegistry();
        chooser = new StubChooser();
        service = new SettingsService(config, new AccessControl(config), new Notifier(registry), chooser);
        watcher = FakeTransport.remote("192.168.0.7");
        registry.register("dev-w", "Watcher", true, false, watcher, null);
    }

    @Test
    public void getReportsCurrentValues() {
        SettingsView view = service.get(null);
        assertEquals(config.saveDir().toString(), view.saveDir);
        assertEquals(8123, view.port);
        assertFalse(view.requiresCode);
    }

    @Test(expected = AuthException.class)
    public void getNeedsCodeWhenSet() {
        config.setAccessCode("abc");
        service.get("xyz");
    }

    @Test
    public void nonAdminCannotUpdate() {
        Path before = config.saveDir();
        try {
            service.update(null, false, tmp.getRoot().toPath().resolve("other").toString(), "1111");
            fail("expected AuthorizationException");
        } catch (AuthorizationException e) {
            assertEquals(403, e.status());
        }
        assertEquals(before, config.saveDir());
        assertFalse(config.requiresCode());
        assertNull(watcher.last("settings"));
    }

    @Test
    public void adminUpdateCreatesDirAndBroadcasts() {
        Path target = tmp.getRoot().toPath().resolve("nested").resolve("drop");

        SettingsView view = service.update(null, true, target.toString(), " 4242 ");

        assertTrue(Files.isDirectory(target));
        assertEquals(target, config.saveDir());
        assertTrue(view.requiresCode);
        assertEquals("4242", config.accessCode());

        JsonObject frame = watcher.last("settings");
        assertEquals(target.toString(), frame.get("save_dir").getAsString());
        assertTrue(frame.get("requires_code").getAsBoolean());
    }

    @Test
    public void emptyAccessCodeOpensTheHub() {
        config.setAccessCode("4242");
        service.update("4242", true, null, "");
        assertFalse(config.requiresCode());
        assertFalse(watcher.last("settings").get("requires_code").getAsBoolean());
    }

    @Test
    public void chooserPicksNewDirectory() throws Exception {
        Path picked = tmp.newFolder("picked").toPath();
        chooser.answer = picked;

        assertEquals(picked, service.chooseDirectory(null, true));
        assertEquals(picked, config.saveDir());
        assertEquals(picked.toString(), watcher.last("settings").get("save_dir").getAsString());
    }

    @Test
    public void unavailablePickerIsServerError() {
        chooser.available = false;
        try {
            service.chooseDirectory(null, true);
            fail("expected PickerUnavailableException");
        } catch (PickerUnavailableException e) {
            assertEquals(500, e.status());
        }
    }

    @Test(expected = PickerUnavailableException.class)
    public void failingPickerIsServerError() {
        chooser.broken = true;
        service.chooseDirectory(null, true);
    }

    @Test
    public void cancelledPickerIsBadRequest() {
        Path before = config.saveDir();
        try {
            service.chooseDirectory(null, true);
            fail("expected BadRequestException");
        } catch (BadRequestException e) {
            assertEquals(400, e.status());
        }
        assertEquals(before, config.saveDir());
        assertNull(watcher.last("settings"));
    }

    @Test(expected = AuthorizationException.class)
    public void pickerIsHostOnly() {
        chooser.answer = tmp.getRoot().toPath();
        service.chooseDirectory(null, false);
    }
}
