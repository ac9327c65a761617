package com.example.filedrop.service;

import com.example.filedrop.access.AccessControl;
import com.example.filedrop.core.BadRequestException;
import com.example.filedrop.core.ServerConfig;
import com.example.filedrop.session.Notifier;
import com.example.filedrop.store.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

public class SettingsService {

    public static class SettingsView {
        public String saveDir;
        public int port;
        public boolean requiresCode;
    }

    private final ServerConfig config;
    private final AccessControl access;
    private final Notifier notifier;
    private final DirectoryChooser chooser;

    public SettingsService(ServerConfig config, AccessControl access, Notifier notifier, DirectoryChooser chooser) {
        this.config = config;
        this.access = access;
        this.notifier = notifier;
        this.chooser = chooser;
    }

    public SettingsView get(String code) {
        access.validateOperation(code);
        return view();
    }

    /**
     * Host-only. A null {@code saveDir} or {@code newAccessCode} leaves that
     * setting alone; an empty access code opens the hub.
     */
    public SettingsView update(String code, boolean admin, String saveDir, String newAccessCode) {
        access.validateOperation(code);
        access.requireAdmin(admin, "Only the server can change settings");
        if (saveDir != null && !saveDir.isBlank()) {
            config.setSaveDir(prepare(Paths.get(saveDir.trim())));
        }
        if (newAccessCode != null) {
            config.setAccessCode(newAccessCode);
        }
        System.out.println("Settings updated: save_dir=" + config.saveDir() + ", requires_code=" + config.requiresCode());
        broadcast();
        return view();
    }

    public Path chooseDirectory(String code, boolean admin) {
        access.validateOperation(code);
        access.requireAdmin(admin, "Only the server can choose the folder");
        if (!chooser.isAvailable()) {
            throw new PickerUnavailableException("Folder picker not available");
        }
        Optional<Path> picked;
        try {
            picked = chooser.choose(config.saveDir());
        } catch (IllegalStateException e) {
            throw new PickerUnavailableException(e.getMessage(), e);
        }
        if (picked.isEmpty()) throw new BadRequestException("No folder chosen");
        config.setSaveDir(prepare(picked.get()));
        System.out.println("Save folder chosen: " + config.saveDir());
        broadcast();
        return config.saveDir();
    }

    private void broadcast() {
        notifier.broadcastSettings(config.saveDir().toString(), config.requiresCode());
    }

    private static Path prepare(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create " + dir + ": " + e.getMessage(), e);
        }
        return dir;
    }

    private SettingsView view() {
        SettingsView v = new SettingsView();
        v.saveDir = config.saveDir().toString();
        v.port = config.port();
        v.requiresCode = config.requiresCode();
        return v;
    }
}
