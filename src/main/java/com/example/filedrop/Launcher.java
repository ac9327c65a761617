package com.example.filedrop;

import com.example.filedrop.access.AccessControl;
import com.example.filedrop.core.ServerConfig;
import com.example.filedrop.core.Settings;
import com.example.filedrop.service.FileGateway;
import com.example.filedrop.service.SettingsService;
import com.example.filedrop.service.SwingDirectoryChooser;
import com.example.filedrop.session.Notifier;
import com.example.filedrop.session.SessionRegistry;
import com.example.filedrop.store.Db;
import com.example.filedrop.store.FileStore;
import com.example.filedrop.store.UploadDao;
import com.example.filedrop.util.Net;
import com.example.filedrop.web.ApiRoutes;
import com.example.filedrop.web.HubSocket;
import com.example.filedrop.web.WebServer;
import java.io.IOException;
import java.nio.file.Files;
import java.sql.SQLException;

public class Launcher {

    public static void main(String[] args) {
        System.out.println("Starting " + Settings.APP_NAME + "...");

        ServerConfig config;
        try {
            config = ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: filedrop [--host H] [--port P] [--save-dir DIR] [--access-code CODE] [--index-db FILE]");
            System.exit(2);
            return;
        }

        try {
            Files.createDirectories(config.saveDir());
        } catch (IOException e) {
            System.err.println("Failed to create save dir " + config.saveDir() + ": " + e.getMessage());
            return;
        }

        try {
            Db.init(config.indexDb());
        } catch (SQLException e) {
            System.err.println("Failed to init upload index: " + e.getMessage());
            return;
        }

        AccessControl access = new AccessControl(config);
        SessionRegistry registry = new SessionRegistry();
        Notifier notifier = new Notifier(registry);
        FileStore fileStore = new FileStore(config::saveDir);
        FileGateway fileGateway = new FileGateway(access, fileStore, new UploadDao(), notifier);
        SettingsService settingsService = new SettingsService(config, access, notifier, new SwingDirectoryChooser());

        ApiRoutes apiRoutes = new ApiRoutes(config, access, fileGateway, settingsService);
        HubSocket hubSocket = new HubSocket(registry, notifier, access);
        WebServer webServer = new WebServer(config.host(), config.port(), apiRoutes, hubSocket);
        webServer.start();

        System.out.println("Save dir: " + config.saveDir());
        System.out.println("Access:   " + (config.requiresCode() ? "code required" : "open"));
        System.out.println("Local:    http://localhost:" + config.port() + "/");
        System.out.println("LAN:      http://" + Net.lanIp() + ":" + config.port() + "/");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            webServer.close();
            Db.close();
        }));
    }
}
