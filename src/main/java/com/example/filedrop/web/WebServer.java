package com.example.filedrop.web;

import com.example.filedrop.core.HubException;
import com.example.filedrop.core.Settings;
import com.google.gson.Gson;
import spark.Spark;

public class WebServer implements AutoCloseable {

    private final String host;
    private final int port;
    private final ApiRoutes apiRoutes;
    private final HubSocket hubSocket;
    private final Gson gson;
    private volatile boolean started;

    public WebServer(String host, int port, ApiRoutes apiRoutes, HubSocket hubSocket) {
        this.host = host;
        this.port = port;
        this.apiRoutes = apiRoutes;
        this.hubSocket = hubSocket;
        this.gson = apiRoutes.gson();
    }

    public void start() {
        if (started) return;
        started = true;

        Spark.ipAddress(host);
        Spark.port(port);
        Spark.webSocketIdleTimeoutMillis(Settings.WS_IDLE_TIMEOUT_MS);
        // must be mapped before any HTTP route
        Spark.webSocket("/ws", hubSocket);

        Spark.exception(HubException.class, (e, req, res) -> {
            res.status(e.status());
            res.type("application/json");
            res.body(gson.toJson(Dto.fail(e.getMessage())));
        });

        Spark.exception(Exception.class, (e, req, res) -> {
            System.err.println("Unhandled error on " + req.requestMethod() + " " + req.pathInfo() + ": " + e);
            res.status(500);
            res.type("application/json");
            res.body(gson.toJson(Dto.fail("Internal error")));
        });

        Spark.notFound((req, res) -> {
            res.type("application/json");
            return gson.toJson(Dto.fail("Not found"));
        });

        apiRoutes.register();
        Spark.init();
        Spark.awaitInitialization();
    }

    @Override
    public void close() {
        if (!started) return;
        started = false;
        Spark.stop();
        Spark.awaitStop();
    }
}
