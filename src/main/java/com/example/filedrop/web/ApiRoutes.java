package com.example.filedrop.web;

import com.example.filedrop.access.AccessControl;
import com.example.filedrop.access.OwnerOrigin;
import com.example.filedrop.core.BadRequestException;
import com.example.filedrop.core.ServerConfig;
import com.example.filedrop.core.Settings;
import com.example.filedrop.service.FileGateway;
import com.example.filedrop.service.FileGateway.FileSummary;
import com.example.filedrop.service.SettingsService;
import com.example.filedrop.store.FileStore.StoredFile;
import com.example.filedrop.store.NoSuchStoredFileException;
import com.example.filedrop.store.StorageException;
import com.example.filedrop.util.Net;
import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import javax.servlet.MultipartConfigElement;
import javax.servlet.ServletException;
import javax.servlet.http.Part;
import spark.Request;
import spark.Response;
import spark.Spark;

public class ApiRoutes {

    private static final String MULTIPART_CONFIG = "org.eclipse.jetty.multipartConfig";

    private final Gson gson;
    private final ServerConfig config;
    private final AccessControl access;
    private final FileGateway fileGateway;
    private final SettingsService settingsService;
    private final Predicate<String> ownerAddress;

    public ApiRoutes(ServerConfig config, AccessControl access, FileGateway fileGateway, SettingsService settingsService) {
        this(config, access, fileGateway, settingsService, OwnerOrigin::isOwner);
    }

    /** {@code ownerAddress} decides admin from the request's remote IP. */
    ApiRoutes(
            ServerConfig config,
            AccessControl access,
            FileGateway fileGateway,
            SettingsService settingsService,
            Predicate<String> ownerAddress
    ) {
        this.gson = jsonCodec();
        this.config = config;
        this.access = access;
        this.fileGateway = fileGateway;
        this.settingsService = settingsService;
        this.ownerAddress = ownerAddress;
    }

    static Gson jsonCodec() {
        return new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .create();
    }

    public Gson gson() {
        return gson;
    }

    public void register() {
        Spark.get("/api/info", this::getInfo);

        Spark.get("/api/settings", this::getSettings);
        Spark.post("/api/settings", this::postSettings);
        Spark.post("/api/settings/save-dialog", this::postSaveDialog);

        Spark.get("/api/files", this::getFiles);
        Spark.get("/api/files/:name", this::getFile);
        Spark.delete("/api/files/:name", this::deleteFile);

        Spark.post("/api/upload", this::postUpload);
    }

    private Object getInfo(Request req, Response res) {
        res.type("application/json");
        String lanIp = Net.lanIp();
        Dto.InfoDto info = new Dto.InfoDto();
        info.name = Settings.APP_NAME;
        info.lanIp = lanIp;
        info.port = config.port();
        info.lanUrl = "http://" + lanIp + ":" + config.port();
        info.requiresCode = access.requiresCode();
        info.saveDir = config.saveDir().toString();
        info.isAdmin = isAdmin(req);
        return gson.toJson(info);
    }

    private Object getSettings(Request req, Response res) {
        res.type("application/json");
        return gson.toJson(settingsService.get(code(req)));
    }

    private Object postSettings(Request req, Response res) {
        res.type("application/json");
        Dto.UpdateSettingsRequest body = parse(req.body(), Dto.UpdateSettingsRequest.class);
        String code = body.code != null ? body.code : code(req);
        return gson.toJson(settingsService.update(code, isAdmin(req), body.saveDir, body.accessCode));
    }

    private Object postSaveDialog(Request req, Response res) {
        res.type("application/json");
        Path dir = settingsService.chooseDirectory(code(req), isAdmin(req));
        Dto.SaveDirResponse out = new Dto.SaveDirResponse();
        out.saveDir = dir.toString();
        return gson.toJson(out);
    }

    private Object getFiles(Request req, Response res) {
        res.type("application/json");
        List<FileSummary> files = fileGateway.list(code(req));
        Dto.FilesResponse out = new Dto.FilesResponse();
        out.files = files;
        return gson.toJson(out);
    }

    private Object getFile(Request req, Response res) {
        StoredFile file = fileGateway.fetch(req.params(":name"), code(req));
        InputStream in;
        try {
            in = Files.newInputStream(file.path);
        } catch (NoSuchFileException e) {
            throw new NoSuchStoredFileException(file.name);
        } catch (IOException e) {
            throw new StorageException("Cannot read " + file.name + ": " + e.getMessage(), e);
        }
        res.type("application/octet-stream");
        res.header("Content-Length", String.valueOf(file.size));
        res.header("Content-Disposition", "attachment; filename*=UTF-8''" + encode(file.name));
        return in;
    }

    private Object deleteFile(Request req, Response res) {
        fileGateway.delete(req.params(":name"), code(req), isAdmin(req));
        res.status(204);
        return "";
    }

    private Object postUpload(Request req, Response res) {
        res.type("application/json");
        req.attribute(MULTIPART_CONFIG, new MultipartConfigElement(System.getProperty("java.io.tmpdir")));

        Part filePart = part(req, "file");
        if (filePart == null) throw new BadRequestException("Missing file");
        try {
            String uploaderName = partText(req, "name");
            String clientId = firstNonEmpty(partText(req, "client_id"), req.headers(Settings.CLIENT_HEADER));
            String code = firstNonEmpty(partText(req, "code"), code(req));
            List<String> targets = splitIds(partText(req, "target_ids"));

            FileSummary stored;
            try (InputStream in = filePart.getInputStream()) {
                stored = fileGateway.acceptUpload(in, filePart.getSubmittedFileName(), uploaderName, clientId, code, targets);
            }
            Dto.UploadResponse out = new Dto.UploadResponse();
            out.name = stored.name;
            out.size = stored.size;
            return gson.toJson(out);
        } catch (IOException e) {
            throw new StorageException("Upload failed: " + e.getMessage(), e);
        } finally {
            deletePart(filePart);
        }
    }

    private boolean isAdmin(Request req) {
        return ownerAddress.test(req.ip());
    }

    private String code(Request req) {
        return firstNonEmpty(req.queryParams("code"), req.headers(Settings.CODE_HEADER));
    }

    private Part part(Request req, String name) {
        try {
            return req.raw().getPart(name);
        } catch (ServletException e) {
            throw new BadRequestException("Expected multipart/form-data");
        } catch (IOException e) {
            throw new StorageException("Upload failed: " + e.getMessage(), e);
        }
    }

    private String partText(Request req, String name) throws IOException {
        Part p = part(req, name);
        if (p == null) return null;
        try (InputStream in = p.getInputStream()) {
            String v = new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            return v.isEmpty() ? null : v;
        }
    }

    private static void deletePart(Part p) {
        try {
            p.delete();
        } catch (IOException e) {
            System.err.println("Could not remove multipart temp file: " + e.getMessage());
        }
    }

    static List<String> splitIds(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String t : raw.split(",")) {
            String v = t.trim();
            if (!v.isEmpty() && !out.contains(v)) out.add(v);
        }
        return out;
    }

    private static String firstNonEmpty(String a, String b) {
        if (a != null && !a.trim().isEmpty()) return a.trim();
        if (b != null && !b.trim().isEmpty()) return b.trim();
        return null;
    }

    private static String encode(String name) {
        return URLEncoder.encode(name, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private <T> T parse(String body, Class<T> clazz) {
        if (body == null || body.isEmpty()) throw new BadRequestException("Bad body");
        T value;
        try {
            value = gson.fromJson(body, clazz);
        } catch (JsonParseException e) {
            throw new BadRequestException("Bad body: " + e.getMessage());
        }
        if (value == null) throw new BadRequestException("Bad body");
        return value;
    }
}
