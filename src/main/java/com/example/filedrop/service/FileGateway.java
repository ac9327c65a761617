package com.example.filedrop.service;

import com.example.filedrop.access.AccessControl;
import com.example.filedrop.core.Settings;
import com.example.filedrop.session.Notifier;
import com.example.filedrop.store.FileStore;
import com.example.filedrop.store.FileStore.StoredFile;
import com.example.filedrop.store.UploadDao;
import com.example.filedrop.store.UploadDao.Upload;
import java.io.InputStream;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Access-controlled view over the {@link FileStore}. Every call checks the
 * access code first; deleting also needs the caller to be the host.
 */
public class FileGateway {

    public static class FileSummary {
        public String name;
        public long size;
        public long mtime;
        public String from;
        /** Uploaded for specific devices; listing still shows it to everyone. */
        public boolean targeted;
    }

    private final AccessControl access;
    private final FileStore store;
    private final UploadDao uploadDao;
    private final Notifier notifier;

    public FileGateway(AccessControl access, FileStore store, UploadDao uploadDao, Notifier notifier) {
        this.access = access;
        this.store = store;
        this.uploadDao = uploadDao;
        this.notifier = notifier;
    }

    public List<FileSummary> list(String code) {
        access.validateOperation(code);
        List<FileSummary> out = new ArrayList<>();
        for (StoredFile f : store.list()) {
            out.add(summarize(f, lookup(f)));
        }
        return out;
    }

    public StoredFile fetch(String name, String code) {
        access.validateOperation(code);
        return store.get(name);
    }

    public void delete(String name, String code, boolean admin) {
        access.validateOperation(code);
        access.requireAdmin(admin, "Only the server can remove files");
        StoredFile removed = store.delete(name);
        try {
            uploadDao.deleteByPath(key(removed));
        } catch (SQLException e) {
            // the file is gone; a stale row only costs a lookup miss
            System.err.println("Failed to unindex " + removed.name + ": " + e.getMessage());
        }
        System.out.println("File deleted: " + removed.name);
    }

    /**
     * Stores the bytes under a free name, then tells the addressed
     * receive-capable sessions about it.
     */
    public FileSummary acceptUpload(
            InputStream in,
            String declaredName,
            String uploaderName,
            String deviceId,
            String code,
            List<String> targetDeviceIds
    ) {
        access.validateOperation(code);
        List<String> targets = targetDeviceIds == null ? Collections.emptyList() : targetDeviceIds;
        String from = uploaderName == null || uploaderName.isBlank()
                ? Settings.DEFAULT_NAME
                : truncate(uploaderName.trim(), Settings.MAX_NAME_LENGTH);

        StoredFile stored = store.store(in, declaredName);

        Upload upload = new Upload();
        upload.path = key(stored);
        upload.name = stored.name;
        upload.size = stored.size;
        upload.uploaderName = from;
        upload.targets = targets;
        try {
            uploadDao.upsert(upload);
        } catch (SQLException e) {
            // listing falls back to no uploader name
            System.err.println("Failed to index upload " + stored.name + ": " + e.getMessage());
        }

        int notified = notifier.notifyFile(stored.name, stored.size, from, deviceId, targets);
        System.out.println("Upload stored: " + stored.name + " (" + stored.size + " bytes) from " + from + ", notified " + notified);
        return summarize(stored, upload);
    }

    // Index errors never fail the caller; the entry just loses its metadata.
    private Upload lookup(StoredFile f) {
        try {
            return uploadDao.getByPath(key(f));
        } catch (SQLException e) {
            System.err.println("Failed to read index for " + f.name + ": " + e.getMessage());
            return null;
        }
    }

    private static FileSummary summarize(StoredFile f, Upload upload) {
        FileSummary s = new FileSummary();
        s.name = f.name;
        s.size = f.size;
        s.mtime = f.mtime;
        s.from = upload != null ? upload.uploaderName : null;
        s.targeted = upload != null && !upload.targets.isEmpty();
        return s;
    }

    private static String key(StoredFile f) {
        return f.path.toAbsolutePath().normalize().toString();
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
