package com.example.filedrop.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class UploadDao {

    public static class Upload {
        public String path;
        public String name;
        public long size;
        public String uploaderName;
        public List<String> targets = Collections.emptyList();
    }

    public void upsert(Upload upload) throws SQLException {
        Connection conn = Db.getConnection();
        String sql = "INSERT INTO uploads (path, name, size, uploader_name, targets) VALUES (?, ?, ?, ?, ?) " +
                "ON CONFLICT(path) DO UPDATE SET " +
                "name = excluded.name, " +
                "size = excluded.size, " +
                "uploader_name = excluded.uploader_name, " +
                "targets = excluded.targets";
        synchronized (Db.class) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, upload.path);
                ps.setString(2, upload.name);
                ps.setLong(3, upload.size);
                ps.setString(4, upload.uploaderName);
                ps.setString(5, joinTargets(upload.targets));
                ps.executeUpdate();
            }
        }
    }

    public Upload getByPath(String path) throws SQLException {
        Connection conn = Db.getConnection();
        String sql = "SELECT * FROM uploads WHERE path = ? LIMIT 1";
        synchronized (Db.class) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, path);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) return mapRow(rs);
                }
            }
        }
        return null;
    }

    public boolean deleteByPath(String path) throws SQLException {
        Connection conn = Db.getConnection();
        String sql = "DELETE FROM uploads WHERE path = ?";
        synchronized (Db.class) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, path);
                return ps.executeUpdate() > 0;
            }
        }
    }

    private Upload mapRow(ResultSet rs) throws SQLException {
        Upload u = new Upload();
        u.path = rs.getString("path");
        u.name = rs.getString("name");
        u.size = rs.getLong("size");
        u.uploaderName = rs.getString("uploader_name");
        u.targets = splitTargets(rs.getString("targets"));
        return u;
    }

    private static String joinTargets(List<String> targets) {
        if (targets == null || targets.isEmpty()) return null;
        return String.join(",", targets);
    }

    private static List<String> splitTargets(String raw) {
        if (raw == null || raw.isEmpty()) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        for (String t : Arrays.asList(raw.split(","))) {
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }
}
