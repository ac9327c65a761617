package com.example.filedrop.store;

import com.example.filedrop.core.BadRequestException;
import com.example.filedrop.core.Settings;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * The save directory. Listing, deleting and finalizing uploads share one lock,
 * so a finished upload is visible to the next listing and two uploads never
 * resolve to the same name. Upload bytes go to a hidden temporary file first
 * and are linked into place only when complete; an existing file is never
 * replaced.
 */
public class FileStore {

    public static class StoredFile {
        public String name;
        public long size;
        public long mtime;
        public Path path;
    }

    private final Supplier<Path> directory;
    private final Object lock = new Object();

    public FileStore(Supplier<Path> directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory.get();
    }

    public List<StoredFile> list() {
        synchronized (lock) {
            Path dir = ensureDir();
            List<StoredFile> out = new ArrayList<>();
            try (Stream<Path> entries = Files.list(dir)) {
                for (Path p : (Iterable<Path>) entries::iterator) {
                    String name = p.getFileName().toString();
                    if (name.startsWith(".")) continue;
                    BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
                    if (!attrs.isRegularFile()) continue;
                    out.add(toStoredFile(p, attrs));
                }
            } catch (IOException e) {
                throw new StorageException("Cannot list " + dir + ": " + e.getMessage(), e);
            }
            out.sort(Comparator.comparing(f -> f.name.toLowerCase()));
            return out;
        }
    }

    public StoredFile get(String name) {
        synchronized (lock) {
            Path path = existing(name);
            try {
                return toStoredFile(path, Files.readAttributes(path, BasicFileAttributes.class));
            } catch (IOException e) {
                throw new StorageException("Cannot read " + name + ": " + e.getMessage(), e);
            }
        }
    }

    public StoredFile delete(String name) {
        synchronized (lock) {
            StoredFile file = get(name);
            try {
                Files.delete(file.path);
            } catch (IOException e) {
                throw new StorageException("Cannot delete " + name + ": " + e.getMessage(), e);
            }
            return file;
        }
    }

    public StoredFile store(InputStream in, String declaredName) {
        String name = uploadName(declaredName);
        Path dir = ensureDir();
        Path tmp;
        try {
            tmp = Files.createTempFile(dir, Settings.TEMP_PREFIX, Settings.TEMP_SUFFIX);
        } catch (IOException e) {
            throw new StorageException("Cannot write to " + dir + ": " + e.getMessage(), e);
        }
        try {
            Files.copy(in, tmp, StandardCopyOption.REPLACE_EXISTING);
            synchronized (lock) {
                Path dest = moveIntoPlace(tmp, dir, name);
                return toStoredFile(dest, Files.readAttributes(dest, BasicFileAttributes.class));
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Upload failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deleteQuietly(tmp);
            throw e;
        }
    }

    private Path moveIntoPlace(Path tmp, Path dir, String name) throws IOException {
        while (true) {
            Path dest = uniquePath(dir, name);
            try {
                claim(tmp, dest);
                return dest;
            } catch (FileAlreadyExistsException e) {
                System.out.println("Name taken outside the hub, retrying: " + dest.getFileName());
            }
        }
    }

    /**
     * Puts the finished temp file at {@code dest} without ever replacing a
     * file that is already there.
     *
     * @throws FileAlreadyExistsException if {@code dest} exists
     */
    static void claim(Path tmp, Path dest) throws IOException {
        try {
            Files.createLink(dest, tmp);
            deleteQuietly(tmp);
            return;
        } catch (FileAlreadyExistsException e) {
            throw e;
        } catch (UnsupportedOperationException | FileSystemException e) {
            System.out.println("Hard link not possible in " + dest.getParent() + ", reserving name instead: " + e.getMessage());
        }
        // createFile fails if the name exists; the replace below only hits our own empty file
        Files.createFile(dest);
        try {
            Files.move(tmp, dest, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(dest);
            throw e;
        }
    }

    /** {@code name}, or {@code stem (n).ext} with the lowest free n. */
    static Path uniquePath(Path dir, String name) {
        Path dest = dir.resolve(name);
        if (!Files.exists(dest)) return dest;
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String suffix = dot > 0 ? name.substring(dot) : "";
        for (int counter = 1; ; counter++) {
            Path candidate = dir.resolve(stem + " (" + counter + ")" + suffix);
            if (!Files.exists(candidate)) return candidate;
        }
    }

    /** Last path segment of a client-supplied name. */
    static String safeName(String name) {
        if (name == null) throw new BadRequestException("Missing file name");
        String n = name.replace('\\', '/');
        int slash = n.lastIndexOf('/');
        if (slash >= 0) n = n.substring(slash + 1);
        n = n.trim();
        if (n.isEmpty() || ".".equals(n) || "..".equals(n) || n.indexOf('\0') >= 0) {
            throw new BadRequestException("Invalid file name");
        }
        return n;
    }

    // Hidden names would never show up in a listing.
    static String uploadName(String declared) {
        String n = safeName(declared);
        int i = 0;
        while (i < n.length() && n.charAt(i) == '.') i++;
        n = n.substring(i);
        if (n.isEmpty()) throw new BadRequestException("Invalid file name");
        return n;
    }

    private Path existing(String name) {
        String safe = safeName(name);
        if (safe.startsWith(".")) throw new NoSuchStoredFileException(safe);
        Path path = directory.get().resolve(safe);
        if (!Files.isRegularFile(path)) throw new NoSuchStoredFileException(safe);
        return path;
    }

    private Path ensureDir() {
        Path dir = directory.get();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create " + dir + ": " + e.getMessage(), e);
        }
        return dir;
    }

    private static StoredFile toStoredFile(Path path, BasicFileAttributes attrs) {
        StoredFile f = new StoredFile();
        f.name = path.getFileName().toString();
        f.size = attrs.size();
        f.mtime = attrs.lastModifiedTime().toMillis() / 1000;
        f.path = path;
        return f;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Could not remove temp file " + path + ": " + e.getMessage());
        }
    }
}
