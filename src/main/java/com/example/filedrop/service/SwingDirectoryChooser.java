package com.example.filedrop.service;

import java.awt.GraphicsEnvironment;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.swing.JFileChooser;
import javax.swing.SwingUtilities;

public class SwingDirectoryChooser implements DirectoryChooser {

    @Override
    public boolean isAvailable() {
        return !GraphicsEnvironment.isHeadless();
    }

    @Override
    public Optional<Path> choose(Path current) {
        AtomicReference<Path> chosen = new AtomicReference<>();
        try {
            SwingUtilities.invokeAndWait(() -> {
                JFileChooser chooser = new JFileChooser(current == null ? null : current.toFile());
                chooser.setDialogTitle("Choose FileDrop folder");
                chooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
                chooser.setAcceptAllFileFilterUsed(false);
                if (chooser.showOpenDialog(null) == JFileChooser.APPROVE_OPTION) {
                    chosen.set(chooser.getSelectedFile().toPath());
                }
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Folder picker interrupted", e);
        } catch (InvocationTargetException e) {
            throw new IllegalStateException("Folder picker failed: " + e.getCause(), e);
        }
        return Optional.ofNullable(chosen.get());
    }
}
