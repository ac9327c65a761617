package com.example.filedrop.service;

import java.nio.file.Path;
import java.util.Optional;

/** Lets the host pick a save directory on the server machine. */
public interface DirectoryChooser {

    /** False when no picker can be shown, e.g. on a headless host. */
    boolean isAvailable();

    /** Empty when the user cancelled. */
    Optional<Path> choose(Path current);
}
