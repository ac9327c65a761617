package com.example.filedrop.store;

import com.example.filedrop.core.HubException;

public class NoSuchStoredFileException extends HubException {

    public NoSuchStoredFileException(String name) {
        super(404, "File not found: " + name);
    }
}
