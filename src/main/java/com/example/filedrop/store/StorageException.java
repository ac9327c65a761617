package com.example.filedrop.store;

import com.example.filedrop.core.HubException;

/** Disk or index failure. The message is returned to the caller as is. */
public class StorageException extends HubException {

    public StorageException(String message, Throwable cause) {
        super(500, message, cause);
    }
}
