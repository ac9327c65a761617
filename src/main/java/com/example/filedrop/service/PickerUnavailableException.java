package com.example.filedrop.service;

import com.example.filedrop.core.HubException;

public class PickerUnavailableException extends HubException {

    public PickerUnavailableException(String message) {
        super(500, message);
    }

    public PickerUnavailableException(String message, Throwable cause) {
        super(500, message, cause);
    }
}
