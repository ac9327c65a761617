package com.example.filedrop.core;

public class BadRequestException extends HubException {

    public BadRequestException(String message) {
        super(400, message);
    }
}
