package com.example.filedrop.access;

import com.example.filedrop.core.HubException;

/** Missing or incorrect access code. */
public class AuthException extends HubException {

    public AuthException() {
        super(401, "Invalid access code");
    }
}
