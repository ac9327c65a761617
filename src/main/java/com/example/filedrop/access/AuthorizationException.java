package com.example.filedrop.access;

import com.example.filedrop.core.HubException;

/** A non-admin caller attempted an admin-only action. */
public class AuthorizationException extends HubException {

    public AuthorizationException(String message) {
        super(403, message);
    }
}
