package com.rerag.authz;

import com.rerag.RetrievalException;

public class AuthorizationException extends RetrievalException {

    public AuthorizationException(String message) {
        super(message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
