package com.rerag.store;

import com.rerag.RetrievalException;

public class StorageException extends RetrievalException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
