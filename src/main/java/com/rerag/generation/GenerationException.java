package com.rerag.generation;

import com.rerag.RetrievalException;

public class GenerationException extends RetrievalException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
