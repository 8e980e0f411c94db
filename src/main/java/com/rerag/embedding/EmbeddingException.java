package com.rerag.embedding;

import com.rerag.RetrievalException;

public class EmbeddingException extends RetrievalException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
