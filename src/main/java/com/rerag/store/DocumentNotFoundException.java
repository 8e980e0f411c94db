package com.rerag.store;

import com.rerag.RetrievalException;

public class DocumentNotFoundException extends RetrievalException {
    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
