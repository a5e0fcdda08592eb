package com.e2eq.docmap.exceptions;

/**
 * Wraps a failure reported by the underlying document store driver.
 */
public class DocumentStoreException extends DocMapException {
    private static final long serialVersionUID = 1L;

    private final String collection;

    public DocumentStoreException(String collection, String message) {
        super(message);
        this.collection = collection;
    }

    public DocumentStoreException(String collection, String message, Throwable cause) {
        super(message, cause);
        this.collection = collection;
    }

    public String getCollection() {
        return collection;
    }
}
