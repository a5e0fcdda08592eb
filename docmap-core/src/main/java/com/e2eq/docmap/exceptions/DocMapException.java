package com.e2eq.docmap.exceptions;

public class DocMapException extends RuntimeException {
    public DocMapException() {
        super();
    }

    public DocMapException(String message) {
        super(message);
    }

    public DocMapException(String message, Throwable cause) {
        super(message, cause);
    }

    public DocMapException(Throwable cause) {
        super(cause);
    }
}
