package com.prepair.backend.exception;

public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String kind, Long id) {
        super(kind + " not found: " + id);
    }
}
