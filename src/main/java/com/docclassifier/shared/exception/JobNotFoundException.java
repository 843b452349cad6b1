package com.docclassifier.shared.exception;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String kind, UUID id) {
        super(kind + " not found: " + id);
    }
}
