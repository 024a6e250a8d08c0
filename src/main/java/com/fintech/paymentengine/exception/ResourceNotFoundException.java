package com.fintech.paymentengine.exception;

public class ResourceNotFoundException extends PaymentEngineException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
