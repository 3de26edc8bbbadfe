package com.fincraft.etl.transform;

/**
 * Payload does not have the structure its table descriptor expects.
 */
public class PayloadValidationException extends Exception {

    public PayloadValidationException(String message) {
        super(message);
    }

    public PayloadValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
