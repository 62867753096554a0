package com.tale.script.ai;

/** The code generator is missing, failed, or answered with nothing usable. */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
