package com.tale.script.ai;

/** A prompt asked for something the gateway will not generate. */
public class UnsafeRequestException extends RuntimeException {

    public UnsafeRequestException(String message) {
        super(message);
    }
}
