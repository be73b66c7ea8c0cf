package com.quashbugs.prpulse.exception;

public class UnsupportedProviderException extends RuntimeException {

    public UnsupportedProviderException(String message) {
        super(message);
    }
}
