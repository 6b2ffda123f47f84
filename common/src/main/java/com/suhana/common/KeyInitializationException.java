package com.suhana.common;

/**
 * No key could be loaded, derived or generated. The subsystem is unusable.
 */
public class KeyInitializationException extends SuhanaCryptoException {
    public KeyInitializationException(String message) {
        super(message);
    }

    public KeyInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
