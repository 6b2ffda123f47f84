package com.suhana.common;

/**
 * Root of the crypto subsystem's unchecked error taxonomy.
 */
public class SuhanaCryptoException extends RuntimeException {
    public SuhanaCryptoException(String message) {
        super(message);
    }

    public SuhanaCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
