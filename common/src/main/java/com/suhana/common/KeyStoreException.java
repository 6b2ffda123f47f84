package com.suhana.common;

/**
 * Persisting the key store failed. The in-memory ring is left unmodified.
 */
public class KeyStoreException extends SuhanaCryptoException {
    public KeyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
