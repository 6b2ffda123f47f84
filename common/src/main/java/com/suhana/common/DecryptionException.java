package com.suhana.common;

/**
 * No candidate key authenticated a token, or a stream packet was rejected.
 * Never retried automatically: the same key set cannot succeed twice.
 */
public class DecryptionException extends SuhanaCryptoException {
    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
