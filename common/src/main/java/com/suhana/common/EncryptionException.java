package com.suhana.common;

public class EncryptionException extends SuhanaCryptoException {
    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
