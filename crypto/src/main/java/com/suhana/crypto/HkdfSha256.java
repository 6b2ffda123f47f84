package com.suhana.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

import java.util.Objects;

/**
 * HKDF (RFC 5869) extract-and-expand over SHA-256.
 */
public final class HkdfSha256 {

    private HkdfSha256() {}

    public static byte[] derive(byte[] ikm, byte[] salt, byte[] info, int length) {
        Objects.requireNonNull(ikm, "ikm");
        if (ikm.length == 0) throw new IllegalArgumentException("ikm cannot be empty");
        if (length <= 0 || length > 255 * 32) throw new IllegalArgumentException("invalid output length: " + length);

        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(ikm, salt, info));

        byte[] out = new byte[length];
        hkdf.generateBytes(out, 0, length);
        return out;
    }
}
