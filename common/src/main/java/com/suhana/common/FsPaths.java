// common/src/main/java/com/suhana/common/FsPaths.java
package com.suhana.common;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class FsPaths {
    // ---- property/env keys (used by tests and code) ----
    public static final String BASE_DIR_PROP  = "suhana.baseDir";
    public static final String BASE_DIR_ENV   = "SUHANA_BASE_DIR";
    public static final String KEYSTORE_PROP  = "suhana.keys.storeFile";

    public static final String ENCRYPTED_SUFFIX = ".enc";
    public static final String DECRYPTED_SUFFIX = ".dec";
    public static final String SALT_SUFFIX      = ".salt";

    private FsPaths() {}

    public static Path baseDir() {
        String prop = System.getProperty(BASE_DIR_PROP);
        if (prop == null || prop.isBlank()) {
            String env = System.getenv(BASE_DIR_ENV);
            if (env != null && !env.isBlank()) prop = env;
        }
        Path base = (prop == null || prop.isBlank())
                ? Paths.get(System.getProperty("user.dir"))
                : Paths.get(prop);
        return base.toAbsolutePath().normalize();
    }

    public static Path keyStoreFile() {
        String rel = System.getProperty(KEYSTORE_PROP, "config/encryption_keys/current_keys.json");
        Path p = Paths.get(rel);
        return p.isAbsolute() ? p.normalize() : baseDir().resolve(p).normalize();
    }

    /** Resolves a relative path against {@link #baseDir()}; absolute paths are only normalized. */
    public static Path resolve(String path) {
        Path p = Paths.get(path);
        return p.isAbsolute() ? p.normalize() : baseDir().resolve(p).toAbsolutePath().normalize();
    }

    /** Sibling file holding the per-installation password salt. */
    public static Path saltFileFor(Path keyStoreFile) {
        return keyStoreFile.resolveSibling(keyStoreFile.getFileName() + SALT_SUFFIX);
    }

    /** {@code name.ext -> name.ext.enc} */
    public static Path encryptedPathFor(Path file) {
        return file.resolveSibling(file.getFileName() + ENCRYPTED_SUFFIX);
    }

    /** {@code name.ext.enc -> name.ext}, anything else gets {@code .dec} appended. */
    public static Path decryptedPathFor(Path encryptedFile) {
        String name = encryptedFile.getFileName().toString();
        if (name.endsWith(ENCRYPTED_SUFFIX) && name.length() > ENCRYPTED_SUFFIX.length()) {
            return encryptedFile.resolveSibling(name.substring(0, name.length() - ENCRYPTED_SUFFIX.length()));
        }
        return encryptedFile.resolveSibling(name + DECRYPTED_SUFFIX);
    }
}
