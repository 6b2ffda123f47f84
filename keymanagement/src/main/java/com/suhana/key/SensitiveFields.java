package com.suhana.key;

import com.suhana.common.DecryptionException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field-level encryption of records, bound to one caller-owned {@link EncryptionManager}.
 *
 * An encrypted field holds the base64 of its token and is marked by a sibling
 * {@code <field>_encrypted = true} flag.
 */
public final class SensitiveFields {
    public static final String FLAG_SUFFIX = "_encrypted";

    private final EncryptionManager manager;

    public SensitiveFields(EncryptionManager manager) {
        this.manager = Objects.requireNonNull(manager, "manager");
    }

    /**
     * Copy of {@code record} with each named field that is present and non-null encrypted.
     * Absent and null fields are left untouched.
     *
     * Only strings and maps keep their type through {@link #decryptFields}. Numbers, booleans
     * and lists are stored as their JSON text and come back as that text ({@code 1234 -> "1234"}).
     */
    public Map<String, Object> encryptFields(Map<String, ?> record, Collection<String> fields) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(fields, "fields");
        Map<String, Object> out = new LinkedHashMap<>(record);
        for (String field : fields) {
            Object value = out.get(field);
            if (value == null) continue;
            byte[] token = manager.encryptObject(value);
            out.put(field, new String(Base64.getEncoder().encode(token), StandardCharsets.US_ASCII));
            out.put(field + FLAG_SUFFIX, Boolean.TRUE);
        }
        return out;
    }

    /**
     * Copy of {@code record} with every flagged field decrypted and its flag removed.
     * JSON-object plaintexts come back as records, everything else as text.
     *
     * @throws DecryptionException if a flagged field is not a valid token for this manager's keys
     */
    public Map<String, Object> decryptFields(Map<String, ?> record) {
        Objects.requireNonNull(record, "record");
        Map<String, Object> out = new LinkedHashMap<>(record);

        List<String> flagged = new ArrayList<>();
        for (Map.Entry<String, ?> e : record.entrySet()) {
            String key = e.getKey();
            if (key.endsWith(FLAG_SUFFIX) && key.length() > FLAG_SUFFIX.length()
                    && Boolean.TRUE.equals(e.getValue())) {
                flagged.add(key.substring(0, key.length() - FLAG_SUFFIX.length()));
            }
        }

        for (String field : flagged) {
            Object value = out.get(field);
            if (value == null) continue;
            if (!(value instanceof String)) {
                throw new DecryptionException("Encrypted field '" + field + "' is not a base64 string");
            }
            byte[] token;
            try {
                token = Base64.getDecoder().decode((String) value);
            } catch (IllegalArgumentException e) {
                throw new DecryptionException("Encrypted field '" + field + "' is not valid base64", e);
            }
            out.put(field, manager.decrypt(token).value());
            out.remove(field + FLAG_SUFFIX);
        }
        return out;
    }
}
