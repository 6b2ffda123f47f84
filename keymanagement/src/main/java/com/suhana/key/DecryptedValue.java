package com.suhana.key;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.suhana.common.PersistenceUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Plaintext recovered from a token.
 *
 * Tokens do not record what kind of value was encrypted. A plaintext that parses, in full, as a
 * JSON object is reported as a record; everything else is text. A string that happens to be a JSON
 * object therefore comes back as a record, and raw bytes come back as (possibly lossy) text
 * unless read through {@link #asBytes()}.
 */
public final class DecryptedValue {
    private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {};

    private final byte[] plaintext;
    private Optional<Map<String, Object>> record;

    DecryptedValue(byte[] plaintext) {
        this.plaintext = plaintext;
    }

    public byte[] asBytes() {
        return plaintext.clone();
    }

    public String asText() {
        return new String(plaintext, StandardCharsets.UTF_8);
    }

    public boolean isRecord() {
        return parsedRecord().isPresent();
    }

    /** The structured record, if the plaintext is a JSON object. */
    public Optional<Map<String, Object>> asRecord() {
        return parsedRecord();
    }

    /** Record when structured, otherwise text. */
    public Object value() {
        Optional<Map<String, Object>> r = parsedRecord();
        return r.isPresent() ? r.get() : asText();
    }

    private synchronized Optional<Map<String, Object>> parsedRecord() {
        if (record == null) {
            record = parse(plaintext);
        }
        return record;
    }

    private static Optional<Map<String, Object>> parse(byte[] bytes) {
        int i = 0;
        while (i < bytes.length && Character.isWhitespace(bytes[i])) i++;
        if (i == bytes.length || bytes[i] != '{') return Optional.empty();
        try {
            Map<String, Object> parsed = PersistenceUtils.mapper()
                    .readerFor(RECORD)
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readValue(bytes);
            return Optional.ofNullable(parsed);
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DecryptedValue && Arrays.equals(plaintext, ((DecryptedValue) o).plaintext);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(plaintext);
    }

    @Override
    public String toString() {
        return "DecryptedValue{" + plaintext.length + " bytes}";
    }
}
