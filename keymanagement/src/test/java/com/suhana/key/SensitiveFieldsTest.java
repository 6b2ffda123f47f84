package com.suhana.key;

import com.suhana.common.DecryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SensitiveFieldsTest {

    @TempDir
    Path tempDir;

    private EncryptionManager manager;
    private SensitiveFields fields;

    @BeforeEach
    void setUp() {
        manager = new EncryptionManager(tempDir.resolve("keys.json"));
        fields = new SensitiveFields(manager);
    }

    @Test
    void sensitiveFieldsRoundTrip() {
        Map<String, Object> user = new HashMap<>();
        user.put("username", "test_user");
        user.put("password", "secret123");
        user.put("token", null);

        Map<String, Object> enc = fields.encryptFields(user, List.of("password", "token"));

        assertEquals("test_user", enc.get("username"));
        assertNotEquals("secret123", enc.get("password"));
        assertEquals(Boolean.TRUE, enc.get("password_encrypted"));
        assertNull(enc.get("token"));
        assertFalse(enc.containsKey("token_encrypted"));
        assertEquals("secret123", user.get("password"), "input must not be modified");

        Map<String, Object> dec = fields.decryptFields(enc);

        assertEquals("secret123", dec.get("password"));
        assertFalse(dec.containsKey("password_encrypted"));
        assertEquals(user, dec);
    }

    @Test
    void structuredFieldComesBackAsRecord() {
        Map<String, Object> profile = new LinkedHashMap<>();
        profile.put("city", "Pune");
        profile.put("age", 31);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("profile", profile);

        Map<String, Object> dec = fields.decryptFields(fields.encryptFields(record, List.of("profile")));

        assertEquals(profile, dec.get("profile"));
    }

    @Test
    void scalarFieldComesBackAsJsonText() {
        Map<String, Object> dec = fields.decryptFields(fields.encryptFields(Map.of("pin", 1234), List.of("pin")));

        assertEquals("1234", dec.get("pin"));
    }

    @Test
    void absentFieldsAreIgnored() {
        Map<String, Object> record = Map.of("name", "x");

        Map<String, Object> enc = fields.encryptFields(record, List.of("missing"));

        assertEquals(record, enc);
    }

    @Test
    void falseFlagLeavesFieldAlone() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("note", "plain");
        record.put("note_encrypted", false);

        assertEquals(record, fields.decryptFields(record));
    }

    @Test
    void foreignManagerCannotDecrypt() {
        Map<String, Object> enc = fields.encryptFields(Map.of("pin", "1234"), List.of("pin"));
        SensitiveFields other = new SensitiveFields(new EncryptionManager(tempDir.resolve("other.json")));

        assertThrows(DecryptionException.class, () -> other.decryptFields(enc));
    }

    @Test
    void malformedFieldIsRejected() {
        Map<String, Object> bad = new LinkedHashMap<>();
        bad.put("pin", "%%% not base64 %%%");
        bad.put("pin_encrypted", true);
        assertThrows(DecryptionException.class, () -> fields.decryptFields(bad));

        bad.put("pin", 42);
        assertThrows(DecryptionException.class, () -> fields.decryptFields(bad));
    }

    @Test
    void nullManagerIsRejected() {
        assertThrows(NullPointerException.class, () -> new SensitiveFields(null));
    }
}
