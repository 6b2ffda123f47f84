package com.suhana.key;

import com.suhana.crypto.KeyUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered key history, newest first.
 *
 * Position 0 is the primary key used for every new encryption; all entries are candidates
 * for decryption, tried in order. Instances are immutable: {@link #prepend} returns a new
 * ring, so a caller can persist the successor before making it active.
 */
public final class KeyRing implements Iterable<KeyRecord> {
    private static final KeyRing EMPTY = new KeyRing(List.of());

    private final List<KeyRecord> keys;

    private KeyRing(List<KeyRecord> keys) {
        this.keys = keys;
    }

    public static KeyRing empty() {
        return EMPTY;
    }

    public static KeyRing of(List<KeyRecord> newestFirst) {
        Objects.requireNonNull(newestFirst, "keys");
        if (newestFirst.contains(null)) throw new IllegalArgumentException("keys cannot contain null");
        return new KeyRing(List.copyOf(newestFirst));
    }

    public KeyRecord primary() {
        if (keys.isEmpty()) throw new IllegalStateException("Key ring is empty");
        return keys.get(0);
    }

    /** All keys in trial order (newest first). */
    public List<KeyRecord> candidates() {
        return keys;
    }

    /**
     * Ring with {@code key} as the new primary, truncated from the tail to {@code maxKeys}.
     * An older entry holding the same key material is dropped rather than duplicated.
     */
    public KeyRing prepend(KeyRecord key, int maxKeys) {
        Objects.requireNonNull(key, "key");
        if (maxKeys < 1) throw new IllegalArgumentException("maxKeys must be positive");

        List<KeyRecord> next = new ArrayList<>(keys.size() + 1);
        next.add(key);
        for (KeyRecord k : keys) {
            if (next.size() >= maxKeys) break;
            if (!KeyUtils.sameKey(k.getSecret(), key.getSecret())) next.add(k);
        }
        return new KeyRing(Collections.unmodifiableList(next));
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public int size() {
        return keys.size();
    }

    @Override
    public Iterator<KeyRecord> iterator() {
        return keys.iterator();
    }

    @Override
    public String toString() {
        return "KeyRing{size=" + keys.size()
                + (keys.isEmpty() ? "" : ", primaryCreated=" + keys.get(0).getCreatedAt()) + "}";
    }
}
