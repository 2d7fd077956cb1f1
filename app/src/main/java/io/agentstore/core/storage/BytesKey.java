package io.agentstore.core.storage;

import java.util.Arrays;

/**
 * Value-based key wrapper around byte[] so we can use it in maps/sets.
 * byte[] doesn't implement value-based equals/hashCode.
 */
final class BytesKey {
    private final byte[] bytes;
    private final int hash; // cache hashCode

    BytesKey(byte[] src) {
        if (src == null) throw new NullPointerException("key");
        this.bytes = src.clone();
        this.hash = Arrays.hashCode(this.bytes);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BytesKey)) return false;
        BytesKey other = (BytesKey) o;
        return Arrays.equals(this.bytes, other.bytes);
    }

    @Override public int hashCode() {
        return hash;
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16))
              .append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
