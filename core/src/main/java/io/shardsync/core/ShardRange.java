package io.shardsync.core;

import java.util.Objects;

/**
 * Inclusive interval [begin, end] over the unsigned 32-bit hash space a shard covers.
 * <br>
 * Shard names carry the range as two 8-digit lowercase hex numbers, e.g.
 * {@code 00000000-1fffffff}. Comparison uses unsigned semantics (Integer.compareUnsigned).
 */
public final class ShardRange {

    static final int HEX_DIGITS = 8;

    private final int begin;
    private final int end;

    public ShardRange(int begin, int end) {
        if (Integer.compareUnsigned(begin, end) > 0) {
            throw new IllegalArgumentException(
                    "range begin " + toHex(begin) + " is after end " + toHex(end));
        }
        this.begin = begin;
        this.end = end;
    }

    /**
     * Parse "xxxxxxxx-yyyyyyyy".
     *
     * @throws IllegalArgumentException if either bound is not exactly 8 hex digits.
     */
    public static ShardRange parse(String text) {
        Objects.requireNonNull(text, "text");
        if (text.length() != 2 * HEX_DIGITS + 1 || text.charAt(HEX_DIGITS) != '-') {
            throw new IllegalArgumentException("malformed shard range: " + text);
        }
        try {
            int b = Integer.parseUnsignedInt(text.substring(0, HEX_DIGITS), 16);
            int e = Integer.parseUnsignedInt(text.substring(HEX_DIGITS + 1), 16);
            return new ShardRange(b, e);
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("malformed shard range: " + text, nfe);
        }
    }

    public int begin() {
        return begin;
    }

    public int end() {
        return end;
    }

    /**
     * Return true if 'hash' falls in this range under unsigned comparison.
     */
    public boolean contains(int hash) {
        return Integer.compareUnsigned(hash, begin) >= 0
                && Integer.compareUnsigned(hash, end) <= 0;
    }

    /** Canonical "xxxxxxxx-yyyyyyyy" form, as it appears in shard names. */
    public String format() {
        return toHex(begin) + "-" + toHex(end);
    }

    @Override
    public String toString() {
        return "ShardRange[" + format() + "]";
    }

    private static String toHex(int v) {
        String s = Integer.toHexString(v);
        return "0".repeat(HEX_DIGITS - s.length()) + s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShardRange other)) return false;
        return begin == other.begin && end == other.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(begin, end);
    }
}
