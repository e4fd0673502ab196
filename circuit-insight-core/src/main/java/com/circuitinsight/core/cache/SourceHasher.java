package com.circuitinsight.core.cache;

/**
 * Fast, non-cryptographic content fingerprints used as cache keys.
 *
 * <p>The digest is the 31-multiplier rolling hash of the UTF-16 content
 * ({@link String#hashCode()}) rendered in base 36. It is whitespace-sensitive.
 */
public final class SourceHasher {

    private SourceHasher() {
        // Utility class
    }

    /**
     * Hashes a single text.
     *
     * @param content text, null is treated as empty
     * @return base-36 digest
     */
    public static String hash(String content) {
        int hash = content == null ? 0 : content.hashCode();
        return Long.toString(Math.abs((long) hash), Character.MAX_RADIX);
    }

    /**
     * Hashes several texts into one digest. Null parts are distinguished from empty parts.
     *
     * @param parts texts to combine
     * @return base-36 digest
     */
    public static String hashAll(String... parts) {
        int hash = 1;
        for (String part : parts) {
            hash = 31 * hash + (part == null ? -1 : part.hashCode());
        }
        return Long.toString(Math.abs((long) hash), Character.MAX_RADIX);
    }
}
