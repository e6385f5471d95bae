// file: core/src/main/java/io/hybriddb/core/Ids.java
package io.hybriddb.core;

import java.security.SecureRandom;

/**
 * Document id generator.
 * <p>
 * Ids are 32 lowercase hex characters laid out as
 * {@code xxxxxxxxxxxx4xxxyxxxxxxxxxxxxxxx}: position 12 is always '4' and
 * position 16 is one of 8, 9, a, b.
 */
public final class Ids {
    private static final String TEMPLATE = "xxxxxxxxxxxx4xxxyxxxxxxxxxxxxxxx";
    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private Ids() {}

    public static String newId() {
        char[] out = new char[TEMPLATE.length()];
        for (int i = 0; i < out.length; i++) {
            char c = TEMPLATE.charAt(i);
            int r = RANDOM.nextInt(16);
            out[i] = switch (c) {
                case 'x' -> HEX[r];
                case 'y' -> HEX[(r & 0x3) | 0x8];
                default -> c;
            };
        }
        return new String(out);
    }
}
