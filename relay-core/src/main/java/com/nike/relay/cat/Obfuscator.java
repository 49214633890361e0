package com.nike.relay.cat;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * The reversible transform used by the legacy cross-application tracing headers: every UTF-8 byte of the input is
 * XORed with the UTF-8 bytes of the key (cycling through the key), and the result is Base64 encoded. The transform
 * hides payloads from casual inspection, it is not encryption.
 */
public class Obfuscator {

    private Obfuscator() {
        // Nothing to do
    }

    /**
     * @return The obfuscated form of {@code value}, or {@code value} itself when the key is null or empty.
     */
    public static String obfuscate(String value, String key) {
        if (value == null || key == null || key.isEmpty()) {
            return value;
        }

        byte[] xored = xor(value.getBytes(StandardCharsets.UTF_8), key.getBytes(StandardCharsets.UTF_8));
        return Base64.getEncoder().encodeToString(xored);
    }

    /**
     * Reverses {@link #obfuscate(String, String)}.
     *
     * @throws IllegalArgumentException if {@code obfuscated} is not valid Base64.
     */
    public static String deobfuscate(String obfuscated, String key) {
        if (obfuscated == null || key == null || key.isEmpty()) {
            return obfuscated;
        }

        byte[] decoded = Base64.getDecoder().decode(obfuscated.trim());
        return new String(xor(decoded, key.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }

    private static byte[] xor(byte[] input, byte[] key) {
        byte[] output = new byte[input.length];
        for (int i = 0; i < input.length; i++) {
            output[i] = (byte) (input[i] ^ key[i % key.length]);
        }
        return output;
    }
}
