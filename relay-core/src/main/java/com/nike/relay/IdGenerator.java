package com.nike.relay;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Random;

/**
 * Generates the identifiers used for {@link Transaction}s, {@link Segment}s and distributed trace ids. Every id is
 * a random 64-bit value rendered as 16 lowercase hex characters (zero padded), which is also the format B3
 * propagation headers expect.
 *
 * @author Nic Munroe
 */
public class IdGenerator {

    private static final Logger logger = LoggerFactory.getLogger(IdGenerator.class);

    /**
     * Non-blocking pseudorandom source. Falls back to {@link Random} if SHA1PRNG is not available, in which case ids
     * only cover 48 bits of randomness.
     */
    private static final Random random = getRandomInstance("SHA1PRNG");

    private IdGenerator() {
        // Do nothing
    }

    /**
     * @return A new random id: 16 lowercase hex characters.
     */
    public static String generateId() {
        return longToUnsignedLowerHexString(generate64BitRandomLong());
    }

    /**
     * @return A random long pulled from the full 64-bit search space.
     */
    public static long generate64BitRandomLong() {
        byte[] random8Bytes = new byte[8];
        random.nextBytes(random8Bytes);

        long longVal = 0;
        for (int i = 0; i < 8; i++) {
            longVal = (longVal << 8) | (random8Bytes[i] & 0xff);
        }

        return longVal;
    }

    /**
     * @return The given value as an unsigned, zero padded, 16 character lowercase hex string.
     */
    public static String longToUnsignedLowerHexString(long value) {
        return String.format("%016x", value);
    }

    protected static Random getRandomInstance(String desiredSecureRandomImplementation) {
        Random randomToUse;

        try {
            randomToUse = SecureRandom.getInstance(desiredSecureRandomImplementation);
            randomToUse.setSeed(System.nanoTime());
        }
        catch (NoSuchAlgorithmException e) {
            logger.error(
                "Unable to retrieve the {} SecureRandom instance. Defaulting to a new Random(System.nanoTime()) "
                + "instead. Ids will not cover the full 64 bits of possible values. relay_error=true",
                desiredSecureRandomImplementation, e
            );
            randomToUse = new Random(System.nanoTime());
        }

        return randomToUse;
    }
}
