package com.nike.relay.cat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Path hashes identify a transaction's position in a chain of cross-application calls. Each hop combines its own
 * application and transaction name with the hash it received from its caller, so the same route through the same
 * services always produces the same hash.
 */
public class PathHashes {

    private static final Logger logger = LoggerFactory.getLogger(PathHashes.class);

    private PathHashes() {
        // Nothing to do
    }

    /**
     * Rotates the referring hash left by one bit and XORs it with the low 32 bits of
     * {@code MD5(appName + ";" + pathName)}.
     *
     * @param appName The calling application's (first) name.
     * @param pathName The calling transaction's full name.
     * @param referringPathHash The hash received from upstream as 8 hex characters, or null at the start of a chain.
     * @return The path hash as 8 lowercase, zero padded hex characters.
     */
    public static String calculatePathHash(String appName, String pathName, String referringPathHash) {
        int referring = parseHash(referringPathHash);
        int rotated = (referring << 1) | (referring >>> 31);

        byte[] md5 = md5(String.valueOf(appName) + ";" + ((pathName == null) ? "" : pathName));
        int low4Bytes = ((md5[12] & 0xff) << 24)
                        | ((md5[13] & 0xff) << 16)
                        | ((md5[14] & 0xff) << 8)
                        | (md5[15] & 0xff);

        return String.format("%08x", rotated ^ low4Bytes);
    }

    /**
     * @return The 32 bit value of the given hex hash, or 0 when it is missing or not hex.
     */
    static int parseHash(String hash) {
        if (hash == null || hash.isEmpty()) {
            return 0;
        }

        try {
            return (int) Long.parseLong(hash, 16);
        }
        catch (NumberFormatException e) {
            logger.debug("Treating unparsable referring path hash as absent. referring_path_hash={}", hash);
            return 0;
        }
    }

    private static byte[] md5(String value) {
        try {
            return MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
        }
        catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to support MD5.
            throw new IllegalStateException("MD5 is not available", e);
        }
    }
}
