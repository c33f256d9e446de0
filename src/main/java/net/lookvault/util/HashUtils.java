package net.lookvault.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 helpers shared by the asset and generation caches.
 *
 * <p>Every JRE ships SHA-256, so a missing algorithm is reported as an
 * {@link IllegalStateException} instead of a checked exception that every
 * cache caller would have to re-wrap.</p>
 */
public final class HashUtils {

    private static final String SHA_256 = "SHA-256";

    private HashUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Computes SHA-256 hash of byte array data.
     *
     * @param data Byte array to hash
     * @return SHA-256 hash as byte array
     */
    public static byte[] computeSha256(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(SHA_256);
            return digest.digest(data);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available in this runtime", ex);
        }
    }

    /**
     * Computes SHA-256 hash of string data (UTF-8) and returns it as hexadecimal.
     *
     * @param data String to hash
     * @return SHA-256 hash as lowercase hex string (64 characters)
     *
     * @example
     * <pre>{@code
     * String hex = HashUtils.sha256Hex("https://example.com/image.jpg");
     * }</pre>
     */
    public static String sha256Hex(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Data cannot be null");
        }
        return bytesToHex(computeSha256(data.getBytes(StandardCharsets.UTF_8)));
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
