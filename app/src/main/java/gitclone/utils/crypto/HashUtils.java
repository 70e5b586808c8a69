package gitclone.utils.crypto;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Utility class for SHA-1 object ids: hashing and conversion between the raw
 * 20-byte form used inside trees and packs and the 40-character hex form used
 * everywhere else.
 */
public class HashUtils {

    public static final int RAW_LENGTH = 20;
    public static final int HEX_LENGTH = 40;

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    public static String sha1Hex(byte[] data) {
        return toHex(sha1(data));
    }

    public static byte[] sha1(byte[] data) {
        return newSha1().digest(data);
    }

    public static MessageDigest newSha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
    }

    public static String toHex(byte[] bytes) {
        return toHex(bytes, 0, bytes.length);
    }

    public static String toHex(byte[] bytes, int offset, int length) {
        char[] out = new char[length * 2];
        for (int i = 0; i < length; i++) {
            int b = bytes[offset + i] & 0xff;
            out[i * 2] = HEX_DIGITS[b >>> 4];
            out[i * 2 + 1] = HEX_DIGITS[b & 0x0f];
        }
        return new String(out);
    }

    /**
     * Converts a 40-character hex id into its raw 20-byte form.
     *
     * @throws IllegalArgumentException if the string is not a valid id
     */
    public static byte[] toBytes(String hex) {
        if (!isValidSha(hex)) {
            throw new IllegalArgumentException("Not a valid object id: " + hex);
        }
        byte[] result = new byte[RAW_LENGTH];
        for (int i = 0; i < RAW_LENGTH; i++) {
            int hi = Character.digit(hex.charAt(i * 2), 16);
            int lo = Character.digit(hex.charAt(i * 2 + 1), 16);
            result[i] = (byte) ((hi << 4) | lo);
        }
        return result;
    }

    public static boolean isValidSha(String sha) {
        if (sha == null || sha.length() != HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < sha.length(); i++) {
            if (Character.digit(sha.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
