package org.relaysync.utils.security;

import org.mindrot.jbcrypt.BCrypt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;


public class PasswordUtil {
    private PasswordUtil(){}

    private static final int BCRYPT_COST = 12;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String hashPassword(String plainPassword) {
        if (plainPassword == null) throw new IllegalArgumentException("Password cannot be null");
        return BCrypt.hashpw(plainPassword, BCrypt.gensalt(BCRYPT_COST));
    }

    public static boolean isHashed(String stored) {
        return stored != null && stored.startsWith("$2");
    }

    /**
     * Hand-edited and freshly bootstrapped stores hold plaintext; anything written through
     * the API is a BCrypt hash.
     */
    public static boolean verifyPassword(String plainPassword, String stored) {
        if (plainPassword == null || stored == null || stored.isEmpty()) return false;
        if (isHashed(stored)) {
            try {
                return BCrypt.checkpw(plainPassword, stored);
            } catch (IllegalArgumentException e) {
                // corrupt hash
                return false;
            }
        }
        return MessageDigest.isEqual(
                plainPassword.getBytes(StandardCharsets.UTF_8),
                stored.getBytes(StandardCharsets.UTF_8));
    }

    public static String generateUsername() {
        byte[] bytes = new byte[6];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static String generatePassword() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
