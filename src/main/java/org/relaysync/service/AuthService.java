package org.relaysync.service;

import org.relaysync.model.AdminAuth;
import org.relaysync.store.ConfigStore;
import org.relaysync.utils.security.JwtUtil;
import org.relaysync.utils.security.PasswordUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Single-admin login against the auth section of the job store. Sessions are stateless JWTs.
 */
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final ConfigStore store;
    private final long accessTokenTtlSeconds;

    public AuthService(ConfigStore store, long accessTokenTtlSeconds) {
        this.store = store;
        this.accessTokenTtlSeconds = accessTokenTtlSeconds;
    }

    /**
     * @return an access token when the credentials match the stored admin, empty otherwise
     */
    public Optional<String> login(String username, String password) {
        AdminAuth auth = store.getSnapshot().auth();
        if (isBlank(auth.username()) || isBlank(auth.password())) {
            logger.warn("Login refused: no admin credentials configured");
            return Optional.empty();
        }
        if (username == null || password == null) {
            return Optional.empty();
        }
        boolean userMatches = MessageDigest.isEqual(
                username.getBytes(StandardCharsets.UTF_8), auth.username().getBytes(StandardCharsets.UTF_8));
        boolean passwordMatches = PasswordUtil.verifyPassword(password, auth.password());
        if (!userMatches || !passwordMatches) {
            logger.warn("Login failed for user '{}'", username);
            return Optional.empty();
        }
        logger.info("Admin '{}' logged in", username);
        return Optional.of(JwtUtil.generateAccessToken(username, accessTokenTtlSeconds));
    }

    /**
     * @return the admin name of a valid session token, or null
     */
    public String authenticate(String token) {
        return JwtUtil.validate(token);
    }

    public long getAccessTokenTtlSeconds() {
        return accessTokenTtlSeconds;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
