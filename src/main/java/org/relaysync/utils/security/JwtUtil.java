package org.relaysync.utils.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

public final class JwtUtil {

    private static final String ISSUER = "RelaySync";

    private JwtUtil() {}

    /**
     * Access token for the admin session.
     *
     * @param username   admin username, used as subject
     * @param ttlSeconds token lifetime in seconds
     * @return compact JWT string
     */
    public static String generateAccessToken(String username, long ttlSeconds) {
        Instant now = Instant.now();

        return Jwts.builder()
                .setSubject(username)
                .setId(UUID.randomUUID().toString())
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .setIssuer(ISSUER)
                .signWith(signingKey(), SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * @return the subject of a valid, unexpired token, or null
     */
    public static String validate(String token) {
        if (token == null || token.isBlank()) return null;
        try {
            Claims c = Jwts.parserBuilder()
                    .setSigningKey(signingKey())
                    .requireIssuer(ISSUER)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
            return c.getSubject();
        } catch (JwtException | IllegalArgumentException e) {
            return null;
        }
    }

    private static SecretKey signingKey() {
        return Keys.hmacShaKeyFor(KeyProvider.getJwtSigningKey().getBytes(StandardCharsets.UTF_8));
    }
}
