package org.kioskfleet.utils;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * HS256 token helpers. Tokens are issued by the authentication service;
 * this server only verifies them. {@link #generateToken} exists for
 * tooling and tests.
 */
public class JwtUtil {

    public static final String CLAIM_USERNAME = "username";
    public static final String CLAIM_ROLE = "role";

    //1. generate jwt token
    public static String generateToken(String secretKey, long exTimeSeconds, String userId, String username, String role) {
        return Jwts.builder()
                .setSubject(userId)
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_ROLE, role)
                .setIssuedAt(new Date())
                .setExpiration(new Date(System.currentTimeMillis() + (exTimeSeconds * 1000L)))
                .signWith(signingKey(secretKey), SignatureAlgorithm.HS256)
                .compact();
    }

    //2. get all data, throws JwtException when the signature or expiry check fails
    public static Claims extractAllClaims(String token, String secretKey) {
        return Jwts.parserBuilder()
                .setSigningKey(signingKey(secretKey))
                .build()
                .parseClaimsJws(token)
                .getBody();
    }

    private static SecretKey signingKey(String secretKey) {
        return Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }
}
