package com.discussboard.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.discussboard.backend.modules.auth.domain.ActorType;
import com.discussboard.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.discussboard.backend.modules.auth.presentation.dto.AuthorizationToken;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService {

    static final String ISSUER = "discussboard";
    private static final String CLAIM_MEMBER_ID = "memberId";
    private static final String CLAIM_EMAIL = "email";
    private static final String CLAIM_TYPE = "type";
    private static final String CLAIM_ROLES = "roles";

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:3600000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public AuthorizationToken issueTokens(TokenSubject subject, String refreshToken) {
        Instant now = clock.instant();
        Instant accessExpiry = now.plusMillis(accessTokenTtlMillis);
        Instant refreshExpiry = now.plusMillis(refreshTokenTtlMillis);

        SecretKey key = tokenProvider.getSecretKey();

        String accessToken = Jwts.builder()
                .issuer(ISSUER)
                .subject(subject.userAccountId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(accessExpiry))
                .claim(CLAIM_MEMBER_ID, subject.memberId() != null ? subject.memberId().toString() : null)
                .claim(CLAIM_EMAIL, subject.email())
                .claim(CLAIM_TYPE, subject.actorType().name())
                .claim(CLAIM_ROLES, subject.roles())
                .signWith(key, SIG.HS256)
                .compact();

        return new AuthorizationToken(
                accessToken,
                refreshToken,
                OffsetDateTime.ofInstant(accessExpiry, clock.getZone()),
                OffsetDateTime.ofInstant(refreshExpiry, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .requireIssuer(ISSUER)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userAccountId = UUID.fromString(claims.getSubject());
            String memberIdClaim = claims.get(CLAIM_MEMBER_ID, String.class);
            UUID memberId = memberIdClaim != null ? UUID.fromString(memberIdClaim) : null;
            String typeClaim = claims.get(CLAIM_TYPE, String.class);
            ActorType actorType = typeClaim != null ? ActorType.valueOf(typeClaim) : ActorType.MEMBER;
            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userAccountId,
                    memberId,
                    claims.get(CLAIM_EMAIL, String.class),
                    actorType,
                    roles,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public String newRefreshToken() {
        return UUID.randomUUID().toString();
    }

    public String hashRefreshToken(String refreshToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(refreshToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    public record TokenSubject(UUID userAccountId, UUID memberId, String email, ActorType actorType,
                               List<String> roles) {
    }

    public record ParsedToken(UUID userAccountId, UUID memberId, String email, ActorType actorType,
                              List<String> roles, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
