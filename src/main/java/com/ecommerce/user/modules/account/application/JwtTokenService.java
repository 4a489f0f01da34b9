package com.ecommerce.user.modules.account.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.ecommerce.user.global.config.JwtProperties;
import com.ecommerce.user.modules.account.domain.RevokedToken;
import com.ecommerce.user.modules.account.domain.UserAccount;
import com.ecommerce.user.modules.account.infrastructure.jwt.JwtTokenProvider;
import com.ecommerce.user.modules.account.infrastructure.persistence.RevokedTokenRepository;
import com.ecommerce.user.modules.account.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.security.SignatureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues and verifies signed access/refresh tokens bound to a user id.
 *
 * <p>Both token kinds are HS256 JWTs carrying {@code user_id}, {@code token_type} and a unique {@code jti}.
 * Access tokens are verified statelessly. Refresh tokens are additionally checked against the revocation table,
 * where {@link #revoke(String)} records them until they would have expired.</p>
 */
@Service
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_TOKEN_TYPE = "token_type";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_STAFF = "staff";
    static final String TYPE_ACCESS = "access";
    static final String TYPE_REFRESH = "refresh";

    private final JwtTokenProvider tokenProvider;
    private final RevokedTokenRepository revokedTokenRepository;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            RevokedTokenRepository revokedTokenRepository,
            JwtProperties jwtProperties,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.revokedTokenRepository = revokedTokenRepository;
        this.accessTokenTtlMillis = jwtProperties.expiration();
        this.refreshTokenTtlMillis = jwtProperties.refreshExpiration();
        this.clock = clock;
    }

    public TokenPairResponse issuePair(UserAccount user) {
        Instant now = clock.instant();
        String accessToken = buildAccessToken(user, now);
        String refreshToken = Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(refreshTokenTtlMillis)))
                .claim(CLAIM_USER_ID, user.getId().toString())
                .claim(CLAIM_TOKEN_TYPE, TYPE_REFRESH)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new TokenPairResponse(
                accessToken,
                refreshToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                refreshTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public String issueAccessToken(UserAccount user) {
        return buildAccessToken(user, clock.instant());
    }

    /**
     * Verifies signature, expiry and token type of an access token.
     *
     * @throws InvalidTokenException with a short human-readable detail when any check fails
     */
    public AccessClaims verify(String token) {
        Claims claims = parse(token, TYPE_ACCESS);
        Boolean staff = claims.get(CLAIM_STAFF, Boolean.class);
        return new AccessClaims(
                extractUserId(claims),
                claims.get(CLAIM_EMAIL, String.class),
                Boolean.TRUE.equals(staff),
                toOffset(claims.getExpiration())
        );
    }

    /**
     * Verifies a refresh token and rejects it when it has been revoked.
     */
    @Transactional(readOnly = true)
    public RefreshClaims verifyRefresh(String token) {
        Claims claims = parse(token, TYPE_REFRESH);
        String tokenId = claims.getId();
        if (tokenId == null || tokenId.isBlank()) {
            throw new InvalidTokenException("Token has no id");
        }
        if (revokedTokenRepository.existsById(tokenId)) {
            throw new InvalidTokenException("Token is blacklisted");
        }
        return new RefreshClaims(extractUserId(claims), tokenId, toOffset(claims.getExpiration()));
    }

    /**
     * Records the refresh token as revoked. Revoking an already revoked token fails like any other invalid token.
     */
    @Transactional
    public RefreshClaims revoke(String refreshToken) {
        RefreshClaims claims = verifyRefresh(refreshToken);
        OffsetDateTime now = OffsetDateTime.now(clock);
        revokedTokenRepository.save(new RevokedToken(claims.tokenId(), claims.userId(), claims.expiresAt(), now));
        int purged = revokedTokenRepository.deleteExpired(now);
        if (purged > 0) {
            log.debug("Purged {} expired revocation records", purged);
        }
        return claims;
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    private String buildAccessToken(UserAccount user, Instant now) {
        SecretKey key = tokenProvider.getSecretKey();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(accessTokenTtlMillis)))
                .claim(CLAIM_USER_ID, user.getId().toString())
                .claim(CLAIM_TOKEN_TYPE, TYPE_ACCESS)
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_STAFF, user.isStaff())
                .signWith(key, SIG.HS256)
                .compact();
    }

    private Claims parse(String token, String expectedType) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException("Token is expired", e);
        } catch (SignatureException e) {
            throw new InvalidTokenException("Token signature is invalid", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Token is invalid or malformed", e);
        }

        if (!expectedType.equals(claims.get(CLAIM_TOKEN_TYPE, String.class))) {
            throw new InvalidTokenException("Token has wrong type");
        }
        return claims;
    }

    private UUID extractUserId(Claims claims) {
        String raw = claims.get(CLAIM_USER_ID, String.class);
        if (raw == null) {
            raw = claims.getSubject();
        }
        if (raw == null) {
            throw new InvalidTokenException("Token contained no recognizable user identification");
        }
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Token contained no recognizable user identification", e);
        }
    }

    private OffsetDateTime toOffset(Date date) {
        Instant instant = date != null ? date.toInstant() : clock.instant();
        return OffsetDateTime.ofInstant(instant, clock.getZone());
    }

    public record AccessClaims(UUID userId, String email, boolean staff, OffsetDateTime expiresAt) {
    }

    public record RefreshClaims(UUID userId, String tokenId, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {

        private final String detail;

        public InvalidTokenException(String detail) {
            this(detail, null);
        }

        public InvalidTokenException(String detail, Throwable cause) {
            super("Invalid token: " + detail, cause);
            this.detail = detail;
        }

        public String getDetail() {
            return detail;
        }
    }
}
