package dustin.miniauth.domains.auth.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.Date;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import dustin.miniauth.domains.auth.config.AuthProperties;
import dustin.miniauth.domains.auth.model.AccessTokenClaims;
import dustin.miniauth.domains.auth.model.TokenScope;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

/**
 * JWT 서비스
 * JWT Service for stateless access tokens and opaque refresh token material
 *
 * Access Token 검증은 DB 조회 없이 서명과 만료만으로 판단한다.
 * 유효 구간: iat <= now < exp (exp 시각 정각부터 거부).
 */
@Slf4j
@Service
public class JwtService {
    
    static final String SCOPE_CLAIM = "scope";
    static final String TYPE_CLAIM = "type";
    static final String ACCESS_TYPE = "access";
    
    private static final int MIN_SECRET_BYTES = 32;
    private static final int REFRESH_TOKEN_BYTES = 32;
    
    private final SecretKey secretKey;
    private final Duration accessTokenTtl;
    private final SecureRandom secureRandom;
    
    public JwtService(AuthProperties properties) {
        String secret = properties.getJwt().getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("auth.jwt.secret must be configured with at least "
                    + MIN_SECRET_BYTES + " bytes");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenTtl = properties.getJwt().getAccessTokenTtl();
        this.secureRandom = new SecureRandom();
    }
    
    /**
     * Access Token 발급
     * Issue a signed access token bound to subject and scope
     *
     * JWT 의 시간 클레임은 초 단위이므로 now 를 초 단위로 내린다.
     */
    public String issueAccessToken(UUID subjectId, TokenScope scope, Instant now) {
        Instant issuedAt = now.truncatedTo(ChronoUnit.SECONDS);
        Instant expiration = accessTokenExpiresAt(now);
        
        return Jwts.builder()
                .subject(subjectId.toString())
                .claim(SCOPE_CLAIM, scope.toClaim())
                .claim(TYPE_CLAIM, ACCESS_TYPE)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiration))
                .signWith(secretKey)
                .compact();
    }
    
    /**
     * Access Token 검증 및 클레임 추출
     * Validate an access token; empty on bad signature, expiry or malformed payload
     */
    public Optional<AccessTokenClaims> validateAccessToken(String token, Instant now) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(now))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            
            if (!ACCESS_TYPE.equals(claims.get(TYPE_CLAIM, String.class))
                    || claims.getSubject() == null
                    || claims.getIssuedAt() == null
                    || claims.getExpiration() == null) {
                return Optional.empty();
            }
            
            Instant issuedAt = claims.getIssuedAt().toInstant();
            Instant expiresAt = claims.getExpiration().toInstant();
            if (now.isBefore(issuedAt) || !now.isBefore(expiresAt)) {
                return Optional.empty();
            }
            
            Optional<TokenScope> scope = TokenScope.parse(claims.get(SCOPE_CLAIM, String.class));
            if (scope.isEmpty()) {
                return Optional.empty();
            }
            
            UUID subjectId = UUID.fromString(claims.getSubject());
            return Optional.of(new AccessTokenClaims(subjectId, scope.get(), issuedAt, expiresAt));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Access token rejected: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }
    }
    
    /**
     * now 에 발급된 Access Token 의 만료 시각
     * Expiry of an access token issued at {@code now}
     */
    public Instant accessTokenExpiresAt(Instant now) {
        return now.truncatedTo(ChronoUnit.SECONDS).plus(accessTokenTtl);
    }
    
    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }
    
    /**
     * Refresh Token 생성 (랜덤 문자열)
     * Generate Refresh Token (random string)
     */
    public String generateRefreshToken() {
        byte[] randomBytes = new byte[REFRESH_TOKEN_BYTES];
        secureRandom.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }
    
    /**
     * Refresh Token 해싱 (DB 저장용)
     * Hash Refresh Token (for database storage)
     */
    public String hashRefreshToken(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
