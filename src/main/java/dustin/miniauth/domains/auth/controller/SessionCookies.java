package dustin.miniauth.domains.auth.controller;

import java.time.Duration;
import java.time.Instant;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import dustin.miniauth.domains.auth.config.AuthProperties;
import dustin.miniauth.domains.auth.middleware.CredentialMaterial;
import dustin.miniauth.domains.auth.model.SessionTokens;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 플랫폼 세션 쿠키 작성기
 * Writes and clears the httpOnly session cookies of the platform flows
 */
@Component
public class SessionCookies {

    private static final String REFRESH_COOKIE_PATH = "/api/v1/auth";

    private final boolean secure;
    private final String sameSite;

    public SessionCookies(AuthProperties properties) {
        this.secure = properties.getCookie().isSecure();
        this.sameSite = properties.getCookie().getSameSite();
    }

    public void write(HttpServletResponse response, SessionTokens tokens, Instant now) {
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(CredentialMaterial.ACCESS_TOKEN_COOKIE,
                tokens.getAccessToken(), "/", Duration.between(now, tokens.getAccessTokenExpiresAt())).toString());
        response.addHeader(HttpHeaders.SET_COOKIE, cookie(CredentialMaterial.REFRESH_TOKEN_COOKIE,
                tokens.getRefreshToken(), REFRESH_COOKIE_PATH, Duration.between(now, tokens.getRefreshTokenExpiresAt())).toString());
    }

    public void clear(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE,
                cookie(CredentialMaterial.ACCESS_TOKEN_COOKIE, "", "/", Duration.ZERO).toString());
        response.addHeader(HttpHeaders.SET_COOKIE,
                cookie(CredentialMaterial.REFRESH_TOKEN_COOKIE, "", REFRESH_COOKIE_PATH, Duration.ZERO).toString());
    }

    private ResponseCookie cookie(String name, String value, String path, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(secure)
                .sameSite(sameSite)
                .path(path)
                .maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge)
                .build();
    }
}
