package dustin.miniauth.domains.auth.middleware;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.Value;

/**
 * 요청에 실린 자격 증명
 * Credential material carried by a request
 * Access Token 은 Authorization 헤더를 먼저, 없으면 access_token 쿠키를 본다.
 */
@Value
public class CredentialMaterial {

    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";
    private static final String BEARER_PREFIX = "Bearer ";

    String apiKey;
    String accessToken;

    public static CredentialMaterial from(HttpServletRequest request, String apiKeyHeader) {
        String apiKey = blankToNull(request.getHeader(apiKeyHeader));

        String accessToken = null;
        String authHeader = request.getHeader("Authorization");
        if (authHeader != null && authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            accessToken = blankToNull(authHeader.substring(BEARER_PREFIX.length()).trim());
        }
        if (accessToken == null) {
            accessToken = cookieValue(request, ACCESS_TOKEN_COOKIE);
        }
        return new CredentialMaterial(apiKey, accessToken);
    }

    public static String cookieValue(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return null;
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName())) {
                return blankToNull(cookie.getValue());
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
