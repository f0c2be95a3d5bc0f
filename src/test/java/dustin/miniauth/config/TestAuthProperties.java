package dustin.miniauth.config;

import java.time.Duration;

import dustin.miniauth.domains.auth.config.AuthProperties;

/**
 * 스프링 컨텍스트 없이 쓰는 인증 설정
 * AuthProperties for plain unit tests (cheap Argon2 cost)
 */
public final class TestAuthProperties {

    public static final String SECRET = "unit-test-signing-secret-at-least-32-bytes!";

    private TestAuthProperties() {
    }

    public static AuthProperties create() {
        return create(SECRET, Duration.ofMinutes(30));
    }

    public static AuthProperties create(String secret, Duration accessTokenTtl) {
        return new AuthProperties(
                new AuthProperties.Jwt(secret, accessTokenTtl),
                Duration.ofDays(7),
                new AuthProperties.Password(2, 1024, 1),
                new AuthProperties.Cookie(false, "Lax"),
                "X-Project-Api-Key");
    }
}
