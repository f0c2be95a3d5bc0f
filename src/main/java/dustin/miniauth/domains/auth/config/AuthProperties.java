package dustin.miniauth.domains.auth.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import lombok.Getter;

/**
 * 인증 설정
 * Authentication Configuration
 *
 * 역할:
 * - 서명 키, 토큰 만료 시간, Argon2 비용, 쿠키 정책
 * - 서버 시작 시 한 번 바인딩되고 이후 변경되지 않음 (setter 없음)
 *
 * 설정 방법:
 * - application.yml 의 auth.* 항목
 * - 환경변수로 오버라이드 가능 (예: AUTH_JWT_SECRET)
 */
@Getter
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private final Jwt jwt;

    /**
     * Refresh Token 만료 시간
     * Refresh token lifetime
     */
    private final Duration refreshTokenTtl;

    private final Password password;

    private final Cookie cookie;

    /**
     * 프로젝트 API 키 헤더 이름
     * Project API key header name
     */
    private final String apiKeyHeader;

    public AuthProperties(
            @DefaultValue Jwt jwt,
            @DefaultValue("7d") Duration refreshTokenTtl,
            @DefaultValue Password password,
            @DefaultValue Cookie cookie,
            @DefaultValue("X-Project-Api-Key") String apiKeyHeader) {
        this.jwt = jwt;
        this.refreshTokenTtl = refreshTokenTtl;
        this.password = password;
        this.cookie = cookie;
        this.apiKeyHeader = apiKeyHeader;
    }

    @Getter
    public static class Jwt {

        /**
         * HS256 서명 키 (최소 32바이트)
         * HS256 signing secret (at least 32 bytes)
         */
        private final String secret;

        /**
         * Access Token 만료 시간 (짧게 유지)
         * Access token lifetime
         */
        private final Duration accessTokenTtl;

        public Jwt(String secret, @DefaultValue("30m") Duration accessTokenTtl) {
            this.secret = secret;
            this.accessTokenTtl = accessTokenTtl;
        }
    }

    /**
     * Argon2id 비용 파라미터
     * Argon2id cost parameters
     */
    @Getter
    public static class Password {

        private final int iterations;
        private final int memoryKb;
        private final int parallelism;

        public Password(
                @DefaultValue("10") int iterations,
                @DefaultValue("65536") int memoryKb,
                @DefaultValue("1") int parallelism) {
            this.iterations = iterations;
            this.memoryKb = memoryKb;
            this.parallelism = parallelism;
        }
    }

    @Getter
    public static class Cookie {

        private final boolean secure;
        private final String sameSite;

        public Cookie(@DefaultValue("true") boolean secure, @DefaultValue("Lax") String sameSite) {
            this.secure = secure;
            this.sameSite = sameSite;
        }
    }
}
