package dustin.miniauth.domains.auth.middleware;

import java.time.Instant;
import java.util.Optional;

import org.springframework.stereotype.Component;

import dustin.miniauth.domains.auth.exception.AuthException;
import dustin.miniauth.domains.auth.exception.AuthenticationFailedException;
import dustin.miniauth.domains.auth.model.AccessTokenClaims;
import dustin.miniauth.domains.auth.model.TokenScope;
import dustin.miniauth.domains.auth.model.entity.User;
import dustin.miniauth.domains.auth.service.IdentityResolver;
import dustin.miniauth.domains.auth.service.JwtService;
import dustin.miniauth.domains.project.service.ApiKeyValidator;
import dustin.miniauth.domains.project.service.ValidatedApiKey;
import lombok.RequiredArgsConstructor;

/**
 * 인증 디스패처
 * Authorization Dispatcher
 *
 * 전이 규칙 (순서대로 평가):
 * 1. API 키 헤더가 있으면 → API 키 검증 → PROJECT_KEY_AUTHENTICATED 또는 DENIED
 * 2. Access Token 이 있으면 → 토큰 검증 + 신원 확인 → 스코프에 따라
 *    PLATFORM_AUTHENTICATED / CLIENT_AUTHENTICATED, 실패 시 DENIED
 * 3. 둘 다 없으면 → UNAUTHENTICATED
 */
@Component
@RequiredArgsConstructor
public class AuthorizationDispatcher {

    private final ApiKeyValidator apiKeyValidator;
    private final JwtService jwtService;
    private final IdentityResolver identityResolver;

    public AuthenticationResult authenticate(CredentialMaterial credentials, Instant now) {
        if (credentials.getApiKey() != null) {
            return authenticateApiKey(credentials.getApiKey());
        }
        if (credentials.getAccessToken() != null) {
            return authenticateAccessToken(credentials.getAccessToken(), now);
        }
        return AuthenticationResult.unauthenticated();
    }

    AuthenticationResult authenticateApiKey(String apiKey) {
        Optional<ValidatedApiKey> validated = apiKeyValidator.validate(apiKey);
        if (validated.isEmpty()) {
            return AuthenticationResult.denied(new AuthenticationFailedException("invalid or inactive project API key"));
        }
        ValidatedApiKey key = validated.get();
        return AuthenticationResult.projectKey(AuthenticatedPrincipal.builder()
                .apiKeyId(key.getKeyId())
                .projectId(key.getProject().getId())
                .scope(TokenScope.project(key.getProject().getId()))
                .build());
    }

    AuthenticationResult authenticateAccessToken(String token, Instant now) {
        Optional<AccessTokenClaims> claims = jwtService.validateAccessToken(token, now);
        if (claims.isEmpty()) {
            return AuthenticationResult.denied(new AuthenticationFailedException("invalid or expired access token"));
        }

        TokenScope scope = claims.get().getScope();
        User user;
        try {
            user = identityResolver.resolve(claims.get().getSubjectId(), scope);
        } catch (AuthException e) {
            return AuthenticationResult.denied(e);
        }

        AuthenticatedPrincipal principal = AuthenticatedPrincipal.builder()
                .userId(user.getId())
                .email(user.getEmail())
                .projectId(scope.getProjectId())
                .scope(scope)
                .build();
        return scope.isPlatform()
                ? AuthenticationResult.platform(principal)
                : AuthenticationResult.client(principal);
    }
}
