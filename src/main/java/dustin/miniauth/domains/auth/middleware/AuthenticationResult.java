package dustin.miniauth.domains.auth.middleware;

import dustin.miniauth.domains.auth.exception.AuthException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 인증 디스패처의 결과 (상태 + 주체 또는 실패 원인)
 * Outcome of dispatching a request's credential material
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class AuthenticationResult {

    private static final AuthenticationResult UNAUTHENTICATED =
            new AuthenticationResult(AuthState.UNAUTHENTICATED, null, null);

    private final AuthState state;
    private final AuthenticatedPrincipal principal;
    private final AuthException failure;

    public static AuthenticationResult unauthenticated() {
        return UNAUTHENTICATED;
    }

    public static AuthenticationResult platform(AuthenticatedPrincipal principal) {
        return new AuthenticationResult(AuthState.PLATFORM_AUTHENTICATED, principal, null);
    }

    public static AuthenticationResult projectKey(AuthenticatedPrincipal principal) {
        return new AuthenticationResult(AuthState.PROJECT_KEY_AUTHENTICATED, principal, null);
    }

    public static AuthenticationResult client(AuthenticatedPrincipal principal) {
        return new AuthenticationResult(AuthState.CLIENT_AUTHENTICATED, principal, null);
    }

    public static AuthenticationResult denied(AuthException failure) {
        return new AuthenticationResult(AuthState.DENIED, null, failure);
    }

    public boolean isAuthenticated() {
        return principal != null;
    }
}
