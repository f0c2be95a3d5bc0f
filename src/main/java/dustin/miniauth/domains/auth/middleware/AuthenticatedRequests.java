package dustin.miniauth.domains.auth.middleware;

import dustin.miniauth.domains.auth.exception.AuthenticationFailedException;
import dustin.miniauth.domains.auth.exception.AuthorizationDeniedException;
import jakarta.servlet.http.HttpServletRequest;

/**
 * 컨트롤러에서 요청의 인증 결과를 꺼내는 헬퍼
 * Helpers for controllers to demand a particular authentication state
 *
 * 인증 정보가 없으면 AuthenticationFailed, 다른 종류의 주체이면 AuthorizationDenied.
 */
public final class AuthenticatedRequests {

    public static final String ATTRIBUTE = AuthenticatedRequests.class.getName() + ".result";

    private AuthenticatedRequests() {
    }

    public static AuthenticationResult current(HttpServletRequest request) {
        Object value = request.getAttribute(ATTRIBUTE);
        return value instanceof AuthenticationResult ? (AuthenticationResult) value : AuthenticationResult.unauthenticated();
    }

    public static AuthenticatedPrincipal requirePlatformUser(HttpServletRequest request) {
        return require(request, AuthState.PLATFORM_AUTHENTICATED);
    }

    public static AuthenticatedPrincipal requireClientUser(HttpServletRequest request) {
        return require(request, AuthState.CLIENT_AUTHENTICATED);
    }

    public static AuthenticatedPrincipal requireProjectKey(HttpServletRequest request) {
        return require(request, AuthState.PROJECT_KEY_AUTHENTICATED);
    }

    /**
     * 플랫폼 또는 프로젝트 사용자 (API 키 단독은 불가)
     * Any user principal, platform or client
     */
    public static AuthenticatedPrincipal requireUser(HttpServletRequest request) {
        AuthenticationResult result = current(request);
        if (result.getState() == AuthState.PLATFORM_AUTHENTICATED || result.getState() == AuthState.CLIENT_AUTHENTICATED) {
            return result.getPrincipal();
        }
        throw rejection(result, "a user credential is required");
    }

    private static AuthenticatedPrincipal require(HttpServletRequest request, AuthState expected) {
        AuthenticationResult result = current(request);
        if (result.getState() == expected) {
            return result.getPrincipal();
        }
        throw rejection(result, expected + " required but request is " + result.getState());
    }

    private static RuntimeException rejection(AuthenticationResult result, String reason) {
        if (result.getState() == AuthState.UNAUTHENTICATED) {
            return new AuthenticationFailedException("no credential presented: " + reason);
        }
        if (result.getState() == AuthState.DENIED && result.getFailure() != null) {
            return result.getFailure();
        }
        return new AuthorizationDeniedException(reason);
    }
}
