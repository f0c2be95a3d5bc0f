package dustin.miniauth.domains.auth.middleware;

/**
 * 요청 인증 상태
 * Authentication state of an inbound request
 */
public enum AuthState {
    UNAUTHENTICATED,
    PLATFORM_AUTHENTICATED,
    PROJECT_KEY_AUTHENTICATED,
    CLIENT_AUTHENTICATED,
    DENIED
}
