package dustin.miniauth.domains.auth.exception;

/**
 * 인증 관련 예외
 * Authentication-related exception
 * 모든 도메인 예외의 상위 타입
 */
public class AuthException extends RuntimeException {
    
    public AuthException(String message) {
        super(message);
    }
    
    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
