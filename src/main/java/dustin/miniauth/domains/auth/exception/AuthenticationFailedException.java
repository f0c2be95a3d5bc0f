package dustin.miniauth.domains.auth.exception;

/**
 * 인증 실패 예외 (401)
 * Authentication failed exception
 *
 * 호출자에게는 항상 같은 메시지를 노출한다.
 * 실제 원인(reason)은 로그에만 남긴다.
 */
public class AuthenticationFailedException extends AuthException {

    public static final String MESSAGE = "Invalid or expired credentials";

    private final String reason;

    public AuthenticationFailedException(String reason) {
        super(MESSAGE);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
