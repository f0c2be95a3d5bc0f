package dustin.miniauth.domains.auth.exception;

/**
 * 권한 없음 예외 (403)
 * Authorization denied exception - credential is valid but scope/role/ownership is not
 */
public class AuthorizationDeniedException extends AuthException {

    public static final String MESSAGE = "You are not permitted to perform this action";

    private final String reason;

    public AuthorizationDeniedException(String reason) {
        super(MESSAGE);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
