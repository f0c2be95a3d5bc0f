package dustin.miniauth.domains.auth.exception;

/**
 * 잘못된 요청 예외 (400)
 * Invalid request exception (password mismatch, weak password, unknown role...)
 */
public class InvalidRequestException extends AuthException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
