package dustin.miniauth.domains.auth.exception;

/**
 * 중복 리소스 예외 (409)
 * Thrown when a uniqueness rule is violated. Carries the field in contention.
 */
public class DuplicateResourceException extends AuthException {

    private final String field;

    public DuplicateResourceException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
