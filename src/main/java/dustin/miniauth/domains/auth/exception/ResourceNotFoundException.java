package dustin.miniauth.domains.auth.exception;

/**
 * 리소스 없음 예외 (404)
 * Thrown when a resource is absent, or absent from the caller's tenant view.
 */
public class ResourceNotFoundException extends AuthException {

    public ResourceNotFoundException(String resource) {
        super(resource + " not found");
    }
}
