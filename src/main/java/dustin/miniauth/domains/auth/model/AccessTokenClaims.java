package dustin.miniauth.domains.auth.model;

import java.time.Instant;
import java.util.UUID;

import lombok.Value;

/**
 * 검증된 Access Token 클레임
 * Verified access token claims {sub, scope, iat, exp}
 */
@Value
public class AccessTokenClaims {
    UUID subjectId;
    TokenScope scope;
    Instant issuedAt;
    Instant expiresAt;
}
