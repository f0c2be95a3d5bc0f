package dustin.miniauth.domains.auth.model;

import dustin.miniauth.domains.auth.model.entity.RefreshToken;
import lombok.Value;

/**
 * 발급된 Refresh Token
 * Issued refresh token: the plaintext value (only observable here) and its stored record
 */
@Value
public class IssuedRefreshToken {
    String value;
    RefreshToken record;
}
