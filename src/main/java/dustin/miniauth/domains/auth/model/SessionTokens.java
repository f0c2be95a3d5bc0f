package dustin.miniauth.domains.auth.model;

import java.time.Instant;

import dustin.miniauth.domains.auth.model.entity.User;
import lombok.Builder;
import lombok.Value;

/**
 * 로그인 / 갱신 결과
 * Tokens minted by a login or refresh, with the transport they should use
 */
@Value
@Builder
public class SessionTokens {
    User user;
    String accessToken;
    Instant accessTokenExpiresAt;
    String refreshToken;
    Instant refreshTokenExpiresAt;
    TokenTransport transport;
}
