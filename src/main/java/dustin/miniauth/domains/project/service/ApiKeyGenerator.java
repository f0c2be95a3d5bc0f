package dustin.miniauth.domains.project.service;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;

/**
 * 프로젝트 API 키 생성 유틸리티
 * Utility class for project API key generation.
 * Format: {@code ma_<epochSeconds>_<base64url(32 random bytes)>}
 */
public final class ApiKeyGenerator {

    static final String API_KEY_PREFIX = "ma";
    private static final int KEY_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private ApiKeyGenerator() {
    }

    /**
     * Generate a new API key.
     *
     * @param now issue time embedded in the key
     * @return generated key (e.g. ma_1718000000_Q2x...)
     */
    public static String generate(Instant now) {
        byte[] randomBytes = new byte[KEY_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        String encoded = Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
        return API_KEY_PREFIX + "_" + now.getEpochSecond() + "_" + encoded;
    }

    /**
     * Cheap format check so obviously malformed keys never reach the database.
     * The random part is base64url and may itself contain underscores.
     */
    public static boolean hasValidFormat(String apiKey) {
        if (apiKey == null || !apiKey.startsWith(API_KEY_PREFIX + "_")) {
            return false;
        }
        String rest = apiKey.substring(API_KEY_PREFIX.length() + 1);
        int separator = rest.indexOf('_');
        if (separator <= 0 || separator == rest.length() - 1) {
            return false;
        }
        for (int i = 0; i < separator; i++) {
            if (!Character.isDigit(rest.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
