package dustin.miniauth.domains.project.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ApiKeyGeneratorTest {

    @Test
    @DisplayName("ma_<epochSeconds>_<base64url> 형식으로 생성")
    void generatesPrefixedKey() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");

        String key = ApiKeyGenerator.generate(now);

        assertThat(key).startsWith("ma_" + now.getEpochSecond() + "_");
        assertThat(key.substring(("ma_" + now.getEpochSecond() + "_").length())).hasSize(43);
        assertThat(ApiKeyGenerator.hasValidFormat(key)).isTrue();
        assertThat(ApiKeyGenerator.generate(now)).isNotEqualTo(key);
    }

    @Test
    @DisplayName("형식이 맞지 않는 키는 DB 조회 전에 걸러진다")
    void rejectsMalformedKeys() {
        assertThat(ApiKeyGenerator.hasValidFormat(null)).isFalse();
        assertThat(ApiKeyGenerator.hasValidFormat("")).isFalse();
        assertThat(ApiKeyGenerator.hasValidFormat("sk_123_abc")).isFalse();
        assertThat(ApiKeyGenerator.hasValidFormat("ma_abc_def")).isFalse();
        assertThat(ApiKeyGenerator.hasValidFormat("ma__def")).isFalse();
        assertThat(ApiKeyGenerator.hasValidFormat("ma_123_")).isFalse();
    }
}
