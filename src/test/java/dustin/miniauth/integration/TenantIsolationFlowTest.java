package dustin.miniauth.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.cookie;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.miniauth.config.MutableClock;
import dustin.miniauth.config.TestConfig;
import dustin.miniauth.domains.auth.repository.RefreshTokenRepository;
import dustin.miniauth.domains.auth.repository.UserRepository;
import dustin.miniauth.domains.project.repository.ProjectApiKeyRepository;
import dustin.miniauth.domains.project.repository.ProjectMemberRepository;
import dustin.miniauth.domains.project.repository.ProjectRepository;
import jakarta.servlet.http.Cookie;

/**
 * 플랫폼 / 프로젝트 사용자 전체 흐름 통합 테스트
 * Tenant Isolation Flow Test over the HTTP surface
 *
 * 테스트 항목:
 * 1. 플랫폼 가입 → 쿠키 로그인 → 프로젝트 생성 → 프로젝트 사용자 가입 / 로그인
 * 2. 프로젝트 사용자 토큰으로 플랫폼 API 접근 시 403
 * 3. API 키 비활성화 후 새 인증은 401, 기존 세션은 유지
 * 4. 다른 프로젝트 조회 시 404
 *
 * 트랜잭션 없이 실제로 커밋되므로 전후로 테이블을 비운다.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestConfig.class)
class TenantIsolationFlowTest {

    private static final String API_KEY_HEADER = "X-Project-Api-Key";
    private static final String PASSWORD = "Secret123!";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    @Autowired
    private RefreshTokenRepository refreshTokenRepository;

    @Autowired
    private ProjectMemberRepository projectMemberRepository;

    @Autowired
    private ProjectApiKeyRepository projectApiKeyRepository;

    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private UserRepository userRepository;

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.now().truncatedTo(ChronoUnit.SECONDS));
        cleanUp();
    }

    @AfterEach
    void tearDown() {
        cleanUp();
    }

    private void cleanUp() {
        refreshTokenRepository.deleteAllInBatch();
        projectMemberRepository.deleteAllInBatch();
        projectApiKeyRepository.deleteAllInBatch();
        projectRepository.deleteAllInBatch();
        userRepository.deleteAllInBatch();
    }

    @Test
    @DisplayName("프로젝트 사용자 토큰은 자기 프로젝트 범위에서만 통한다")
    void clientTokenStaysInsideItsProject() throws Exception {
        Cookie platformCookie = registerAndLoginPlatform("a@x.com");

        JsonNode project = createProject(platformCookie, "P");
        String projectId = project.get("id").asText();
        JsonNode defaultKey = project.get("apiKeys").get(0);
        assertThat(defaultKey.get("name").asText()).isEqualTo("Default");
        assertThat(defaultKey.get("active").asBoolean()).isTrue();
        String apiKey = defaultKey.get("key").asText();

        mockMvc.perform(post("/api/v1/client/auth/register")
                        .header(API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody("b@y.com")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.projectId").value(projectId));

        JsonNode clientLogin = clientLogin(apiKey, "b@y.com");
        assertThat(clientLogin.get("tokenType").asText()).isEqualTo("bearer");
        String clientAccess = clientLogin.get("accessToken").asText();

        mockMvc.perform(get("/api/v1/projects/{projectId}/members", projectId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + clientAccess))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("authorization_denied"));

        mockMvc.perform(get("/api/v1/client/auth/user")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + clientAccess))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("b@y.com"))
                .andExpect(jsonPath("$.projectId").value(projectId));

        mockMvc.perform(get("/api/v1/client/projects/{projectId}", projectId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + clientAccess))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("P"));

        String otherProjectId = createProject(platformCookie, "Q").get("id").asText();
        mockMvc.perform(get("/api/v1/client/projects/{projectId}", otherProjectId)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + clientAccess))
                .andExpect(status().isNotFound());

        // 플랫폼 토큰으로는 프로젝트 사용자 API 를 쓸 수 없다
        mockMvc.perform(get("/api/v1/client/auth/user").cookie(platformCookie))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("API 키 비활성화는 새 인증만 막고 기존 세션은 유지된다")
    void deactivatedKeyBlocksNewAuthenticationOnly() throws Exception {
        Cookie platformCookie = registerAndLoginPlatform("a@x.com");
        JsonNode project = createProject(platformCookie, "P");
        String projectId = project.get("id").asText();
        JsonNode defaultKey = project.get("apiKeys").get(0);
        String apiKey = defaultKey.get("key").asText();

        mockMvc.perform(post("/api/v1/client/auth/register")
                        .header(API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody("b@y.com")))
                .andExpect(status().isCreated());
        JsonNode clientLogin = clientLogin(apiKey, "b@y.com");
        String refreshToken = clientLogin.get("refreshToken").asText();
        String clientAccess = clientLogin.get("accessToken").asText();

        UUID defaultKeyId = UUID.fromString(defaultKey.get("id").asText());
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                assertThat(projectApiKeyRepository.findById(defaultKeyId))
                        .hasValueSatisfying(k -> assertThat(k.getLastUsedAt()).isNotNull()));

        MvcResult created = mockMvc.perform(post("/api/v1/projects/{projectId}/api-keys", projectId)
                        .cookie(platformCookie)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("name", "Backup"))))
                .andExpect(status().isCreated())
                .andReturn();
        String backupKey = read(created).get("key").asText();

        mockMvc.perform(delete("/api/v1/projects/{projectId}/api-keys/{keyId}", projectId, defaultKeyId)
                        .cookie(platformCookie))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(post("/api/v1/client/auth/register")
                        .header(API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody("c@y.com")))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/v1/client/auth/login")
                        .header(API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("b@y.com")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("authentication_failed"));

        // 이미 발급된 토큰은 키와 무관하다
        mockMvc.perform(get("/api/v1/client/auth/user")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + clientAccess))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/client/auth/refresh")
                        .header(API_KEY_HEADER, backupKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("refreshToken", refreshToken))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refreshToken").isNotEmpty());
    }

    @Test
    @DisplayName("플랫폼 세션: 쿠키 갱신, 전체 로그아웃 후 토큰 재사용 불가")
    void platformCookieSession() throws Exception {
        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody("a@x.com")))
                .andExpect(status().isCreated());

        MvcResult login = mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody("a@x.com")))
                .andExpect(status().isOk())
                .andExpect(cookie().httpOnly("refresh_token", true))
                .andExpect(jsonPath("$.accessToken").doesNotExist())
                .andReturn();
        Cookie access = login.getResponse().getCookie("access_token");
        Cookie refresh = login.getResponse().getCookie("refresh_token");

        mockMvc.perform(get("/api/v1/users/me").cookie(access))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("a@x.com"));

        MvcResult refreshed = mockMvc.perform(post("/api/v1/auth/refresh").cookie(refresh))
                .andExpect(status().isOk())
                .andReturn();
        Cookie rotated = refreshed.getResponse().getCookie("refresh_token");
        assertThat(rotated.getValue()).isNotEqualTo(refresh.getValue());

        mockMvc.perform(post("/api/v1/auth/refresh").cookie(refresh))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/v1/auth/logout-all").cookie(access))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.revokedSessions").value(1));
        mockMvc.perform(post("/api/v1/auth/refresh").cookie(rotated))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/v1/users/me"))
                .andExpect(status().isUnauthorized());
    }

    private Cookie registerAndLoginPlatform(String email) throws Exception {
        mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(registerBody(email)))
                .andExpect(status().isCreated());
        MvcResult login = mockMvc.perform(post("/api/v1/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(email)))
                .andExpect(status().isOk())
                .andExpect(cookie().exists("access_token"))
                .andReturn();
        return login.getResponse().getCookie("access_token");
    }

    private JsonNode createProject(Cookie platformCookie, String name) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/projects")
                        .cookie(platformCookie)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("name", name))))
                .andExpect(status().isCreated())
                .andReturn();
        return read(result);
    }

    private JsonNode clientLogin(String apiKey, String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/client/auth/login")
                        .header(API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(loginBody(email)))
                .andExpect(status().isOk())
                .andReturn();
        return read(result);
    }

    private String registerBody(String email) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "email", email,
                "password", PASSWORD,
                "confirmPassword", PASSWORD));
    }

    private String loginBody(String email) throws Exception {
        return objectMapper.writeValueAsString(Map.of("email", email, "password", PASSWORD));
    }

    private JsonNode read(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
