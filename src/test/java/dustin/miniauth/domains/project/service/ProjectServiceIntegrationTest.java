package dustin.miniauth.domains.project.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.config.TestConfig;
import dustin.miniauth.domains.auth.exception.AuthorizationDeniedException;
import dustin.miniauth.domains.auth.exception.DuplicateResourceException;
import dustin.miniauth.domains.auth.exception.InvalidRequestException;
import dustin.miniauth.domains.auth.exception.ResourceNotFoundException;
import dustin.miniauth.domains.auth.model.entity.User;
import dustin.miniauth.domains.auth.repository.UserRepository;
import dustin.miniauth.domains.project.model.dto.ApiKeyResponse;
import dustin.miniauth.domains.project.model.dto.CreateProjectRequest;
import dustin.miniauth.domains.project.model.dto.MemberResponse;
import dustin.miniauth.domains.project.model.dto.ProjectResponse;
import dustin.miniauth.domains.project.model.dto.UpdateProjectRequest;
import dustin.miniauth.domains.project.model.entity.ProjectApiKey;
import dustin.miniauth.shared.model.dto.PageResponse;

/**
 * 프로젝트 / API 키 / 멤버 통합 테스트
 * Project Service Integration Test
 *
 * 테스트 항목:
 * 1. 생성 시 기본 API 키 발급
 * 2. 소유자 전용 작업과 멤버 권한
 * 3. 소유자는 제거 / 역할 변경 불가
 * 4. 삭제 시 키 비활성화, 이후 NotFound
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
@Import(TestConfig.class)
class ProjectServiceIntegrationTest {

    @Autowired
    private ProjectService projectService;

    @Autowired
    private ApiKeyService apiKeyService;

    @Autowired
    private ProjectMemberService projectMemberService;

    @Autowired
    private ApiKeyValidator apiKeyValidator;

    @Autowired
    private UserRepository userRepository;

    private UUID ownerId;
    private UUID adminId;
    private UUID outsiderId;
    private UUID projectId;
    private String defaultKey;

    @BeforeEach
    void setUp() {
        ownerId = platformUser("owner-p@x.com");
        adminId = platformUser("admin-p@x.com");
        outsiderId = platformUser("outsider-p@x.com");

        ProjectResponse created = projectService.createProject(ownerId, new CreateProjectRequest("P", "desc"));
        projectId = created.getId();
        defaultKey = created.getApiKeys().get(0).getKey();
    }

    @Test
    @DisplayName("생성 시 활성 기본 키 \"Default\" 가 함께 발급된다")
    void createIssuesDefaultKey() {
        ProjectResponse project = projectService.getProject(ownerId, projectId);

        assertThat(project.getRole()).isEqualTo("owner");
        assertThat(project.getApiKeys()).hasSize(1);
        ApiKeyResponse key = project.getApiKeys().get(0);
        assertThat(key.getName()).isEqualTo("Default");
        assertThat(key.getActive()).isTrue();
        assertThat(key.getKey()).startsWith("ma_");
        assertThat(apiKeyValidator.validate(defaultKey)).isPresent();
    }

    @Test
    @DisplayName("무관한 사용자에게 프로젝트는 NotFound, 멤버는 조회 가능하지만 수정 불가")
    void visibilityAndOwnership() {
        assertThatThrownBy(() -> projectService.getProject(outsiderId, projectId))
                .isInstanceOf(ResourceNotFoundException.class);

        projectMemberService.addMember(ownerId, projectId, adminId, "admin");

        ProjectResponse asAdmin = projectService.getProject(adminId, projectId);
        assertThat(asAdmin.getRole()).isEqualTo("admin");
        assertThat(asAdmin.getApiKeys()).isNull();

        assertThatThrownBy(() -> projectService.updateProject(adminId, projectId, new UpdateProjectRequest("X", null)))
                .isInstanceOf(AuthorizationDeniedException.class);
        assertThatThrownBy(() -> apiKeyService.createKey(adminId, projectId, "k"))
                .isInstanceOf(AuthorizationDeniedException.class);
        assertThatThrownBy(() -> projectService.deleteProject(adminId, projectId))
                .isInstanceOf(AuthorizationDeniedException.class);

        PageResponse<ProjectResponse> adminProjects = projectService.listProjects(adminId, 0, 20);
        assertThat(adminProjects.getContent()).extracting(ProjectResponse::getId).contains(projectId);
        assertThat(adminProjects.isEmpty()).isFalse();

        PageResponse<ProjectResponse> outsiderProjects = projectService.listProjects(outsiderId, 0, 20);
        assertThat(outsiderProjects.getContent()).isEmpty();
        assertThat(outsiderProjects.isEmpty()).isTrue();
        assertThat(outsiderProjects.getTotalElements()).isZero();
    }

    @Test
    @DisplayName("멤버 목록은 소유자를 owner 로 먼저 보여준다")
    void listMembersShowsOwner() {
        projectMemberService.addMember(ownerId, projectId, adminId, "member");

        List<MemberResponse> members = projectMemberService.listMembers(adminId, projectId);

        assertThat(members).extracting(MemberResponse::getUserId).containsExactly(ownerId, adminId);
        assertThat(members).extracting(MemberResponse::getRole).containsExactly("owner", "member");
        assertThatThrownBy(() -> projectMemberService.listMembers(outsiderId, projectId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("소유자는 누가 요청해도 제거 / 역할 변경 / 추가 대상이 될 수 없다")
    void ownerIsImmutableAsMember() {
        projectMemberService.addMember(ownerId, projectId, adminId, "admin");

        assertThatThrownBy(() -> projectMemberService.removeMember(ownerId, projectId, ownerId))
                .isInstanceOf(AuthorizationDeniedException.class);
        assertThatThrownBy(() -> projectMemberService.removeMember(adminId, projectId, ownerId))
                .isInstanceOf(AuthorizationDeniedException.class);
        assertThatThrownBy(() -> projectMemberService.updateMemberRole(ownerId, projectId, ownerId, "member"))
                .isInstanceOf(AuthorizationDeniedException.class);
        assertThatThrownBy(() -> projectMemberService.updateMemberRole(adminId, projectId, ownerId, "admin"))
                .isInstanceOf(AuthorizationDeniedException.class);
        assertThatThrownBy(() -> projectMemberService.addMember(ownerId, projectId, ownerId, "admin"))
                .isInstanceOf(AuthorizationDeniedException.class);
    }

    @Test
    @DisplayName("멤버 추가 / 역할 변경 / 제거 규칙")
    void memberLifecycle() {
        assertThatThrownBy(() -> projectMemberService.addMember(ownerId, projectId, adminId, "owner"))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> projectMemberService.addMember(ownerId, projectId, UUID.randomUUID(), "member"))
                .isInstanceOf(ResourceNotFoundException.class);

        projectMemberService.addMember(ownerId, projectId, adminId, "member");
        assertThatThrownBy(() -> projectMemberService.addMember(ownerId, projectId, adminId, "admin"))
                .isInstanceOf(DuplicateResourceException.class);

        assertThat(projectMemberService.updateMemberRole(ownerId, projectId, adminId, "admin").getRole())
                .isEqualTo("admin");
        assertThatThrownBy(() -> projectMemberService.removeMember(adminId, projectId, adminId))
                .isInstanceOf(AuthorizationDeniedException.class);

        projectMemberService.removeMember(ownerId, projectId, adminId);
        assertThatThrownBy(() -> projectService.getProject(adminId, projectId))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> projectMemberService.removeMember(ownerId, projectId, adminId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("키 비활성화 후 검증 실패, 목록은 includeInactive 로만 보인다")
    void deactivateKey() {
        ProjectApiKey extra = apiKeyService.createKey(ownerId, projectId, "iOS");
        apiKeyService.deactivateKey(ownerId, projectId, extra.getId());
        apiKeyService.deactivateKey(ownerId, projectId, extra.getId());

        assertThat(apiKeyValidator.validate(extra.getKeyValue())).isEmpty();
        assertThat(apiKeyService.listKeys(ownerId, projectId, false)).extracting(ProjectApiKey::getName)
                .containsExactly("Default");
        assertThat(apiKeyService.listKeys(ownerId, projectId, true)).hasSize(2);
    }

    @Test
    @DisplayName("다른 프로젝트의 키 ID 는 NotFound")
    void keyOfOtherProjectIsNotFound() {
        ProjectResponse other = projectService.createProject(outsiderId, new CreateProjectRequest("Q", null));
        UUID otherKeyId = other.getApiKeys().get(0).getId();

        assertThatThrownBy(() -> apiKeyService.deactivateKey(ownerId, projectId, otherKeyId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("삭제는 soft delete: 모든 키 비활성화, 이후 NotFound")
    void deleteProject() {
        projectMemberService.addMember(ownerId, projectId, adminId, "member");

        projectService.deleteProject(ownerId, projectId);

        assertThat(apiKeyValidator.validate(defaultKey)).isEmpty();
        assertThatThrownBy(() -> projectService.getProject(ownerId, projectId))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> projectService.getClientProject(projectId, projectId))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(projectService.listProjects(adminId, 0, 20).getContent()).isEmpty();
    }

    @Test
    @DisplayName("프로젝트 사용자는 자기 프로젝트만 조회")
    void clientProjectView() {
        assertThat(projectService.getClientProject(projectId, projectId).getName()).isEqualTo("P");
        assertThatThrownBy(() -> projectService.getClientProject(UUID.randomUUID(), projectId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private UUID platformUser(String email) {
        return userRepository.save(User.builder().email(email).passwordHash("hash").build()).getId();
    }
}
