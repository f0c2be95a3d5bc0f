package dustin.miniauth.domains.auth.service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.auth.exception.AuthenticationFailedException;
import dustin.miniauth.domains.auth.exception.AuthorizationDeniedException;
import dustin.miniauth.domains.auth.exception.DuplicateResourceException;
import dustin.miniauth.domains.auth.model.TokenScope;
import dustin.miniauth.domains.auth.model.entity.User;
import dustin.miniauth.domains.auth.repository.UserRepository;
import dustin.miniauth.domains.project.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;

/**
 * 신원 확인 서비스
 * Identity Resolver
 *
 * 역할:
 * - (subjectId, scope) 쌍을 실제 사용자로 변환하면서 스코프 필터 적용
 * - 플랫폼 / 프로젝트 namespace 별 이메일 조회와 유일성 검사
 *
 * 스코프 불일치는 AuthorizationDenied 이다. 자격 증명 자체는 유효하지만
 * 그 스코프로는 해당 사용자를 가리킬 수 없기 때문이다.
 */
@Service
@RequiredArgsConstructor
public class IdentityResolver {

    private final UserRepository userRepository;
    private final ProjectRepository projectRepository;

    /**
     * 스코프를 적용하여 사용자 조회
     * Resolve a subject within a scope
     */
    @Transactional(readOnly = true)
    public User resolve(UUID subjectId, TokenScope scope) {
        User user = userRepository.findById(subjectId)
                .orElseThrow(() -> new AuthenticationFailedException("token subject no longer exists"));

        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new AuthenticationFailedException("user " + subjectId + " is inactive");
        }

        if (scope.isPlatform()) {
            if (!user.isPlatformUser()) {
                throw new AuthorizationDeniedException("platform scope cannot resolve project user " + subjectId);
            }
            return user;
        }

        if (!scope.getProjectId().equals(user.getProjectId())) {
            throw new AuthorizationDeniedException("scope " + scope + " cannot resolve user " + subjectId);
        }
        if (projectRepository.findByIdAndActiveTrue(scope.getProjectId()).isEmpty()) {
            throw new AuthenticationFailedException("project " + scope.getProjectId() + " is no longer active");
        }
        return user;
    }

    /**
     * namespace 안에서 이메일로 사용자 조회
     * Find a user by email within the platform (projectId == null) or a project
     */
    @Transactional(readOnly = true)
    public Optional<User> findByEmail(UUID projectIdOrNull, String email) {
        if (email == null) {
            return Optional.empty();
        }
        return userRepository.findByEmailNamespaceAndEmail(User.namespaceOf(projectIdOrNull), normalizeEmail(email));
    }

    /**
     * 이메일 유일성 검사
     * Ensure no other user owns the email in the namespace
     */
    @Transactional(readOnly = true)
    public void requireEmailAvailable(UUID projectIdOrNull, String email) {
        if (userRepository.existsByEmailNamespaceAndEmail(User.namespaceOf(projectIdOrNull), normalizeEmail(email))) {
            throw new DuplicateResourceException("email", projectIdOrNull == null
                    ? "Email already registered"
                    : "Email already registered in this project");
        }
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
