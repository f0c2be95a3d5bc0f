package dustin.miniauth.domains.auth.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.auth.exception.AuthenticationFailedException;
import dustin.miniauth.domains.auth.exception.DuplicateResourceException;
import dustin.miniauth.domains.auth.model.IssuedRefreshToken;
import dustin.miniauth.domains.auth.model.SessionTokens;
import dustin.miniauth.domains.auth.model.TokenScope;
import dustin.miniauth.domains.auth.model.TokenTransport;
import dustin.miniauth.domains.auth.model.dto.LoginRequest;
import dustin.miniauth.domains.auth.model.dto.RegisterRequest;
import dustin.miniauth.domains.auth.model.entity.RefreshToken;
import dustin.miniauth.domains.auth.model.entity.User;
import dustin.miniauth.domains.auth.repository.UserRepository;
import dustin.miniauth.domains.project.model.entity.Project;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증 서비스 (세션 생명주기)
 * Auth Service - registration, login, refresh, logout and logout-all
 *
 * 각 작업은 하나의 트랜잭션이다. 새 Refresh Token 행이 커밋되지 않으면
 * 토큰 값도 호출자에게 돌아가지 않는다.
 *
 * 잠금 순서: 사용자 행(PESSIMISTIC_WRITE) → Refresh Token 행.
 * 로그인 / 갱신 / 전체 로그아웃이 모두 이 순서를 따르므로 같은 사용자에 대해 직렬화된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {
    
    private final UserRepository userRepository;
    private final PasswordService passwordService;
    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;
    private final IdentityResolver identityResolver;
    private final Clock clock;
    
    /**
     * 플랫폼 사용자 회원가입
     * Register a platform user
     */
    @Transactional
    public User registerPlatformUser(RegisterRequest request) {
        return register(null, request);
    }
    
    /**
     * 프로젝트 사용자 회원가입 (API 키로 확인된 프로젝트)
     * Register an end-user of the project resolved from the API key
     */
    @Transactional
    public User registerClientUser(Project project, RegisterRequest request) {
        return register(project.getId(), request);
    }
    
    private User register(UUID projectId, RegisterRequest request) {
        PasswordPolicy.requireMatching(request.getPassword(), request.getConfirmPassword());
        PasswordPolicy.requireStrong(request.getPassword());
        
        String email = IdentityResolver.normalizeEmail(request.getEmail());
        identityResolver.requireEmailAvailable(projectId, email);
        
        User user = User.builder()
                .email(email)
                .passwordHash(passwordService.hash(request.getPassword()))
                .fullName(request.getFullName())
                .projectId(projectId)
                .active(true)
                .build();
        
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // 사전 검사와 insert 사이의 경쟁
            throw new DuplicateResourceException("email", "Email already registered");
        }
        
        log.info("Registered {} user {}", projectId == null ? "platform" : "project " + projectId, user.getId());
        return user;
    }
    
    /**
     * 플랫폼 로그인 (토큰은 쿠키로 전달)
     * Platform login; tokens travel as cookies
     */
    @Transactional
    public SessionTokens loginPlatform(LoginRequest request, String userAgent) {
        return login(null, request, userAgent, TokenTransport.COOKIE);
    }
    
    /**
     * 프로젝트 사용자 로그인 (토큰은 응답 본문으로 전달)
     * Client login scoped to the API key's project; tokens travel in the body
     */
    @Transactional
    public SessionTokens loginClient(Project project, LoginRequest request, String userAgent) {
        return login(project.getId(), request, userAgent, TokenTransport.BODY);
    }
    
    private SessionTokens login(UUID projectId, LoginRequest request, String userAgent, TokenTransport transport) {
        Instant now = clock.instant();
        
        Optional<User> found = identityResolver.findByEmail(projectId, request.getEmail());
        if (found.isEmpty()) {
            passwordService.verifyDecoy(request.getPassword());
            throw new AuthenticationFailedException("no user with that email in namespace " + User.namespaceOf(projectId));
        }
        
        User user = found.get();
        if (!passwordService.verify(request.getPassword(), user.getPasswordHash())) {
            throw new AuthenticationFailedException("password mismatch for user " + user.getId());
        }
        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new AuthenticationFailedException("user " + user.getId() + " is inactive");
        }
        
        lockUser(user.getId());
        SessionTokens tokens = issueSession(user, userAgent, now, transport);
        log.info("User {} logged in ({})", user.getId(), TokenScope.forProjectId(projectId));
        return tokens;
    }
    
    /**
     * 토큰 갱신 (회전: 기존 토큰 폐기 + 새 토큰 발급)
     * Refresh with rotation-on-use
     *
     * @param project API 키로 확인된 프로젝트, 플랫폼 흐름이면 null
     */
    @Transactional
    public SessionTokens refresh(String refreshValue, Project project, String userAgent) {
        Instant now = clock.instant();
        
        RefreshToken token = refreshTokenService.validateRefreshToken(refreshValue, now)
                .orElseThrow(() -> new AuthenticationFailedException("refresh token unknown, revoked or expired"));
        
        User user = lockUser(token.getUserId());
        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new AuthenticationFailedException("user " + user.getId() + " is inactive");
        }
        if (!belongsTo(user, project)) {
            throw new AuthenticationFailedException("refresh token of user " + user.getId() + " presented in another context");
        }
        if (!refreshTokenService.revoke(token, now)) {
            // 동시에 다른 요청이 먼저 회전했거나 전체 로그아웃됨
            throw new AuthenticationFailedException("refresh token " + token.getId() + " already consumed");
        }
        
        return issueSession(user, userAgent, now, project == null ? TokenTransport.COOKIE : TokenTransport.BODY);
    }
    
    /**
     * 로그아웃 (멱등)
     * Logout; revokes the presented token when it belongs to this context, always succeeds
     */
    @Transactional
    public void logout(String refreshValue, Project project) {
        Instant now = clock.instant();
        
        refreshTokenService.findByValue(refreshValue).ifPresent(token -> {
            Optional<User> owner = userRepository.findById(token.getUserId());
            if (owner.isEmpty() || !belongsTo(owner.get(), project)) {
                log.debug("Ignoring logout of refresh token {} from another context", token.getId());
                return;
            }
            if (refreshTokenService.revoke(token, now)) {
                log.info("User {} logged out", token.getUserId());
            }
        });
    }
    
    /**
     * 전체 로그아웃
     * Revoke every active refresh token of the user
     *
     * @return 폐기된 토큰 수
     */
    @Transactional
    public int logoutAll(UUID userId) {
        lockUser(userId);
        return refreshTokenService.revokeAll(userId, clock.instant());
    }
    
    private SessionTokens issueSession(User user, String userAgent, Instant now, TokenTransport transport) {
        String accessToken = jwtService.issueAccessToken(user.getId(), TokenScope.forProjectId(user.getProjectId()), now);
        IssuedRefreshToken refresh = refreshTokenService.issueRefreshToken(user.getId(), userAgent, now);
        
        return SessionTokens.builder()
                .user(user)
                .accessToken(accessToken)
                .accessTokenExpiresAt(jwtService.accessTokenExpiresAt(now))
                .refreshToken(refresh.getValue())
                .refreshTokenExpiresAt(refresh.getRecord().getExpiresAt())
                .transport(transport)
                .build();
    }
    
    private User lockUser(UUID userId) {
        return userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new AuthenticationFailedException("user " + userId + " no longer exists"));
    }
    
    private static boolean belongsTo(User user, Project project) {
        return project == null ? user.isPlatformUser() : project.getId().equals(user.getProjectId());
    }
}
