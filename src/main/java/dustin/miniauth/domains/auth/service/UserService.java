package dustin.miniauth.domains.auth.service;

import java.time.Clock;
import java.util.UUID;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.auth.exception.AuthenticationFailedException;
import dustin.miniauth.domains.auth.exception.DuplicateResourceException;
import dustin.miniauth.domains.auth.exception.InvalidRequestException;
import dustin.miniauth.domains.auth.model.dto.ChangePasswordRequest;
import dustin.miniauth.domains.auth.model.dto.UpdateUserRequest;
import dustin.miniauth.domains.auth.model.entity.User;
import dustin.miniauth.domains.auth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 사용자 프로필 서비스
 * User profile service for the authenticated user
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {
    
    private final UserRepository userRepository;
    private final PasswordService passwordService;
    private final RefreshTokenService refreshTokenService;
    private final IdentityResolver identityResolver;
    private final Clock clock;
    
    @Transactional(readOnly = true)
    public User getUserInfo(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new AuthenticationFailedException("user " + userId + " no longer exists"));
    }
    
    /**
     * 프로필 수정. 이메일은 같은 namespace 안에서 유일해야 한다.
     * Update full name and/or email
     */
    @Transactional
    public User updateProfile(UUID userId, UpdateUserRequest request) {
        User user = getUserInfo(userId);
        
        if (request.getEmail() != null) {
            String email = IdentityResolver.normalizeEmail(request.getEmail());
            if (!email.equals(user.getEmail())) {
                identityResolver.requireEmailAvailable(user.getProjectId(), email);
                user.setEmail(email);
            }
        }
        if (request.getFullName() != null) {
            user.setFullName(request.getFullName());
        }
        
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateResourceException("email", "Email already registered");
        }
    }
    
    /**
     * 비밀번호 변경. 성공 시 모든 세션(Refresh Token)을 폐기한다.
     * Change password and revoke every session of the user
     */
    @Transactional
    public void changePassword(UUID userId, ChangePasswordRequest request) {
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new AuthenticationFailedException("user " + userId + " no longer exists"));
        
        if (!passwordService.verify(request.getCurrentPassword(), user.getPasswordHash())) {
            throw new InvalidRequestException("Current password is incorrect");
        }
        PasswordPolicy.requireMatching(request.getNewPassword(), request.getConfirmPassword());
        if (request.getNewPassword().equals(request.getCurrentPassword())) {
            throw new InvalidRequestException("New password must differ from the current password");
        }
        PasswordPolicy.requireStrong(request.getNewPassword());
        
        user.setPasswordHash(passwordService.hash(request.getNewPassword()));
        userRepository.saveAndFlush(user);
        
        int revoked = refreshTokenService.revokeAll(userId, clock.instant());
        log.info("User {} changed password, {} session(s) revoked", userId, revoked);
    }
}
