package dustin.miniauth.domains.project.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.miniauth.domains.auth.exception.DuplicateResourceException;
import dustin.miniauth.domains.auth.exception.InvalidRequestException;
import dustin.miniauth.domains.auth.exception.ResourceNotFoundException;
import dustin.miniauth.domains.auth.model.entity.User;
import dustin.miniauth.domains.auth.repository.UserRepository;
import dustin.miniauth.domains.project.model.dto.MemberResponse;
import dustin.miniauth.domains.project.model.entity.Project;
import dustin.miniauth.domains.project.model.entity.ProjectMember;
import dustin.miniauth.domains.project.model.entity.ProjectRole;
import dustin.miniauth.domains.project.repository.ProjectMemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로젝트 멤버 서비스
 * Project Member Service
 *
 * 소유자는 멤버 행으로 저장되지 않으며, 목록에서만 "owner" 로 표시된다.
 * 추가 / 역할 변경 / 제거는 소유자만 가능하고, 소유자 자신은 그 대상이 될 수 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectMemberService {
    
    private final ProjectMemberRepository projectMemberRepository;
    private final UserRepository userRepository;
    private final ProjectAccessResolver projectAccessResolver;
    
    @Transactional
    public MemberResponse addMember(UUID callerId, UUID projectId, UUID targetUserId, String roleValue) {
        Project project = projectAccessResolver.requireOwned(callerId, projectId);
        ProjectAccessPolicy.requireNotOwner(project, targetUserId);
        ProjectRole role = requireAssignable(roleValue);
        
        User target = userRepository.findById(targetUserId)
                .filter(User::isPlatformUser)
                .filter(u -> Boolean.TRUE.equals(u.getActive()))
                .orElseThrow(() -> new ResourceNotFoundException("User"));
        
        if (projectMemberRepository.existsByProjectIdAndUserId(projectId, targetUserId)) {
            throw new DuplicateResourceException("userId", "User is already a member of this project");
        }
        
        ProjectMember member;
        try {
            member = projectMemberRepository.saveAndFlush(ProjectMember.builder()
                    .projectId(projectId)
                    .userId(targetUserId)
                    .role(role)
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateResourceException("userId", "User is already a member of this project");
        }
        
        log.info("Added user {} to project {} as {}", targetUserId, projectId, role.value());
        return toResponse(member, target);
    }
    
    /**
     * 멤버 목록 (소유자가 첫 항목)
     * List members; any member of the project may do this
     */
    @Transactional(readOnly = true)
    public List<MemberResponse> listMembers(UUID callerId, UUID projectId) {
        Project project = projectAccessResolver.requireVisible(callerId, projectId).getProject();
        List<ProjectMember> members = projectMemberRepository.findByProjectIdOrderByCreatedAtAsc(projectId);
        
        List<UUID> userIds = new ArrayList<>();
        userIds.add(project.getOwnerId());
        members.forEach(m -> userIds.add(m.getUserId()));
        Map<UUID, User> users = userRepository.findAllById(userIds).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
        
        List<MemberResponse> result = new ArrayList<>();
        User owner = users.get(project.getOwnerId());
        result.add(MemberResponse.builder()
                .userId(project.getOwnerId())
                .email(owner != null ? owner.getEmail() : null)
                .fullName(owner != null ? owner.getFullName() : null)
                .role(ProjectRole.OWNER.value())
                .joinedAt(project.getCreatedAt())
                .build());
        for (ProjectMember member : members) {
            result.add(toResponse(member, users.get(member.getUserId())));
        }
        return result;
    }
    
    @Transactional
    public MemberResponse updateMemberRole(UUID callerId, UUID projectId, UUID targetUserId, String roleValue) {
        Project project = projectAccessResolver.requireVisible(callerId, projectId).getProject();
        ProjectAccessPolicy.requireNotOwner(project, targetUserId);
        ProjectAccessPolicy.requireOwner(project, callerId);
        ProjectRole role = requireAssignable(roleValue);
        
        ProjectMember member = projectMemberRepository.findByProjectIdAndUserId(projectId, targetUserId)
                .orElseThrow(() -> new ResourceNotFoundException("Member"));
        member.setRole(role);
        member = projectMemberRepository.save(member);
        
        log.info("Changed role of user {} in project {} to {}", targetUserId, projectId, role.value());
        return toResponse(member, userRepository.findById(targetUserId).orElse(null));
    }
    
    @Transactional
    public void removeMember(UUID callerId, UUID projectId, UUID targetUserId) {
        Project project = projectAccessResolver.requireVisible(callerId, projectId).getProject();
        ProjectAccessPolicy.requireNotOwner(project, targetUserId);
        ProjectAccessPolicy.requireOwner(project, callerId);
        
        ProjectMember member = projectMemberRepository.findByProjectIdAndUserId(projectId, targetUserId)
                .orElseThrow(() -> new ResourceNotFoundException("Member"));
        projectMemberRepository.delete(member);
        log.info("Removed user {} from project {}", targetUserId, projectId);
    }
    
    private static ProjectRole requireAssignable(String roleValue) {
        return ProjectRole.assignable(roleValue)
                .orElseThrow(() -> new InvalidRequestException("Role must be 'member' or 'admin'"));
    }
    
    private static MemberResponse toResponse(ProjectMember member, User user) {
        return MemberResponse.builder()
                .userId(member.getUserId())
                .email(user != null ? user.getEmail() : null)
                .fullName(user != null ? user.getFullName() : null)
                .role(member.getRole().value())
                .joinedAt(member.getCreatedAt())
                .build();
    }
}
