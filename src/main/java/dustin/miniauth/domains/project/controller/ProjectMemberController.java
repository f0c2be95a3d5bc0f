package dustin.miniauth.domains.project.controller;

import java.util.List;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.miniauth.config.OpenApiConfig;
import dustin.miniauth.domains.auth.middleware.AuthenticatedPrincipal;
import dustin.miniauth.domains.auth.middleware.AuthenticatedRequests;
import dustin.miniauth.domains.project.model.dto.AddMemberRequest;
import dustin.miniauth.domains.project.model.dto.MemberResponse;
import dustin.miniauth.domains.project.model.dto.UpdateMemberRoleRequest;
import dustin.miniauth.domains.project.service.ProjectMemberService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 프로젝트 멤버 컨트롤러
 * Project Member Controller
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/members")
@RequiredArgsConstructor
@Tag(name = "Project Members", description = "Platform users sharing a project")
@SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
public class ProjectMemberController {
    
    private final ProjectMemberService projectMemberService;
    
    @Operation(summary = "멤버 추가", description = "소유자만 가능. 역할은 member 또는 admin")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Member added"),
            @ApiResponse(responseCode = "400", description = "Invalid role"),
            @ApiResponse(responseCode = "403", description = "Not the owner, or the target is the owner"),
            @ApiResponse(responseCode = "404", description = "Project or user not found"),
            @ApiResponse(responseCode = "409", description = "Already a member")
    })
    @PostMapping
    public ResponseEntity<MemberResponse> addMember(@PathVariable UUID projectId,
                                                    @Valid @RequestBody AddMemberRequest body,
                                                    HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(
                projectMemberService.addMember(principal.getUserId(), projectId, body.getUserId(), body.getRole()));
    }
    
    @Operation(summary = "멤버 목록", description = "프로젝트의 모든 멤버가 조회 가능. 소유자는 owner 로 표시")
    @GetMapping
    public ResponseEntity<List<MemberResponse>> listMembers(@PathVariable UUID projectId, HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.ok(projectMemberService.listMembers(principal.getUserId(), projectId));
    }
    
    @Operation(summary = "멤버 역할 변경", description = "소유자만 가능. 소유자 자신의 역할은 변경 불가")
    @PutMapping("/{userId}")
    public ResponseEntity<MemberResponse> updateMemberRole(@PathVariable UUID projectId,
                                                           @PathVariable UUID userId,
                                                           @Valid @RequestBody UpdateMemberRoleRequest body,
                                                           HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.ok(
                projectMemberService.updateMemberRole(principal.getUserId(), projectId, userId, body.getRole()));
    }
    
    @Operation(summary = "멤버 제거", description = "소유자만 가능. 소유자는 제거할 수 없음")
    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> removeMember(@PathVariable UUID projectId,
                                             @PathVariable UUID userId,
                                             HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        projectMemberService.removeMember(principal.getUserId(), projectId, userId);
        return ResponseEntity.noContent().build();
    }
}
