package dustin.miniauth.domains.project.controller;

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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.miniauth.config.OpenApiConfig;
import dustin.miniauth.domains.auth.middleware.AuthenticatedPrincipal;
import dustin.miniauth.domains.auth.middleware.AuthenticatedRequests;
import dustin.miniauth.domains.project.model.dto.CreateProjectRequest;
import dustin.miniauth.domains.project.model.dto.ProjectResponse;
import dustin.miniauth.domains.project.model.dto.UpdateProjectRequest;
import dustin.miniauth.domains.project.service.ProjectService;
import dustin.miniauth.shared.model.dto.PageResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 프로젝트 컨트롤러
 * Project Controller (platform users only)
 */
@RestController
@RequestMapping("/api/v1/projects")
@RequiredArgsConstructor
@Tag(name = "Projects", description = "Project management for platform users")
@SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
public class ProjectController {
    
    private final ProjectService projectService;
    
    /**
     * 프로젝트 생성
     * Create project (a default API key is issued with it)
     */
    @Operation(summary = "프로젝트 생성", description = "프로젝트를 만들고 기본 API 키를 함께 발급합니다")
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "Project created",
                    content = @Content(schema = @Schema(implementation = ProjectResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "403", description = "Not a platform user")
    })
    @PostMapping
    public ResponseEntity<ProjectResponse> createProject(@Valid @RequestBody CreateProjectRequest body,
                                                         HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(projectService.createProject(principal.getUserId(), body));
    }
    
    @Operation(summary = "프로젝트 목록", description = "소유하거나 멤버로 속한 프로젝트 목록")
    @GetMapping
    public ResponseEntity<PageResponse<ProjectResponse>> listProjects(
            @Parameter(description = "페이지 번호 (0부터)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "페이지 크기") @RequestParam(defaultValue = "20") int size,
            HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.ok(projectService.listProjects(principal.getUserId(), page, size));
    }
    
    @Operation(summary = "프로젝트 조회")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project found"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @GetMapping("/{projectId}")
    public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID projectId, HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.ok(projectService.getProject(principal.getUserId(), projectId));
    }
    
    @Operation(summary = "프로젝트 수정", description = "소유자만 가능")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project updated"),
            @ApiResponse(responseCode = "403", description = "Not the owner"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @PutMapping("/{projectId}")
    public ResponseEntity<ProjectResponse> updateProject(@PathVariable UUID projectId,
                                                         @Valid @RequestBody UpdateProjectRequest body,
                                                         HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.ok(projectService.updateProject(principal.getUserId(), projectId, body));
    }
    
    @Operation(summary = "프로젝트 삭제", description = "소유자만 가능. 모든 API 키가 비활성화됩니다")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Project deleted"),
            @ApiResponse(responseCode = "403", description = "Not the owner"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @DeleteMapping("/{projectId}")
    public ResponseEntity<Void> deleteProject(@PathVariable UUID projectId, HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        projectService.deleteProject(principal.getUserId(), projectId);
        return ResponseEntity.noContent().build();
    }
}
