package dustin.miniauth.domains.project.controller;

import java.util.UUID;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.miniauth.config.OpenApiConfig;
import dustin.miniauth.domains.auth.middleware.AuthenticatedPrincipal;
import dustin.miniauth.domains.auth.middleware.AuthenticatedRequests;
import dustin.miniauth.domains.project.model.dto.ClientProjectResponse;
import dustin.miniauth.domains.project.service.ProjectService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * 프로젝트 사용자용 프로젝트 조회
 * Project view for project end-users
 */
@RestController
@RequestMapping("/api/v1/client/projects")
@RequiredArgsConstructor
@Tag(name = "Client Projects", description = "Project summary visible to its end-users")
public class ClientProjectController {
    
    private final ProjectService projectService;
    
    @Operation(
            summary = "내 프로젝트 조회",
            description = "자신이 속한 프로젝트만 조회할 수 있습니다. 다른 프로젝트 ID 는 404",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Project found"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @GetMapping("/{projectId}")
    public ResponseEntity<ClientProjectResponse> getProject(@PathVariable UUID projectId, HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requireClientUser(request);
        return ResponseEntity.ok(projectService.getClientProject(principal.getProjectId(), projectId));
    }
}
