package dustin.miniauth.domains.project.controller;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.miniauth.config.OpenApiConfig;
import dustin.miniauth.domains.auth.middleware.AuthenticatedPrincipal;
import dustin.miniauth.domains.auth.middleware.AuthenticatedRequests;
import dustin.miniauth.domains.project.model.dto.ApiKeyResponse;
import dustin.miniauth.domains.project.model.dto.CreateApiKeyRequest;
import dustin.miniauth.domains.project.service.ApiKeyService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 프로젝트 API 키 컨트롤러
 * Project API Key Controller (owner only)
 */
@RestController
@RequestMapping("/api/v1/projects/{projectId}/api-keys")
@RequiredArgsConstructor
@Tag(name = "Project API Keys", description = "API keys used by client applications of a project")
@SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
public class ProjectApiKeyController {
    
    private final ApiKeyService apiKeyService;
    
    @Operation(summary = "API 키 생성")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Key created"),
            @ApiResponse(responseCode = "403", description = "Not the owner"),
            @ApiResponse(responseCode = "404", description = "Project not found")
    })
    @PostMapping
    public ResponseEntity<ApiKeyResponse> createKey(@PathVariable UUID projectId,
                                                    @Valid @RequestBody CreateApiKeyRequest body,
                                                    HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiKeyResponse.from(apiKeyService.createKey(principal.getUserId(), projectId, body.getName())));
    }
    
    @Operation(summary = "API 키 목록", description = "기본은 활성 키만, includeInactive=true 면 전체")
    @GetMapping
    public ResponseEntity<List<ApiKeyResponse>> listKeys(@PathVariable UUID projectId,
                                                         @RequestParam(defaultValue = "false") boolean includeInactive,
                                                         HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.ok(apiKeyService.listKeys(principal.getUserId(), projectId, includeInactive).stream()
                .map(ApiKeyResponse::from)
                .collect(Collectors.toList()));
    }
    
    @Operation(summary = "API 키 비활성화", description = "이미 발급된 세션에는 영향이 없습니다")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Key deactivated"),
            @ApiResponse(responseCode = "403", description = "Not the owner"),
            @ApiResponse(responseCode = "404", description = "Project or key not found")
    })
    @DeleteMapping("/{keyId}")
    public ResponseEntity<ApiKeyResponse> deactivateKey(@PathVariable UUID projectId,
                                                        @PathVariable UUID keyId,
                                                        HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requirePlatformUser(request);
        return ResponseEntity.ok(ApiKeyResponse.from(apiKeyService.deactivateKey(principal.getUserId(), projectId, keyId)));
    }
}
