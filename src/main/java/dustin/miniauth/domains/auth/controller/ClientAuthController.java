package dustin.miniauth.domains.auth.controller;

import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.miniauth.config.OpenApiConfig;
import dustin.miniauth.domains.auth.exception.AuthenticationFailedException;
import dustin.miniauth.domains.auth.middleware.AuthenticatedPrincipal;
import dustin.miniauth.domains.auth.middleware.AuthenticatedRequests;
import dustin.miniauth.domains.auth.model.dto.LoginRequest;
import dustin.miniauth.domains.auth.model.dto.LoginResponse;
import dustin.miniauth.domains.auth.model.dto.LogoutRequest;
import dustin.miniauth.domains.auth.model.dto.RefreshTokenRequest;
import dustin.miniauth.domains.auth.model.dto.RegisterRequest;
import dustin.miniauth.domains.auth.model.dto.UserResponse;
import dustin.miniauth.domains.auth.service.AuthService;
import dustin.miniauth.domains.auth.service.UserService;
import dustin.miniauth.domains.project.model.entity.Project;
import dustin.miniauth.domains.project.repository.ProjectRepository;
import io.swagger.v3.oas.annotations.Operation;
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
 * 프로젝트 사용자 인증 컨트롤러
 * Client (project end-user) Auth Controller
 *
 * register / login / refresh / logout 은 X-Project-Api-Key 헤더가 필요하고,
 * 토큰은 응답 본문으로 주고받는다.
 */
@RestController
@RequestMapping("/api/v1/client/auth")
@RequiredArgsConstructor
@Tag(name = "Client Auth", description = "Project end-user authentication under a project API key")
public class ClientAuthController {
    
    private final AuthService authService;
    private final UserService userService;
    private final ProjectRepository projectRepository;
    
    @Operation(
            summary = "프로젝트 사용자 회원가입",
            description = "API 키가 가리키는 프로젝트에 사용자를 등록합니다",
            security = @SecurityRequirement(name = OpenApiConfig.PROJECT_API_KEY)
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "User created successfully",
                    content = @Content(schema = @Schema(implementation = UserResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Validation failed or weak password"),
            @ApiResponse(responseCode = "401", description = "Missing, unknown or inactive API key"),
            @ApiResponse(responseCode = "409", description = "Email already registered in this project")
    })
    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request,
                                                 HttpServletRequest httpRequest) {
        Project project = projectOf(httpRequest);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(UserResponse.from(authService.registerClientUser(project, request)));
    }
    
    @Operation(
            summary = "프로젝트 사용자 로그인",
            description = "토큰을 응답 본문으로 반환합니다",
            security = @SecurityRequirement(name = OpenApiConfig.PROJECT_API_KEY)
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Login successful",
                    content = @Content(schema = @Schema(implementation = LoginResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "Invalid credentials or API key")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        Project project = projectOf(httpRequest);
        return ResponseEntity.ok(LoginResponse.of(
                authService.loginClient(project, request, httpRequest.getHeader(HttpHeaders.USER_AGENT)),
                "Login successful"));
    }
    
    @Operation(
            summary = "프로젝트 사용자 토큰 갱신",
            security = @SecurityRequirement(name = OpenApiConfig.PROJECT_API_KEY)
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Token refreshed successfully"),
            @ApiResponse(responseCode = "401", description = "Invalid refresh token or API key")
    })
    @PostMapping("/refresh")
    public ResponseEntity<LoginResponse> refresh(@RequestBody RefreshTokenRequest request,
                                                 HttpServletRequest httpRequest) {
        Project project = projectOf(httpRequest);
        return ResponseEntity.ok(LoginResponse.of(
                authService.refresh(request.getRefreshToken(), project, httpRequest.getHeader(HttpHeaders.USER_AGENT)),
                "Token refreshed"));
    }
    
    @Operation(
            summary = "프로젝트 사용자 로그아웃",
            security = @SecurityRequirement(name = OpenApiConfig.PROJECT_API_KEY)
    )
    @ApiResponse(responseCode = "200", description = "Logout successful")
    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(@RequestBody(required = false) LogoutRequest request,
                                                      HttpServletRequest httpRequest) {
        Project project = projectOf(httpRequest);
        authService.logout(request == null ? null : request.getRefreshToken(), project);
        return ResponseEntity.ok(Map.of("message", "Logout successful"));
    }
    
    @Operation(
            summary = "프로젝트 사용자 정보 조회",
            description = "Access Token 의 주체를 반환합니다 (Bearer 만 사용)",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "User info retrieved successfully",
                    content = @Content(schema = @Schema(implementation = UserResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "403", description = "Not a project end-user token")
    })
    @GetMapping("/user")
    public ResponseEntity<UserResponse> getUser(HttpServletRequest httpRequest) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requireClientUser(httpRequest);
        return ResponseEntity.ok(UserResponse.from(userService.getUserInfo(principal.getUserId())));
    }
    
    private Project projectOf(HttpServletRequest httpRequest) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requireProjectKey(httpRequest);
        return projectRepository.findByIdAndActiveTrue(principal.getProjectId())
                .orElseThrow(() -> new AuthenticationFailedException("project " + principal.getProjectId() + " is no longer active"));
    }
}
