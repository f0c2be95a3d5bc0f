package dustin.miniauth.domains.auth.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.miniauth.config.OpenApiConfig;
import dustin.miniauth.domains.auth.middleware.AuthenticatedPrincipal;
import dustin.miniauth.domains.auth.middleware.AuthenticatedRequests;
import dustin.miniauth.domains.auth.model.dto.ChangePasswordRequest;
import dustin.miniauth.domains.auth.model.dto.UpdateUserRequest;
import dustin.miniauth.domains.auth.model.dto.UserResponse;
import dustin.miniauth.domains.auth.service.UserService;
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
 * 사용자 프로필 컨트롤러
 * Current user profile
 */
@RestController
@RequestMapping("/api/v1/users/me")
@RequiredArgsConstructor
@Tag(name = "Users", description = "Profile of the authenticated user")
public class UserController {
    
    private final UserService userService;
    
    @Operation(
            summary = "사용자 정보 조회",
            description = "현재 로그인한 사용자의 정보를 조회합니다",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "User info retrieved successfully",
                    content = @Content(schema = @Schema(implementation = UserResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @GetMapping
    public ResponseEntity<UserResponse> getMe(HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requireUser(request);
        return ResponseEntity.ok(UserResponse.from(userService.getUserInfo(principal.getUserId())));
    }
    
    @Operation(
            summary = "프로필 수정",
            description = "이름 또는 이메일을 변경합니다. 이메일은 같은 범위(플랫폼 / 프로젝트) 안에서 유일해야 합니다",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile updated"),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PutMapping
    public ResponseEntity<UserResponse> updateMe(@Valid @RequestBody UpdateUserRequest body, HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requireUser(request);
        return ResponseEntity.ok(UserResponse.from(userService.updateProfile(principal.getUserId(), body)));
    }
    
    @Operation(
            summary = "비밀번호 변경",
            description = "비밀번호를 변경하고 모든 세션을 종료합니다",
            security = @SecurityRequirement(name = OpenApiConfig.BEARER_AUTH)
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "Wrong current password or weak new password"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @PostMapping("/change-password")
    public ResponseEntity<Map<String, String>> changePassword(@Valid @RequestBody ChangePasswordRequest body,
                                                              HttpServletRequest request) {
        AuthenticatedPrincipal principal = AuthenticatedRequests.requireUser(request);
        userService.changePassword(principal.getUserId(), body);
        return ResponseEntity.ok(Map.of("message", "Password changed"));
    }
}
