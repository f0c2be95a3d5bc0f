package dustin.miniauth.domains.auth.middleware;

import java.io.IOException;
import java.time.Clock;
import java.util.Set;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.miniauth.domains.auth.config.AuthProperties;
import dustin.miniauth.domains.auth.exception.AuthException;
import dustin.miniauth.domains.auth.exception.AuthenticationFailedException;
import dustin.miniauth.domains.auth.exception.AuthorizationDeniedException;
import dustin.miniauth.shared.model.dto.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증 필터
 * Authentication Filter
 *
 * 요청마다 AuthorizationDispatcher 를 한 번 실행하여 결과를 Request Attribute 에 저장한다.
 * - DENIED: 여기서 바로 에러 응답 (401 / 403)
 * - UNAUTHENTICATED: 통과. 인증이 필요한 엔드포인트는 컨트롤러에서 거절한다.
 * - 그 외: 주체를 저장하고 통과
 */
@Slf4j
@Component
public class AuthenticationFilter extends OncePerRequestFilter {

    private static final Set<String> PUBLIC_PATHS = Set.of(
            "/api/v1/auth/register",
            "/api/v1/auth/login",
            "/api/v1/auth/refresh",
            "/api/v1/auth/logout");

    private final AuthorizationDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String apiKeyHeader;

    public AuthenticationFilter(AuthorizationDispatcher dispatcher,
                                ObjectMapper objectMapper,
                                Clock clock,
                                AuthProperties properties) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.apiKeyHeader = properties.getApiKeyHeader();
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // Swagger UI 및 자격 증명 없이 호출되는 플랫폼 세션 API
        String path = request.getRequestURI();
        return path.startsWith("/swagger-ui")
                || path.startsWith("/v3/api-docs")
                || path.startsWith("/swagger-resources")
                || path.startsWith("/webjars")
                || PUBLIC_PATHS.contains(path);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        CredentialMaterial credentials = CredentialMaterial.from(request, apiKeyHeader);
        AuthenticationResult result = dispatcher.authenticate(credentials, clock.instant());

        if (result.getState() == AuthState.DENIED) {
            writeDenied(request, response, result.getFailure());
            return;
        }

        request.setAttribute(AuthenticatedRequests.ATTRIBUTE, result);
        filterChain.doFilter(request, response);
    }

    private void writeDenied(HttpServletRequest request, HttpServletResponse response, AuthException failure)
            throws IOException {
        if (response.isCommitted()) {
            return;
        }
        HttpStatus status;
        ErrorResponse body;
        if (failure instanceof AuthorizationDeniedException) {
            log.warn("Request {} {} denied: {}", request.getMethod(), request.getRequestURI(),
                    ((AuthorizationDeniedException) failure).getReason());
            status = HttpStatus.FORBIDDEN;
            body = ErrorResponse.of("authorization_denied", AuthorizationDeniedException.MESSAGE);
        } else {
            log.warn("Request {} {} rejected: {}", request.getMethod(), request.getRequestURI(),
                    failure instanceof AuthenticationFailedException
                            ? ((AuthenticationFailedException) failure).getReason()
                            : "unknown");
            status = HttpStatus.UNAUTHORIZED;
            body = ErrorResponse.of("authentication_failed", AuthenticationFailedException.MESSAGE);
        }

        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        objectMapper.writeValue(response.getWriter(), body);
        response.getWriter().flush();
    }
}
