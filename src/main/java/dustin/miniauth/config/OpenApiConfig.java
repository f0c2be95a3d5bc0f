package dustin.miniauth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;

/**
 * Swagger / OpenAPI 설정
 * OpenAPI Configuration
 */
@Configuration
public class OpenApiConfig {

    public static final String BEARER_AUTH = "BearerAuth";
    public static final String PROJECT_API_KEY = "ProjectApiKey";

    @Bean
    public OpenAPI miniAuthOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Mini Auth API")
                        .description("플랫폼 사용자와 프로젝트 사용자를 위한 인증 서버 / Multi-tenant authentication authority")
                        .version("v1"))
                .components(new Components()
                        .addSecuritySchemes(BEARER_AUTH, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT"))
                        .addSecuritySchemes(PROJECT_API_KEY, new SecurityScheme()
                                .type(SecurityScheme.Type.APIKEY)
                                .in(SecurityScheme.In.HEADER)
                                .name("X-Project-Api-Key")));
    }
}
