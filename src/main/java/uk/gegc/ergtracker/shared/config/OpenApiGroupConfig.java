package uk.gegc.ergtracker.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups and the bearer-token scheme shared by every secured endpoint.
 */
@Configuration
public class OpenApiGroupConfig {

    private static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI ergTrackerOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("ErgTracker API")
                        .version("v1")
                        .description("Societies, accounts and rowing ergometer test results"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }

    @Bean
    public GroupedOpenApi authGroup() {
        return GroupedOpenApi.builder()
                .group("auth")
                .displayName("Authentication & Accounts")
                .pathsToMatch("/api/v1/auth/**", "/api/v1/users/**")
                .build();
    }

    @Bean
    public GroupedOpenApi societiesGroup() {
        return GroupedOpenApi.builder()
                .group("societies")
                .displayName("Societies & Transfers")
                .pathsToMatch("/api/v1/societies/**", "/api/v1/society-changes/**")
                .build();
    }

    @Bean
    public GroupedOpenApi testsGroup() {
        return GroupedOpenApi.builder()
                .group("tests")
                .displayName("Performance Tests & Statistics")
                .pathsToMatch("/api/v1/tests/**")
                .build();
    }

    @Bean
    public GroupedOpenApi adminGroup() {
        return GroupedOpenApi.builder()
                .group("admin")
                .displayName("Administration")
                .pathsToMatch("/api/v1/admin/**")
                .build();
    }
}
