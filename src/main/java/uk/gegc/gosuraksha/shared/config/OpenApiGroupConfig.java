package uk.gegc.gosuraksha.shared.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups and the bearer scheme referenced by the controllers.
 */
@Configuration
public class OpenApiGroupConfig {

    public static final String BEARER_SCHEME = "Bearer Authentication";

    @Bean
    public OpenAPI goSurakshaOpenApi() {
        return new OpenAPI()
                .info(new Info().title("GoSuraksha Usage & Subscription API").version("v1"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi usageGroup() {
        return GroupedOpenApi.builder()
                .group("usage")
                .displayName("Usage Quotas")
                .pathsToMatch("/api/v1/usage/**")
                .build();
    }

    @Bean
    public GroupedOpenApi subscriptionGroup() {
        return GroupedOpenApi.builder()
                .group("subscription")
                .displayName("Subscription & Entitlements")
                .pathsToMatch("/api/v1/subscription/**")
                .build();
    }
}
