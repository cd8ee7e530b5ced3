package com.atlas.api.config;

import com.atlas.api.infrastructure.web.AuthenticationInterceptor;
import com.atlas.api.infrastructure.web.CorrelationIdFilter;
import com.atlas.api.infrastructure.web.CurrentIdentityArgumentResolver;
import com.atlas.security.CredentialResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS, request authentication and identity injection.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final CorsProperties cors;
    private final CredentialResolver credentialResolver;

    public WebConfig(CorsProperties cors, CredentialResolver credentialResolver) {
        this.cors = cors;
        this.credentialResolver = credentialResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = cors.allowedOrigins().toArray(String[]::new);
        for (String path : List.of("/api/**", "/health")) {
            registry.addMapping(path)
                    .allowedOrigins(origins)
                    .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
                    .allowedHeaders("*")
                    .exposedHeaders(CorrelationIdFilter.CORRELATION_ID_HEADER)
                    .allowCredentials(true)
                    .maxAge(3600);
        }
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AuthenticationInterceptor(credentialResolver))
                .addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new CurrentIdentityArgumentResolver());
    }
}
