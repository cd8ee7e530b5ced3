package com.atlas.api.infrastructure.web;

import com.atlas.observability.CorrelationContextHolder;
import com.atlas.security.CredentialResolver;
import com.atlas.security.Identity;
import com.atlas.security.RoleChecker;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Authenticates and authorizes requests to handlers annotated with {@link RequiresRole}.
 * <p>
 * The {@code Authorization} header goes through the {@link CredentialResolver}; the resulting
 * identity must satisfy the declared role. Failures propagate as
 * {@link com.atlas.security.AuthException} and are rendered by the exception handler.
 */
public class AuthenticationInterceptor implements HandlerInterceptor {

    /** Request attribute holding the resolved {@link Identity}. */
    public static final String IDENTITY_ATTRIBUTE = AuthenticationInterceptor.class.getName() + ".identity";

    private static final Logger log = LoggerFactory.getLogger(AuthenticationInterceptor.class);

    private final CredentialResolver credentials;

    public AuthenticationInterceptor(CredentialResolver credentials) {
        this.credentials = credentials;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RequiresRole required = requiredRole(method);
        if (required == null) {
            return true;
        }

        Identity identity = credentials.resolve(request.getHeader(HttpHeaders.AUTHORIZATION));
        RoleChecker.authorize(identity, required.value());

        request.setAttribute(IDENTITY_ATTRIBUTE, identity);
        CorrelationContextHolder.update(ctx -> ctx.withUser(identity.id()));
        log.debug("Authenticated {} as {} for {}", identity.username(), identity.role(), request.getRequestURI());
        return true;
    }

    private static RequiresRole requiredRole(HandlerMethod method) {
        RequiresRole onMethod = AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), RequiresRole.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequiresRole.class);
    }
}
