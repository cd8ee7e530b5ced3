package com.atlas.api.infrastructure.web;

import com.atlas.security.AuthException;
import com.atlas.security.AuthFailure;
import com.atlas.security.Identity;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentIdentity} parameters from the attribute set by
 * {@link AuthenticationInterceptor}.
 */
public class CurrentIdentityArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentIdentity.class)
                && Identity.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object identity = webRequest.getAttribute(AuthenticationInterceptor.IDENTITY_ATTRIBUTE,
                RequestAttributes.SCOPE_REQUEST);
        if (identity == null) {
            throw new AuthException(AuthFailure.MISSING_CREDENTIAL);
        }
        return identity;
    }
}
