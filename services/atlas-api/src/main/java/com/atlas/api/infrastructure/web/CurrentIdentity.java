package com.atlas.api.infrastructure.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Injects the {@link com.atlas.security.Identity} resolved by {@link AuthenticationInterceptor}
 * into a handler parameter. Only valid on handlers annotated with {@link RequiresRole}.
 */
@Documented
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface CurrentIdentity {
}
