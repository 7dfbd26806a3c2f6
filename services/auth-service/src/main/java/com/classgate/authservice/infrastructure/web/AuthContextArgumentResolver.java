package com.classgate.authservice.infrastructure.web;

import com.classgate.observability.CorrelationContextHolder;
import com.classgate.security.AccessControl;
import com.classgate.security.AuthContext;
import com.classgate.security.BearerTokenExtractor;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves an {@link AuthContext} handler parameter from the request's bearer token.
 *
 * <p>Any handler that declares an {@code AuthContext} parameter is protected: the token is
 * verified before the handler runs and the resulting context is passed in as an argument. Nothing
 * is stored on the request. Token failures propagate to {@link GlobalExceptionHandler}, which
 * answers 401.
 */
@Component
public class AuthContextArgumentResolver implements HandlerMethodArgumentResolver {

    private final AccessControl accessControl;

    public AuthContextArgumentResolver(AccessControl accessControl) {
        this.accessControl = accessControl;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthContext.class.equals(parameter.getParameterType());
    }

    @Override
    public AuthContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        AuthContext context =
                accessControl.authenticate(webRequest.getHeader(BearerTokenExtractor.AUTHORIZATION_HEADER));
        CorrelationContextHolder.bindUser(context.userId());
        return context;
    }
}
