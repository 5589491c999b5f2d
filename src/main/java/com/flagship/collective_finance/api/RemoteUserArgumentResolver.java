package com.flagship.collective_finance.api;

import com.flagship.collective_finance.auth.Principal;
import com.flagship.collective_finance.error.AuthorizationException;
import com.flagship.collective_finance.error.ErrorCode;
import com.flagship.collective_finance.observability.CorrelationContext;
import org.slf4j.MDC;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.UUID;

/**
 * Resolves the {@link Principal} of a request from the
 * {@code X-Remote-User-Id} header set by the authenticating gateway.
 * No header means an anonymous caller.
 */
public class RemoteUserArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String REMOTE_USER_HEADER = "X-Remote-User-Id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Principal.class.equals(parameter.getParameterType());
    }

    @Override
    public Principal resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                     NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(REMOTE_USER_HEADER);
        if (header == null || header.isBlank()) {
            return Principal.anonymous();
        }
        UUID userAccountId;
        try {
            userAccountId = UUID.fromString(header.trim());
        } catch (IllegalArgumentException e) {
            throw new AuthorizationException(ErrorCode.UNAUTHENTICATED, "Malformed " + REMOTE_USER_HEADER + " header");
        }
        MDC.put(CorrelationContext.USER_ID_MDC_KEY, userAccountId.toString());
        return Principal.user(userAccountId);
    }
}
