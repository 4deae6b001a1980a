package com.catagent.gateway.http;

import com.catagent.auth.CurrentUser;
import com.catagent.shared.error.AuthenticationRequiredException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Turns the identity headers set by the upstream session layer into a {@link CurrentUser}.
 */
public class CurrentUserArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_HEADER = "X-User-Id";
    public static final String ACTOR_HEADER = "X-Actor-Id";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return CurrentUser.class.equals(parameter.getParameterType());
    }

    @Override
    public CurrentUser resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                       NativeWebRequest request, WebDataBinderFactory binderFactory) {
        var userId = request.getHeader(USER_HEADER);
        if (userId == null || userId.isBlank()) {
            throw new AuthenticationRequiredException();
        }
        return new CurrentUser(userId.trim(), request.getHeader(ACTOR_HEADER));
    }
}
