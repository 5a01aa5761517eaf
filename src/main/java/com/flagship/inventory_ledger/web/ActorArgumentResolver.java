package com.flagship.inventory_ledger.web;

import com.flagship.inventory_ledger.common.Actor;
import com.flagship.inventory_ledger.common.Role;
import com.flagship.inventory_ledger.common.exception.ValidationException;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Locale;
import java.util.UUID;

/**
 * Resolves an {@link Actor} controller parameter from the gateway headers.
 */
public class ActorArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return Actor.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                  ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest,
                                  WebDataBinderFactory binderFactory) throws Exception {
        String id = webRequest.getHeader(ActorHeaders.ACTOR_ID);
        if (id == null || id.isBlank()) {
            throw new MissingRequestHeaderException(ActorHeaders.ACTOR_ID, parameter);
        }
        String role = webRequest.getHeader(ActorHeaders.ACTOR_ROLE);
        if (role == null || role.isBlank()) {
            throw new MissingRequestHeaderException(ActorHeaders.ACTOR_ROLE, parameter);
        }

        UUID actorId;
        try {
            actorId = UUID.fromString(id.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Header " + ActorHeaders.ACTOR_ID + " must be a UUID");
        }

        Role actorRole;
        try {
            actorRole = Role.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown role: " + role);
        }

        return Actor.of(actorId, actorRole);
    }
}
