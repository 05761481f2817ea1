package com.contentdesk.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.contentdesk.backend.global.error.PermissionDeniedException;
import com.contentdesk.backend.global.error.ProblemResponse;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authorization.AuthorizationDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    public RestAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        List<String> missing = resolveMissingPermissions(accessDeniedException);
        PermissionDeniedException problem = new PermissionDeniedException(missing);
        ProblemResponse body = ProblemResponse.of(
                HttpStatus.FORBIDDEN,
                problem.getCode(),
                problem.getDetailMessage(),
                request.getRequestURI(),
                problem.getMissingPermissions()
        );

        response.setStatus(HttpStatus.FORBIDDEN.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private List<String> resolveMissingPermissions(AccessDeniedException exception) {
        if (exception instanceof AuthorizationDeniedException denied
                && denied.getAuthorizationResult() instanceof PermissionAwareAuthorizationDecision decision) {
            return decision.getMissingPermissions();
        }
        return List.of();
    }
}
