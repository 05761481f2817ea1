package com.contentdesk.backend.global.security;

import java.io.IOException;
import java.util.Map;

import com.contentdesk.backend.global.error.ProblemResponse;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Writes the 401 problem body. Failures raised by {@link JwtAuthenticationFilter} carry a reason
 * key as their message, which is mapped to a stable error code; anything else (no token at all)
 * is reported as {@code unauthorized}.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(RestAuthenticationEntryPoint.class);

    static final String INVALID_ACCESS_TOKEN = "INVALID_ACCESS_TOKEN";
    static final String USER_NOT_ACTIVE = "USER_NOT_ACTIVE";
    static final String IDENTITY_UNAVAILABLE = "IDENTITY_UNAVAILABLE";

    private static final Map<String, Failure> FAILURES = Map.of(
            INVALID_ACCESS_TOKEN, new Failure("auth.invalid_token", "유효하지 않거나 만료된 액세스 토큰입니다."),
            USER_NOT_ACTIVE, new Failure("auth.user_inactive", "토큰의 사용자가 존재하지 않거나 삭제되었습니다."),
            IDENTITY_UNAVAILABLE, new Failure("auth.identity_unavailable", "사용자 정보를 확인할 수 없습니다.")
    );
    private static final Failure UNAUTHENTICATED = new Failure("unauthorized", "인증이 필요합니다.");

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        Failure failure = FAILURES.getOrDefault(authException.getMessage(), UNAUTHENTICATED);
        log.debug("Rejecting {} {} with {}", request.getMethod(), request.getRequestURI(), failure.code());

        ProblemResponse body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, failure.code(), failure.detail(), request.getRequestURI());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }

    private record Failure(String code, String detail) {
    }
}
