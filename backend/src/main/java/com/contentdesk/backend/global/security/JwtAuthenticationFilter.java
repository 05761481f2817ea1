package com.contentdesk.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.contentdesk.backend.modules.auth.application.AuthenticatedUserLoader;
import com.contentdesk.backend.modules.auth.application.JwtTokenService;
import com.contentdesk.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.contentdesk.backend.modules.auth.application.JwtTokenService.ParsedToken;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the bearer token and attaches a freshly loaded {@link AuthenticatedUser}. Any failure
 * while resolving the identity ends the request with 401; nothing is retried.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final AuthenticatedUserLoader authenticatedUserLoader;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            AuthenticatedUserLoader authenticatedUserLoader,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.jwtTokenService = jwtTokenService;
        this.authenticatedUserLoader = authenticatedUserLoader;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            try {
                AuthenticatedUser user = resolveUser(token);
                List<SimpleGrantedAuthority> authorities = user.permissions().stream()
                        .map(SimpleGrantedAuthority::new)
                        .toList();

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(user, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (AuthenticationException ex) {
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response, ex);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private AuthenticatedUser resolveUser(String token) {
        ParsedToken parsed;
        try {
            parsed = jwtTokenService.parseAccessToken(token);
        } catch (InvalidTokenException ex) {
            throw new BadCredentialsException(RestAuthenticationEntryPoint.INVALID_ACCESS_TOKEN, ex);
        }

        Optional<AuthenticatedUser> user;
        try {
            user = authenticatedUserLoader.load(parsed.userId());
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Identity lookup failed for user {}", parsed.userId(), ex);
            throw new InsufficientAuthenticationException(RestAuthenticationEntryPoint.IDENTITY_UNAVAILABLE, ex);
        }
        return user.orElseThrow(() -> new BadCredentialsException(RestAuthenticationEntryPoint.USER_NOT_ACTIVE));
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getMethod().equalsIgnoreCase("OPTIONS");
    }
}
