package com.contentdesk.backend.modules.authorization.infrastructure.security;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import com.contentdesk.backend.global.security.AuthenticatedUser;
import com.contentdesk.backend.global.security.PermissionAwareAuthorizationDecision;
import com.contentdesk.backend.global.web.RequestIdFilter;
import com.contentdesk.backend.modules.audit.application.AuthorizationAuditEvent;
import com.contentdesk.backend.modules.audit.application.AuthorizationAuditRecorder;
import com.contentdesk.backend.modules.audit.domain.AuditStatus;
import com.contentdesk.backend.modules.authorization.application.AuthorizationDecisionEngine;
import com.contentdesk.backend.modules.authorization.domain.AccessDecision;
import com.contentdesk.backend.modules.authorization.domain.AuthorizationRequirement;
import com.contentdesk.backend.modules.authorization.domain.ResourceTarget;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * Adapts {@link AuthorizationDecisionEngine} to one route of the security filter chain. Denials
 * and every decision on a mutating request are reported to the audit recorder.
 */
public class RequirementAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private static final Logger log = LoggerFactory.getLogger(RequirementAuthorizationManager.class);
    private static final Set<String> READ_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    private final AuthorizationDecisionEngine decisionEngine;
    private final AuthorizationAuditRecorder auditRecorder;
    private final RouteRule rule;

    public RequirementAuthorizationManager(
            AuthorizationDecisionEngine decisionEngine,
            AuthorizationAuditRecorder auditRecorder,
            RouteRule rule
    ) {
        this.decisionEngine = decisionEngine;
        this.auditRecorder = auditRecorder;
        this.rule = rule;
    }

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication, RequestAuthorizationContext context) {
        long started = System.nanoTime();
        AuthenticatedUser user = currentUser(authentication.get());
        String resourceId = rule.idVariable() != null ? context.getVariables().get(rule.idVariable()) : null;
        ResourceTarget target = new ResourceTarget(rule.resource(), resourceId);
        HttpServletRequest request = context.getRequest();

        AccessDecision decision;
        try {
            decision = decisionEngine.decide(user, rule.requirement(), target);
        } catch (RuntimeException ex) {
            log.error("Authorization check failed for {} {}; denying", request.getMethod(), request.getRequestURI(), ex);
            audit(user, resourceId, request, AuditStatus.ERROR, started, Map.<String, Object>of("error", String.valueOf(ex.getMessage())));
            return new PermissionAwareAuthorizationDecision(false, List.of());
        }

        if (!decision.granted()) {
            audit(user, resourceId, request, AuditStatus.DENIED, started, Map.<String, Object>of("missing", decision.missingPermissions()));
        } else if (!READ_METHODS.contains(request.getMethod()) && !rule.requirement().isPublic()) {
            audit(user, resourceId, request, AuditStatus.SUCCESS, started, Map.<String, Object>of("grantedBy", decision.grantedBy().name()));
        }
        return new PermissionAwareAuthorizationDecision(decision.granted(), decision.missingPermissions());
    }

    public AuthorizationRequirement requirement() {
        return rule.requirement();
    }

    private void audit(
            AuthenticatedUser user,
            String resourceId,
            HttpServletRequest request,
            AuditStatus status,
            long started,
            Map<String, Object> extra
    ) {
        long durationMs = (System.nanoTime() - started) / 1_000_000L;
        Map<String, Object> detail = new LinkedHashMap<>(extra);
        detail.put("method", request.getMethod());
        detail.put("path", request.getRequestURI());
        auditRecorder.record(new AuthorizationAuditEvent(
                user != null ? user.userId() : null,
                rule.action(),
                rule.resource(),
                resourceId,
                status,
                durationMs,
                RequestIdFilter.currentRequestId(),
                detail
        ));
    }

    private AuthenticatedUser currentUser(Authentication authentication) {
        if (authentication != null && authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return user;
        }
        return null;
    }
}
