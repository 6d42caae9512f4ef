package uk.gegc.covenhub.shared.security.aspect;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.springframework.stereotype.Component;
import uk.gegc.covenhub.shared.exception.ForbiddenException;
import uk.gegc.covenhub.shared.exception.UnauthorizedException;
import uk.gegc.covenhub.shared.security.AppPermissionEvaluator;
import uk.gegc.covenhub.shared.security.PermissionName;
import uk.gegc.covenhub.shared.security.annotation.RequirePermission;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class PermissionAspect {

    private final AppPermissionEvaluator appPermissionEvaluator;

    @Before("@annotation(requirePermission)")
    public void checkPermission(JoinPoint joinPoint, RequirePermission requirePermission) {
        if (appPermissionEvaluator.currentCallerId().isEmpty()) {
            log.warn("Access denied: no authenticated caller for {}", joinPoint.getSignature().toShortString());
            throw new UnauthorizedException("Authentication is required to access this resource");
        }

        PermissionName[] requiredPermissions = requirePermission.value();
        RequirePermission.LogicalOperator operator = requirePermission.operator();

        boolean hasAccess = false;

        if (operator == RequirePermission.LogicalOperator.OR) {
            hasAccess = appPermissionEvaluator.hasAnyPermission(requiredPermissions);
        } else if (operator == RequirePermission.LogicalOperator.AND) {
            hasAccess = appPermissionEvaluator.hasAllPermissions(requiredPermissions);
        }

        if (!hasAccess) {
            log.warn("Access denied: Caller lacks required permissions. Required: {}, Operator: {}",
                    requiredPermissions, operator);
            throw new ForbiddenException("Insufficient permissions to access this resource");
        }
    }
}
