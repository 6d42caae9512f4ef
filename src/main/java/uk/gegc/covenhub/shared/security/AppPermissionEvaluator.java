package uk.gegc.covenhub.shared.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Capability checks against the authorities of the current caller. Authorities carry
 * {@link PermissionName} names verbatim (e.g. {@code ASSET_CREATE}).
 */
@Component
@Slf4j
public class AppPermissionEvaluator {

    /**
     * Check if current caller has the specified permission
     */
    public boolean hasPermission(PermissionName permission) {
        return currentPermissions().contains(permission.name());
    }

    /**
     * Check if current caller has any of the specified permissions
     */
    public boolean hasAnyPermission(PermissionName... permissions) {
        Set<String> granted = currentPermissions();
        for (PermissionName permission : permissions) {
            if (granted.contains(permission.name())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check if current caller has all of the specified permissions
     */
    public boolean hasAllPermissions(PermissionName... permissions) {
        Set<String> granted = currentPermissions();
        if (granted.isEmpty()) {
            return false;
        }
        for (PermissionName permission : permissions) {
            if (!granted.contains(permission.name())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Identity of the authenticated caller, empty for anonymous requests
     */
    public Optional<String> currentCallerId() {
        Authentication authentication = currentAuthentication();
        if (authentication == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(authentication.getName());
    }

    private Set<String> currentPermissions() {
        Authentication authentication = currentAuthentication();
        if (authentication == null) {
            return Set.of();
        }
        return authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .collect(Collectors.toSet());
    }

    private Authentication currentAuthentication() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return authentication;
    }
}
