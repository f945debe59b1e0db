package com.example.widgetstate.shared.store;

import com.example.widgetstate.shared.config.PermissionPolicy;
import com.example.widgetstate.shared.model.UserSession;
import lombok.Getter;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Combines role permissions with the resource grants a session carries in its metadata under
 * {@code permissions}, keyed {@code "<type>:<id>"}.
 */
public class PermissionResolver {

    public static final String PERMISSIONS_METADATA_KEY = "permissions";

    @Getter
    private final PermissionPolicy policy;
    private final Set<String> superuserRoles;

    public PermissionResolver(PermissionPolicy policy, Set<String> superuserRoles) {
        this.policy = policy;
        this.superuserRoles = superuserRoles == null ? Set.of() : Set.copyOf(superuserRoles);
    }

    /**
     * @param rolePermissions permissions of each role the session holds; roles missing from the map grant nothing
     */
    public boolean isGranted(UserSession session, Map<String, Set<String>> rolePermissions,
                             String resourceType, String resourceId, String permission) {
        boolean roleGrant = session.getRoles().stream()
                .map(rolePermissions::get)
                .anyMatch(perms -> perms != null && perms.contains(permission));

        Collection<?> resourceGrants = resourceGrants(session, resourceType + ":" + resourceId);
        if (resourceGrants == null) {
            return roleGrant;
        }
        boolean resourceGrant = resourceGrants.stream().anyMatch(p -> permission.equals(String.valueOf(p)));

        if (policy == PermissionPolicy.RESOURCE_OVERRIDES_ROLE) {
            return resourceGrant || (roleGrant && isSuperuser(session));
        }
        return roleGrant || resourceGrant;
    }

    private boolean isSuperuser(UserSession session) {
        return session.getRoles().stream().anyMatch(superuserRoles::contains);
    }

    private static Collection<?> resourceGrants(UserSession session, String resourceKey) {
        Object grants = session.getMetadata().get(PERMISSIONS_METADATA_KEY);
        if (!(grants instanceof Map<?, ?> byResource)) {
            return null;
        }
        Object entry = byResource.get(resourceKey);
        if (entry instanceof Collection<?> collection) {
            return collection;
        }
        return entry == null ? null : Set.of(entry);
    }
}
