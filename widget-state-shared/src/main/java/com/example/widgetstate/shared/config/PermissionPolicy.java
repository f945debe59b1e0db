package com.example.widgetstate.shared.config;

/**
 * How role permissions and resource-scoped grants combine in a permission check.
 */
public enum PermissionPolicy {
    /** A match in either the role layer or the resource grants allows access. */
    UNION,
    /**
     * A resource-scoped entry for the exact resource decides on its own; only superuser roles
     * still pass through their role permissions.
     */
    RESOURCE_OVERRIDES_ROLE
}
