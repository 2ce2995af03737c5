package com.koni.ems.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Identity of the caller as established by the upstream authentication layer.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Caller {

    public static final String ADMIN_ROLE = "admin";

    private final String userId;
    private final String role;

    public Caller(String userId, String role) {
        this.userId = userId;
        this.role = role;
    }

    public static Caller admin(String userId) {
        return new Caller(userId, ADMIN_ROLE);
    }

    public boolean isAdmin() {
        return ADMIN_ROLE.equalsIgnoreCase(role);
    }

    public boolean isAnonymous() {
        return userId == null || userId.isBlank();
    }
}
