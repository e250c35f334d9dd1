package com.example.rota.auth;

import com.example.rota.staff.StaffRole;

/**
 * Who is acting: the identity every core operation authorizes against.
 */
public record Caller(Long staffId, StaffRole role, Long organizationId) {

    public boolean isManager() {
        return role != null && role.canManage();
    }

    public boolean isAdmin() {
        return role == StaffRole.ADMIN;
    }
}
