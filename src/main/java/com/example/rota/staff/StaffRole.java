package com.example.rota.staff;

public enum StaffRole {
    EMPLOYEE,
    MANAGER,
    ADMIN;

    public boolean canManage() {
        return this == MANAGER || this == ADMIN;
    }
}
