package com.example.rota.auth;

import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRole;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;

public class StaffPrincipal implements UserDetails {

    private final Long staffId;
    private final Long organizationId;
    private final StaffRole role;
    private final String username;
    private final String password;
    private final boolean enabled;

    public StaffPrincipal(Long staffId, Long organizationId, StaffRole role, String username, String password, boolean enabled) {
        this.staffId = staffId;
        this.organizationId = organizationId;
        this.role = role;
        this.username = username;
        this.password = password;
        this.enabled = enabled;
    }

    public static StaffPrincipal of(Staff staff) {
        return new StaffPrincipal(staff.getId(), staff.getOrganizationId(), staff.getRole(),
                staff.getEmail(), staff.getPasswordHash(), !Boolean.FALSE.equals(staff.getActive()));
    }

    public Caller toCaller() {
        return new Caller(staffId, role, organizationId);
    }

    public Long getStaffId() {
        return staffId;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public StaffRole getRole() {
        return role;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return Collections.singletonList(new SimpleGrantedAuthority("ROLE_" + role.name()));
    }

    @Override
    public String getPassword() {
        return password;
    }

    @Override
    public String getUsername() {
        return username;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StaffPrincipal that = (StaffPrincipal) o;
        return Objects.equals(staffId, that.staffId) && Objects.equals(username, that.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(staffId, username);
    }

    @Override
    public String toString() {
        return "StaffPrincipal{staffId=" + staffId + ", organizationId=" + organizationId + ", role=" + role + '}';
    }
}
