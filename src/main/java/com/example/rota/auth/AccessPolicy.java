package com.example.rota.auth;

import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.NotFoundException;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Role and ownership checks shared by every mutating operation.
 * Entities of another organization are reported as missing rather than forbidden.
 */
@Component
public class AccessPolicy {

    public void requireManager(Caller caller) {
        if (caller == null || !caller.isManager()) {
            throw new AuthorizationException("Manager or admin role required");
        }
    }

    public void requireAdmin(Caller caller) {
        if (caller == null || !caller.isAdmin()) {
            throw new AuthorizationException("Admin role required");
        }
    }

    public void requireSameOrganization(Caller caller, Long organizationId, String entity, Object id) {
        if (caller == null || !Objects.equals(caller.organizationId(), organizationId)) {
            throw new NotFoundException(entity, id);
        }
    }

    /**
     * Staff act on their own records; managers may act on anyone in their organization.
     */
    public void requireSelfOrManager(Caller caller, Long staffId) {
        if (caller.isManager()) {
            return;
        }
        requireSelf(caller, staffId);
    }

    public void requireSelf(Caller caller, Long staffId) {
        if (!Objects.equals(caller.staffId(), staffId)) {
            throw new AuthorizationException("You can only act on your own records");
        }
    }
}
