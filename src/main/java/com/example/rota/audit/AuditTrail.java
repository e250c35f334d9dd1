package com.example.rota.audit;

import com.example.rota.auth.Caller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Writes audit records inside the caller's transaction, so they commit or roll back with the change.
 */
@Component
public class AuditTrail {

    private static final Logger logger = LoggerFactory.getLogger(AuditTrail.class);

    private final AuditRecordRepository repository;
    private final Clock clock;

    public AuditTrail(AuditRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public void record(Caller actor, AuditAction action, String entityType, Long entityId, String detail) {
        repository.save(new AuditRecord(actor.organizationId(), actor.staffId(), action, entityType,
                entityId, detail, LocalDateTime.now(clock)));
        logger.debug("audit {} {}#{} by staff {}: {}", action, entityType, entityId, actor.staffId(), detail);
    }
}
