package com.example.rota.audit;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "audit_records", indexes = @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id"))
public class AuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "actor_id", nullable = false)
    private Long actorId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private AuditAction action;

    @Column(name = "entity_type", nullable = false, length = 40)
    private String entityType;

    @Column(name = "entity_id", nullable = false)
    private Long entityId;

    @Column(length = 1000)
    private String detail;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;

    protected AuditRecord() {
    }

    public AuditRecord(Long organizationId, Long actorId, AuditAction action, String entityType,
                       Long entityId, String detail, LocalDateTime recordedAt) {
        this.organizationId = organizationId;
        this.actorId = actorId;
        this.action = action;
        this.entityType = entityType;
        this.entityId = entityId;
        this.detail = detail;
        this.recordedAt = recordedAt;
    }

    public Long getId() { return id; }
    public Long getOrganizationId() { return organizationId; }
    public Long getActorId() { return actorId; }
    public AuditAction getAction() { return action; }
    public String getEntityType() { return entityType; }
    public Long getEntityId() { return entityId; }
    public String getDetail() { return detail; }
    public LocalDateTime getRecordedAt() { return recordedAt; }
}
