package com.example.rota.audit;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditRecordRepository extends JpaRepository<AuditRecord, Long> {

    List<AuditRecord> findByEntityTypeAndEntityIdOrderByRecordedAtAsc(String entityType, Long entityId);

    long countByEntityTypeAndEntityIdAndAction(String entityType, Long entityId, AuditAction action);
}
