package com.example.rota.swap;

import com.example.rota.shift.Shift;
import com.example.rota.staff.Staff;
import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "swap_requests",
        uniqueConstraints = @UniqueConstraint(name = "uk_swap_pending", columnNames = "pending_key"))
public class SwapRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shift_id", nullable = false)
    private Shift shift;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "requester_id", nullable = false)
    private Staff requester;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private SwapType type;

    @Column(length = 500)
    private String message;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "proposed_staff_id")
    private Staff proposedStaff;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private SwapStatus status = SwapStatus.PENDING;

    @Column(name = "requested_at", nullable = false)
    private LocalDateTime requestedAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @Column(name = "resolved_by")
    private Long resolvedBy;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "replacement_id")
    private Staff replacement;

    @Column(name = "manager_comment", length = 500)
    private String managerComment;

    // "shiftId:requesterId" while pending, null afterwards
    @Column(name = "pending_key", length = 64)
    private String pendingKey;

    protected SwapRequest() {
    }

    public SwapRequest(Shift shift, Staff requester, SwapType type, String message, Staff proposedStaff,
                       LocalDateTime requestedAt) {
        this.organizationId = shift.getOrganizationId();
        this.shift = shift;
        this.requester = requester;
        this.type = type;
        this.message = message;
        this.proposedStaff = proposedStaff;
        this.requestedAt = requestedAt;
        this.pendingKey = pendingKey(shift.getId(), requester.getId());
    }

    static String pendingKey(Long shiftId, Long requesterId) {
        return shiftId + ":" + requesterId;
    }

    public boolean isPending() {
        return status == SwapStatus.PENDING;
    }

    void resolve(SwapStatus outcome, Long managerId, LocalDateTime at) {
        this.status = outcome;
        this.resolvedBy = managerId;
        this.resolvedAt = at;
        this.pendingKey = null;
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public Shift getShift() {
        return shift;
    }

    public Staff getRequester() {
        return requester;
    }

    public SwapType getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    public Staff getProposedStaff() {
        return proposedStaff;
    }

    public SwapStatus getStatus() {
        return status;
    }

    public LocalDateTime getRequestedAt() {
        return requestedAt;
    }

    public LocalDateTime getResolvedAt() {
        return resolvedAt;
    }

    public Long getResolvedBy() {
        return resolvedBy;
    }

    public Staff getReplacement() {
        return replacement;
    }

    void setReplacement(Staff replacement) {
        this.replacement = replacement;
    }

    public String getManagerComment() {
        return managerComment;
    }

    void setManagerComment(String managerComment) {
        this.managerComment = managerComment;
    }

    public String getPendingKey() {
        return pendingKey;
    }

    public enum SwapStatus {
        PENDING,
        APPROVED,
        REJECTED,
        CANCELLED
    }
}
