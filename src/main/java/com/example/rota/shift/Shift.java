package com.example.rota.shift;

import com.example.rota.category.ShiftCategory;
import com.example.rota.location.Location;
import com.example.rota.staff.Staff;
import jakarta.persistence.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "shifts", indexes = {
        @Index(name = "idx_shift_org_start", columnList = "organization_id, start_at"),
        @Index(name = "idx_shift_assignee", columnList = "assignee_id")
})
public class Shift {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(nullable = false, length = 120)
    private String title;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private LocalDateTime endAt;

    @Column(name = "scheduled_break_minutes", nullable = false)
    private Integer scheduledBreakMinutes = 0;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "location_id")
    private Location location;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id")
    private ShiftCategory category;

    // null means the shift is open
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assignee_id")
    private Staff assignee;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ShiftStatus status = ShiftStatus.OPEN;

    @Column(name = "is_archived", nullable = false)
    private Boolean archived = false;

    @Version
    private Long version;

    @OneToMany(mappedBy = "shift", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("startAt ASC")
    private List<ShiftSegment> segments = new ArrayList<>();

    protected Shift() {
    }

    public Shift(Long organizationId, String title, LocalDateTime startAt, LocalDateTime endAt) {
        this.organizationId = organizationId;
        this.title = title;
        this.startAt = startAt;
        this.endAt = endAt;
    }

    /**
     * Assigns or releases the shift. Releasing always returns it to OPEN.
     */
    public void assignTo(Staff staff) {
        this.assignee = staff;
        this.status = staff == null ? ShiftStatus.OPEN : ShiftStatus.ASSIGNED;
    }

    public boolean isAssignedTo(Long staffId) {
        return assignee != null && assignee.getId().equals(staffId);
    }

    public void replaceSegments(List<ShiftSegment> replacement) {
        segments.clear();
        for (ShiftSegment segment : replacement) {
            segment.setShift(this);
            segments.add(segment);
        }
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public LocalDateTime getStartAt() {
        return startAt;
    }

    public void setStartAt(LocalDateTime startAt) {
        this.startAt = startAt;
    }

    public LocalDateTime getEndAt() {
        return endAt;
    }

    public void setEndAt(LocalDateTime endAt) {
        this.endAt = endAt;
    }

    public Integer getScheduledBreakMinutes() {
        return scheduledBreakMinutes;
    }

    public void setScheduledBreakMinutes(Integer scheduledBreakMinutes) {
        this.scheduledBreakMinutes = scheduledBreakMinutes;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public ShiftCategory getCategory() {
        return category;
    }

    public void setCategory(ShiftCategory category) {
        this.category = category;
    }

    public Staff getAssignee() {
        return assignee;
    }

    public ShiftStatus getStatus() {
        return status;
    }

    public void setStatus(ShiftStatus status) {
        this.status = status;
    }

    public Boolean getArchived() {
        return archived;
    }

    public void setArchived(Boolean archived) {
        this.archived = archived;
    }

    public Long getVersion() {
        return version;
    }

    public List<ShiftSegment> getSegments() {
        return segments;
    }
}
