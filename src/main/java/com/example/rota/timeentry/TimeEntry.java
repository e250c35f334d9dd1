package com.example.rota.timeentry;

import com.example.rota.shift.Shift;
import com.example.rota.staff.Staff;
import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "time_entries",
        uniqueConstraints = @UniqueConstraint(name = "uk_time_entry_active_staff", columnNames = "active_staff_id"),
        indexes = {
                @Index(name = "idx_time_entry_staff_in", columnList = "staff_id, clock_in"),
                @Index(name = "idx_time_entry_org_in", columnList = "organization_id, clock_in")
        })
public class TimeEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "staff_id", nullable = false)
    private Staff staff;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "shift_id")
    private Shift shift;

    @Column(name = "clock_in", nullable = false)
    private LocalDateTime clockIn;

    @Column(name = "clock_out")
    private LocalDateTime clockOut;

    @Column(name = "break_started_at")
    private LocalDateTime breakStartedAt;

    @Column(name = "break_minutes", nullable = false)
    private Integer breakMinutes = 0;

    @Column(name = "mandated_break_minutes", nullable = false)
    private Integer mandatedBreakMinutes = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TimeEntryState state = TimeEntryState.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", nullable = false, length = 16)
    private ApprovalStatus approvalStatus = ApprovalStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "clock_in_flag", nullable = false, length = 8)
    private ClockInFlag clockInFlag = ClockInFlag.NONE;

    @Column(name = "flag_cleared", nullable = false)
    private Boolean flagCleared = false;

    @Column(name = "flag_cleared_by")
    private Long flagClearedBy;

    @Column(name = "flag_cleared_at")
    private LocalDateTime flagClearedAt;

    private Double latitude;

    private Double longitude;

    @Column(name = "distance_metres")
    private Double distanceMetres;

    @Column(name = "outside_geofence", nullable = false)
    private Boolean outsideGeofence = false;

    @Column(name = "late_clock_out", nullable = false)
    private Boolean lateClockOut = false;

    @Column(name = "missed_clock_out", nullable = false)
    private Boolean missedClockOut = false;

    @Column(name = "is_manual", nullable = false)
    private Boolean manual = false;

    @Column(length = 500)
    private String notes;

    @Column(name = "approved_by")
    private Long approvedBy;

    @Column(name = "approved_at")
    private LocalDateTime approvedAt;

    // staff id while the entry is open, null once closed; the unique constraint allows one open entry per staff
    @Column(name = "active_staff_id")
    private Long activeStaffId;

    @Version
    private Long version;

    protected TimeEntry() {
    }

    public TimeEntry(Staff staff, Shift shift, LocalDateTime clockIn) {
        this.organizationId = staff.getOrganizationId();
        this.staff = staff;
        this.shift = shift;
        this.clockIn = clockIn;
        this.activeStaffId = staff.getId();
    }

    /**
     * A manual entry is born closed and pending.
     */
    public static TimeEntry manual(Staff staff, Shift shift, LocalDateTime clockIn, LocalDateTime clockOut, int breakMinutes) {
        TimeEntry entry = new TimeEntry(staff, shift, clockIn);
        entry.manual = true;
        entry.breakMinutes = breakMinutes;
        entry.close(clockOut);
        return entry;
    }

    public void startBreak(LocalDateTime at) {
        this.breakStartedAt = at;
        this.state = TimeEntryState.ON_BREAK;
    }

    public void endBreak(int elapsedMinutes) {
        this.breakMinutes = this.breakMinutes + elapsedMinutes;
        this.breakStartedAt = null;
        this.state = TimeEntryState.ACTIVE;
    }

    public void close(LocalDateTime at) {
        this.clockOut = at;
        this.breakStartedAt = null;
        this.state = TimeEntryState.CLOSED;
        this.activeStaffId = null;
    }

    public boolean isFlagged() {
        return clockInFlag != ClockInFlag.NONE;
    }

    /**
     * Break actually deducted from the span.
     */
    public int deductibleBreakMinutes(boolean enforceMandated) {
        return enforceMandated ? Math.max(breakMinutes, mandatedBreakMinutes) : breakMinutes;
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public Staff getStaff() {
        return staff;
    }

    public Shift getShift() {
        return shift;
    }

    public void setShift(Shift shift) {
        this.shift = shift;
    }

    public LocalDateTime getClockIn() {
        return clockIn;
    }

    public void setClockIn(LocalDateTime clockIn) {
        this.clockIn = clockIn;
    }

    public LocalDateTime getClockOut() {
        return clockOut;
    }

    public void setClockOut(LocalDateTime clockOut) {
        this.clockOut = clockOut;
    }

    public LocalDateTime getBreakStartedAt() {
        return breakStartedAt;
    }

    public Integer getBreakMinutes() {
        return breakMinutes;
    }

    public void setBreakMinutes(Integer breakMinutes) {
        this.breakMinutes = breakMinutes;
    }

    public Integer getMandatedBreakMinutes() {
        return mandatedBreakMinutes;
    }

    public void setMandatedBreakMinutes(Integer mandatedBreakMinutes) {
        this.mandatedBreakMinutes = mandatedBreakMinutes;
    }

    public TimeEntryState getState() {
        return state;
    }

    public ApprovalStatus getApprovalStatus() {
        return approvalStatus;
    }

    public void setApprovalStatus(ApprovalStatus approvalStatus) {
        this.approvalStatus = approvalStatus;
    }

    public ClockInFlag getClockInFlag() {
        return clockInFlag;
    }

    public void setClockInFlag(ClockInFlag clockInFlag) {
        this.clockInFlag = clockInFlag;
    }

    public Boolean getFlagCleared() {
        return flagCleared;
    }

    public void clearFlag(Long managerId, LocalDateTime at) {
        this.flagCleared = true;
        this.flagClearedBy = managerId;
        this.flagClearedAt = at;
    }

    public Long getFlagClearedBy() {
        return flagClearedBy;
    }

    public LocalDateTime getFlagClearedAt() {
        return flagClearedAt;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setPosition(Double latitude, Double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public Double getDistanceMetres() {
        return distanceMetres;
    }

    public void setDistanceMetres(Double distanceMetres) {
        this.distanceMetres = distanceMetres;
    }

    public Boolean getOutsideGeofence() {
        return outsideGeofence;
    }

    public void setOutsideGeofence(Boolean outsideGeofence) {
        this.outsideGeofence = outsideGeofence;
    }

    public Boolean getLateClockOut() {
        return lateClockOut;
    }

    public void setLateClockOut(Boolean lateClockOut) {
        this.lateClockOut = lateClockOut;
    }

    public Boolean getMissedClockOut() {
        return missedClockOut;
    }

    public void markMissedClockOut() {
        this.missedClockOut = true;
    }

    public Boolean getManual() {
        return manual;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public Long getApprovedBy() {
        return approvedBy;
    }

    public LocalDateTime getApprovedAt() {
        return approvedAt;
    }

    public void markReviewed(ApprovalStatus status, Long managerId, LocalDateTime at) {
        this.approvalStatus = status;
        this.approvedBy = managerId;
        this.approvedAt = at;
    }

    public Long getActiveStaffId() {
        return activeStaffId;
    }

    public Long getVersion() {
        return version;
    }
}
