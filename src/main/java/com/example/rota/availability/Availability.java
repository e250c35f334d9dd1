package com.example.rota.availability;

import jakarta.persistence.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * A stated availability slot: either weekly on a day of week, or once on a date.
 * Advisory only; assignment never checks it.
 */
@Entity
@Table(name = "availability", indexes = @Index(name = "idx_availability_staff", columnList = "staff_id"))
public class Availability {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(name = "staff_id", nullable = false)
    private Long staffId;

    @Enumerated(EnumType.STRING)
    @Column(name = "day_of_week", length = 12)
    private DayOfWeek dayOfWeek;

    @Column(name = "specific_date")
    private LocalDate date;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(length = 255)
    private String notes;

    protected Availability() {
    }

    public Availability(Long organizationId, Long staffId, DayOfWeek dayOfWeek, LocalDate date,
                        LocalTime startTime, LocalTime endTime, String notes) {
        this.organizationId = organizationId;
        this.staffId = staffId;
        this.dayOfWeek = dayOfWeek;
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
        this.notes = notes;
    }

    public boolean isRecurring() {
        return dayOfWeek != null;
    }

    /**
     * Whether this slot applies on the given calendar day.
     */
    public boolean appliesOn(LocalDate day) {
        return isRecurring() ? dayOfWeek == day.getDayOfWeek() : day.equals(date);
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public Long getStaffId() {
        return staffId;
    }

    public DayOfWeek getDayOfWeek() {
        return dayOfWeek;
    }

    public LocalDate getDate() {
        return date;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }

    public String getNotes() {
        return notes;
    }
}
