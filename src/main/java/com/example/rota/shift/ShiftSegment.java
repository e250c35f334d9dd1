package com.example.rota.shift;

import com.example.rota.category.ShiftCategory;
import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * A sub-window of a shift worked under its own category, e.g. two hours on the bar inside a floor shift.
 */
@Entity
@Table(name = "shift_segments")
public class ShiftSegment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "shift_id", nullable = false)
    private Shift shift;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime startAt;

    @Column(name = "end_at", nullable = false)
    private LocalDateTime endAt;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private ShiftCategory category;

    protected ShiftSegment() {
    }

    public ShiftSegment(LocalDateTime startAt, LocalDateTime endAt, ShiftCategory category) {
        this.startAt = startAt;
        this.endAt = endAt;
        this.category = category;
    }

    public Long getId() {
        return id;
    }

    public Shift getShift() {
        return shift;
    }

    void setShift(Shift shift) {
        this.shift = shift;
    }

    public LocalDateTime getStartAt() {
        return startAt;
    }

    public LocalDateTime getEndAt() {
        return endAt;
    }

    public ShiftCategory getCategory() {
        return category;
    }
}
