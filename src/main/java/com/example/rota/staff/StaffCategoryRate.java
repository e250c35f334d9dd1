package com.example.rota.staff;

import com.example.rota.category.ShiftCategory;
import jakarta.persistence.*;

import java.math.BigDecimal;

/**
 * Staff-specific rate that overrides a category's default hourly rate.
 */
@Entity
@Table(name = "staff_category_rates",
        uniqueConstraints = @UniqueConstraint(name = "uk_staff_category_rate", columnNames = {"staff_id", "category_id"}))
public class StaffCategoryRate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "staff_id")
    private Staff staff;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id")
    private ShiftCategory category;

    @Column(name = "hourly_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    protected StaffCategoryRate() {
    }

    public StaffCategoryRate(Staff staff, ShiftCategory category, BigDecimal hourlyRate) {
        this.staff = staff;
        this.category = category;
        this.hourlyRate = hourlyRate;
    }

    public Long getId() { return id; }
    public Staff getStaff() { return staff; }
    public ShiftCategory getCategory() { return category; }
    public BigDecimal getHourlyRate() { return hourlyRate; }
    public void setHourlyRate(BigDecimal hourlyRate) { this.hourlyRate = hourlyRate; }
}
