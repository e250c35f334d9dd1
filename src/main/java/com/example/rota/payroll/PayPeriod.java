package com.example.rota.payroll;

import jakarta.persistence.*;

import java.time.LocalDate;

@Entity
@Table(name = "pay_periods")
public class PayPeriod {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(nullable = false, length = 80)
    private String name;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "pay_date")
    private LocalDate payDate;

    @Column(name = "is_active")
    private Boolean active = true;

    protected PayPeriod() {
    }

    public PayPeriod(Long organizationId, String name, LocalDate startDate, LocalDate endDate, LocalDate payDate) {
        this.organizationId = organizationId;
        this.name = name;
        this.startDate = startDate;
        this.endDate = endDate;
        this.payDate = payDate;
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public String getName() {
        return name;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public LocalDate getPayDate() {
        return payDate;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }
}
