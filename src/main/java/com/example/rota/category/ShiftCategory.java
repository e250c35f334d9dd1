package com.example.rota.category;

import jakarta.persistence.*;

import java.math.BigDecimal;

@Entity
@Table(name = "shift_categories",
        uniqueConstraints = @UniqueConstraint(name = "uk_category_name", columnNames = {"organization_id", "name"}))
public class ShiftCategory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(nullable = false, length = 60)
    private String name;

    @Column(name = "hourly_rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal hourlyRate;

    @Column(length = 16)
    private String color;

    protected ShiftCategory() {
    }

    public ShiftCategory(Long organizationId, String name, BigDecimal hourlyRate, String color) {
        this.organizationId = organizationId;
        this.name = name;
        this.hourlyRate = hourlyRate;
        this.color = color;
    }

    public Long getId() { return id; }
    public Long getOrganizationId() { return organizationId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public BigDecimal getHourlyRate() { return hourlyRate; }
    public void setHourlyRate(BigDecimal hourlyRate) { this.hourlyRate = hourlyRate; }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }
}
