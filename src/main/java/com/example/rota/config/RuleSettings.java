package com.example.rota.config;

import com.example.rota.breaks.BreakCalculationMode;
import com.example.rota.breaks.BreakTier;
import com.example.rota.breaks.BreakTiersConverter;
import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "rule_settings")
public class RuleSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false, unique = true)
    private Long organizationId;

    @Column(name = "clock_in_window_minutes", nullable = false)
    private Integer clockInWindowMinutes;

    @Column(name = "late_grace_minutes", nullable = false)
    private Integer lateGraceMinutes;

    @Column(name = "clock_out_grace_minutes", nullable = false)
    private Integer clockOutGraceMinutes;

    @Convert(converter = BreakTiersConverter.class)
    @Column(name = "break_tiers", length = 2000)
    private List<BreakTier> breakTiers = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "break_calculation_mode", length = 16)
    private BreakCalculationMode breakCalculationMode;

    protected RuleSettings() {
    }

    public RuleSettings(Long organizationId, int clockInWindowMinutes, int lateGraceMinutes,
                        int clockOutGraceMinutes, List<BreakTier> breakTiers) {
        this.organizationId = organizationId;
        this.clockInWindowMinutes = clockInWindowMinutes;
        this.lateGraceMinutes = lateGraceMinutes;
        this.clockOutGraceMinutes = clockOutGraceMinutes;
        this.breakTiers = new ArrayList<>(breakTiers);
    }

    public Long getId() {
        return id;
    }

    public Long getOrganizationId() {
        return organizationId;
    }

    public Integer getClockInWindowMinutes() {
        return clockInWindowMinutes;
    }

    public void setClockInWindowMinutes(Integer clockInWindowMinutes) {
        this.clockInWindowMinutes = clockInWindowMinutes;
    }

    public Integer getLateGraceMinutes() {
        return lateGraceMinutes;
    }

    public void setLateGraceMinutes(Integer lateGraceMinutes) {
        this.lateGraceMinutes = lateGraceMinutes;
    }

    public Integer getClockOutGraceMinutes() {
        return clockOutGraceMinutes;
    }

    public void setClockOutGraceMinutes(Integer clockOutGraceMinutes) {
        this.clockOutGraceMinutes = clockOutGraceMinutes;
    }

    public List<BreakTier> getBreakTiers() {
        return breakTiers;
    }

    public void setBreakTiers(List<BreakTier> breakTiers) {
        this.breakTiers = new ArrayList<>(breakTiers);
    }

    public BreakCalculationMode getBreakCalculationMode() {
        return breakCalculationMode;
    }

    public void setBreakCalculationMode(BreakCalculationMode breakCalculationMode) {
        this.breakCalculationMode = breakCalculationMode;
    }
}
