package com.example.rota.location;

import com.example.rota.breaks.BreakTier;
import com.example.rota.breaks.BreakTiersConverter;
import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "locations")
public class Location {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private Long organizationId;

    @Column(nullable = false, length = 100)
    private String name;

    private Double latitude;

    private Double longitude;

    @Column(name = "clock_in_radius_metres", nullable = false)
    private Integer clockInRadiusMetres = 100;

    // empty means the organization default applies
    @Convert(converter = BreakTiersConverter.class)
    @Column(name = "break_tiers", length = 2000)
    private List<BreakTier> breakTiers = new ArrayList<>();

    @Column(name = "is_active")
    private Boolean active = true;

    protected Location() {
    }

    public Location(Long organizationId, String name) {
        this.organizationId = organizationId;
        this.name = name;
    }

    public Long getId() { return id; }
    public Long getOrganizationId() { return organizationId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Double getLatitude() { return latitude; }
    public void setLatitude(Double latitude) { this.latitude = latitude; }
    public Double getLongitude() { return longitude; }
    public void setLongitude(Double longitude) { this.longitude = longitude; }
    public Integer getClockInRadiusMetres() { return clockInRadiusMetres; }
    public void setClockInRadiusMetres(Integer clockInRadiusMetres) { this.clockInRadiusMetres = clockInRadiusMetres; }
    public List<BreakTier> getBreakTiers() { return breakTiers; }
    public void setBreakTiers(List<BreakTier> breakTiers) { this.breakTiers = breakTiers == null ? new ArrayList<>() : new ArrayList<>(breakTiers); }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}
