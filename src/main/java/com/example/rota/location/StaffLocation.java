package com.example.rota.location;

import com.example.rota.staff.Staff;
import jakarta.persistence.*;

/**
 * Assigns a staff member to a location. Staff with at least one assignment only see shifts there.
 */
@Entity
@Table(name = "staff_locations",
        uniqueConstraints = @UniqueConstraint(name = "uk_staff_location", columnNames = {"staff_id", "location_id"}))
public class StaffLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "staff_id")
    private Staff staff;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "location_id")
    private Location location;

    protected StaffLocation() {
    }

    public StaffLocation(Staff staff, Location location) {
        this.staff = staff;
        this.location = location;
    }

    public Long getId() { return id; }
    public Staff getStaff() { return staff; }
    public Location getLocation() { return location; }
}
