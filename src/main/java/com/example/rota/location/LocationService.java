package com.example.rota.location;

import com.example.rota.audit.AuditAction;
import com.example.rota.audit.AuditTrail;
import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.config.RotaProperties;
import com.example.rota.config.RuleSettingsService;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@Transactional
public class LocationService {

    private static final Logger logger = LoggerFactory.getLogger(LocationService.class);

    private final LocationRepository repository;
    private final StaffLocationRepository staffLocationRepository;
    private final StaffRepository staffRepository;
    private final AccessPolicy accessPolicy;
    private final AuditTrail auditTrail;
    private final RotaProperties properties;

    public LocationService(LocationRepository repository,
                           StaffLocationRepository staffLocationRepository,
                           StaffRepository staffRepository,
                           AccessPolicy accessPolicy,
                           AuditTrail auditTrail,
                           RotaProperties properties) {
        this.repository = repository;
        this.staffLocationRepository = staffLocationRepository;
        this.staffRepository = staffRepository;
        this.accessPolicy = accessPolicy;
        this.auditTrail = auditTrail;
        this.properties = properties;
    }

    public Location create(Caller caller, LocationRequest request) {
        accessPolicy.requireManager(caller);
        Location location = new Location(caller.organizationId(), requireName(request.name()));
        location.setClockInRadiusMetres(properties.getDefaultRadiusMetres());
        apply(location, request);
        Location saved = repository.save(location);
        logger.info("Location created: id={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    public Location update(Caller caller, Long id, LocationRequest request) {
        accessPolicy.requireManager(caller);
        Location location = get(caller, id);
        if (request.name() != null) {
            location.setName(requireName(request.name()));
        }
        apply(location, request);
        return location;
    }

    @Transactional(readOnly = true)
    public Location get(Caller caller, Long id) {
        Location location = repository.findById(id).orElseThrow(() -> new NotFoundException("Location", id));
        accessPolicy.requireSameOrganization(caller, location.getOrganizationId(), "Location", id);
        return location;
    }

    @Transactional(readOnly = true)
    public List<Location> list(Caller caller) {
        return repository.findByOrganizationIdOrderByNameAsc(caller.organizationId());
    }

    /**
     * Locations a staff member is assigned to. Staff may read their own; managers anyone's in their organization.
     */
    @Transactional(readOnly = true)
    public List<Location> staffLocations(Caller caller, Long staffId) {
        accessPolicy.requireSelfOrManager(caller, staffId);
        requireStaff(caller, staffId);
        return staffLocationRepository.findLocationsByStaffId(staffId);
    }

    /**
     * Replaces all location assignments of a staff member. An empty list removes the restriction.
     */
    public List<Location> assignStaffLocations(Caller caller, Long staffId, List<Long> locationIds) {
        accessPolicy.requireAdmin(caller);
        Staff staff = requireStaff(caller, staffId);
        Set<Long> wanted = locationIds == null ? Set.of() : new LinkedHashSet<>(locationIds);
        if (wanted.contains(null)) {
            throw new ValidationException("Location ids must not be null", "locationIds", locationIds);
        }
        List<Location> locations = new ArrayList<>(wanted.size());
        for (Long locationId : wanted) {
            locations.add(get(caller, locationId));
        }
        staffLocationRepository.deleteByStaffId(staffId);
        for (Location location : locations) {
            staffLocationRepository.save(new StaffLocation(staff, location));
        }
        auditTrail.record(caller, AuditAction.STAFF_LOCATIONS_UPDATED, "Staff", staffId, "locations=" + wanted);
        logger.info("Staff {} assigned to locations {} by {}", staffId, wanted, caller.staffId());
        return staffLocationRepository.findLocationsByStaffId(staffId);
    }

    /**
     * Ids of the locations a staff member is restricted to; empty means unrestricted.
     */
    @Transactional(readOnly = true)
    public Set<Long> assignedLocationIds(Long staffId) {
        return new HashSet<>(staffLocationRepository.findLocationIdsByStaffId(staffId));
    }

    private Staff requireStaff(Caller caller, Long staffId) {
        Staff staff = staffRepository.findById(staffId).orElseThrow(() -> new NotFoundException("Staff", staffId));
        accessPolicy.requireSameOrganization(caller, staff.getOrganizationId(), "Staff", staffId);
        return staff;
    }

    private void apply(Location location, LocationRequest request) {
        if ((request.latitude() == null) != (request.longitude() == null)) {
            throw new ValidationException("Latitude and longitude must be given together", "latitude", request.latitude());
        }
        if (request.latitude() != null) {
            if (Math.abs(request.latitude()) > 90 || Math.abs(request.longitude()) > 180) {
                throw new ValidationException("Coordinates out of range", "latitude", request.latitude());
            }
            location.setLatitude(request.latitude());
            location.setLongitude(request.longitude());
        }
        if (request.clockInRadiusMetres() != null) {
            if (request.clockInRadiusMetres() <= 0) {
                throw new ValidationException("Radius must be positive", "clockInRadiusMetres", request.clockInRadiusMetres());
            }
            location.setClockInRadiusMetres(request.clockInRadiusMetres());
        }
        if (request.breakTiers() != null) {
            location.setBreakTiers(RuleSettingsService.normalizeTiers(request.breakTiers()));
        }
        if (request.active() != null) {
            location.setActive(request.active());
        }
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Location name is required", "name", name);
        }
        return name.trim();
    }
}
