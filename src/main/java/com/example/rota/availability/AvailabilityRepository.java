package com.example.rota.availability;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface AvailabilityRepository extends JpaRepository<Availability, Long> {

    List<Availability> findByStaffIdOrderByDayOfWeekAscDateAscStartTimeAsc(Long staffId);

    List<Availability> findByOrganizationIdOrderByStaffIdAsc(Long organizationId);

    List<Availability> findByStaffIdIn(Collection<Long> staffIds);
}
