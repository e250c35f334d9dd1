package com.example.rota.location;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LocationRepository extends JpaRepository<Location, Long> {

    List<Location> findByOrganizationIdAndActiveTrueOrderByNameAsc(Long organizationId);

    List<Location> findByOrganizationIdOrderByNameAsc(Long organizationId);
}
