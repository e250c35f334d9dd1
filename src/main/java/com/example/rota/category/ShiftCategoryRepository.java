package com.example.rota.category;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ShiftCategoryRepository extends JpaRepository<ShiftCategory, Long> {

    List<ShiftCategory> findByOrganizationIdOrderByNameAsc(Long organizationId);

    boolean existsByOrganizationIdAndNameIgnoreCase(Long organizationId, String name);
}
