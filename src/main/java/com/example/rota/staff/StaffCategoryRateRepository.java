package com.example.rota.staff;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface StaffCategoryRateRepository extends JpaRepository<StaffCategoryRate, Long> {

    Optional<StaffCategoryRate> findByStaff_IdAndCategory_Id(Long staffId, Long categoryId);

    List<StaffCategoryRate> findByStaff_Id(Long staffId);

    @Query("SELECT r FROM StaffCategoryRate r JOIN FETCH r.category WHERE r.staff.id IN :staffIds")
    List<StaffCategoryRate> findByStaffIdIn(@Param("staffIds") Collection<Long> staffIds);
}
