package com.example.rota.config;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface RuleSettingsRepository extends JpaRepository<RuleSettings, Long> {

    Optional<RuleSettings> findByOrganizationId(Long organizationId);
}
