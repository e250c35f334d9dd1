package com.example.rota.config;

import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.breaks.BreakCalculationMode;
import com.example.rota.breaks.BreakTier;
import com.example.rota.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;

@Service
public class RuleSettingsService {

    private static final Logger logger = LoggerFactory.getLogger(RuleSettingsService.class);

    private final RuleSettingsRepository repository;
    private final RotaProperties properties;
    private final AccessPolicy accessPolicy;

    public RuleSettingsService(RuleSettingsRepository repository, RotaProperties properties, AccessPolicy accessPolicy) {
        this.repository = repository;
        this.properties = properties;
        this.accessPolicy = accessPolicy;
    }

    @Cacheable(value = CacheConfig.CLOCK_RULES, key = "#organizationId")
    @Transactional(readOnly = true)
    public ClockRules rulesFor(Long organizationId) {
        return repository.findByOrganizationId(organizationId)
                .map(this::toRules)
                .orElseGet(this::defaults);
    }

    @CacheEvict(value = CacheConfig.CLOCK_RULES, key = "#caller.organizationId()")
    @Transactional
    public ClockRules update(Caller caller, RuleSettingsRequest request) {
        accessPolicy.requireManager(caller);
        ClockRules current = rulesFor(caller.organizationId());
        int window = nonNegative(request.clockInWindowMinutes(), current.clockInWindowMinutes(), "clockInWindowMinutes");
        int lateGrace = nonNegative(request.lateGraceMinutes(), current.lateGraceMinutes(), "lateGraceMinutes");
        int outGrace = nonNegative(request.clockOutGraceMinutes(), current.clockOutGraceMinutes(), "clockOutGraceMinutes");
        List<BreakTier> tiers = request.breakTiers() == null ? current.defaultBreakTiers() : normalizeTiers(request.breakTiers());
        BreakCalculationMode mode = request.breakCalculationMode() == null
                ? current.breakCalculationMode() : request.breakCalculationMode();

        RuleSettings entity = repository.findByOrganizationId(caller.organizationId())
                .orElseGet(() -> new RuleSettings(caller.organizationId(), window, lateGrace, outGrace, tiers));
        entity.setClockInWindowMinutes(window);
        entity.setLateGraceMinutes(lateGrace);
        entity.setClockOutGraceMinutes(outGrace);
        entity.setBreakTiers(tiers);
        entity.setBreakCalculationMode(mode);
        RuleSettings saved = repository.save(entity);
        logger.info("Rule settings updated: organization={}, window={}, lateGrace={}, tiers={}, breakMode={}",
                caller.organizationId(), window, lateGrace, tiers.size(), mode);
        return toRules(saved);
    }

    /**
     * Sorts tiers by threshold and rejects negative values.
     */
    public static List<BreakTier> normalizeTiers(List<BreakTier> tiers) {
        for (BreakTier tier : tiers) {
            if (tier == null || tier.minHours() < 0 || tier.breakMinutes() < 0) {
                throw new ValidationException("Break tiers need non-negative hours and minutes", "breakTiers", tier);
            }
        }
        return tiers.stream()
                .sorted(Comparator.comparingDouble(BreakTier::minHours))
                .toList();
    }

    private ClockRules toRules(RuleSettings settings) {
        return new ClockRules(
                settings.getClockInWindowMinutes(),
                settings.getLateGraceMinutes(),
                settings.getClockOutGraceMinutes(),
                properties.getClock().isEnforceMandatedBreak(),
                settings.getBreakTiers(),
                settings.getBreakCalculationMode() != null
                        ? settings.getBreakCalculationMode() : properties.getBreakCalculationMode());
    }

    private ClockRules defaults() {
        RotaProperties.Clock clock = properties.getClock();
        return new ClockRules(
                clock.getClockInWindowMinutes(),
                clock.getLateGraceMinutes(),
                clock.getClockOutGraceMinutes(),
                clock.isEnforceMandatedBreak(),
                properties.getDefaultBreakTiers(),
                properties.getBreakCalculationMode());
    }

    private int nonNegative(Integer value, int fallback, String field) {
        if (value == null) {
            return fallback;
        }
        if (value < 0) {
            throw new ValidationException(field + " must not be negative", field, value);
        }
        return value;
    }

    public record RuleSettingsRequest(Integer clockInWindowMinutes,
                                      Integer lateGraceMinutes,
                                      Integer clockOutGraceMinutes,
                                      List<BreakTier> breakTiers,
                                      BreakCalculationMode breakCalculationMode) {
    }
}
