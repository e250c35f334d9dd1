package com.example.rota.payroll;

import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Service
@Transactional
public class PayPeriodService {

    private static final Logger logger = LoggerFactory.getLogger(PayPeriodService.class);

    private final PayPeriodRepository repository;
    private final AccessPolicy accessPolicy;

    public PayPeriodService(PayPeriodRepository repository, AccessPolicy accessPolicy) {
        this.repository = repository;
        this.accessPolicy = accessPolicy;
    }

    public PayPeriod register(Caller caller, PayPeriodRequest request) {
        accessPolicy.requireManager(caller);
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("Name is required", "name", request.name());
        }
        if (request.startDate() == null || request.endDate() == null || request.endDate().isBefore(request.startDate())) {
            throw new ValidationException("End date must not be before start date", "endDate", request.endDate());
        }
        if (request.payDate() != null && request.payDate().isBefore(request.startDate())) {
            throw new ValidationException("Pay date must not be before the period starts", "payDate", request.payDate());
        }
        if (!repository.findByOrganizationIdAndActiveTrueAndStartDateLessThanEqualAndEndDateGreaterThanEqual(
                caller.organizationId(), request.endDate(), request.startDate()).isEmpty()) {
            throw new ConflictException("PERIOD_OVERLAP", "The period overlaps an existing pay period");
        }
        PayPeriod saved = repository.save(new PayPeriod(caller.organizationId(), request.name().trim(),
                request.startDate(), request.endDate(), request.payDate()));
        logger.info("Pay period registered: id={}, {} - {}", saved.getId(), saved.getStartDate(), saved.getEndDate());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<PayPeriod> list(Caller caller) {
        accessPolicy.requireManager(caller);
        return repository.findByOrganizationIdOrderByStartDateDesc(caller.organizationId());
    }

    @Transactional(readOnly = true)
    public PayPeriod get(Caller caller, Long id) {
        PayPeriod period = repository.findById(id).orElseThrow(() -> new NotFoundException("PayPeriod", id));
        accessPolicy.requireSameOrganization(caller, period.getOrganizationId(), "PayPeriod", id);
        return period;
    }

    public record PayPeriodRequest(String name, LocalDate startDate, LocalDate endDate, LocalDate payDate) {
    }
}
