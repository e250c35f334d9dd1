package com.example.rota.shift;

import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.category.ShiftCategoryService;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import com.example.rota.location.LocationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalTime;
import java.util.List;

@Service
@Transactional
public class ShiftTemplateService {

    private static final Logger logger = LoggerFactory.getLogger(ShiftTemplateService.class);

    private final ShiftTemplateRepository repository;
    private final ShiftCategoryService categoryService;
    private final LocationService locationService;
    private final AccessPolicy accessPolicy;

    public ShiftTemplateService(ShiftTemplateRepository repository,
                                ShiftCategoryService categoryService,
                                LocationService locationService,
                                AccessPolicy accessPolicy) {
        this.repository = repository;
        this.categoryService = categoryService;
        this.locationService = locationService;
        this.accessPolicy = accessPolicy;
    }

    public TemplateView create(Caller caller, TemplateRequest request) {
        accessPolicy.requireManager(caller);
        validate(request);
        if (repository.existsByOrganizationIdAndNameIgnoreCase(caller.organizationId(), request.name().trim())) {
            logger.warn("Template name already exists: {}", request.name());
            throw new ConflictException("A template with this name already exists");
        }
        ShiftTemplate template = new ShiftTemplate(caller.organizationId(), request.name().trim(),
                request.startTime(), request.endTime());
        apply(caller, template, request);
        ShiftTemplate saved = repository.save(template);
        logger.info("Template created: id={}, name={}", saved.getId(), saved.getName());
        return TemplateView.of(saved);
    }

    public TemplateView update(Caller caller, Long id, TemplateRequest request) {
        accessPolicy.requireManager(caller);
        validate(request);
        ShiftTemplate template = repository.findById(id).orElseThrow(() -> new NotFoundException("Template", id));
        accessPolicy.requireSameOrganization(caller, template.getOrganizationId(), "Template", id);
        template.setName(request.name().trim());
        template.setStartTime(request.startTime());
        template.setEndTime(request.endTime());
        apply(caller, template, request);
        return TemplateView.of(template);
    }

    @Transactional(readOnly = true)
    public List<TemplateView> list(Caller caller) {
        return repository.findByOrganizationIdOrderByNameAsc(caller.organizationId()).stream()
                .map(TemplateView::of)
                .toList();
    }

    private void apply(Caller caller, ShiftTemplate template, TemplateRequest request) {
        template.setCategory(categoryService.resolve(caller, request.categoryId()));
        template.setLocation(request.locationId() == null ? null : locationService.get(caller, request.locationId()));
        if (request.active() != null) {
            template.setActive(request.active());
        }
    }

    private void validate(TemplateRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new ValidationException("Template name is required", "name", request.name());
        }
        if (request.startTime() == null || request.endTime() == null) {
            throw new ValidationException("Start and end time are required", "startTime", request.startTime());
        }
        if (request.startTime().equals(request.endTime())) {
            throw new ValidationException("Start and end time must differ", "endTime", request.endTime());
        }
    }

    public record TemplateRequest(String name, LocalTime startTime, LocalTime endTime,
                                  Long categoryId, Long locationId, Boolean active) {
    }

    public record TemplateView(Long id, String name, LocalTime startTime, LocalTime endTime,
                               Long categoryId, Long locationId, boolean active) {

        static TemplateView of(ShiftTemplate template) {
            return new TemplateView(template.getId(), template.getName(), template.getStartTime(), template.getEndTime(),
                    template.getCategory() != null ? template.getCategory().getId() : null,
                    template.getLocation() != null ? template.getLocation().getId() : null,
                    Boolean.TRUE.equals(template.getActive()));
        }
    }
}
