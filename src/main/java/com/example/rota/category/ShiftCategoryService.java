package com.example.rota.category;

import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
@Transactional
public class ShiftCategoryService {

    private final ShiftCategoryRepository repository;
    private final AccessPolicy accessPolicy;

    public ShiftCategoryService(ShiftCategoryRepository repository, AccessPolicy accessPolicy) {
        this.repository = repository;
        this.accessPolicy = accessPolicy;
    }

    public ShiftCategory create(Caller caller, CategoryRequest request) {
        accessPolicy.requireManager(caller);
        String name = request.name().trim();
        if (repository.existsByOrganizationIdAndNameIgnoreCase(caller.organizationId(), name)) {
            throw new ConflictException("A category with this name already exists");
        }
        return repository.save(new ShiftCategory(caller.organizationId(), name, request.hourlyRate(), request.color()));
    }

    public ShiftCategory update(Caller caller, Long id, CategoryRequest request) {
        accessPolicy.requireManager(caller);
        ShiftCategory category = get(caller, id);
        category.setName(request.name().trim());
        category.setHourlyRate(request.hourlyRate());
        category.setColor(request.color());
        return category;
    }

    @Transactional(readOnly = true)
    public ShiftCategory get(Caller caller, Long id) {
        ShiftCategory category = repository.findById(id).orElseThrow(() -> new NotFoundException("Category", id));
        accessPolicy.requireSameOrganization(caller, category.getOrganizationId(), "Category", id);
        return category;
    }

    /**
     * Resolves an optional category reference; null stays null.
     */
    @Transactional(readOnly = true)
    public ShiftCategory resolve(Caller caller, Long id) {
        return id == null ? null : get(caller, id);
    }

    @Transactional(readOnly = true)
    public List<ShiftCategory> list(Caller caller) {
        return repository.findByOrganizationIdOrderByNameAsc(caller.organizationId());
    }

    public record CategoryRequest(
            @NotBlank(message = "Name is required") String name,
            @NotNull(message = "Hourly rate is required")
            @DecimalMin(value = "0.00", message = "Hourly rate must not be negative") BigDecimal hourlyRate,
            String color) {

        public CategoryRequest {
            if (hourlyRate != null && hourlyRate.signum() < 0) {
                throw new ValidationException("Hourly rate must not be negative", "hourlyRate", hourlyRate);
            }
        }
    }
}
