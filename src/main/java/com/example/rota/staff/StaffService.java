package com.example.rota.staff;

import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.category.ShiftCategory;
import com.example.rota.category.ShiftCategoryService;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
@Transactional
public class StaffService {

    private static final Logger logger = LoggerFactory.getLogger(StaffService.class);

    private final StaffRepository staffRepository;
    private final StaffCategoryRateRepository rateRepository;
    private final ShiftCategoryService categoryService;
    private final PasswordEncoder passwordEncoder;
    private final AccessPolicy accessPolicy;

    public StaffService(StaffRepository staffRepository,
                        StaffCategoryRateRepository rateRepository,
                        ShiftCategoryService categoryService,
                        PasswordEncoder passwordEncoder,
                        AccessPolicy accessPolicy) {
        this.staffRepository = staffRepository;
        this.rateRepository = rateRepository;
        this.categoryService = categoryService;
        this.passwordEncoder = passwordEncoder;
        this.accessPolicy = accessPolicy;
    }

    public StaffView create(Caller caller, CreateStaffRequest request) {
        accessPolicy.requireManager(caller);
        StaffRole role = request.role() == null ? StaffRole.EMPLOYEE : request.role();
        if (role != StaffRole.EMPLOYEE && !caller.isAdmin()) {
            throw new AuthorizationException("Only an admin can create managers or admins");
        }
        if (staffRepository.existsByEmailIgnoreCase(request.email())) {
            logger.warn("Email already registered: {}", request.email());
            throw new ConflictException("EMAIL_TAKEN", "This email is already registered");
        }
        Staff staff = new Staff(caller.organizationId(), request.name().trim(), request.email().trim().toLowerCase(),
                passwordEncoder.encode(request.password()), role);
        applyPay(staff, request.payType(), request.defaultHourlyRate(), request.monthlySalary());
        applyContractedHours(staff, request.contractedHours());
        Staff saved = staffRepository.save(staff);
        logger.info("Staff created: id={}, role={}", saved.getId(), saved.getRole());
        return StaffView.of(saved);
    }

    public StaffView update(Caller caller, Long id, UpdateStaffRequest request) {
        accessPolicy.requireManager(caller);
        Staff staff = load(caller, id);
        if (request.name() != null && !request.name().isBlank()) {
            staff.setName(request.name().trim());
        }
        if (request.role() != null && request.role() != staff.getRole()) {
            if (!caller.isAdmin()) {
                throw new AuthorizationException("Only an admin can change roles");
            }
            staff.setRole(request.role());
        }
        applyPay(staff, request.payType(), request.defaultHourlyRate(), request.monthlySalary());
        applyContractedHours(staff, request.contractedHours());
        if (request.active() != null) {
            staff.setActive(request.active());
        }
        logger.info("Staff updated: id={}", id);
        return StaffView.of(staff);
    }

    @Transactional(readOnly = true)
    public List<StaffView> list(Caller caller) {
        accessPolicy.requireManager(caller);
        return staffRepository.findByOrganizationIdOrderByNameAsc(caller.organizationId()).stream()
                .map(StaffView::of)
                .toList();
    }

    @Transactional(readOnly = true)
    public StaffView me(Caller caller) {
        return StaffView.of(load(caller, caller.staffId()));
    }

    /**
     * Sets the staff-specific rate for a category, or removes it when {@code hourlyRate} is null.
     */
    public List<CategoryRateView> setCategoryRate(Caller caller, Long staffId, Long categoryId, BigDecimal hourlyRate) {
        accessPolicy.requireManager(caller);
        Staff staff = load(caller, staffId);
        ShiftCategory category = categoryService.get(caller, categoryId);
        var existing = rateRepository.findByStaff_IdAndCategory_Id(staffId, categoryId);
        if (hourlyRate == null) {
            existing.ifPresent(rateRepository::delete);
        } else {
            if (hourlyRate.signum() < 0) {
                throw new ValidationException("Hourly rate must not be negative", "hourlyRate", hourlyRate);
            }
            existing.ifPresentOrElse(r -> r.setHourlyRate(hourlyRate),
                    () -> rateRepository.save(new StaffCategoryRate(staff, category, hourlyRate)));
        }
        rateRepository.flush();
        return categoryRates(caller, staffId);
    }

    @Transactional(readOnly = true)
    public List<CategoryRateView> categoryRates(Caller caller, Long staffId) {
        accessPolicy.requireSelfOrManager(caller, staffId);
        load(caller, staffId);
        return rateRepository.findByStaff_Id(staffId).stream()
                .map(r -> new CategoryRateView(r.getCategory().getId(), r.getCategory().getName(), r.getHourlyRate()))
                .toList();
    }

    private Staff load(Caller caller, Long id) {
        Staff staff = staffRepository.findById(id).orElseThrow(() -> new NotFoundException("Staff", id));
        accessPolicy.requireSameOrganization(caller, staff.getOrganizationId(), "Staff", id);
        return staff;
    }

    private void applyPay(Staff staff, PayType payType, BigDecimal hourlyRate, BigDecimal monthlySalary) {
        if (payType != null) {
            staff.setPayType(payType);
        }
        if (hourlyRate != null) {
            if (hourlyRate.signum() < 0) {
                throw new ValidationException("Hourly rate must not be negative", "defaultHourlyRate", hourlyRate);
            }
            staff.setDefaultHourlyRate(hourlyRate);
        }
        if (monthlySalary != null) {
            if (monthlySalary.signum() < 0) {
                throw new ValidationException("Salary must not be negative", "monthlySalary", monthlySalary);
            }
            staff.setMonthlySalary(monthlySalary);
        }
        if (staff.getPayType() == PayType.SALARIED && staff.getMonthlySalary() == null) {
            throw new ValidationException("Salaried staff need a monthly salary", "monthlySalary", null);
        }
    }

    private void applyContractedHours(Staff staff, Double contractedHours) {
        if (contractedHours == null) {
            return;
        }
        if (contractedHours < 0 || contractedHours > 168) {
            throw new ValidationException("Contracted hours must be between 0 and 168 a week", "contractedHours", contractedHours);
        }
        staff.setContractedHours(contractedHours);
    }

    public record CreateStaffRequest(
            @NotBlank(message = "Name is required") String name,
            @NotBlank(message = "Email is required") @Email(message = "Email is invalid") String email,
            @NotNull(message = "Password is required") @Size(min = 8, message = "Password needs at least 8 characters") String password,
            StaffRole role,
            PayType payType,
            BigDecimal defaultHourlyRate,
            BigDecimal monthlySalary,
            Double contractedHours) {
    }

    public record UpdateStaffRequest(String name,
                                     StaffRole role,
                                     PayType payType,
                                     BigDecimal defaultHourlyRate,
                                     BigDecimal monthlySalary,
                                     Double contractedHours,
                                     Boolean active) {
    }

    public record CategoryRateView(Long categoryId, String categoryName, BigDecimal hourlyRate) {
    }
}
