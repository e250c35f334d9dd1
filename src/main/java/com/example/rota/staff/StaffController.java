package com.example.rota.staff;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/staff")
public class StaffController {

    private final StaffService staffService;

    public StaffController(StaffService staffService) {
        this.staffService = staffService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<StaffView>>> list(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(staffService.list(principal.toCaller())));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<StaffView>> me(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(staffService.me(principal.toCaller())));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<StaffView>> create(@AuthenticationPrincipal StaffPrincipal principal,
                                                         @Valid @RequestBody StaffService.CreateStaffRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Staff member created", staffService.create(principal.toCaller(), request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<StaffView>> update(@AuthenticationPrincipal StaffPrincipal principal,
                                                         @PathVariable Long id,
                                                         @RequestBody StaffService.UpdateStaffRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Staff member updated", staffService.update(principal.toCaller(), id, request)));
    }

    @GetMapping("/{id}/category-rates")
    public ResponseEntity<ApiResponse<List<StaffService.CategoryRateView>>> rates(@AuthenticationPrincipal StaffPrincipal principal,
                                                                                  @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(staffService.categoryRates(principal.toCaller(), id)));
    }

    @PutMapping("/{id}/category-rates/{categoryId}")
    public ResponseEntity<ApiResponse<List<StaffService.CategoryRateView>>> setRate(@AuthenticationPrincipal StaffPrincipal principal,
                                                                                    @PathVariable Long id,
                                                                                    @PathVariable Long categoryId,
                                                                                    @RequestBody RateRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
                staffService.setCategoryRate(principal.toCaller(), id, categoryId, request.hourlyRate())));
    }

    public record RateRequest(BigDecimal hourlyRate) {
    }
}
