package com.example.rota.category;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/shift-categories")
public class ShiftCategoryController {

    private final ShiftCategoryService service;

    public ShiftCategoryController(ShiftCategoryService service) {
        this.service = service;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShiftCategory>>> list(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(service.list(principal.toCaller())));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftCategory>> create(@AuthenticationPrincipal StaffPrincipal principal,
                                                             @Valid @RequestBody ShiftCategoryService.CategoryRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Category created", service.create(principal.toCaller(), request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftCategory>> update(@AuthenticationPrincipal StaffPrincipal principal,
                                                             @PathVariable Long id,
                                                             @Valid @RequestBody ShiftCategoryService.CategoryRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Category updated", service.update(principal.toCaller(), id, request)));
    }
}
