package com.example.rota.availability;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/availability")
public class AvailabilityController {

    private final AvailabilityService service;

    public AvailabilityController(AvailabilityService service) {
        this.service = service;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Availability>>> listOwn(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(service.listOwn(principal.toCaller())));
    }

    @GetMapping("/organization")
    public ResponseEntity<ApiResponse<List<Availability>>> listOrganization(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(service.listOrganization(principal.toCaller())));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Availability>> add(@AuthenticationPrincipal StaffPrincipal principal,
                                                         @RequestBody AvailabilityService.AvailabilityRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Availability added", service.add(principal.toCaller(), request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> delete(@AuthenticationPrincipal StaffPrincipal principal, @PathVariable Long id) {
        service.delete(principal.toCaller(), id);
        return ResponseEntity.ok(ApiResponse.success("Availability removed", null));
    }
}
