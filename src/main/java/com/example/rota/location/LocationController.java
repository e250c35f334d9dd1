package com.example.rota.location;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/locations")
public class LocationController {

    private final LocationService service;

    public LocationController(LocationService service) {
        this.service = service;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Location>>> list(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(service.list(principal.toCaller())));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<Location>> create(@AuthenticationPrincipal StaffPrincipal principal,
                                                        @RequestBody LocationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Location created", service.create(principal.toCaller(), request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Location>> update(@AuthenticationPrincipal StaffPrincipal principal,
                                                        @PathVariable Long id,
                                                        @RequestBody LocationRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Location updated", service.update(principal.toCaller(), id, request)));
    }
}
