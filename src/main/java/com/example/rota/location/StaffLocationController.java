package com.example.rota.location;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/staff/{staffId}/locations")
public class StaffLocationController {

    private final LocationService service;

    public StaffLocationController(LocationService service) {
        this.service = service;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Location>>> list(@AuthenticationPrincipal StaffPrincipal principal,
                                                            @PathVariable Long staffId) {
        return ResponseEntity.ok(ApiResponse.success(service.staffLocations(principal.toCaller(), staffId)));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<List<Location>>> replace(@AuthenticationPrincipal StaffPrincipal principal,
                                                               @PathVariable Long staffId,
                                                               @RequestBody AssignmentRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Staff locations updated",
                service.assignStaffLocations(principal.toCaller(), staffId, request.locationIds())));
    }

    public record AssignmentRequest(List<Long> locationIds) {
    }
}
