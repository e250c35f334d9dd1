package com.example.rota.swap;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/swap-requests")
public class SwapRequestController {

    private final SwapRequestService service;

    public SwapRequestController(SwapRequestService service) {
        this.service = service;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<SwapRequestView>>> list(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(service.list(principal.toCaller())));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<SwapRequestView>> create(@AuthenticationPrincipal StaffPrincipal principal,
                                                               @RequestBody SwapRequestService.SwapCreateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Request submitted", service.create(principal.toCaller(), request)));
    }

    @PutMapping("/{id}/approve")
    public ResponseEntity<ApiResponse<SwapRequestView>> approve(@AuthenticationPrincipal StaffPrincipal principal,
                                                                @PathVariable Long id,
                                                                @RequestBody(required = false) ResolveRequest body) {
        Long replacement = body != null ? body.replacementStaffId() : null;
        return ResponseEntity.ok(ApiResponse.success("Request approved", service.approve(principal.toCaller(), id, replacement)));
    }

    @PutMapping("/{id}/reject")
    public ResponseEntity<ApiResponse<SwapRequestView>> reject(@AuthenticationPrincipal StaffPrincipal principal,
                                                               @PathVariable Long id,
                                                               @RequestBody(required = false) ResolveRequest body) {
        String comment = body != null ? body.comment() : null;
        return ResponseEntity.ok(ApiResponse.success("Request rejected", service.reject(principal.toCaller(), id, comment)));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<SwapRequestView>> cancel(@AuthenticationPrincipal StaffPrincipal principal,
                                                               @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Request cancelled", service.cancel(principal.toCaller(), id)));
    }

    public record ResolveRequest(Long replacementStaffId, String comment) {
    }
}
