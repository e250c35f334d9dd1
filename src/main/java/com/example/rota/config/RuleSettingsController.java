package com.example.rota.config;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings/rules")
public class RuleSettingsController {

    private final RuleSettingsService service;

    public RuleSettingsController(RuleSettingsService service) {
        this.service = service;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<ClockRules>> get(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(service.rulesFor(principal.getOrganizationId())));
    }

    @PutMapping
    public ResponseEntity<ApiResponse<ClockRules>> update(@AuthenticationPrincipal StaffPrincipal principal,
                                                          @RequestBody RuleSettingsService.RuleSettingsRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Rule settings updated", service.update(principal.toCaller(), request)));
    }
}
