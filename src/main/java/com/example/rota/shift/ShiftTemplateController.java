package com.example.rota.shift;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/shift-templates")
public class ShiftTemplateController {

    private final ShiftTemplateService service;

    public ShiftTemplateController(ShiftTemplateService service) {
        this.service = service;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShiftTemplateService.TemplateView>>> list(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(service.list(principal.toCaller())));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftTemplateService.TemplateView>> create(@AuthenticationPrincipal StaffPrincipal principal,
                                                                                 @RequestBody ShiftTemplateService.TemplateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Template created", service.create(principal.toCaller(), request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftTemplateService.TemplateView>> update(@AuthenticationPrincipal StaffPrincipal principal,
                                                                                 @PathVariable Long id,
                                                                                 @RequestBody ShiftTemplateService.TemplateRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Template updated", service.update(principal.toCaller(), id, request)));
    }
}
