package com.example.rota.shift;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/shifts")
public class ShiftController {

    private final ShiftService shiftService;

    public ShiftController(ShiftService shiftService) {
        this.shiftService = shiftService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<ShiftView>>> schedule(
            @AuthenticationPrincipal StaffPrincipal principal,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(required = false) Long locationId) {
        List<ShiftView> shifts = shiftService.listSchedule(principal.toCaller(), from, to, locationId);
        return ResponseEntity.ok(ApiResponse.success(null, shifts, Map.<String, Object>of("count", shifts.size())));
    }

    @GetMapping("/open")
    public ResponseEntity<ApiResponse<List<ShiftView>>> open(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(shiftService.listOpenShifts(principal.toCaller())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftView>> get(@AuthenticationPrincipal StaffPrincipal principal, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(shiftService.get(principal.toCaller(), id)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftView>> create(@AuthenticationPrincipal StaffPrincipal principal,
                                                         @RequestBody ShiftRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Shift created", shiftService.createShift(principal.toCaller(), request)));
    }

    @PostMapping("/from-template")
    public ResponseEntity<ApiResponse<ShiftView>> fromTemplate(@AuthenticationPrincipal StaffPrincipal principal,
                                                               @RequestBody FromTemplateRequest request) {
        ShiftView view = shiftService.createFromTemplate(principal.toCaller(), request.templateId(), request.date(),
                request.assigneeId());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Shift created", view));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftView>> update(@AuthenticationPrincipal StaffPrincipal principal,
                                                         @PathVariable Long id,
                                                         @RequestBody ShiftRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Shift updated", shiftService.updateShift(principal.toCaller(), id, request)));
    }

    @PutMapping("/{id}/segments")
    public ResponseEntity<ApiResponse<ShiftView>> segments(@AuthenticationPrincipal StaffPrincipal principal,
                                                           @PathVariable Long id,
                                                           @RequestBody List<ShiftRequest.SegmentRequest> segments) {
        return ResponseEntity.ok(ApiResponse.success(shiftService.replaceSegments(principal.toCaller(), id, segments)));
    }

    @PostMapping("/{id}/assign")
    public ResponseEntity<ApiResponse<ShiftView>> assign(@AuthenticationPrincipal StaffPrincipal principal,
                                                         @PathVariable Long id,
                                                         @RequestBody AssignRequest request) {
        return ResponseEntity.ok(ApiResponse.success(shiftService.assign(principal.toCaller(), id, request.staffId())));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<ApiResponse<ShiftView>> confirm(@AuthenticationPrincipal StaffPrincipal principal, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(shiftService.confirm(principal.toCaller(), id)));
    }

    @PostMapping("/{id}/pickup")
    public ResponseEntity<ApiResponse<ShiftView>> pickUp(@AuthenticationPrincipal StaffPrincipal principal, @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Shift picked up", shiftService.pickUp(principal.toCaller(), id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> delete(@AuthenticationPrincipal StaffPrincipal principal,
                                                                   @PathVariable Long id) {
        boolean archived = shiftService.deleteShift(principal.toCaller(), id);
        return ResponseEntity.ok(ApiResponse.success(archived ? "Shift archived" : "Shift deleted",
                Map.<String, Object>of("id", id, "archived", archived)));
    }

    public record AssignRequest(Long staffId) {
    }

    public record FromTemplateRequest(Long templateId, LocalDate date, Long assigneeId) {
    }
}
