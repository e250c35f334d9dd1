package com.example.rota.timeentry;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/time-entries")
public class TimeEntryController {

    private final TimeEntryService service;

    public TimeEntryController(TimeEntryService service) {
        this.service = service;
    }

    @PostMapping("/clock-in")
    public ResponseEntity<ApiResponse<TimeEntryView>> clockIn(@AuthenticationPrincipal StaffPrincipal principal,
                                                              @RequestBody(required = false) TimeEntryRequests.ClockIn request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Clocked in", service.clockIn(principal.toCaller(), request)));
    }

    @PostMapping("/{id}/break/start")
    public ResponseEntity<ApiResponse<TimeEntryView>> startBreak(@AuthenticationPrincipal StaffPrincipal principal,
                                                                 @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Break started", service.startBreak(principal.toCaller(), id)));
    }

    @PostMapping("/{id}/break/end")
    public ResponseEntity<ApiResponse<TimeEntryView>> endBreak(@AuthenticationPrincipal StaffPrincipal principal,
                                                               @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Break ended", service.endBreak(principal.toCaller(), id)));
    }

    @PostMapping("/{id}/clock-out")
    public ResponseEntity<ApiResponse<TimeEntryView>> clockOut(@AuthenticationPrincipal StaffPrincipal principal,
                                                               @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Clocked out", service.clockOut(principal.toCaller(), id)));
    }

    @GetMapping("/current")
    public ResponseEntity<ApiResponse<TimeEntryView>> current(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(service.currentEntry(principal.toCaller()).orElse(null)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<TimeEntryView>>> list(
            @AuthenticationPrincipal StaffPrincipal principal,
            @RequestParam(required = false) Long staffId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return ResponseEntity.ok(ApiResponse.success(service.list(principal.toCaller(), staffId, from, to)));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ApiResponse<TimeEntryView>> approve(@AuthenticationPrincipal StaffPrincipal principal,
                                                              @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(service.approve(principal.toCaller(), id)));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<ApiResponse<TimeEntryView>> reject(@AuthenticationPrincipal StaffPrincipal principal,
                                                             @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(service.reject(principal.toCaller(), id)));
    }

    @PostMapping("/{id}/clock-in-flag/clear")
    public ResponseEntity<ApiResponse<TimeEntryView>> clearFlag(@AuthenticationPrincipal StaffPrincipal principal,
                                                                @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(service.clearClockInFlag(principal.toCaller(), id)));
    }

    @PostMapping("/{id}/clock-in-flag/reject")
    public ResponseEntity<ApiResponse<TimeEntryView>> rejectClockIn(@AuthenticationPrincipal StaffPrincipal principal,
                                                                    @PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(service.rejectClockIn(principal.toCaller(), id)));
    }

    @PostMapping("/missed-clock-outs")
    public ResponseEntity<ApiResponse<List<TimeEntryView>>> flagMissedClockOuts(@AuthenticationPrincipal StaffPrincipal principal) {
        List<TimeEntryView> flagged = service.flagMissedClockOuts(principal.toCaller());
        return ResponseEntity.ok(ApiResponse.success(flagged.size() + " missed clock-out(s) flagged", flagged));
    }

    @PostMapping("/manual")
    public ResponseEntity<ApiResponse<TimeEntryView>> manual(@AuthenticationPrincipal StaffPrincipal principal,
                                                             @Valid @RequestBody TimeEntryRequests.ManualEntry request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Time entry added", service.createManualEntry(principal.toCaller(), request)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<TimeEntryView>> correct(@AuthenticationPrincipal StaffPrincipal principal,
                                                              @PathVariable Long id,
                                                              @Valid @RequestBody TimeEntryRequests.Correction request) {
        return ResponseEntity.ok(ApiResponse.success("Time entry corrected", service.correct(principal.toCaller(), id, request)));
    }
}
