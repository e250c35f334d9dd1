package com.example.rota.payroll;

import com.example.rota.auth.StaffPrincipal;
import com.example.rota.common.ApiResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/payroll")
public class PayrollController {

    private final PayrollCostService costService;
    private final PayPeriodService payPeriodService;
    private final LabourForecastService forecastService;

    public PayrollController(PayrollCostService costService,
                             PayPeriodService payPeriodService,
                             LabourForecastService forecastService) {
        this.costService = costService;
        this.payPeriodService = payPeriodService;
        this.forecastService = forecastService;
    }

    @GetMapping("/staff-costs")
    public ResponseEntity<ApiResponse<CostReport>> staffCosts(@AuthenticationPrincipal StaffPrincipal principal,
                                                              @RequestParam(required = false) String month,
                                                              @RequestParam(required = false) Long payPeriodId,
                                                              @RequestParam(required = false) Long locationId) {
        return ResponseEntity.ok(ApiResponse.success(
                costService.staffCosts(principal.toCaller(), month, payPeriodId, locationId)));
    }

    @GetMapping("/weekly-forecast")
    public ResponseEntity<ApiResponse<LabourForecast>> weeklyForecast(
            @AuthenticationPrincipal StaffPrincipal principal,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate weekStart,
            @RequestParam(required = false) Long locationId) {
        return ResponseEntity.ok(ApiResponse.success(
                forecastService.weeklyForecast(principal.toCaller(), weekStart, locationId)));
    }

    @GetMapping("/pay-periods")
    public ResponseEntity<ApiResponse<List<PayPeriod>>> payPeriods(@AuthenticationPrincipal StaffPrincipal principal) {
        return ResponseEntity.ok(ApiResponse.success(payPeriodService.list(principal.toCaller())));
    }

    @PostMapping("/pay-periods")
    public ResponseEntity<ApiResponse<PayPeriod>> register(@AuthenticationPrincipal StaffPrincipal principal,
                                                           @RequestBody PayPeriodService.PayPeriodRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Pay period registered", payPeriodService.register(principal.toCaller(), request)));
    }
}
