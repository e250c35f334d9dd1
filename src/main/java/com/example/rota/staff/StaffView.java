package com.example.rota.staff;

import java.math.BigDecimal;

public record StaffView(Long id,
                        String name,
                        String email,
                        StaffRole role,
                        PayType payType,
                        BigDecimal defaultHourlyRate,
                        BigDecimal monthlySalary,
                        Double contractedHours,
                        boolean active) {

    public static StaffView of(Staff staff) {
        return new StaffView(staff.getId(), staff.getName(), staff.getEmail(), staff.getRole(), staff.getPayType(),
                staff.getDefaultHourlyRate(), staff.getMonthlySalary(), staff.getContractedHours(), Boolean.TRUE.equals(staff.getActive()));
    }
}
