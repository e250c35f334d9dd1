package com.example.rota.timeentry;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
