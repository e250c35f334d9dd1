package com.example.rota.swap;

import java.time.LocalDateTime;

public record SwapRequestView(Long id,
                              Long shiftId,
                              String shiftTitle,
                              LocalDateTime shiftStart,
                              Long requesterId,
                              String requesterName,
                              SwapType type,
                              String message,
                              Long proposedStaffId,
                              SwapRequest.SwapStatus status,
                              LocalDateTime requestedAt,
                              LocalDateTime resolvedAt,
                              Long resolvedBy,
                              Long replacementId,
                              String managerComment) {

    static SwapRequestView of(SwapRequest request) {
        return new SwapRequestView(
                request.getId(),
                request.getShift().getId(),
                request.getShift().getTitle(),
                request.getShift().getStartAt(),
                request.getRequester().getId(),
                request.getRequester().getName(),
                request.getType(),
                request.getMessage(),
                request.getProposedStaff() != null ? request.getProposedStaff().getId() : null,
                request.getStatus(),
                request.getRequestedAt(),
                request.getResolvedAt(),
                request.getResolvedBy(),
                request.getReplacement() != null ? request.getReplacement().getId() : null,
                request.getManagerComment());
    }
}
