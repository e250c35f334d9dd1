package com.example.rota.swap;

import com.example.rota.audit.AuditAction;
import com.example.rota.audit.AuditTrail;
import com.example.rota.auth.AccessPolicy;
import com.example.rota.auth.Caller;
import com.example.rota.exception.AuthorizationException;
import com.example.rota.exception.ConflictException;
import com.example.rota.exception.NotFoundException;
import com.example.rota.exception.ValidationException;
import com.example.rota.notification.NotificationType;
import com.example.rota.notification.Notifier;
import com.example.rota.shift.Shift;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Swap and drop requests on assigned shifts. Resolution locks the shift row, so two managers
 * acting on the same shift are serialized and the later one sees the earlier outcome.
 */
@Service
@Transactional
public class SwapRequestService {

    private static final Logger logger = LoggerFactory.getLogger(SwapRequestService.class);
    private static final String ENTITY = "SwapRequest";

    private final SwapRequestRepository requestRepository;
    private final ShiftRepository shiftRepository;
    private final StaffRepository staffRepository;
    private final AccessPolicy accessPolicy;
    private final AuditTrail auditTrail;
    private final Notifier notifier;
    private final Clock clock;

    public SwapRequestService(SwapRequestRepository requestRepository,
                              ShiftRepository shiftRepository,
                              StaffRepository staffRepository,
                              AccessPolicy accessPolicy,
                              AuditTrail auditTrail,
                              Notifier notifier,
                              Clock clock) {
        this.requestRepository = requestRepository;
        this.shiftRepository = shiftRepository;
        this.staffRepository = staffRepository;
        this.accessPolicy = accessPolicy;
        this.auditTrail = auditTrail;
        this.notifier = notifier;
        this.clock = clock;
    }

    public SwapRequestView create(Caller caller, SwapCreateRequest body) {
        if (body.shiftId() == null || body.type() == null) {
            throw new ValidationException("Shift and request type are required", "shiftId", body.shiftId());
        }
        Shift shift = shiftRepository.findById(body.shiftId())
                .orElseThrow(() -> new NotFoundException("Shift", body.shiftId()));
        accessPolicy.requireSameOrganization(caller, shift.getOrganizationId(), "Shift", body.shiftId());
        if (Boolean.TRUE.equals(shift.getArchived())) {
            throw new NotFoundException("Shift", body.shiftId());
        }
        if (!shift.isAssignedTo(caller.staffId())) {
            throw new AuthorizationException("You can only request changes to your own shifts");
        }
        if (requestRepository.existsByPendingKey(SwapRequest.pendingKey(shift.getId(), caller.staffId()))) {
            logger.warn("Duplicate pending request: shift={}, requester={}", shift.getId(), caller.staffId());
            throw new ConflictException("DUPLICATE_REQUEST", "You already have a pending request for this shift");
        }
        Staff requester = shift.getAssignee();
        Staff proposed = null;
        if (body.proposedStaffId() != null) {
            proposed = colleague(caller, body.proposedStaffId(), requester);
        }

        SwapRequest saved = requestRepository.saveAndFlush(new SwapRequest(shift, requester, body.type(),
                body.message(), proposed, now()));
        auditTrail.record(caller, AuditAction.SWAP_REQUEST_CREATED, ENTITY, saved.getId(),
                body.type() + " on shift " + shift.getId());
        boolean drop = body.type() == SwapType.DROP;
        notifier.toManagers(caller.organizationId(),
                drop ? NotificationType.DROP_REQUEST : NotificationType.SWAP_REQUEST,
                drop ? "Shift drop requested" : "Shift swap requested",
                requester.getName() + " asked to " + (drop ? "drop " : "swap ") + shift.getTitle()
                        + " on " + shift.getStartAt().toLocalDate(),
                link(saved));
        logger.info("Swap request created: id={}, shift={}, requester={}, type={}",
                saved.getId(), shift.getId(), requester.getId(), body.type());
        return SwapRequestView.of(saved);
    }

    public SwapRequestView approve(Caller caller, Long requestId, Long replacementStaffId) {
        accessPolicy.requireManager(caller);
        Long shiftId = requestRepository.findShiftIdById(requestId)
                .orElseThrow(() -> new NotFoundException(ENTITY, requestId));
        Shift shift = shiftRepository.findByIdForUpdate(shiftId)
                .orElseThrow(() -> new NotFoundException("Shift", shiftId));
        SwapRequest request = load(caller, requestId);
        if (!request.isPending()) {
            throw new ConflictException("REQUEST_RESOLVED", "This request has already been " + request.getStatus().name().toLowerCase());
        }
        if (Boolean.TRUE.equals(shift.getArchived())) {
            throw new ConflictException("SHIFT_ARCHIVED", "The shift has been removed from the schedule");
        }
        Staff requester = request.getRequester();
        if (!shift.isAssignedTo(requester.getId())) {
            throw new ConflictException("SHIFT_CHANGED", "The shift is no longer assigned to the requester");
        }

        Staff replacement = null;
        if (request.getType().requiresReplacement()) {
            Long chosen = replacementStaffId != null ? replacementStaffId
                    : request.getProposedStaff() != null ? request.getProposedStaff().getId() : null;
            if (chosen == null) {
                throw new ValidationException("A replacement is required to approve a swap", "replacementStaffId", null);
            }
            replacement = colleague(caller, chosen, requester);
        }
        request.getType().resolve(shift, replacement);
        request.setReplacement(replacement);
        request.resolve(SwapRequest.SwapStatus.APPROVED, caller.staffId(), now());
        requestRepository.flush();

        auditTrail.record(caller, AuditAction.SWAP_REQUEST_APPROVED, ENTITY, requestId,
                replacement == null ? "shift released" : "reassigned to " + replacement.getId());
        notifier.toStaff(requester.getId(), NotificationType.REQUEST_APPROVED, "Request approved",
                "Your " + request.getType().name().toLowerCase() + " request for " + shift.getTitle() + " was approved",
                link(request));
        if (replacement != null) {
            notifier.toStaff(replacement.getId(), NotificationType.SHIFT_ASSIGNED, "New shift",
                    "You have been assigned " + shift.getTitle() + " on " + shift.getStartAt().toLocalDate(),
                    "/shifts/" + shift.getId());
        }
        logger.info("Swap request {} approved by {}, shift {} now {}", requestId, caller.staffId(),
                shift.getId(), shift.getStatus());
        return SwapRequestView.of(request);
    }

    public SwapRequestView reject(Caller caller, Long requestId, String comment) {
        accessPolicy.requireManager(caller);
        SwapRequest request = load(caller, requestId);
        if (!request.isPending()) {
            throw new ConflictException("REQUEST_RESOLVED", "This request has already been " + request.getStatus().name().toLowerCase());
        }
        request.setManagerComment(comment);
        request.resolve(SwapRequest.SwapStatus.REJECTED, caller.staffId(), now());
        auditTrail.record(caller, AuditAction.SWAP_REQUEST_REJECTED, ENTITY, requestId, comment);
        notifier.toStaff(request.getRequester().getId(), NotificationType.REQUEST_REJECTED, "Request rejected",
                "Your " + request.getType().name().toLowerCase() + " request for " + request.getShift().getTitle()
                        + " was rejected", link(request));
        logger.info("Swap request {} rejected by {}", requestId, caller.staffId());
        return SwapRequestView.of(request);
    }

    public SwapRequestView cancel(Caller caller, Long requestId) {
        SwapRequest request = load(caller, requestId);
        if (!request.getRequester().getId().equals(caller.staffId())) {
            throw new AuthorizationException("Only the requester can cancel this request");
        }
        if (!request.isPending()) {
            throw new ConflictException("REQUEST_RESOLVED", "This request has already been " + request.getStatus().name().toLowerCase());
        }
        request.resolve(SwapRequest.SwapStatus.CANCELLED, caller.staffId(), now());
        auditTrail.record(caller, AuditAction.SWAP_REQUEST_CANCELLED, ENTITY, requestId, null);
        logger.info("Swap request {} cancelled", requestId);
        return SwapRequestView.of(request);
    }

    @Transactional(readOnly = true)
    public List<SwapRequestView> list(Caller caller) {
        List<SwapRequest> requests = caller.isManager()
                ? requestRepository.findByOrganization(caller.organizationId())
                : requestRepository.findByRequester(caller.staffId());
        return requests.stream().map(SwapRequestView::of).toList();
    }

    private SwapRequest load(Caller caller, Long requestId) {
        SwapRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> new NotFoundException(ENTITY, requestId));
        accessPolicy.requireSameOrganization(caller, request.getOrganizationId(), ENTITY, requestId);
        return request;
    }

    private Staff colleague(Caller caller, Long staffId, Staff requester) {
        Staff staff = staffRepository.findById(staffId).orElseThrow(() -> new NotFoundException("Staff", staffId));
        accessPolicy.requireSameOrganization(caller, staff.getOrganizationId(), "Staff", staffId);
        if (staff.getId().equals(requester.getId())) {
            throw new ValidationException("The replacement must be someone other than the requester", "staffId", staffId);
        }
        if (!Boolean.TRUE.equals(staff.getActive())) {
            throw new ValidationException("Staff member is inactive", "staffId", staffId);
        }
        return staff;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static String link(SwapRequest request) {
        return "/swap-requests/" + request.getId();
    }

    public record SwapCreateRequest(Long shiftId, SwapType type, String message, Long proposedStaffId) {
    }
}
