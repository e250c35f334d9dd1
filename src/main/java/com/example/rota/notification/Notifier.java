package com.example.rota.notification;

import com.example.rota.staff.Staff;
import com.example.rota.staff.StaffRepository;
import com.example.rota.staff.StaffRole;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.EnumSet;

/**
 * Publishes notification events. {@link NotificationDispatcher} hands them to the sink once the
 * surrounding transaction commits, so a rolled-back transition notifies nobody.
 */
@Component
public class Notifier {

    private final ApplicationEventPublisher publisher;
    private final StaffRepository staffRepository;

    public Notifier(ApplicationEventPublisher publisher, StaffRepository staffRepository) {
        this.publisher = publisher;
        this.staffRepository = staffRepository;
    }

    public void toStaff(Long staffId, NotificationType type, String title, String message, String link) {
        publisher.publishEvent(new Notification(staffId, type, title, message, link));
    }

    public void toManagers(Long organizationId, NotificationType type, String title, String message, String link) {
        for (Staff manager : staffRepository.findByOrganizationIdAndRoleIn(organizationId,
                EnumSet.of(StaffRole.MANAGER, StaffRole.ADMIN))) {
            publisher.publishEvent(new Notification(manager.getId(), type, title, message, link));
        }
    }
}
