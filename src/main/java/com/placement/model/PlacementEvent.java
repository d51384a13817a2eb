package com.placement.model;

import java.util.List;

/**
 * Change emitted for a downstream notifier when a company record is created
 * or gains new students.
 */
public record PlacementEvent(
    EventType type,
    String company,
    String recordId,
    List<Student> newlyAddedStudents,
    List<RolePackage> roles,
    int totalStudents,
    String emailSender,
    String timeSent
) {
    public enum EventType {
        NEW_OFFER,
        UPDATE_OFFER
    }
}
