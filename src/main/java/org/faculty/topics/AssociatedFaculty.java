package org.faculty.topics;

import org.faculty.model.FacultyRecord;

/**
 * Display entry of a faculty member whose keyword text mentions a topic.
 */
public record AssociatedFaculty(String facultyId, String name, String department) {

    public static AssociatedFaculty of(FacultyRecord record) {
        return new AssociatedFaculty(record.id(), record.name(), record.departmentOrUnknown());
    }
}
