package org.faculty.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable faculty member as supplied by the caller.
 * <p>
 * id and name are required; department and keywords are optional.
 * Any other fields of the input object (title, school, ...) are kept as
 * pass-through attributes so they can be echoed back in results.
 */
public final class FacultyRecord {

    public static final String UNKNOWN_DEPARTMENT = "Unknown";

    private final String id;
    private final String name;
    private final String department;
    private final String keywords;
    private final Map<String, Object> attributes;

    public FacultyRecord(String id, String name, String department, String keywords, Map<String, Object> attributes) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be non-empty");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must be non-empty for faculty " + id);
        }
        this.id = id;
        this.name = name;
        this.department = department;
        this.keywords = keywords;
        // Insertion order is kept so echoed objects look like the input
        this.attributes = (attributes == null || attributes.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public FacultyRecord(String id, String name, String department, String keywords) {
        this(id, name, department, keywords, Map.of());
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Optional<String> department() {
        return Optional.ofNullable(department);
    }

    public String departmentOrUnknown() {
        return department != null ? department : UNKNOWN_DEPARTMENT;
    }

    public Optional<String> keywords() {
        return Optional.ofNullable(keywords);
    }

    /**
     * @return true if the keyword text is present and non-empty.
     */
    public boolean hasKeywords() {
        return keywords != null && !keywords.isEmpty();
    }

    /** Extra input fields, unmodifiable and in input order. */
    public Map<String, Object> attributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FacultyRecord other)) return false;
        return id.equals(other.id)
                && name.equals(other.name)
                && Objects.equals(department, other.department)
                && Objects.equals(keywords, other.keywords)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, department, keywords, attributes);
    }

    @Override
    public String toString() {
        return "FacultyRecord(" + id + ", " + name + ")";
    }
}
