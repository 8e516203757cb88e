package org.faculty.io.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.faculty.exception.InputValidationException;
import org.faculty.model.FacultyRecord;
import org.faculty.model.Vector;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed, validating view over one JSON request object.
 *
 * Expected faculty shape:
 * { "faculty_id": "f1", "name": "Ada", "department": "CS", "keywords": "graphs; logic", ... }
 *
 * Every accessor fails with {@link InputValidationException} on malformed data, so
 * command handlers only see well-formed typed values.
 */
public final class RequestReader {

    public static final String FACULTY_ID = "faculty_id";
    public static final String NAME = "name";
    public static final String DEPARTMENT = "department";
    public static final String KEYWORDS = "keywords";

    private static final Set<String> KNOWN_FACULTY_FIELDS = Set.of(FACULTY_ID, NAME, DEPARTMENT, KEYWORDS);

    private final JsonNode root;
    private final ObjectMapper mapper;

    public RequestReader(JsonNode root, ObjectMapper mapper) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = MissingNode.getInstance();
        } else if (!root.isObject()) {
            throw new InputValidationException("Request must be a JSON object");
        }
        this.root = root;
        this.mapper = mapper;
    }

    public boolean has(String field) {
        JsonNode n = root.path(field);
        return !n.isMissingNode() && !n.isNull();
    }

    public int optionalInt(String field, int defaultValue) {
        if (!has(field)) {
            return defaultValue;
        }
        JsonNode n = root.get(field);
        if (!n.isIntegralNumber() || !n.canConvertToInt()) {
            throw new InputValidationException("Field '" + field + "' must be an integer");
        }
        return n.intValue();
    }

    public double optionalDouble(String field, double defaultValue) {
        if (!has(field)) {
            return defaultValue;
        }
        JsonNode n = root.get(field);
        if (!n.isNumber()) {
            throw new InputValidationException("Field '" + field + "' must be a number");
        }
        return n.doubleValue();
    }

    /**
     * @return the strings of an array field; an absent field is an empty list
     */
    public List<String> texts(String field) {
        List<String> out = new ArrayList<>();
        int i = 0;
        for (JsonNode n : optionalArray(field)) {
            if (n.isNull()) {
                out.add(null);
            } else if (n.isTextual()) {
                out.add(n.textValue());
            } else {
                throw new InputValidationException("Field '" + field + "[" + i + "]' must be a string");
            }
            i++;
        }
        return out;
    }

    /**
     * @return the vector stored in a required field
     */
    public Vector vector(String field) {
        if (!has(field)) {
            throw new InputValidationException("Missing required field '" + field + "'");
        }
        return toVector(root.get(field), field);
    }

    /**
     * @return the vectors of an array field (absent = empty), all of one dimension
     */
    public List<Vector> vectors(String field) {
        List<Vector> out = new ArrayList<>();
        Integer dim = null;
        int i = 0;
        for (JsonNode n : optionalArray(field)) {
            Vector v = toVector(n, field + "[" + i + "]");
            if (dim == null) {
                dim = v.dim();
            } else if (v.dim() != dim) {
                throw new InputValidationException(
                        "Inconsistent vector dimension in '" + field + "': expected " + dim
                                + " but got " + v.dim() + " at index " + i
                );
            }
            out.add(v);
            i++;
        }
        return out;
    }

    /**
     * @return the faculty records of an array field; an absent field is an empty list
     */
    public List<FacultyRecord> facultyData(String field) {
        List<FacultyRecord> out = new ArrayList<>();
        int i = 0;
        for (JsonNode n : optionalArray(field)) {
            out.add(toFaculty(n, field + "[" + i + "]"));
            i++;
        }
        return out;
    }

    private Iterable<JsonNode> optionalArray(String field) {
        if (!has(field)) {
            return List.of();
        }
        JsonNode n = root.get(field);
        if (!n.isArray()) {
            throw new InputValidationException("Field '" + field + "' must be an array");
        }
        return n;
    }

    private FacultyRecord toFaculty(JsonNode n, String where) {
        if (!n.isObject()) {
            throw new InputValidationException("Expected an object at '" + where + "'");
        }

        String id = scalarText(n.path(FACULTY_ID));
        if (id == null || id.isBlank()) {
            throw new InputValidationException("Missing/blank '" + FACULTY_ID + "' at '" + where + "'");
        }
        String name = optionalText(n, NAME, where);
        if (name == null || name.isBlank()) {
            throw new InputValidationException("Missing/blank '" + NAME + "' for faculty " + id);
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = n.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            if (!KNOWN_FACULTY_FIELDS.contains(e.getKey())) {
                attributes.put(e.getKey(), mapper.convertValue(e.getValue(), Object.class));
            }
        }

        return new FacultyRecord(id, name, optionalText(n, DEPARTMENT, where), optionalText(n, KEYWORDS, where), attributes);
    }

    private static String optionalText(JsonNode object, String field, String where) {
        JsonNode n = object.path(field);
        if (n.isMissingNode() || n.isNull()) {
            return null;
        }
        if (!n.isTextual()) {
            throw new InputValidationException("Field '" + field + "' must be a string at '" + where + "'");
        }
        return n.textValue();
    }

    // ids may arrive as strings or numbers
    private static String scalarText(JsonNode n) {
        if (n.isTextual()) {
            return n.textValue();
        }
        if (n.isIntegralNumber()) {
            return n.asText();
        }
        return null;
    }

    private static Vector toVector(JsonNode n, String where) {
        if (n.getNodeType() != JsonNodeType.ARRAY) {
            throw new InputValidationException("'" + where + "' must be a JSON array of numbers");
        }
        if (n.isEmpty()) {
            throw new InputValidationException("Vector must not be empty at '" + where + "'");
        }
        double[] values = new double[n.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode c = n.get(i);
            if (!c.isNumber()) {
                throw new InputValidationException("Vector array must contain numbers only at '" + where + "'");
            }
            values[i] = c.doubleValue();
            if (!Double.isFinite(values[i])) {
                throw new InputValidationException("Vector contains a non-finite value at '" + where + "'");
            }
        }
        return new Vector(values);
    }
}
