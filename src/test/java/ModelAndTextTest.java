import org.faculty.model.FacultyRecord;
import org.faculty.model.Vector;
import org.faculty.text.TextNormalizer;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for:
 * - Vector
 * - FacultyRecord
 * - TextNormalizer
 */
public class ModelAndTextTest {

    // ----------------------------
    // Vector
    // ----------------------------
    @Nested
    class VectorTests {

        @Test
        void constructor_rejectsNullAndEmpty() {
            assertThrows(IllegalArgumentException.class, () -> new Vector(null));
            assertThrows(IllegalArgumentException.class, () -> new Vector(new double[0]));
        }

        @Test
        void isImmutable_againstSourceAndCopies() {
            double[] raw = {1.0, 2.0};
            Vector v = new Vector(raw);
            raw[0] = 99.0;
            v.toArrayCopy()[1] = 99.0;

            assertEquals(1.0, v.get(0), 0.0);
            assertEquals(2.0, v.get(1), 0.0);
        }

        @Test
        void dotAndNorm() {
            Vector a = Vector.of(3, 4);
            assertEquals(5.0, a.norm(), 1e-12);
            assertEquals(11.0, a.dot(Vector.of(1, 2)), 1e-12);
            assertThrows(IllegalArgumentException.class, () -> a.dot(Vector.of(1, 2, 3)));
        }

        @Test
        void maxAbs_andScaledBy() {
            assertEquals(0.0, Vector.of(0, 0).maxAbs(), 0.0);
            assertEquals(1e-300, Vector.of(0, -1e-300).maxAbs(), 0.0);
            assertEquals(Vector.of(0.5, -1), Vector.of(2, -4).scaledBy(4));
        }

        @Test
        void get_outOfRange_throws() {
            assertThrows(IndexOutOfBoundsException.class, () -> Vector.of(1).get(1));
        }

        @Test
        void toMatrix_copiesRows_andRejectsMixedDimensions() {
            double[][] m = Vector.toMatrix(List.of(Vector.of(1, 2), Vector.of(3, 4)));
            assertArrayEquals(new double[]{3, 4}, m[1], 0.0);

            assertThrows(IllegalArgumentException.class,
                    () -> Vector.toMatrix(List.of(Vector.of(1, 2), Vector.of(3))));
            assertThrows(IllegalArgumentException.class, () -> Vector.toMatrix(List.of()));
        }

        @Test
        void equalsHashCode_byValue() {
            assertEquals(Vector.of(1, 2), Vector.of(1, 2));
            assertEquals(Vector.of(1, 2).hashCode(), Vector.of(1, 2).hashCode());
            assertNotEquals(Vector.of(1, 2), Vector.of(2, 1));
        }
    }

    // ----------------------------
    // FacultyRecord
    // ----------------------------
    @Nested
    class FacultyTests {

        @Test
        void requiredFields_areValidated() {
            assertThrows(IllegalArgumentException.class, () -> new FacultyRecord(" ", "Ada", null, null));
            assertThrows(IllegalArgumentException.class, () -> new FacultyRecord("f1", null, null, null));
        }

        @Test
        void optionalFields_andDepartmentDefault() {
            FacultyRecord r = new FacultyRecord("f1", "Ada", null, null);
            assertTrue(r.department().isEmpty());
            assertEquals("Unknown", r.departmentOrUnknown());
            assertFalse(r.hasKeywords());

            FacultyRecord withKeywords = new FacultyRecord("f2", "Alan", "Math", "");
            assertEquals("Math", withKeywords.departmentOrUnknown());
            assertFalse(withKeywords.hasKeywords(), "empty keyword text counts as absent");
        }

        @Test
        void attributes_areCopiedAndUnmodifiable() {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put("title", "Professor");
            FacultyRecord r = new FacultyRecord("f1", "Ada", null, null, attrs);
            attrs.put("school", "Engineering");

            assertEquals(Map.of("title", "Professor"), r.attributes());
            assertThrows(UnsupportedOperationException.class, () -> r.attributes().put("x", 1));
        }
    }

    // ----------------------------
    // TextNormalizer
    // ----------------------------
    @Nested
    class TextNormalizerTests {

        private final TextNormalizer normalizer = new TextNormalizer();

        @Test
        void nullAndEmpty_becomeEmpty() {
            assertEquals("", normalizer.normalize(null));
            assertEquals("", normalizer.normalize(""));
            assertEquals("", normalizer.normalize(" \r\n\t "));
        }

        @Test
        void collapsesWhitespace_andReplacesSemicolons() {
            String raw = "  machine learning;\r\n data   mining;\tgraphs \n";
            assertEquals("machine learning, data mining, graphs", normalizer.normalize(raw));
        }

        @Test
        void isIdempotent() {
            String once = normalizer.normalize(" a ;b\n\nc ;; d ");
            assertEquals(once, normalizer.normalize(once));
        }
    }
}
