import com.pascals.compiler.semantic.ArrayTypeInfo;
import com.pascals.compiler.semantic.RecordTypeInfo;
import com.pascals.compiler.semantic.Type;
import com.pascals.compiler.semantic.TypeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PascalsTypeTest {

    private static Type arrayOf(Type element, long low, long high) {
        return Type.array(new ArrayTypeInfo(Type.INTEGER, element, low, high, element.size(), 0));
    }

    private static Type point() {
        return Type.record(new RecordTypeInfo(List.of(
            new RecordTypeInfo.Field("x", Type.INTEGER, 0),
            new RecordTypeInfo.Field("y", Type.INTEGER, 1))));
    }

    @Test
    void integer_widens_to_real_only() {
        assertTrue(Type.REAL.compatibleWith(Type.INTEGER));
        assertFalse(Type.INTEGER.compatibleWith(Type.REAL));
        assertTrue(Type.INTEGER.compatibleWith(Type.INTEGER));
    }

    @Test
    void char_and_string_are_distinct() {
        assertFalse(Type.CHAR.compatibleWith(Type.STRING));
        assertFalse(Type.STRING.compatibleWith(Type.CHAR));
        assertFalse(Type.BOOLEAN.compatibleWith(Type.INTEGER));
    }

    @Test
    void arrays_compare_by_element_type() {
        Type ints = arrayOf(Type.INTEGER, 1, 10);
        Type otherInts = arrayOf(Type.INTEGER, 0, 3);
        Type reals = arrayOf(Type.REAL, 1, 10);

        assertTrue(ints.compatibleWith(otherInts));
        assertFalse(reals.compatibleWith(ints));
        assertFalse(ints.compatibleWith(reals));
        assertFalse(ints.compatibleWith(Type.INTEGER));
    }

    @Test
    void records_compare_by_declaration() {
        Type a = point();
        Type b = point();
        assertTrue(a.compatibleWith(a));
        assertTrue(a.compatibleWith(Type.record(a.getRecordInfo())));
        assertFalse(a.compatibleWith(b));
    }

    @Test
    void sizes_follow_layout() {
        assertEquals(1, Type.CHAR.size());
        Type rec = point();
        assertEquals(2, rec.size());
        assertEquals(1, rec.getRecordInfo().field("Y").offset);
        assertNull(rec.getRecordInfo().field("z"));

        Type recs = Type.array(new ArrayTypeInfo(Type.INTEGER, rec, 1, 5, rec.size(), 0));
        assertEquals(10, recs.size());
    }

    @Test
    void classification() {
        assertTrue(Type.CHAR.isOrdinal());
        assertTrue(Type.BOOLEAN.isOrdinal());
        assertFalse(Type.REAL.isOrdinal());
        assertFalse(Type.STRING.isOrdinal());
        assertTrue(Type.REAL.isNumeric());
        assertFalse(Type.CHAR.isNumeric());
        assertTrue(Type.INTEGER.isSimple());
        assertEquals(TypeKind.ARRAY, arrayOf(Type.CHAR, 0, 1).getKind());
    }

    @Test
    void readable_names() {
        assertEquals("integer", Type.INTEGER.toString());
        assertEquals("array of char", arrayOf(Type.CHAR, 0, 1).toString());
        assertEquals("record", point().toString());
    }
}
