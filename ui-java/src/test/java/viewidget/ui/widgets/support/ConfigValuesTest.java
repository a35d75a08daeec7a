package viewidget.ui.widgets.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

class ConfigValuesTest {

    @Test
    void rejectsUnknownKeywordByName() {
        ViewidgetException ex = assertThrows(ViewidgetException.class,
                () -> ConfigValues.strict("Dial", Map.of("sise", 10), Set.of("size")));
        assertEquals("Dial init keyword \"sise\" unknown", ex.getMessage());
    }

    @Test
    void nullMapReadsAsEmpty() {
        ConfigValues c = ConfigValues.strict("LED", null, Set.of("size"));
        assertFalse(c.has("size"));
        assertEquals(100, c.d("size", 100), 0);
    }

    @Test
    void readsNumbersFromNumbersAndStrings() {
        ConfigValues c = ConfigValues.strict("Dial", Map.of("a", 3, "b", " 2.5 "), Set.of("a", "b"));
        assertEquals(3.0, c.d("a", 0), 0);
        assertEquals(2.5, c.d("b", 0), 0);
    }

    @Test
    void nonNumericNumberIsAnError() {
        ConfigValues c = ConfigValues.strict("Dial", Map.of("size", "big"), Set.of("size"));
        assertThrows(ViewidgetException.class, () -> c.d("size", 0));
        ConfigValues l = ConfigValues.strict("Dial", Map.of("size", List.of(1)), Set.of("size"));
        assertThrows(ViewidgetException.class, () -> l.d("size", 0));
    }

    @Test
    void explicitNullIsAbsentForOptionalNumbers() {
        Map<String, Object> m = new HashMap<>();
        m.put("value", null);
        ConfigValues c = ConfigValues.strict("Dial", m, Set.of("value"));
        assertTrue(c.has("value"));
        assertNull(c.optD("value"));
    }

    @Test
    void integersAcceptHexAndBinaryStrings() {
        ConfigValues c = ConfigValues.strict("LED",
                Map.of("a", "0x7", "b", "0b101", "c", 6, "d", 2.5, "e", "x"),
                Set.of("a", "b", "c", "d", "e"));
        assertEquals(7, c.intOrNull("a"));
        assertEquals(5, c.intOrNull("b"));
        assertEquals(6, c.intOrNull("c"));
        assertNull(c.intOrNull("d"));
        assertNull(c.intOrNull("e"));
    }

    @Test
    void booleansAcceptCommonSpellings() {
        ConfigValues c = ConfigValues.strict("LED",
                Map.of("a", true, "b", "true", "c", 0, "d", "1"), Set.of("a", "b", "c", "d"));
        assertTrue(c.b("a", false));
        assertTrue(c.b("b", false));
        assertFalse(c.b("c", true));
        assertTrue(c.b("d", false));
    }
}
