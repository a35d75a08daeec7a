package viewidget.ui.widgets.led;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import viewidget.ui.widgets.support.ViewidgetException;

class LedOptionsTest {

    @Test
    void defaults() {
        LedOptions o = LedOptions.defaults();
        assertEquals(100, o.size());
        assertEquals(10, o.caseWidth());
        assertFalse(o.state());
        assertEquals("white", o.diodeColor());
        assertEquals("white", o.bulbColor());
        assertEquals(0b111, o.reflectStyle());
        assertEquals(0, o.fadeRate());
        assertEquals(0, o.blinkRate());
    }

    @Test
    void fromConfigReadsEveryKeyword() {
        Map<String, Object> cfg = new HashMap<>();
        cfg.put("size", 125);
        cfg.put("casewidth", 5);
        cfg.put("state", true);
        cfg.put("diodecolor", "yellow");
        cfg.put("bulbcolor", "green");
        cfg.put("reflectstyle", "0b011");
        cfg.put("faderate", 250.4);
        cfg.put("blinkrate", 1000);

        LedOptions o = LedOptions.fromConfig(cfg);
        assertEquals(125, o.size());
        assertEquals(5, o.caseWidth());
        assertTrue(o.state());
        assertEquals("yellow", o.diodeColor());
        assertEquals("green", o.bulbColor());
        assertEquals(3, o.reflectStyle());
        assertEquals(250, o.fadeRate());
        assertEquals(1000, o.blinkRate());
    }

    @Test
    void nonIntegerReflectStyleWarnsAndKeepsDefault() {
        LedOptions o = LedOptions.fromConfig(Map.<String, Object>of("reflectstyle", 2.5));
        assertEquals(0b111, o.reflectStyle());
        assertEquals(List.of("LED could not set reflectstyle: must be an integer"),
                LedGeometry.resolve(o).warnings());
    }

    @Test
    void unknownKeywordIsRejected() {
        ViewidgetException ex = assertThrows(ViewidgetException.class,
                () -> LedOptions.fromConfig(Map.<String, Object>of("colour", "red")));
        assertEquals("LED init keyword \"colour\" unknown", ex.getMessage());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(ViewidgetException.class, () -> LedOptions.defaults().size(0));
        assertThrows(ViewidgetException.class, () -> LedOptions.defaults().caseWidth(-1));
        assertThrows(ViewidgetException.class, () -> LedOptions.defaults().blinkRate(-1));
    }

    @Test
    void nullColourKeepsCurrent() {
        LedOptions o = LedOptions.defaults().bulbColor("red").bulbColor(null);
        assertEquals("red", o.bulbColor());
    }
}
