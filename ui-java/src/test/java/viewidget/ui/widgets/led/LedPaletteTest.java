package viewidget.ui.widgets.led;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;
import viewidget.ui.widgets.support.ColorResolver;
import viewidget.ui.widgets.support.RgbColor;

class LedPaletteTest {

    private static RgbColor grey(int v) {
        return new RgbColor(v, v, v);
    }

    @Test
    void whiteLedOffIsQuarterLightBulb() {
        LedPalette p = new LedPalette(RgbColor.WHITE, RgbColor.WHITE, true, true);
        assertEquals(grey(16384), p.off().led());
        assertEquals(grey(32768), p.off().reflection());
        assertEquals(0, p.off().brightness(), 0);
    }

    @Test
    void onColourIsDiodeFilteredByBulb() {
        RgbColor yellow = ColorResolver.resolve("#ffffffff0000");
        RgbColor cyan = ColorResolver.resolve("#0000ffffffff");
        LedPalette p = new LedPalette(yellow, cyan, false, true);
        assertEquals(new RgbColor(0, 65535, 0), p.on().led());
        assertEquals(RgbColor.WHITE, p.on().reflection());
        assertEquals(1, p.on().brightness(), 0);
    }

    @Test
    void halfBrightnessQuadraticReflection() {
        LedPalette p = new LedPalette(RgbColor.WHITE, RgbColor.WHITE, true, true);
        LedAppearance a = p.shade(0.5);
        assertEquals(grey(40959), a.led());
        assertEquals(grey(40959), a.reflection());
        assertEquals(0.5, a.brightness(), 0);
    }

    @Test
    void halfBrightnessLinearReflection() {
        LedPalette p = new LedPalette(RgbColor.WHITE, RgbColor.WHITE, true, false);
        LedAppearance a = p.shade(0.5);
        assertEquals(grey(40959), a.led());
        assertEquals(grey(49151), a.reflection());
    }

    @Test
    void dimDarkLightFallsBackToOffColours() {
        RgbColor red = ColorResolver.resolve("#ffff00000000");
        LedPalette p = new LedPalette(red, RgbColor.WHITE, true, true);

        LedAppearance dim = p.shade(0.1);
        assertSame(p.off().led(), dim.led());
        assertSame(p.off().reflection(), dim.reflection());
        assertEquals(0.1, dim.brightness(), 0);

        LedAppearance lit = p.shade(0.6);
        assertEquals(0, lit.led().green());
        assertEquals(0, lit.led().blue());
    }

    @Test
    void colouredReflectionKeepsHue() {
        RgbColor red = ColorResolver.resolve("#ffff00000000");
        LedPalette p = new LedPalette(red, red, false, false);
        RgbColor r = p.shade(0.5).reflection();
        assertEquals(65535, r.red());
        assertEquals(r.green(), r.blue());
    }
}
