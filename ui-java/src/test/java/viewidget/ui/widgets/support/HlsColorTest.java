package viewidget.ui.widgets.support;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class HlsColorTest {
    private static final double EPS = 1e-9;

    @Test
    void greyHasNoHueOrSaturation() {
        HlsColor hls = HlsColor.fromRgb(0.6, 0.6, 0.6);
        assertEquals(0.0, hls.h(), EPS);
        assertEquals(0.6, hls.l(), EPS);
        assertEquals(0.0, hls.s(), EPS);
    }

    @Test
    void primariesLandOnTheirHues() {
        HlsColor red = HlsColor.fromRgb(1, 0, 0);
        assertEquals(0.0, red.h(), EPS);
        assertEquals(0.5, red.l(), EPS);
        assertEquals(1.0, red.s(), EPS);

        assertEquals(1.0 / 3.0, HlsColor.fromRgb(0, 1, 0).h(), EPS);
        assertEquals(2.0 / 3.0, HlsColor.fromRgb(0, 0, 1).h(), EPS);
    }

    @Test
    void hueWrapsIntoUnitInterval() {
        // magenta: r == max, b > g gives a negative raw hue
        HlsColor magenta = HlsColor.fromRgb(1, 0, 1);
        assertEquals(5.0 / 6.0, magenta.h(), EPS);
    }

    @Test
    void darkeningRedKeepsHue() {
        RgbColor dim = new HlsColor(0, 0.125, 1).toRgb();
        assertEquals(new RgbColor(16384, 0, 0), dim);
    }

    @Test
    void lightColoursUseUpperHexcone() {
        HlsColor pink = HlsColor.fromRgb(1, 0.5, 0.5);
        assertEquals(0.75, pink.l(), EPS);
        assertEquals(1.0, pink.s(), EPS);
        RgbColor back = pink.toRgb();
        assertEquals(RgbColor.MAX, back.red());
        assertEquals(32768, back.green());
        assertEquals(32768, back.blue());
    }
}
