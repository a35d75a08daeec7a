package viewidget.ui.widgets.led;

import viewidget.ui.widgets.support.HlsColor;
import viewidget.ui.widgets.support.RgbColor;

/**
 * Colours of an LED across its brightness range.
 *
 * Off: the bulb colour at 1/4 lightness, reflection at 1/2 lightness.
 * On:  diode AND bulb (the bulb filters the light), reflection white.
 * In between, {@link #shade(double)} ramps the lightness of the on colour from
 * 1/4 to full and the reflection from half its target lightness up to white.
 */
public final class LedPalette {

    private final RgbColor diode;
    private final RgbColor bulb;
    private final boolean monotone;
    private final boolean quadratic;

    private final HlsColor bulbHls;
    private final HlsColor onHls;
    private final LedAppearance off;
    private final LedAppearance on;

    public LedPalette(RgbColor diode, RgbColor bulb, boolean monotoneReflection, boolean quadraticReflection) {
        this.diode = diode;
        this.bulb = bulb;
        this.monotone = monotoneReflection;
        this.quadratic = quadraticReflection;

        this.bulbHls = HlsColor.fromRgb(bulb);
        RgbColor offLed = bulbHls.withLightness(0.25 * bulbHls.l()).toRgb();
        RgbColor offReflection = new HlsColor(bulbHls.h(), 0.5 * bulbHls.l(), monotone ? 0 : bulbHls.s()).toRgb();
        this.off = new LedAppearance(offLed, offReflection, 0);

        RgbColor onLed = diode.and(bulb);
        this.onHls = HlsColor.fromRgb(onLed);
        this.on = new LedAppearance(onLed, RgbColor.WHITE, 1);
    }

    public LedAppearance off() { return off; }

    public LedAppearance on() { return on; }

    /** Appearance for a partial brightness, 0 < level < 1. */
    public LedAppearance shade(double level) {
        double lum = onHls.l() * (0.75 * level + 0.25);
        if (lum < 0.2 * bulbHls.l()) {
            return new LedAppearance(off.led(), off.reflection(), level);
        }
        RgbColor led = onHls.withLightness(lum).toRgb();

        double sat = monotone ? 0 : onHls.s();
        double target = monotone ? bulbHls.l() : onHls.l();
        double ramp = quadratic ? level * level : level;
        double reflectLum = (1 - 0.5 * target) * ramp + 0.5 * target;
        RgbColor reflection = new HlsColor(onHls.h(), reflectLum, sat).toRgb();
        return new LedAppearance(led, reflection, level);
    }

    public RgbColor diode() { return diode; }
    public RgbColor bulb() { return bulb; }
    public boolean isMonotone() { return monotone; }
    public boolean isQuadratic() { return quadratic; }
}
