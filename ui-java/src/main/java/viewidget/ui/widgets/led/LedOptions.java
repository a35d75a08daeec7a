package viewidget.ui.widgets.led;

import java.util.Map;
import java.util.Set;

import viewidget.ui.widgets.support.ConfigValues;
import viewidget.ui.widgets.support.ViewidgetException;
import viewidget.ui.widgets.support.WidgetWarnings;

/**
 * LED construction options.
 *
 * Config keys (all optional):
 *   size         : > 0, default 100
 *   casewidth    : >= 0, default 10
 *   state        : boolean, default off
 *   diodecolor   : colour of the light, default "white"
 *   bulbcolor    : colour of the bulb that filters the light, default "white"
 *   reflectstyle : bit flags, default 0b111
 *                    0b001 reflection visible
 *                    0b010 reflection takes the bulb colour (else monotone)
 *                    0b100 quadratic reflection brightness (else linear)
 *   faderate     : ms to reach full brightness, >= 0, default 0
 *   blinkrate    : ms between on/off flips, >= 0, 0 = no blinking, default 0
 */
public final class LedOptions {

    public static final int REFLECT_VISIBLE = 0x1;
    public static final int REFLECT_COLORED = 0x2;
    public static final int REFLECT_QUADRATIC = 0x4;

    static final Set<String> KEYS = Set.of(
            "size", "casewidth", "state", "diodecolor", "bulbcolor",
            "reflectstyle", "faderate", "blinkrate");

    private double size = 100;
    private double caseWidth = 10;
    private boolean state = false;
    private String diodeColor = "white";
    private String bulbColor = "white";
    private int reflectStyle = REFLECT_VISIBLE | REFLECT_COLORED | REFLECT_QUADRATIC;
    private int fadeRate = 0;
    private int blinkRate = 0;

    private final WidgetWarnings warnings = new WidgetWarnings("LED");

    public static LedOptions defaults() {
        return new LedOptions();
    }

    /** Build options from a keyword map; unknown keys are an error. */
    public static LedOptions fromConfig(Map<String, Object> cfg) {
        ConfigValues c = ConfigValues.strict("LED", cfg, KEYS);
        LedOptions o = new LedOptions();
        if (c.has("size")) o.size(c.d("size", o.size));
        if (c.has("casewidth")) o.caseWidth(c.d("casewidth", o.caseWidth));
        if (c.has("state")) o.state(c.b("state", false));
        if (c.has("diodecolor")) o.diodeColor(c.s("diodecolor", null));
        if (c.has("bulbcolor")) o.bulbColor(c.s("bulbcolor", null));
        if (c.has("reflectstyle")) {
            Integer style = c.intOrNull("reflectstyle");
            if (style == null) {
                o.warnings.warn("LED could not set reflectstyle: must be an integer");
            } else {
                o.reflectStyle(style);
            }
        }
        if (c.has("faderate")) o.fadeRate(c.d("faderate", 0));
        if (c.has("blinkrate")) o.blinkRate(c.d("blinkrate", 0));
        return o;
    }

    // --- Fluent setters ---

    public LedOptions size(double size) {
        if (!(size > 0)) throw new ViewidgetException("LED size must be greater than zero");
        this.size = size;
        return this;
    }

    public LedOptions caseWidth(double caseWidth) {
        if (!(caseWidth >= 0)) throw new ViewidgetException("LED casewidth must be greater than or equal to zero");
        this.caseWidth = caseWidth;
        return this;
    }

    public LedOptions state(boolean on) {
        this.state = on;
        return this;
    }

    /** {@code null} keeps the current colour. */
    public LedOptions diodeColor(String color) {
        if (color != null) this.diodeColor = color;
        return this;
    }

    /** {@code null} keeps the current colour. */
    public LedOptions bulbColor(String color) {
        if (color != null) this.bulbColor = color;
        return this;
    }

    public LedOptions reflectStyle(int flags) {
        this.reflectStyle = flags;
        return this;
    }

    public LedOptions fadeRate(double millis) {
        this.fadeRate = LedDriver.checkRate("faderate", millis);
        return this;
    }

    public LedOptions blinkRate(double millis) {
        this.blinkRate = LedDriver.checkRate("blinkrate", millis);
        return this;
    }

    // --- Getters ---

    public double size() { return size; }
    public double caseWidth() { return caseWidth; }
    public boolean state() { return state; }
    public String diodeColor() { return diodeColor; }
    public String bulbColor() { return bulbColor; }
    public int reflectStyle() { return reflectStyle; }
    public int fadeRate() { return fadeRate; }
    public int blinkRate() { return blinkRate; }

    WidgetWarnings warnings() { return warnings; }
}
