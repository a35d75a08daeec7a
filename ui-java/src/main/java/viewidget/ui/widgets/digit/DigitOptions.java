package viewidget.ui.widgets.digit;

import java.util.Map;
import java.util.Set;

import viewidget.ui.widgets.support.ConfigValues;
import viewidget.ui.widgets.support.ViewidgetException;

/**
 * Digit construction options.
 *
 * Config keys (all optional):
 *   size               : height, > 0, default 100 (width is 2/3 of it)
 *   value              : 0-15 or one of 0-9/A-F, null = blank, default 0
 *   background or bg   : default "black"
 *   foreground or fg   : default "red"
 */
public final class DigitOptions {

    static final Set<String> KEYS = Set.of("size", "value", "background", "bg", "foreground", "fg");

    private double size = 100;
    private Object value = 0;
    private String background = "black";
    private String foreground = "red";

    public static DigitOptions defaults() {
        return new DigitOptions();
    }

    /** Build options from a keyword map; unknown keys are an error. */
    public static DigitOptions fromConfig(Map<String, Object> cfg) {
        ConfigValues c = ConfigValues.strict("Digit", cfg, KEYS);
        DigitOptions o = new DigitOptions();
        if (c.has("size")) o.size(c.d("size", o.size));
        if (c.has("value")) o.value(c.raw("value"));
        if (c.has("background")) o.background(c.s("background", o.background));
        if (c.has("bg")) o.background(c.s("bg", o.background));
        if (c.has("foreground")) o.foreground(c.s("foreground", o.foreground));
        if (c.has("fg")) o.foreground(c.s("fg", o.foreground));
        return o;
    }

    public DigitOptions size(double size) {
        if (!(size > 0)) throw new ViewidgetException("Digit size must be greater than zero");
        this.size = size;
        return this;
    }

    /** Initial glyph; {@code null} starts blank, an undisplayable value leaves all segments lit. */
    public DigitOptions value(Object value) {
        this.value = value;
        return this;
    }

    public DigitOptions background(String color) {
        this.background = color;
        return this;
    }

    public DigitOptions foreground(String color) {
        this.foreground = color;
        return this;
    }

    public double size() { return size; }
    public Object value() { return value; }
    public String background() { return background; }
    public String foreground() { return foreground; }
}
