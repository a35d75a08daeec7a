package viewidget.ui.widgets.dial;

import java.util.Map;
import java.util.Set;

import viewidget.ui.widgets.support.ConfigValues;
import viewidget.ui.widgets.support.ViewidgetException;

/**
 * Dial construction options.
 *
 * Config keys (all optional):
 *   size           : > 0, default 300
 *   casewidth      : >= 0, default 15
 *   start          : degrees from +x axis, |start| < 360, default 225
 *   extent         : degrees, |extent| <= 360, default -270 (a full turn disables bound)
 *   min / max      : scale end values, default 60 / 220
 *   majorscale     : > 0, numbered long ticks, default 20
 *   semimajorscale : >= 0, unnumbered long ticks, 0 disables, default 10
 *   minorscale     : >= 0, short ticks, 0 disables, default 2
 *   unit           : string, "deg" becomes a degree sign
 *   bound          : hard stops at min/max, default true
 *   withdisplay    : numeric readout, default true
 *   value          : initial value, default min
 *
 * Single-field rules are checked by the setters; cross-field rules by
 * {@link DialGeometry#resolve(DialOptions)}.
 */
public final class DialOptions {

    public static final String DEGREE = "°";

    static final Set<String> KEYS = Set.of(
            "size", "casewidth", "start", "extent", "min", "max",
            "majorscale", "semimajorscale", "minorscale",
            "unit", "bound", "withdisplay", "value");

    private double size = 300;
    private double caseWidth = 15;
    private double start = 225;
    private double extent = -270;
    private double min = 60;
    private double max = 220;
    private double majorScale = 20;
    private double semiMajorScale = 10;
    private double minorScale = 2;
    private String unit;
    private Boolean bound;
    private boolean withDisplay = true;
    private Double value;

    public static DialOptions defaults() {
        return new DialOptions();
    }

    /** Build options from a keyword map; unknown keys are an error. */
    public static DialOptions fromConfig(Map<String, Object> cfg) {
        ConfigValues c = ConfigValues.strict("Dial", cfg, KEYS);
        DialOptions o = new DialOptions();
        if (c.has("size")) o.size(c.d("size", o.size));
        if (c.has("casewidth")) o.caseWidth(c.d("casewidth", o.caseWidth));
        if (c.has("start")) o.start(c.d("start", o.start));
        if (c.has("extent")) o.extent(c.d("extent", o.extent));
        if (c.has("min")) o.min(c.d("min", o.min));
        if (c.has("max")) o.max(c.d("max", o.max));
        if (c.has("majorscale")) o.majorScale(c.d("majorscale", o.majorScale));
        if (c.has("semimajorscale")) o.semiMajorScale(c.d("semimajorscale", o.semiMajorScale));
        if (c.has("minorscale")) o.minorScale(c.d("minorscale", o.minorScale));
        if (c.has("unit")) o.unit(c.s("unit", null));
        if (c.has("bound")) o.bound(c.raw("bound") == null ? null : c.b("bound", true));
        if (c.has("withdisplay")) o.withDisplay(c.b("withdisplay", true));
        if (c.has("value")) o.value(c.optD("value"));
        return o;
    }

    // --- Fluent setters ---

    public DialOptions size(double size) {
        if (!(size > 0)) throw new ViewidgetException("Dial size must be greater than zero");
        this.size = size;
        return this;
    }

    public DialOptions caseWidth(double caseWidth) {
        if (!(caseWidth >= 0)) throw new ViewidgetException("Dial casewidth must be greater than or equal to zero");
        this.caseWidth = caseWidth;
        return this;
    }

    public DialOptions start(double start) {
        if (!(Math.abs(start) < 360)) {
            throw new ViewidgetException("Dial start angle must be smaller than +/-360 degrees");
        }
        this.start = start;
        return this;
    }

    public DialOptions extent(double extent) {
        if (!(Math.abs(extent) <= 360)) {
            throw new ViewidgetException("Dial extent angle must be smaller than or equal to +/-360 degrees");
        }
        this.extent = extent;
        return this;
    }

    public DialOptions min(double min) {
        this.min = min;
        return this;
    }

    public DialOptions max(double max) {
        this.max = max;
        return this;
    }

    public DialOptions majorScale(double step) {
        if (!(step > 0)) throw new ViewidgetException("Dial majorscale must be greater than zero");
        this.majorScale = step;
        return this;
    }

    public DialOptions semiMajorScale(double step) {
        if (!(step >= 0)) throw new ViewidgetException("Dial semimajorscale must be greater than or equal to zero");
        this.semiMajorScale = step;
        return this;
    }

    public DialOptions minorScale(double step) {
        if (!(step >= 0)) throw new ViewidgetException("Dial minorscale must be greater than or equal to zero");
        this.minorScale = step;
        return this;
    }

    public DialOptions unit(String unit) {
        this.unit = (unit == null) ? null : unit.replace("deg", DEGREE);
        return this;
    }

    /** {@code null} restores the default (bound unless the dial is a full circle). */
    public DialOptions bound(Boolean bound) {
        this.bound = bound;
        return this;
    }

    public DialOptions withDisplay(boolean withDisplay) {
        this.withDisplay = withDisplay;
        return this;
    }

    /** {@code null} starts the needle at min. */
    public DialOptions value(Double value) {
        this.value = value;
        return this;
    }

    // --- Getters ---

    public double size() { return size; }
    public double caseWidth() { return caseWidth; }
    public double start() { return start; }
    public double extent() { return extent; }
    public double min() { return min; }
    public double max() { return max; }
    public double majorScale() { return majorScale; }
    public double semiMajorScale() { return semiMajorScale; }
    public double minorScale() { return minorScale; }
    public String unit() { return unit; }
    public Boolean bound() { return bound; }
    public boolean withDisplay() { return withDisplay; }
    public Double value() { return value; }
}
