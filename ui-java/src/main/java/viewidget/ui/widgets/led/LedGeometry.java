package viewidget.ui.widgets.led;

import java.util.List;

import viewidget.ui.widgets.support.WidgetWarnings;

/**
 * Resolved layout of an LED: case, bulb and reflection arc on a square canvas.
 */
public final class LedGeometry {

    private final double size;
    private final double caseWidth;
    private final int shadow3D;
    private final int light3D;
    private final double length;
    private final boolean reflectionVisible;
    private final boolean monotoneReflection;
    private final boolean quadraticReflection;
    private final List<String> warnings;

    private LedGeometry(LedOptions o, WidgetWarnings warn) {
        this.size = o.size();
        int style = o.reflectStyle();
        this.reflectionVisible = (style & LedOptions.REFLECT_VISIBLE) != 0;
        this.monotoneReflection = (style & LedOptions.REFLECT_COLORED) == 0;
        this.quadraticReflection = (style & LedOptions.REFLECT_QUADRATIC) != 0;

        double cw = o.caseWidth();
        if (cw != 0 && size / cw < 10) {
            warn.warn("LED casewidth must be less than or equal to 1/10 the size");
            cw = size / 10;
        }
        this.caseWidth = cw;

        this.shadow3D = (int) Math.floor(Math.log10(2 * size));
        this.light3D = (int) Math.ceil(shadow3D / 2.0);
        this.length = size + caseWidth + shadow3D;
        this.warnings = warn.messages();
    }

    public static LedGeometry resolve(LedOptions options) {
        WidgetWarnings warn = new WidgetWarnings("LED");
        warn.carry(options.warnings().messages());
        return new LedGeometry(options, warn);
    }

    public double size() { return size; }
    public double caseWidth() { return caseWidth; }
    public int shadow3D() { return shadow3D; }
    public int light3D() { return light3D; }
    /** Side of the square canvas. */
    public double length() { return length; }

    /** Diameter of the bulb (and of the case ovals behind it). */
    public double bulbDiameter() { return size - caseWidth; }

    /** Bounding box of the reflection arc: {x1, y1, x2, y2}. */
    public double[] reflectionBounds() {
        double offset = (size - caseWidth) / 6;
        double p1 = offset + caseWidth;
        double p2 = size - offset;
        return new double[] { p1, p1, p2, p2 };
    }

    public double reflectionWidth() { return (size - caseWidth) / 20; }

    public boolean isReflectionVisible() { return reflectionVisible; }
    public boolean isMonotoneReflection() { return monotoneReflection; }
    public boolean isQuadraticReflection() { return quadraticReflection; }

    public List<String> warnings() { return warnings; }
}
