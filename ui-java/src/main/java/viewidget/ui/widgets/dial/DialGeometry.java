package viewidget.ui.widgets.dial;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import viewidget.ui.widgets.support.ViewidgetException;
import viewidget.ui.widgets.support.WidgetWarnings;

/**
 * Resolved, immutable layout of a dial: checked options plus every static shape
 * the dial face needs. Coordinates are canvas pixels with y pointing down; angles
 * are degrees counter-clockwise from the +x axis.
 */
public final class DialGeometry {

    /** One scale tick, from the inner radius outwards. */
    public record Tick(double x1, double y1, double x2, double y2, double lineWidth) {}

    /** A numbered scale label centred on (x, y). */
    public record Label(double x, double y, String text) {}

    // Guards int() truncation of step counts against binary fractions (e.g. 0.3 / 0.1).
    private static final double COUNT_EPSILON = 1e-9;

    private final double size;
    private final double caseWidth;
    private final double start;
    private final double extent;
    private final double min;
    private final double max;
    private final double majorScale;
    private final double semiMajorScale;
    private final double minorScale;
    private final int countDirection;
    private final boolean bound;
    private final boolean withDisplay;
    private final String unit;
    private final Double initialValue;

    private final int shadow3D;
    private final int light3D;
    private final double length;
    private final double center;
    private final double radius;
    private final double arcOffset;
    private final double pinRadius;

    private final List<Tick> minorTicks;
    private final List<Tick> semiMajorTicks;
    private final List<Tick> majorTicks;
    private final List<Label> labels;
    private final double[] needleX;
    private final double[] needleY;
    private final List<String> warnings;

    private DialGeometry(DialOptions o, WidgetWarnings warn) {
        this.start = o.start();
        this.extent = o.extent();
        this.min = o.min();
        this.max = o.max();
        this.majorScale = o.majorScale();
        this.unit = o.unit();
        this.withDisplay = o.withDisplay();
        this.initialValue = o.value();
        this.size = o.size();

        boolean fullCircle = Math.abs(extent) == 360;
        this.bound = (o.bound() != null) ? o.bound() : !fullCircle;

        if (min == max) {
            throw new ViewidgetException("Dial min cannot be equal to the max");
        } else if (min > max) {
            warn.warn("Dial min is greater than the max");
            this.countDirection = -1;
        } else {
            this.countDirection = 1;
        }

        double semi = o.semiMajorScale();
        if (semi != 0) {
            if (semi >= majorScale) {
                warn.warn("Dial semimajorscale greater than or equal to majorscale");
                semi = 0;
            } else if (majorScale % semi != 0) {
                warn.warn("Dial semimajorscale must be a factor of the majorscale");
                semi = 0;
            }
        }
        this.semiMajorScale = semi;
        this.minorScale = o.minorScale();

        double cw = o.caseWidth();
        if (cw != 0 && size / cw < 10) {
            warn.warn("Dial casewidth must be less than or equal to 1/10 the size");
            cw = size / 10;
        }
        this.caseWidth = cw;

        this.shadow3D = (int) Math.floor(Math.log10(2 * size));
        this.light3D = (int) Math.ceil(shadow3D / 2.0);
        this.length = size + caseWidth + shadow3D;
        this.center = (size + caseWidth) / 2;
        this.radius = (size - caseWidth) / 2;
        this.arcOffset = radius / 3;
        this.pinRadius = size / 25;

        double span = Math.abs(max - min);
        double inner = radius - arcOffset;

        this.minorTicks = minorScale != 0
                ? ticks(stepCount(span, minorScale) + 1, minorScale, span, inner, arcOffset / 5, 1)
                : List.of();
        this.semiMajorTicks = semiMajorScale != 0
                ? ticks(stepCount(span, semiMajorScale) + 1, semiMajorScale, span, inner, arcOffset / 3, 1)
                : List.of();

        // a full circle would draw the last major tick on top of the first
        int majorCount = stepCount(span, majorScale) + (fullCircle ? 0 : 1);
        this.majorTicks = ticks(majorCount, majorScale, span, inner, arcOffset / 3, 3);

        List<Label> lbl = new ArrayList<>(majorCount);
        double textRadius = radius - arcOffset / 2.5;
        for (int n = 0; n < majorCount; n++) {
            double a = Math.toRadians(start + n * extent * majorScale / span);
            double textValue = min + n * majorScale * countDirection;
            lbl.add(new Label(center + textRadius * Math.cos(a), center - textRadius * Math.sin(a),
                    formatScaleValue(textValue)));
        }
        this.labels = Collections.unmodifiableList(lbl);

        // needle rests pointing along +x (0 degrees)
        this.needleX = new double[] { center + 2.5 * arcOffset, center - arcOffset, center - arcOffset };
        this.needleY = new double[] { center, center + 0.75 * pinRadius, center - 0.75 * pinRadius };

        this.warnings = warn.messages();
    }

    /**
     * Check the cross-field rules and lay the dial out.
     * @throws ViewidgetException if min equals max
     */
    public static DialGeometry resolve(DialOptions options) {
        return new DialGeometry(options, new WidgetWarnings("Dial"));
    }

    private List<Tick> ticks(int count, double step, double span, double inner, double tickLength, double width) {
        List<Tick> out = new ArrayList<>(count);
        for (int n = 0; n < count; n++) {
            double a = Math.toRadians(start + n * extent * step / span);
            double cos = Math.cos(a);
            double sin = Math.sin(a);
            double x1 = center + inner * cos;
            double y1 = center - inner * sin;
            out.add(new Tick(x1, y1, x1 + tickLength * cos, y1 - tickLength * sin, width));
        }
        return Collections.unmodifiableList(out);
    }

    private static int stepCount(double span, double step) {
        return (int) Math.floor(span / step + COUNT_EPSILON);
    }

    /** Scale numbers print without a trailing ".0" when integral. */
    static String formatScaleValue(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    /** Needle polygon rotated about the centre to {@code angleDeg}: {xs, ys}. */
    public double[][] needleAt(double angleDeg) {
        double a = Math.toRadians(angleDeg);
        double cos = Math.cos(a);
        double sin = Math.sin(a);
        double[] xs = new double[needleX.length];
        double[] ys = new double[needleY.length];
        for (int i = 0; i < xs.length; i++) {
            double dx = needleX[i] - center;
            double dy = needleY[i] - center;
            // screen y points down, so a counter-clockwise turn is a negative rotation
            xs[i] = center + dx * cos + dy * sin;
            ys[i] = center + dy * cos - dx * sin;
        }
        return new double[][] { xs, ys };
    }

    // --- Accessors ---

    public double size() { return size; }
    public double caseWidth() { return caseWidth; }
    public double start() { return start; }
    public double extent() { return extent; }
    public double end() { return start + extent; }
    public double min() { return min; }
    public double max() { return max; }
    public double majorScale() { return majorScale; }
    public double semiMajorScale() { return semiMajorScale; }
    public double minorScale() { return minorScale; }
    public int countDirection() { return countDirection; }
    public boolean isBound() { return bound; }
    public boolean isFullCircle() { return Math.abs(extent) == 360; }
    public boolean withDisplay() { return withDisplay; }
    public String unit() { return unit; }
    public Double initialValue() { return initialValue; }

    public int shadow3D() { return shadow3D; }
    public int light3D() { return light3D; }
    /** Side of the square canvas. */
    public double length() { return length; }
    public double center() { return center; }
    public double radius() { return radius; }
    public double arcOffset() { return arcOffset; }
    public double pinRadius() { return pinRadius; }

    /** Bounding box of the scale arc: {x1, y1, x2, y2}. */
    public double[] scaleArcBounds() {
        double lo = arcOffset + caseWidth;
        double hi = size - arcOffset;
        return new double[] { lo, lo, hi, hi };
    }

    public double readoutX() { return center; }
    public double readoutY() { return center + arcOffset * 4 / 3; }
    public double scaleFontSize() { return Math.floor(arcOffset / 5); }
    public double displayFontSize() { return Math.floor(arcOffset / 3); }

    public List<Tick> minorTicks() { return minorTicks; }
    public List<Tick> semiMajorTicks() { return semiMajorTicks; }
    public List<Tick> majorTicks() { return majorTicks; }
    public List<Label> labels() { return labels; }
    public List<String> warnings() { return warnings; }
}
