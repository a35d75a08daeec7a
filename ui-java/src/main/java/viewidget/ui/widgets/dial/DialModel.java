package viewidget.ui.widgets.dial;

import java.math.BigDecimal;
import java.math.RoundingMode;

import viewidget.ui.widgets.support.ColorResolver;
import viewidget.ui.widgets.support.RgbColor;
import viewidget.ui.widgets.support.ViewidgetException;

/**
 * Live state of a dial: the value, where the needle points, and the readout text.
 */
public final class DialModel {

    private final DialGeometry geometry;

    private Double value;
    private double angle;
    private boolean outOfBounds;
    private double[][] needle;

    private RgbColor normalColor = ColorResolver.resolve("black");
    private RgbColor alertColor = ColorResolver.resolve("red");
    private int displayRoundTo = 1;

    public DialModel(DialGeometry geometry) {
        this.geometry = geometry;
        setValue(geometry.initialValue());
    }

    /**
     * Point the needle at {@code v}; {@code null} means the scale minimum.
     * @return false when the value is unchanged and nothing was recomputed
     */
    public boolean setValue(Double v) {
        double target = (v == null) ? geometry.min() : v;
        if (value != null && value == target) return false;
        value = target;

        double min = geometry.min();
        double max = geometry.max();
        double a = (target - min) * (geometry.end() - geometry.start()) / (max - min) + geometry.start();

        outOfBounds = false;
        if (geometry.isBound()) {
            boolean increasing = min < max;
            boolean belowStart = increasing ? target < min : target > min;
            boolean pastEnd = increasing ? target > max : target < max;
            if (belowStart) {
                a = geometry.start();
                outOfBounds = true;
            } else if (pastEnd) {
                a = geometry.end();
                outOfBounds = true;
            }
        }
        angle = a;
        needle = geometry.needleAt(a);
        return true;
    }

    public double getValue() { return value; }

    /** Needle angle in degrees, after bound clamping. */
    public double getAngle() { return angle; }

    public boolean isOutOfBounds() { return outOfBounds; }

    /** Rotated needle polygon: {xs, ys}. */
    public double[][] getNeedle() { return needle; }

    /** The value rounded half-to-even on its exact binary value; ties go to the even digit. */
    public String readoutText() {
        if (value.isNaN() || value.isInfinite()) return value.toString();
        if (displayRoundTo > 0) {
            return new BigDecimal(value).setScale(displayRoundTo, RoundingMode.HALF_EVEN).toPlainString();
        }
        return Long.toString((long) Math.rint(value));
    }

    public RgbColor readoutColor() {
        return outOfBounds ? alertColor : normalColor;
    }

    /** Readout colours for in-range and out-of-bounds values; {@code null} keeps the current one. */
    public void setDisplayColors(String normal, String alert) {
        if (normal != null) normalColor = ColorResolver.resolve(normal);
        if (alert != null) alertColor = ColorResolver.resolve(alert);
    }

    public RgbColor getNormalColor() { return normalColor; }
    public RgbColor getAlertColor() { return alertColor; }

    /** Decimal places on the readout; zero or less rounds to a whole number. */
    public void setDisplayRoundTo(int places) {
        if (places > 12) throw new ViewidgetException("Dial displayroundto must be 12 or fewer places");
        displayRoundTo = places;
    }

    public int getDisplayRoundTo() { return displayRoundTo; }

    public DialGeometry geometry() { return geometry; }
}
