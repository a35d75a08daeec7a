package viewidget.ui.widgets.support;

import javafx.scene.paint.Color;

/**
 * Colour with 16 bits per channel (0..65535), the resolution colours are blended at.
 */
public record RgbColor(int red, int green, int blue) {

    public static final int MAX = 0xFFFF;
    public static final RgbColor WHITE = new RgbColor(MAX, MAX, MAX);
    public static final RgbColor BLACK = new RgbColor(0, 0, 0);

    public RgbColor {
        if (red < 0 || red > MAX || green < 0 || green > MAX || blue < 0 || blue > MAX) {
            throw new ViewidgetException("RGB channel out of range: " + red + "," + green + "," + blue);
        }
    }

    /** Channels in [0, 1], rounded to the nearest 16-bit step. */
    public static RgbColor ofFractions(double r, double g, double b) {
        return new RgbColor(scale(r), scale(g), scale(b));
    }

    public static RgbColor of8Bit(int r, int g, int b) {
        // 0xAB -> 0xABAB, so 0xFF maps to full intensity
        return new RgbColor(r * 257, g * 257, b * 257);
    }

    public static RgbColor fromFx(Color c) {
        return ofFractions(c.getRed(), c.getGreen(), c.getBlue());
    }

    /** Channel-wise bitwise AND; a coloured bulb filters the diode behind it. */
    public RgbColor and(RgbColor other) {
        return new RgbColor(red & other.red, green & other.green, blue & other.blue);
    }

    public double redFraction() { return red / (double) MAX; }
    public double greenFraction() { return green / (double) MAX; }
    public double blueFraction() { return blue / (double) MAX; }

    public String toHex() {
        return String.format("#%04x%04x%04x", red, green, blue);
    }

    public Color toFx() {
        return Color.color(redFraction(), greenFraction(), blueFraction());
    }

    private static int scale(double fraction) {
        double clamped = Math.max(0.0, Math.min(1.0, fraction));
        return (int) Math.round(clamped * MAX);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
