package viewidget.ui.widgets.digit;

import java.util.Locale;

/**
 * Seven-segment masks for the hexadecimal glyphs 0-F.
 *
 * Bit n switches segment n:
 *   0 top, 1 bottom, 2 upper-left, 3 upper-right,
 *   4 lower-left, 5 lower-right, 6 middle
 */
public final class SegmentMasks {

    public static final int SEGMENT_COUNT = 7;
    public static final int ALL = 0b1111111;
    public static final int BLANK = 0;

    private static final int[] GLYPHS = {
        0b0111111, // 0
        0b0101000, // 1
        0b1011011, // 2
        0b1101011, // 3
        0b1101100, // 4
        0b1100111, // 5
        0b1110111, // 6
        0b0101001, // 7
        0b1111111, // 8
        0b1101111, // 9
        0b1111101, // A
        0b1110110, // b
        0b0010111, // C
        0b1111010, // d
        0b1010111, // E
        0b1010101, // F
    };

    /** Mask of glyph 0..15. */
    public static int mask(int glyph) {
        return GLYPHS[glyph];
    }

    /**
     * Glyph index (0..15) for a displayable value, or -1 if it has no glyph.
     * Accepts the integers 0-15 and the single characters 0-9, a-f, A-F.
     */
    public static int glyphOf(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long v = ((Number) value).longValue();
            return (v >= 0 && v < GLYPHS.length) ? (int) v : -1;
        }
        if (value instanceof Double || value instanceof Float) {
            double v = ((Number) value).doubleValue();
            return (v == Math.rint(v) && v >= 0 && v < GLYPHS.length) ? (int) v : -1;
        }
        if (value instanceof Character c) {
            return glyphOf(c.charValue());
        }
        if (value instanceof CharSequence s && s.length() == 1) {
            return glyphOf(s.charAt(0));
        }
        return -1;
    }

    private static int glyphOf(char c) {
        return (c < 128) ? Character.digit(c, 16) : -1;
    }

    /** Upper-case hex character for a glyph, e.g. 11 -> 'B'. */
    public static char charOf(int glyph) {
        return Character.toUpperCase(Character.forDigit(glyph, 16));
    }

    static String describe(int mask) {
        return String.format(Locale.ROOT, "0b%7s", Integer.toBinaryString(mask & ALL)).replace(' ', '0');
    }

    private SegmentMasks() {}
}
