package viewidget.ui.widgets.digit;

import java.util.List;

import viewidget.ui.widgets.support.ColorResolver;
import viewidget.ui.widgets.support.RgbColor;
import viewidget.ui.widgets.support.WidgetWarnings;

/**
 * Which segments of a digit are lit, and in what colours.
 */
public final class DigitModel {

    private static final int UNSET = -1;

    // all segments lit until a valid value arrives, so a bad initial value shows "8"
    private int mask = SegmentMasks.ALL;
    private int glyph = 8;
    private RgbColor foreground;
    private RgbColor background;
    private final WidgetWarnings warnings = new WidgetWarnings("Digit");

    public DigitModel(DigitOptions options) {
        this.foreground = ColorResolver.resolve(options.foreground());
        this.background = ColorResolver.resolve(options.background());
        if (!setValue(options.value())) {
            warnings.warn("Digit cannot display initial value \"" + options.value() + "\"");
        }
    }

    /**
     * Show a glyph (0-15, or a single 0-9/A-F character); {@code null} blanks the digit.
     * @return false if the value has no glyph; the display is then left unchanged
     */
    public boolean setValue(Object value) {
        if (value == null) {
            mask = SegmentMasks.BLANK;
            glyph = UNSET;
            return true;
        }
        int g = SegmentMasks.glyphOf(value);
        if (g < 0) return false;
        mask = SegmentMasks.mask(g);
        glyph = g;
        return true;
    }

    /** Light segments directly; bit n drives segment n. */
    public void setMask(int mask) {
        this.mask = mask & SegmentMasks.ALL;
    }

    /** Change segment and/or background colour; {@code null} keeps the current one. */
    public void changeColor(String fg, String bg) {
        if (fg != null) foreground = ColorResolver.resolve(fg);
        if (bg != null) background = ColorResolver.resolve(bg);
    }

    public boolean isSegmentOn(int index) {
        return (mask & (1 << index)) != 0;
    }

    public int getMask() { return mask; }

    /** Displayed glyph 0..15, or {@code null} when blank. */
    public Integer getValue() { return glyph == UNSET ? null : glyph; }

    /** Non-fatal configuration warnings raised while building this digit. */
    public List<String> getWarnings() { return warnings.messages(); }

    public RgbColor getForeground() { return foreground; }

    /** Background fill; also the outline of every segment. */
    public RgbColor getBackground() { return background; }

    @Override
    public String toString() {
        return "DigitModel{value=" + (glyph == UNSET ? "blank" : String.valueOf(SegmentMasks.charOf(glyph)))
                + ", mask=" + SegmentMasks.describe(mask) + "}";
    }
}
