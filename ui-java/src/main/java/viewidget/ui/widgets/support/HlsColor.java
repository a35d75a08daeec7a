package viewidget.ui.widgets.support;

/**
 * Hue / lightness / saturation triple, all components in [0, 1].
 * Conversions follow the classic double-hexcone model.
 */
public record HlsColor(double h, double l, double s) {

    private static final double ONE_THIRD = 1.0 / 3.0;
    private static final double ONE_SIXTH = 1.0 / 6.0;
    private static final double TWO_THIRD = 2.0 / 3.0;

    public static HlsColor fromRgb(double r, double g, double b) {
        double maxc = Math.max(r, Math.max(g, b));
        double minc = Math.min(r, Math.min(g, b));
        double sumc = maxc + minc;
        double rangec = maxc - minc;
        double l = sumc / 2.0;
        if (minc == maxc) {
            return new HlsColor(0.0, l, 0.0);
        }
        double s = (l <= 0.5) ? rangec / sumc : rangec / (2.0 - maxc - minc);
        double rc = (maxc - r) / rangec;
        double gc = (maxc - g) / rangec;
        double bc = (maxc - b) / rangec;
        double h;
        if (r == maxc) {
            h = bc - gc;
        } else if (g == maxc) {
            h = 2.0 + rc - bc;
        } else {
            h = 4.0 + gc - rc;
        }
        return new HlsColor(wrap(h / 6.0), l, s);
    }

    public static HlsColor fromRgb(RgbColor c) {
        return fromRgb(c.redFraction(), c.greenFraction(), c.blueFraction());
    }

    /** Same hue and saturation, new lightness. */
    public HlsColor withLightness(double lightness) {
        return new HlsColor(h, lightness, s);
    }

    public HlsColor withSaturation(double saturation) {
        return new HlsColor(h, l, saturation);
    }

    public RgbColor toRgb() {
        if (s == 0.0) {
            return RgbColor.ofFractions(l, l, l);
        }
        double m2 = (l <= 0.5) ? l * (1.0 + s) : l + s - (l * s);
        double m1 = 2.0 * l - m2;
        return RgbColor.ofFractions(
                channel(m1, m2, h + ONE_THIRD),
                channel(m1, m2, h),
                channel(m1, m2, h - ONE_THIRD));
    }

    private static double channel(double m1, double m2, double hue) {
        hue = wrap(hue);
        if (hue < ONE_SIXTH) return m1 + (m2 - m1) * hue * 6.0;
        if (hue < 0.5) return m2;
        if (hue < TWO_THIRD) return m1 + (m2 - m1) * (TWO_THIRD - hue) * 6.0;
        return m1;
    }

    private static double wrap(double v) {
        return v - Math.floor(v);
    }
}
