package viewidget.ui.widgets.support;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javafx.scene.paint.Color;

/**
 * Resolves colour specs to {@link RgbColor}.
 *
 * Accepted forms:
 *   #rgb, #rrggbb          : hex RGB
 *   #rrrrggggbbbb          : 16-bit-per-channel hex, as produced by {@link RgbColor#toHex()}
 *   gray0..gray100         : (or grey) percentage grey scale, e.g. "gray60"
 *   anything Color.web()   : CSS colour names, rgb(...), hsl(...)
 */
public final class ColorResolver {

    private static final Pattern HEX16 = Pattern.compile("#([0-9a-fA-F]{4})([0-9a-fA-F]{4})([0-9a-fA-F]{4})");
    private static final Pattern GRAY = Pattern.compile("gr[ae]y(\\d{1,3})");

    public static RgbColor resolve(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new ViewidgetException("Colour must not be empty");
        }
        String s = spec.trim();

        Matcher hex = HEX16.matcher(s);
        if (hex.matches()) {
            return new RgbColor(
                    Integer.parseInt(hex.group(1), 16),
                    Integer.parseInt(hex.group(2), 16),
                    Integer.parseInt(hex.group(3), 16));
        }

        Matcher gray = GRAY.matcher(s.toLowerCase(Locale.ROOT));
        if (gray.matches()) {
            int pct = Integer.parseInt(gray.group(1));
            if (pct > 100) {
                throw new ViewidgetException("Unknown colour name \"" + spec + "\"");
            }
            int v = (int) Math.round(pct * 255 / 100.0);
            return RgbColor.of8Bit(v, v, v);
        }

        try {
            return RgbColor.fromFx(Color.web(s));
        } catch (IllegalArgumentException e) {
            throw new ViewidgetException("Unknown colour name \"" + spec + "\"", e);
        }
    }

    public static Color resolveFx(String spec) {
        return resolve(spec).toFx();
    }

    private ColorResolver() {}
}
