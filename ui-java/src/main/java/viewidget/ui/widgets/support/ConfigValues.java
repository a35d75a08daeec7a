package viewidget.ui.widgets.support;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed reads over a widget option map (as loaded from JSON or built in code).
 * Values may be numbers, booleans or strings; strings are parsed leniently.
 */
public final class ConfigValues {

    private final String widget;
    private final Map<String, Object> cfg;

    private ConfigValues(String widget, Map<String, Object> cfg) {
        this.widget = widget;
        this.cfg = cfg;
    }

    /**
     * Wrap {@code cfg}, rejecting any key outside {@code allowed}.
     * @throws ViewidgetException naming the first unknown keyword
     */
    public static ConfigValues strict(String widget, Map<String, Object> cfg, Set<String> allowed) {
        Map<String, Object> m = (cfg == null) ? Map.of() : cfg;
        for (String key : m.keySet()) {
            if (!allowed.contains(key)) {
                throw new ViewidgetException(widget + " init keyword \"" + key + "\" unknown");
            }
        }
        return new ConfigValues(widget, m);
    }

    public boolean has(String key) {
        return cfg.containsKey(key);
    }

    public Object raw(String key) {
        return cfg.get(key);
    }

    public double d(String key, double def) {
        Object o = cfg.get(key);
        if (o == null) return def;
        if (o instanceof Number n) return n.doubleValue();
        if (o instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ViewidgetException(widget + " " + key + " must be a number, got \"" + s + "\"", e);
            }
        }
        throw new ViewidgetException(widget + " " + key + " must be a number, got " + o.getClass().getSimpleName());
    }

    /** Nullable number; absent or JSON null reads as {@code null}. */
    public Double optD(String key) {
        return cfg.get(key) == null ? null : d(key, 0);
    }

    public String s(String key, String def) {
        Object o = cfg.get(key);
        return (o == null) ? def : Objects.toString(o);
    }

    public boolean b(String key, boolean def) {
        Object o = cfg.get(key);
        if (o == null) return def;
        if (o instanceof Boolean bool) return bool;
        if (o instanceof Number n) return n.doubleValue() != 0;
        if (o instanceof String s) return Boolean.parseBoolean(s.trim()) || "1".equals(s.trim());
        return def;
    }

    /** Integer value, or {@code null} when the value is present but not integral. */
    public Integer intOrNull(String key) {
        Object o = cfg.get(key);
        if (o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte) {
            return ((Number) o).intValue();
        }
        if (o instanceof String s) {
            String t = s.trim().toLowerCase();
            try {
                if (t.startsWith("0x")) return Integer.parseInt(t.substring(2), 16);
                if (t.startsWith("0b")) return Integer.parseInt(t.substring(2), 2);
                return Integer.parseInt(t);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
