package viewidget.system;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import viewidget.ui.widgets.dial.DialOptions;
import viewidget.ui.widgets.digit.DigitOptions;
import viewidget.ui.widgets.led.LedOptions;
import viewidget.ui.widgets.support.ViewidgetException;

/**
 * WidgetConfigs
 *
 * Loads widget option maps from JSON. A config is a flat object whose keys are
 * the widget's option names, e.g. configs/widgets/dial_psi.json:
 *
 *   { "size": 275, "casewidth": 10, "min": 0, "max": 100, "value": 14.7, "unit": "psi" }
 *
 * Classpath paths MUST NOT include "resources/"; a leading "/" is accepted.
 */
public final class WidgetConfigs {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_OF_OBJECT =
            new TypeReference<Map<String, Object>>() { };

    /**
     * Read a JSON object from the classpath.
     * @throws ViewidgetException if the resource is missing or not a JSON object
     */
    public static Map<String, Object> fromClasspath(String resourcePath) {
        Objects.requireNonNull(resourcePath, "resourcePath");
        String norm = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;

        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = WidgetConfigs.class.getClassLoader();

        try (InputStream in = cl.getResourceAsStream(norm)) {
            if (in == null) {
                throw new ViewidgetException("Widget config not found on classpath: " + norm);
            }
            Map<String, Object> cfg = read(JSON.readValue(in, MAP_OF_OBJECT), norm);
            Logger.info("[Config] Loaded: " + norm);
            return cfg;
        } catch (IOException e) {
            throw new ViewidgetException("Failed to read widget config " + norm + ": " + e.getMessage(), e);
        }
    }

    /** Read a JSON object from a file. */
    public static Map<String, Object> fromFile(Path file) {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            Map<String, Object> cfg = read(JSON.readValue(in, MAP_OF_OBJECT), file.toString());
            Logger.info("[Config] Loaded: " + file);
            return cfg;
        } catch (IOException e) {
            throw new ViewidgetException("Failed to read widget config " + file + ": " + e.getMessage(), e);
        }
    }

    /** Parse a JSON object held in a string. */
    public static Map<String, Object> fromString(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return read(JSON.readValue(json, MAP_OF_OBJECT), "<string>");
        } catch (IOException e) {
            throw new ViewidgetException("Failed to parse widget config: " + e.getMessage(), e);
        }
    }

    public static DialOptions dialOptions(String resourcePath) {
        return DialOptions.fromConfig(fromClasspath(resourcePath));
    }

    public static LedOptions ledOptions(String resourcePath) {
        return LedOptions.fromConfig(fromClasspath(resourcePath));
    }

    public static DigitOptions digitOptions(String resourcePath) {
        return DigitOptions.fromConfig(fromClasspath(resourcePath));
    }

    private static Map<String, Object> read(Map<String, Object> parsed, String source) {
        if (parsed == null) {
            throw new ViewidgetException("Widget config is empty: " + source);
        }
        return Collections.unmodifiableMap(parsed);
    }

    private WidgetConfigs() {}
}
