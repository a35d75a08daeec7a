package viewidget.ui.widgets.led;

import java.util.List;
import java.util.Map;

import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.layout.Region;
import javafx.scene.paint.Color;
import javafx.scene.shape.ArcType;
import javafx.scene.shape.StrokeLineCap;
import viewidget.system.Logger;
import viewidget.ui.widgets.support.ColorResolver;
import viewidget.ui.widgets.support.FxWidgetTimer;
import viewidget.ui.widgets.support.WidgetTimer;

/**
 * Indicator lamp with a case, a coloured bulb and a glint of reflection.
 * It can be turned on or off, blink, fade (warm up / cool down), dim, and change colour.
 *
 * Construction options are listed on {@link LedOptions}. Operations:
 *   turn(state) / turnOn() / turnOff() / toggle()
 *   changeColor(diode, bulb)
 *   setBrightness(level)   : 0..1
 *   setBlinkRate(ms)       : 0 stops blinking
 *   setFadeRate(ms)        : 0 switches instantly
 *
 * Example:
 *   new Led(LedOptions.defaults().size(125).bulbColor("green").state(Led.ON))
 */
public class Led extends Region {

    public static final boolean ON = true;
    public static final boolean OFF = false;

    private static final Color LIGHT = Color.WHITE;
    private static final Color SHADOW = ColorResolver.resolveFx("gray5");
    private static final Color CASE = ColorResolver.resolveFx("gray60");

    private final LedGeometry geometry;
    private final Canvas canvas;
    private final LedDriver driver;

    public Led() {
        this(LedOptions.defaults());
    }

    /** Build from a keyword map (e.g. loaded from JSON); unknown keys are rejected. */
    public Led(Map<String, Object> cfg) {
        this(LedOptions.fromConfig(cfg));
    }

    public Led(LedOptions options) {
        this(options, FxWidgetTimer.INSTANCE);
    }

    public Led(LedOptions options, WidgetTimer timer) {
        this.geometry = LedGeometry.resolve(options);
        this.canvas = new Canvas(geometry.length(), geometry.length());
        getChildren().add(canvas);
        setPrefSize(geometry.length(), geometry.length());
        setMinSize(USE_PREF_SIZE, USE_PREF_SIZE);
        setMaxSize(USE_PREF_SIZE, USE_PREF_SIZE);

        this.driver = new LedDriver(options, geometry, timer, a -> draw());
        draw();
        Logger.debug("[LED] built size=" + geometry.size() + " diode=" + driver.getDiodeColor()
                + " bulb=" + driver.getBulbColor());
    }

    // --- Operations ---

    public void turn(boolean state) { driver.turn(state); }
    public void turnOn() { driver.turnOn(); }
    public void turnOff() { driver.turnOff(); }
    public void toggle() { driver.toggle(); }

    /** {@code null} keeps the current colour. */
    public void changeColor(String diodeColor, String bulbColor) { driver.changeColor(diodeColor, bulbColor); }

    public void setBrightness(double level) { driver.setBrightness(level); }
    public void setBlinkRate(double millis) { driver.setBlinkRate(millis); }
    public void setFadeRate(double millis) { driver.setFadeRate(millis); }
    public void blink() { driver.blink(); }
    public void blinkCancel() { driver.blinkCancel(); }
    public void fade(boolean state) { driver.fade(state); }

    public boolean isOn() { return driver.isOn(); }
    public boolean isBlinking() { return driver.isBlinking(); }
    public double getBrightness() { return driver.getBrightness(); }

    public LedDriver getDriver() { return driver; }
    public LedGeometry getGeometry() { return geometry; }

    /** Non-fatal configuration warnings raised while building this LED. */
    public List<String> getWarnings() { return geometry.warnings(); }

    // --- Layout handling ---

    @Override
    protected double computePrefWidth(double height) { return canvas.getWidth(); }

    @Override
    protected double computePrefHeight(double width) { return canvas.getHeight(); }

    @Override
    protected void layoutChildren() {
        canvas.setLayoutX(0);
        canvas.setLayoutY(0);
    }

    // --- Draw ---

    private void draw() {
        // first appearance arrives from inside the driver constructor
        if (driver == null) return;

        GraphicsContext g = canvas.getGraphicsContext2D();
        LedGeometry geo = geometry;
        LedAppearance look = driver.getAppearance();
        double cw = geo.caseWidth();
        double d = geo.bulbDiameter();

        g.clearRect(0, 0, canvas.getWidth(), canvas.getHeight());

        oval(g, cw, cw - geo.light3D(), d, LIGHT, LIGHT, cw);
        oval(g, cw, cw + geo.shadow3D(), d, SHADOW, SHADOW, cw);
        oval(g, cw, cw, d, look.led().toFx(), CASE, cw);

        if (geo.isReflectionVisible()) {
            double[] r = geo.reflectionBounds();
            g.setLineCap(StrokeLineCap.BUTT);
            g.setLineWidth(geo.reflectionWidth());
            g.setStroke(look.reflection().toFx());
            g.strokeArc(r[0], r[1], r[2] - r[0], r[3] - r[1], 90, 90, ArcType.OPEN);
        }
    }

    private static void oval(GraphicsContext g, double x, double y, double d, Color fill, Color outline, double lw) {
        g.setFill(fill);
        g.fillOval(x, y, d, d);
        if (lw > 0) {
            g.setLineWidth(lw);
            g.setStroke(outline);
            g.strokeOval(x, y, d, d);
        }
    }
}
