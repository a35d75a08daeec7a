package viewidget.ui.widgets.dial;

import java.util.List;
import java.util.Map;

import javafx.geometry.VPos;
import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.layout.Region;
import javafx.scene.paint.Color;
import javafx.scene.shape.ArcType;
import javafx.scene.shape.StrokeLineCap;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.scene.text.Text;
import javafx.scene.text.TextAlignment;
import viewidget.system.Logger;
import viewidget.ui.widgets.support.ColorResolver;

/**
 * Circular gauge modelled on a bi-metal thermometer; works equally as a
 * pressure gauge or speedometer.
 *
 * Construction options are listed on {@link DialOptions}. After construction:
 *   setValue(v)            : points the needle at v (null = min)
 *   setDisplayColors(n, a) : readout colour in range / out of bounds
 *   setDisplayRoundTo(n)   : readout decimal places
 *
 * Example:
 *   new Dial(DialOptions.defaults().size(275).caseWidth(10).min(0).max(100).value(14.7).unit("psi"))
 */
public class Dial extends Region {

    private static final Color FACE = Color.WHITE;
    private static final Color FACE_OUTLINE = ColorResolver.resolveFx("gray60");
    private static final Color LIGHT = Color.WHITE;
    private static final Color SHADOW = ColorResolver.resolveFx("gray5");
    private static final Color PIN_LIGHT = ColorResolver.resolveFx("gray95");
    private static final Color PIN = ColorResolver.resolveFx("gray70");
    private static final Color PIN_OUTLINE = Color.web("#DDDDDD");

    private final DialGeometry geometry;
    private final DialModel model;
    private final Canvas canvas;
    private final Font scaleFont;
    private final Font displayFont;

    public Dial() {
        this(DialOptions.defaults());
    }

    /** Build from a keyword map (e.g. loaded from JSON); unknown keys are rejected. */
    public Dial(Map<String, Object> cfg) {
        this(DialOptions.fromConfig(cfg));
    }

    public Dial(DialOptions options) {
        this.geometry = DialGeometry.resolve(options);
        this.model = new DialModel(geometry);
        this.canvas = new Canvas(geometry.length(), geometry.length());
        this.scaleFont = Font.font(null, FontWeight.BOLD, Math.max(1, geometry.scaleFontSize()));
        this.displayFont = Font.font(null, FontWeight.BOLD, Math.max(1, geometry.displayFontSize()));

        getChildren().add(canvas);
        setPrefSize(geometry.length(), geometry.length());
        setMinSize(USE_PREF_SIZE, USE_PREF_SIZE);
        setMaxSize(USE_PREF_SIZE, USE_PREF_SIZE);
        draw();
        Logger.debug("[Dial] built size=" + geometry.size() + " range=" + geometry.min() + ".." + geometry.max());
    }

    // --- Value ---

    public void setValue(double v) {
        setValue(Double.valueOf(v));
    }

    /** Point the needle at {@code v}; {@code null} means the scale minimum. */
    public void setValue(Double v) {
        if (model.setValue(v)) draw();
    }

    public double getValue() { return model.getValue(); }

    public boolean isOutOfBounds() { return model.isOutOfBounds(); }

    public void setDisplayColors(String normal, String alert) {
        model.setDisplayColors(normal, alert);
        draw();
    }

    public void setDisplayRoundTo(int places) {
        model.setDisplayRoundTo(places);
        draw();
    }

    public DialGeometry getGeometry() { return geometry; }

    public DialModel getModel() { return model; }

    /** Non-fatal configuration warnings raised while building this dial. */
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
        GraphicsContext g = canvas.getGraphicsContext2D();
        DialGeometry geo = geometry;
        double cw = geo.caseWidth();
        double size = geo.size();
        double inner = size - cw;

        g.clearRect(0, 0, canvas.getWidth(), canvas.getHeight());

        // --- Body: highlight, drop shadow, then the face over both ---
        g.setLineWidth(cw);
        oval(g, cw, cw - geo.light3D(), inner, LIGHT, LIGHT, cw);
        oval(g, cw, cw + geo.shadow3D(), inner, SHADOW, SHADOW, cw);
        oval(g, cw, cw, inner, FACE, FACE_OUTLINE, cw);

        // --- Scale ---
        g.setStroke(Color.BLACK);
        g.setLineCap(StrokeLineCap.BUTT);
        strokeTicks(g, geo.minorTicks());
        strokeTicks(g, geo.semiMajorTicks());
        strokeTicks(g, geo.majorTicks());

        g.setFill(Color.BLACK);
        g.setFont(scaleFont);
        g.setTextAlign(TextAlignment.CENTER);
        g.setTextBaseline(VPos.CENTER);
        for (DialGeometry.Label l : geo.labels()) {
            g.fillText(l.text(), l.x(), l.y());
        }

        double[] arc = geo.scaleArcBounds();
        g.setLineWidth(2);
        if (geo.isFullCircle()) {
            g.strokeOval(arc[0], arc[1], arc[2] - arc[0], arc[3] - arc[1]);
        } else {
            g.strokeArc(arc[0], arc[1], arc[2] - arc[0], arc[3] - arc[1], geo.start(), geo.extent(), ArcType.OPEN);
        }

        // --- Readout and unit ---
        g.setFont(displayFont);
        double unitX = geo.readoutX();
        if (geo.withDisplay()) {
            g.setFill(model.readoutColor().toFx());
            g.fillText(model.readoutText(), geo.readoutX(), geo.readoutY());
            String lo = DialGeometry.formatScaleValue(geo.min());
            String hi = DialGeometry.formatScaleValue(geo.max());
            unitX = geo.readoutX() + Math.max(textWidth(lo, displayFont), textWidth(hi, displayFont)) + 2;
        }
        if (geo.unit() != null) {
            g.setFill(Color.BLACK);
            g.fillText(geo.unit(), unitX, geo.readoutY());
        }

        // --- Needle ---
        double[][] needle = model.getNeedle();
        g.setFill(Color.BLACK);
        g.fillPolygon(needle[0], needle[1], needle[0].length);

        // --- Pin ---
        double c = geo.center();
        double r = geo.pinRadius();
        g.setLineWidth(1);
        oval(g, c - r, c - r - geo.light3D(), 2 * r, PIN_LIGHT, PIN_LIGHT, 1);
        oval(g, c - r, c - r + geo.shadow3D(), 2 * r, SHADOW, SHADOW, 1);
        oval(g, c - r, c - r, 2 * r, PIN, PIN_OUTLINE, 1);
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

    private static void strokeTicks(GraphicsContext g, List<DialGeometry.Tick> ticks) {
        for (DialGeometry.Tick t : ticks) {
            g.setLineWidth(t.lineWidth());
            g.strokeLine(t.x1(), t.y1(), t.x2(), t.y2());
        }
    }

    private static double textWidth(String s, Font font) {
        Text t = new Text(s);
        t.setFont(font);
        return t.getLayoutBounds().getWidth();
    }
}
