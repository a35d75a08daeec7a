package viewidget.ui.widgets.digit;

import java.util.List;
import java.util.Map;

import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.layout.Region;
import javafx.scene.shape.StrokeLineJoin;

/**
 * One character of a seven-segment display, as on a digital clock.
 * Use singly or line several up for a multi-digit readout.
 *
 * Construction options are listed on {@link DigitOptions}. Operations:
 *   setValue(v)          : 0-15 / '0'-'9' / 'A'-'F', null blanks
 *   setMask(mask)        : light segments directly
 *   changeColor(fg, bg)  : segment / background colour
 *
 * Example:
 *   new Digit(DigitOptions.defaults().size(115).value(8).foreground("green"))
 */
public class Digit extends Region {

    private final DigitGeometry geometry;
    private final DigitModel model;
    private final Canvas canvas;

    public Digit() {
        this(DigitOptions.defaults());
    }

    /** Build from a keyword map (e.g. loaded from JSON); unknown keys are rejected. */
    public Digit(Map<String, Object> cfg) {
        this(DigitOptions.fromConfig(cfg));
    }

    public Digit(DigitOptions options) {
        this.geometry = new DigitGeometry(options.size());
        this.model = new DigitModel(options);
        this.canvas = new Canvas(geometry.width(), geometry.height());
        getChildren().add(canvas);
        setPrefSize(geometry.width(), geometry.height());
        setMinSize(USE_PREF_SIZE, USE_PREF_SIZE);
        setMaxSize(USE_PREF_SIZE, USE_PREF_SIZE);
        draw();
    }

    // --- Operations ---

    /**
     * Display the value if it has a glyph; {@code null} blanks the digit.
     * @return false when the value cannot be shown (display unchanged)
     */
    public boolean setValue(Object value) {
        boolean ok = model.setValue(value);
        if (ok) draw();
        return ok;
    }

    public void setMask(int mask) {
        model.setMask(mask);
        draw();
    }

    /** {@code null} keeps the current colour. */
    public void changeColor(String foreground, String background) {
        model.changeColor(foreground, background);
        draw();
    }

    public Integer getValue() { return model.getValue(); }
    public int getMask() { return model.getMask(); }
    public DigitModel getModel() { return model; }
    public DigitGeometry getGeometry() { return geometry; }

    /** Non-fatal configuration warnings raised while building this digit. */
    public List<String> getWarnings() { return model.getWarnings(); }

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
        double w = canvas.getWidth();
        double h = canvas.getHeight();

        g.setFill(model.getBackground().toFx());
        g.fillRect(0, 0, w, h);

        g.setFill(model.getForeground().toFx());
        g.setStroke(model.getBackground().toFx());
        g.setLineWidth(geometry.outlineWidth());
        g.setLineJoin(StrokeLineJoin.MITER);
        for (int i = 0; i < SegmentMasks.SEGMENT_COUNT; i++) {
            if (!model.isSegmentOn(i)) continue;
            DigitGeometry.Polygon p = geometry.segment(i);
            g.fillPolygon(p.xs(), p.ys(), p.points());
            g.strokePolygon(p.xs(), p.ys(), p.points());
        }
    }
}
