package viewidget.ui.widgets.digit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Segment polygons of a digit of height {@code size} (width 2/3 of it),
 * in {@link SegmentMasks} bit order.
 */
public final class DigitGeometry {

    /** Closed polygon; {@code xs[i], ys[i]} is vertex i. */
    public record Polygon(double[] xs, double[] ys) {
        public int points() { return xs.length; }
    }

    private final double size;
    private final List<Polygon> segments;

    public DigitGeometry(double size) {
        this.size = size;

        double x1 = size * 9 / 100;
        double y1 = x1;
        double x2 = size * 57 / 100;
        double y2 = size * 89 / 100;
        double y3 = size * 49 / 100;
        double tenth = size / 10;
        double twentieth = size / 20;

        List<Polygon> segs = new ArrayList<>(SegmentMasks.SEGMENT_COUNT);

        // top and bottom trapezoids
        segs.add(poly(x1, y1, x2, y1, x2 - tenth, y1 + tenth, x1 + tenth, y1 + tenth));
        segs.add(poly(x1, y2, x2, y2, x2 - tenth, y2 - tenth, x1 + tenth, y2 - tenth));

        // four five-sided verticals, one per corner
        double[][] corners = { { x1, y1 }, { x2, y1 }, { x1, y2 }, { x2, y2 } };
        for (double[] corner : corners) {
            double x = corner[0];
            double y = corner[1];
            double xdir = (x == x1) ? 1 : -1;
            double ydir = (y == y1) ? -1 : 1;
            segs.add(poly(
                    x, y,
                    x, y3 + ydir * twentieth,
                    x + xdir * twentieth, y3,
                    x + xdir * tenth, y3 + ydir * twentieth,
                    x + xdir * tenth, y - ydir * tenth));
        }

        // middle six-sider
        segs.add(poly(
                x1 + twentieth, y3,
                x1 + tenth, y3 - twentieth,
                x2 - tenth, y3 - twentieth,
                x2 - twentieth, y3,
                x2 - tenth, y3 + twentieth,
                x1 + tenth, y3 + twentieth));

        this.segments = Collections.unmodifiableList(segs);
    }

    private static Polygon poly(double... xy) {
        int n = xy.length / 2;
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = xy[2 * i];
            ys[i] = xy[2 * i + 1];
        }
        return new Polygon(xs, ys);
    }

    public double height() { return size; }
    public double width() { return size * 2 / 3; }

    /** Segment outline width. */
    public double outlineWidth() { return Math.max(Math.floor(size / 175), 1); }

    public List<Polygon> segments() { return segments; }

    public Polygon segment(int index) { return segments.get(index); }
}
