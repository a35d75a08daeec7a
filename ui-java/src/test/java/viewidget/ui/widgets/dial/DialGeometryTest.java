package viewidget.ui.widgets.dial;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import viewidget.ui.widgets.support.ViewidgetException;

class DialGeometryTest {
    private static final double EPS = 1e-9;

    @Test
    void defaultLayout() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults());

        assertEquals(2, g.shadow3D());
        assertEquals(1, g.light3D());
        assertEquals(317, g.length(), EPS);
        assertEquals(157.5, g.center(), EPS);
        assertEquals(142.5, g.radius(), EPS);
        assertEquals(47.5, g.arcOffset(), EPS);
        assertEquals(12, g.pinRadius(), EPS);
        assertEquals(-45, g.end(), EPS);
        assertTrue(g.isBound());
        assertTrue(g.warnings().isEmpty());
    }

    @Test
    void tickCountsFollowScaleSteps() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults());
        assertEquals(81, g.minorTicks().size());
        assertEquals(17, g.semiMajorTicks().size());
        assertEquals(9, g.majorTicks().size());
        assertEquals(
                List.of("60", "80", "100", "120", "140", "160", "180", "200", "220"),
                g.labels().stream().map(DialGeometry.Label::text).collect(Collectors.toList()));
    }

    @Test
    void firstMajorTickSitsAtStartAngle() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults());
        DialGeometry.Tick first = g.majorTicks().get(0);
        double inner = g.radius() - g.arcOffset();
        double a = Math.toRadians(225);
        assertEquals(g.center() + inner * Math.cos(a), first.x1(), EPS);
        assertEquals(g.center() - inner * Math.sin(a), first.y1(), EPS);
        double len = Math.hypot(first.x2() - first.x1(), first.y2() - first.y1());
        assertEquals(g.arcOffset() / 3, len, EPS);
        assertEquals(3, first.lineWidth(), 0);

        DialGeometry.Tick last = g.majorTicks().get(8);
        double b = Math.toRadians(-45);
        assertEquals(g.center() + inner * Math.cos(b), last.x1(), EPS);
    }

    @Test
    void minorTicksAreShorter() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults());
        DialGeometry.Tick t = g.minorTicks().get(3);
        assertEquals(g.arcOffset() / 5, Math.hypot(t.x2() - t.x1(), t.y2() - t.y1()), EPS);
    }

    @Test
    void disabledScalesDrawNoTicks() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults().minorScale(0).semiMajorScale(0));
        assertTrue(g.minorTicks().isEmpty());
        assertTrue(g.semiMajorTicks().isEmpty());
        assertEquals(9, g.majorTicks().size());
    }

    @Test
    void fullCircleDropsDuplicateMajorTickAndUnbinds() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults().start(90).extent(-360).min(0).max(80));
        assertTrue(g.isFullCircle());
        assertFalse(g.isBound());
        assertEquals(4, g.majorTicks().size());
        assertEquals("60", g.labels().get(3).text());
    }

    @Test
    void explicitBoundOverridesFullCircleDefault() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults().extent(360).bound(true));
        assertTrue(g.isBound());
    }

    @Test
    void equalMinAndMaxIsAnError() {
        ViewidgetException ex = assertThrows(ViewidgetException.class,
                () -> DialGeometry.resolve(DialOptions.defaults().min(5).max(5)));
        assertEquals("Dial min cannot be equal to the max", ex.getMessage());
    }

    @Test
    void reversedScaleCountsDownWithWarning() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults().min(100).max(0).majorScale(50).semiMajorScale(0));
        assertEquals(-1, g.countDirection());
        assertEquals(List.of("Dial min is greater than the max"), g.warnings());
        assertEquals(List.of("100", "50", "0"),
                g.labels().stream().map(DialGeometry.Label::text).collect(Collectors.toList()));
    }

    @Test
    void semiMajorNotSmallerThanMajorIsDropped() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults().semiMajorScale(20));
        assertEquals(0, g.semiMajorScale(), 0);
        assertTrue(g.semiMajorTicks().isEmpty());
        assertEquals(List.of("Dial semimajorscale greater than or equal to majorscale"), g.warnings());
    }

    @Test
    void semiMajorThatIsNotAFactorIsDropped() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults().semiMajorScale(3));
        assertEquals(0, g.semiMajorScale(), 0);
        assertEquals(List.of("Dial semimajorscale must be a factor of the majorscale"), g.warnings());
    }

    @Test
    void thickCaseIsClampedToATenthOfSize() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults().size(100).caseWidth(20));
        assertEquals(10, g.caseWidth(), EPS);
        assertEquals(List.of("Dial casewidth must be less than or equal to 1/10 the size"), g.warnings());
    }

    @Test
    void zeroCaseWidthIsAllowed() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults().caseWidth(0));
        assertEquals(0, g.caseWidth(), 0);
        assertTrue(g.warnings().isEmpty());
    }

    @Test
    void needleRotatesCounterClockwiseOnScreen() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults());
        double c = g.center();
        double tip = 2.5 * g.arcOffset();

        double[][] rest = g.needleAt(0);
        assertEquals(c + tip, rest[0][0], EPS);
        assertEquals(c, rest[1][0], EPS);

        double[][] up = g.needleAt(90);
        assertEquals(c, up[0][0], EPS);
        assertEquals(c - tip, up[1][0], EPS);

        double[][] down = g.needleAt(-90);
        assertEquals(c + tip, down[1][0], EPS);
    }

    @Test
    void scaleArcAndReadoutPositions() {
        DialGeometry g = DialGeometry.resolve(DialOptions.defaults());
        double[] arc = g.scaleArcBounds();
        assertEquals(62.5, arc[0], EPS);
        assertEquals(252.5, arc[2], EPS);
        assertEquals(g.center(), g.readoutX(), EPS);
        assertEquals(g.center() + 47.5 * 4 / 3, g.readoutY(), EPS);
        assertEquals(9, g.scaleFontSize(), 0);
        assertEquals(15, g.displayFontSize(), 0);
    }

    @Test
    void fractionalScaleValuesKeepTheirDecimals() {
        assertEquals("0.5", DialGeometry.formatScaleValue(0.5));
        assertEquals("-20", DialGeometry.formatScaleValue(-20.0));
        assertEquals("1.25", DialGeometry.formatScaleValue(1.25));
    }
}
