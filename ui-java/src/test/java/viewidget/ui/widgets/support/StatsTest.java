package viewidget.ui.widgets.support;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

class StatsTest {

    @Test
    void emptyMeanIsZero() {
        assertEquals(0.0, Stats.mean(List.of()), 0);
    }

    @Test
    void meanOfMixedNumbers() {
        assertEquals(2.5, Stats.mean(List.of(1, 2.0, 3L, 4f)), 1e-12);
    }
}
