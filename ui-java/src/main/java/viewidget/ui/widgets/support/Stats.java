package viewidget.ui.widgets.support;

import java.util.Collection;

public final class Stats {

    /** Average of the values; an empty collection averages to 0. */
    public static double mean(Collection<? extends Number> values) {
        double sum = 0;
        for (Number n : values) sum += n.doubleValue();
        return sum / Math.max(values.size(), 1);
    }

    private Stats() {}
}
