package viewidget.ui.widgets.support;

import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.util.Duration;

/**
 * {@link WidgetTimer} backed by one-shot JavaFX timelines, so every callback
 * fires on the FX application thread.
 */
public final class FxWidgetTimer implements WidgetTimer {

    public static final FxWidgetTimer INSTANCE = new FxWidgetTimer();

    @Override
    public Scheduled schedule(long delayMillis, Runnable task) {
        Timeline tl = new Timeline(new KeyFrame(Duration.millis(Math.max(0, delayMillis)), e -> task.run()));
        tl.setCycleCount(1);
        tl.play();
        return tl::stop;
    }

    @Override
    public double nowMillis() {
        return System.nanoTime() / 1_000_000.0;
    }

    private FxWidgetTimer() {}
}
