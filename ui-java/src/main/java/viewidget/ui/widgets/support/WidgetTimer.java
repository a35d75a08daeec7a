package viewidget.ui.widgets.support;

/**
 * Single-threaded deferred-callback source used by the animated widgets.
 * Callbacks run on the same thread that scheduled them.
 */
public interface WidgetTimer {

    /** Handle to a pending callback. Cancelling twice, or after it ran, is harmless. */
    interface Scheduled {
        void cancel();
    }

    Scheduled schedule(long delayMillis, Runnable task);

    /** Monotonic clock, in milliseconds. */
    double nowMillis();
}
