package viewidget.ui.widgets.led;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import viewidget.system.Logger;
import viewidget.ui.widgets.support.ColorResolver;
import viewidget.ui.widgets.support.RgbColor;
import viewidget.ui.widgets.support.Stats;
import viewidget.ui.widgets.support.ViewidgetException;
import viewidget.ui.widgets.support.WidgetTimer;

/**
 * On/off state, brightness, blink and fade of one LED.
 *
 * Runs entirely on the thread that owns its {@link WidgetTimer}; blink and fade
 * are self-rescheduling callbacks. Every colour change is pushed to the
 * registered appearance listeners.
 */
public final class LedDriver {

    /** Time between fade steps, in ms. */
    public static final int FADE_TIME_STEP = 20;

    /** Number of recent fade-step overshoots averaged into the next step. */
    private static final int LATENCY_WINDOW = 10;

    private final WidgetTimer timer;
    private final boolean monotone;
    private final boolean quadratic;
    private final List<Consumer<LedAppearance>> listeners = new CopyOnWriteArrayList<>();

    private RgbColor diode;
    private RgbColor bulb;
    private LedPalette palette;
    private LedAppearance current;

    private boolean on = false;
    private int fadeRate;
    private int blinkRate;
    private boolean blinking = false;
    private WidgetTimer.Scheduled fadeTask;
    private WidgetTimer.Scheduled blinkTask;

    public LedDriver(LedOptions options, LedGeometry geometry, WidgetTimer timer) {
        this(options, geometry, timer, null);
    }

    /**
     * @param listener optional first appearance listener, registered before the
     *                 initial state is applied so it sees the first paint
     */
    public LedDriver(LedOptions options, LedGeometry geometry, WidgetTimer timer, Consumer<LedAppearance> listener) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.monotone = geometry.isMonotoneReflection();
        this.quadratic = geometry.isQuadraticReflection();
        this.fadeRate = options.fadeRate();
        this.blinkRate = options.blinkRate();
        if (listener != null) listeners.add(listener);

        this.current = new LedAppearance(null, null, 0);
        changeColor(options.diodeColor(), options.bulbColor());
        turn(options.state());
    }

    public void addListener(Consumer<LedAppearance> l) {
        if (l != null) listeners.add(l);
    }

    public void removeListener(Consumer<LedAppearance> l) {
        listeners.remove(l);
    }

    // --- State ---

    /** Turn the LED on or off, fading at the fade rate and blinking if a blink rate is set. */
    public void turn(boolean state) {
        if (!state) {
            blinkCancel();
            if (on) fade(false);
        } else if (!on && !blinking) {
            if (blinkRate > 0) {
                blinkTask = timer.schedule(blinkRate, this::blink);
                blinking = true;
            }
            fade(true);
        }
    }

    public void turnOn() {
        turn(true);
    }

    public void turnOff() {
        turn(false);
    }

    public void toggle() {
        turn(!on);
    }

    // --- Colour ---

    /**
     * Change the diode and/or bulb colour; {@code null} keeps the current one.
     * @throws ViewidgetException for an unknown colour
     */
    public void changeColor(String diodeColor, String bulbColor) {
        RgbColor nextBulb = (bulbColor != null) ? ColorResolver.resolve(bulbColor) : bulb;
        RgbColor nextDiode = (diodeColor != null) ? ColorResolver.resolve(diodeColor) : diode;
        bulb = nextBulb;
        diode = nextDiode;
        palette = new LedPalette(diode, bulb, monotone, quadratic);
        setBrightness(current.brightness());
    }

    /**
     * Set the luminosity, 0 (off) to 1 (full). An LED that is off can dim but
     * not get brighter.
     */
    public void setBrightness(double level) {
        if (level <= 0) {
            apply(palette.off());
        } else if (on || level < current.brightness()) {
            apply(level >= 1 ? palette.on() : palette.shade(level));
        }
    }

    private void apply(LedAppearance next) {
        current = next;
        for (Consumer<LedAppearance> l : listeners) {
            try {
                l.accept(next);
            } catch (RuntimeException e) {
                Logger.error("[LED] appearance listener threw", e);
            }
        }
    }

    // --- Blink ---

    /**
     * Set the pause between on/off flips, in ms; 0 stops blinking and leaves the LED on.
     * @throws ViewidgetException if negative
     */
    public void setBlinkRate(double millis) {
        blinkRate = checkRate("blinkrate", millis);
        if (blinkRate > 0 && on && !blinking) {
            blink();
        } else if (blinkRate == 0 && blinking) {
            blinkCancel();
            turnOn();
        }
    }

    public void blinkCancel() {
        if (blinkTask != null) {
            blinkTask.cancel();
            blinkTask = null;
            blinking = false;
        }
    }

    /** Flip the LED and, if it went off, schedule the flip back. */
    public void blink() {
        blinkCancel();
        if (blinkRate > 0) {
            toggle();
            if (!on) {
                blinkTask = timer.schedule(blinkRate, this::blink);
                blinking = true;
            }
        }
    }

    // --- Fade ---

    /**
     * Set the time a full off-to-on fade takes, in ms; 0 switches instantly.
     * @throws ViewidgetException if negative
     */
    public void setFadeRate(double millis) {
        fadeRate = checkRate("faderate", millis);
    }

    /** Fade to the given state over |target - brightness| * fade rate. */
    public void fade(boolean state) {
        if (fadeTask != null) {
            fadeTask.cancel();
            fadeTask = null;
        }
        on = state;
        double target = state ? 1 : 0;
        double total = Math.abs(target - current.brightness()) * fadeRate;
        fadeStep(new FadeRun(target, total, timer.nowMillis()), total);
    }

    private void fadeStep(FadeRun run, double remaining) {
        if (remaining <= FADE_TIME_STEP) {
            fadeTask = null;
            setBrightness(run.target);
            return;
        }
        if (run.latency.size() > LATENCY_WINDOW) run.latency.removeFirst();

        double remainingBrightness = run.target - current.brightness();
        double delta = (remainingBrightness / remaining) * (FADE_TIME_STEP + Stats.mean(run.latency));
        setBrightness(current.brightness() + delta);

        double actual = run.total - (timer.nowMillis() - run.startMillis);
        run.latency.addLast(remaining - actual);
        double next = actual - FADE_TIME_STEP;
        fadeTask = timer.schedule(FADE_TIME_STEP, () -> fadeStep(run, next));
    }

    private static final class FadeRun {
        final double target;
        final double total;
        final double startMillis;
        final Deque<Double> latency = new ArrayDeque<>();

        FadeRun(double target, double total, double startMillis) {
            this.target = target;
            this.total = total;
            this.startMillis = startMillis;
        }
    }

    static int checkRate(String name, double millis) {
        if (!(millis >= 0)) {
            throw new ViewidgetException("LED " + name + " must be greater than or equal to zero");
        }
        return (int) Math.round(millis);
    }

    // --- Accessors ---

    public boolean isOn() { return on; }
    public boolean isBlinking() { return blinking; }
    public boolean isFading() { return fadeTask != null; }
    public int getFadeRate() { return fadeRate; }
    public int getBlinkRate() { return blinkRate; }
    public double getBrightness() { return current.brightness(); }
    public LedAppearance getAppearance() { return current; }
    public LedPalette getPalette() { return palette; }
    public RgbColor getDiodeColor() { return diode; }
    public RgbColor getBulbColor() { return bulb; }
}
