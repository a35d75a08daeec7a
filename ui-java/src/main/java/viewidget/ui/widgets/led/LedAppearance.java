package viewidget.ui.widgets.led;

import viewidget.ui.widgets.support.RgbColor;

/** What the LED currently looks like: bulb fill, reflection stroke, and brightness in [0, 1]. */
public record LedAppearance(RgbColor led, RgbColor reflection, double brightness) {}
