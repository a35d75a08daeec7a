package viewidget.ui.widgets.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import viewidget.system.Logger;

/**
 * Collects non-fatal configuration alerts for one widget. Every warning is logged
 * at WARNING as soon as it is raised and kept so callers can inspect it later.
 */
public final class WidgetWarnings {

    private final String widget;
    private final List<String> messages = new ArrayList<>();

    public WidgetWarnings(String widget) {
        this.widget = widget;
    }

    public void warn(String message) {
        messages.add(message);
        Logger.warn("[" + widget + "] " + message);
    }

    /** Record warnings that were already logged elsewhere (e.g. while parsing options). */
    public void carry(List<String> alreadyLogged) {
        messages.addAll(alreadyLogged);
    }

    public List<String> messages() {
        return Collections.unmodifiableList(messages);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
