package viewidget.ui.widgets.support;

/**
 * Raised when a widget option or operation is bad enough that the caller must stop,
 * e.g. a non-positive size, an unknown option keyword or an unresolvable colour.
 * Borderline configuration is reported through {@link WidgetWarnings} instead.
 */
public class ViewidgetException extends RuntimeException {

    public ViewidgetException(String message) {
        super(message);
    }

    public ViewidgetException(String message, Throwable cause) {
        super(message, cause);
    }
}
