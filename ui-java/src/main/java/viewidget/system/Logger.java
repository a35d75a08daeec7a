package viewidget.system;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.SimpleFormatter;

/**
 * Widget-library logger. Once started, widget messages and every
 * java.util.logging record (JavaFX reports through it) go to one file:
 *
 * yyyy-MM-dd HH:mm:ss.SSS | LEVEL   | Class.method(File:Line) | message
 *
 * Usage (host application, before building widgets):
 *   Logger.start(Paths.get("logs/viewidget.log"));
 *   Logger.quietJavaFX(false);
 *   // ... widgets ...
 *   Logger.stop(); // optional, also done by shutdown hook
 *
 * Before start() messages go to the console, so widgets embedded in an
 * application that never starts the logger still report warnings.
 */
public final class Logger {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static final StackWalker WALKER = StackWalker.getInstance();

    private static volatile BufferedWriter writer;
    private static volatile boolean debug;
    private static boolean hookInstalled;
    private static Handler julHandler;

    // --- Lifecycle ----------------------------------------------------------

    /** Start writing to the given file (appending). A second call while running is ignored. */
    public static synchronized void start(Path logFile) {
        Objects.requireNonNull(logFile, "logFile");
        if (writer != null) return;

        Path file = logFile.toAbsolutePath().normalize();
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            System.err.println("Logger initialization failed: " + e);
            throw new RuntimeException(e);
        }

        julHandler = new JulBridge();
        java.util.logging.Logger root = java.util.logging.Logger.getLogger("");
        for (Handler h : root.getHandlers()) root.removeHandler(h);
        root.addHandler(julHandler);

        if (!hookInstalled) {
            hookInstalled = true;
            Runtime.getRuntime().addShutdownHook(new Thread(Logger::stop, "viewidget-logger-shutdown"));
        }
    }

    public static synchronized void stop() {
        BufferedWriter w = writer;
        if (w == null) return;
        if (julHandler != null) {
            java.util.logging.Logger.getLogger("").removeHandler(julHandler);
            julHandler = null;
        }
        writer = null;
        try {
            w.close();
        } catch (IOException e) {
            System.err.println("Logger close failed: " + e);
        }
    }

    public static boolean isEnabled() {
        return writer != null;
    }

    /**
     * Keep JavaFX internals at WARNING and up. The "viewidget" loggers and
     * {@link #debug(String)} stay on in dev mode.
     */
    public static void quietJavaFX(boolean devMode) {
        level("viewidget", devMode ? Level.FINE : Level.INFO);
        for (String name : new String[] { "javafx", "javafx.scene", "javafx.css", "com.sun.javafx", "jdk" }) {
            level(name, Level.WARNING);
        }
        debug = devMode;
    }

    // --- Messages -----------------------------------------------------------

    public static void info(String msg) {
        emit(Level.INFO, msg);
    }

    public static void warn(String msg) {
        emit(Level.WARNING, msg);
    }

    public static void error(String msg) {
        emit(Level.SEVERE, msg);
    }

    public static void error(String msg, Throwable t) {
        emit(Level.SEVERE, msg);
        if (t == null) return;
        StringWriter trace = new StringWriter();
        t.printStackTrace(new PrintWriter(trace));
        emit(Level.SEVERE, trace.toString().stripTrailing());
    }

    /** Only written in dev mode (see {@link #quietJavaFX(boolean)}). */
    public static void debug(String msg) {
        if (debug) emit(Level.FINE, msg);
    }

    // --- Internals ----------------------------------------------------------

    private static void emit(Level level, String msg) {
        if (writer != null) {
            write(level, caller(), msg);
            return;
        }
        PrintStream console = level.intValue() >= Level.WARNING.intValue() ? System.err : System.out;
        console.println(msg);
    }

    private static void write(Level level, String location, String message) {
        String prefix = TS.format(LocalDateTime.now()) + " | " + levelName(level) + " | " + location + " | ";
        synchronized (Logger.class) {
            BufferedWriter w = writer;
            if (w == null) return;
            try {
                for (String line : String.valueOf(message).split("\\R", -1)) {
                    w.write(prefix);
                    w.write(line);
                    w.newLine();
                }
                w.flush();
            } catch (IOException e) {
                System.err.println("Logger write failed: " + e);
            }
        }
    }

    /** Routes java.util.logging records into the same file. */
    private static final class JulBridge extends Handler {
        JulBridge() {
            setLevel(Level.ALL);
            setFormatter(new SimpleFormatter());
        }

        @Override public void publish(LogRecord r) {
            if (r == null || !isLoggable(r)) return;
            String cls = r.getSourceClassName();
            String location = (cls == null)
                    ? caller()
                    : cls + "." + r.getSourceMethodName() + "(" + cls.substring(cls.lastIndexOf('.') + 1) + ".java:-1)";
            write(r.getLevel(), location, getFormatter().formatMessage(r));
            if (r.getThrown() != null) {
                StringWriter trace = new StringWriter();
                r.getThrown().printStackTrace(new PrintWriter(trace));
                write(r.getLevel(), location, trace.toString().stripTrailing());
            }
        }

        @Override public void flush() { }

        @Override public void close() { }
    }

    /** Level name padded to 7 characters, e.g. "INFO   ". */
    private static String levelName(Level l) {
        int v = l.intValue();
        String name;
        if (v >= Level.SEVERE.intValue()) name = "SEVERE";
        else if (v >= Level.WARNING.intValue()) name = "WARNING";
        else if (v >= Level.INFO.intValue()) name = "INFO";
        else if (v >= Level.CONFIG.intValue()) name = "CONFIG";
        else name = "FINE";
        return String.format("%-7s", name);
    }

    /** First frame outside this class and java.util.logging, as Class.method(File:Line). */
    private static String caller() {
        return WALKER.walk(frames -> frames
                .filter(f -> !f.getClassName().equals(Logger.class.getName())
                        && !f.getClassName().startsWith(Logger.class.getName() + "$")
                        && !f.getClassName().startsWith("java.util.logging"))
                .findFirst()
                .map(f -> f.getClassName() + "." + f.getMethodName() + "(" + Objects.toString(f.getFileName(), "?") + ":" + f.getLineNumber() + ")")
                .orElse("?.?(?:-1)"));
    }

    private static void level(String name, Level level) {
        java.util.logging.Logger.getLogger(name).setLevel(level);
    }

    private Logger() {}
}
