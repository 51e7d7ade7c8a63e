package eu.fbk.wikistore.internal;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import org.slf4j.MDC;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.color.ANSIConstants;
import ch.qos.logback.core.pattern.color.ForegroundCompositeConverterBase;

/**
 * Logging helpers: the MDC key tagging the lines of a request or of the loader thread, and the
 * Logback converters referenced by {@code logback.xml}.
 */
public final class Logging {

    /** MDC key holding the context of the current thread ({@code req:N} or {@code loader}). */
    public static final String MDC_CONTEXT = "context";

    /** Context of the background synchronization thread. */
    public static final String CONTEXT_LOADER = "loader";

    private static final AtomicLong REQUEST_COUNTER = new AtomicLong(0L);

    private Logging() {
    }

    /**
     * Tags the current thread with a fresh request context of the form {@code req:<id>}, the id
     * being a base-32 counter.
     *
     * @return the context assigned
     */
    public static String enterRequestContext() {
        final String context = "req:" + Long.toString(REQUEST_COUNTER.incrementAndGet(), 32);
        MDC.put(MDC_CONTEXT, context);
        return context;
    }

    public static void enterContext(final String context) {
        MDC.put(MDC_CONTEXT, context);
    }

    public static void leaveContext() {
        MDC.remove(MDC_CONTEXT);
    }

    @Nullable
    public static Map<String, String> getMDC() {
        return MDC.getCopyOfContextMap();
    }

    public static void setMDC(@Nullable final Map<String, String> mdc) {
        if (mdc == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(Collections.unmodifiableMap(mdc));
        }
    }

    /** Colours the message by level: errors red, warnings yellow, debug and trace faint. */
    public static final class LevelConverter extends
            ForegroundCompositeConverterBase<ILoggingEvent> {

        @Override
        protected String getForegroundColorCode(final ILoggingEvent event) {
            final int level = event.getLevel().toInt();
            if (level >= Level.ERROR_INT) {
                return ANSIConstants.RED_FG;
            } else if (level >= Level.WARN_INT) {
                return ANSIConstants.YELLOW_FG;
            } else if (level < Level.INFO_INT) {
                return ANSIConstants.BLACK_FG;
            }
            return ANSIConstants.DEFAULT_FG;
        }

    }

    /**
     * Emits {@code [context] } when the event carries an MDC context, followed by
     * {@code (logger) } for warnings and errors.
     */
    public static final class ContextConverter extends ClassicConverter {

        @Override
        public String convert(final ILoggingEvent event) {
            final StringBuilder builder = new StringBuilder();
            final String context = event.getMDCPropertyMap().get(MDC_CONTEXT);
            if (context != null) {
                builder.append('[').append(context).append("] ");
            }
            if (event.getLevel().isGreaterOrEqual(Level.WARN)) {
                final String name = event.getLoggerName();
                builder.append('(').append(name.substring(name.lastIndexOf('.') + 1))
                        .append(") ");
            }
            return builder.toString();
        }

    }

}
