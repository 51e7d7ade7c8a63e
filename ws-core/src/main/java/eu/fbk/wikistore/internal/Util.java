package eu.fbk.wikistore.internal;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ThreadFactory;

import javax.annotation.Nullable;

import com.google.common.base.Strings;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private Util() {
    }

    /**
     * Resolves a location given on the command line or in a configuration. The location is
     * looked up, in order, as a classpath resource, as a file path and as a URL.
     *
     * @param location
     *            the location
     * @return the corresponding URL
     * @throws IllegalArgumentException
     *             if the location cannot be resolved
     */
    public static URL getURL(final String location) {
        final String resource = location.startsWith("/") ? location.substring(1) : location;
        final URL classpathURL = Util.class.getClassLoader().getResource(resource);
        if (classpathURL != null) {
            return classpathURL;
        }
        final File file = new File(location);
        try {
            if (file.isFile()) {
                return file.toURI().toURL();
            }
            return new URL(location);
        } catch (final MalformedURLException ex) {
            throw new IllegalArgumentException("Not a resource, file or URL: " + location, ex);
        }
    }

    /**
     * Returns the version of a Maven artifact on the classpath, read from the
     * {@code pom.properties} file packaged with it.
     *
     * @param groupId
     *            the group id
     * @param artifactId
     *            the artifact id
     * @param defaultValue
     *            the value returned when the artifact metadata is not available (e.g., when
     *            running from an IDE)
     * @return the version
     */
    public static String getVersion(final String groupId, final String artifactId,
            final String defaultValue) {
        final String path = "META-INF/maven/" + groupId + "/" + artifactId + "/pom.properties";
        final InputStream stream = Util.class.getClassLoader().getResourceAsStream(path);
        if (stream == null) {
            return defaultValue;
        }
        try {
            final Properties properties = new Properties();
            properties.load(stream);
            final String version = Strings.nullToEmpty(properties.getProperty("version")).trim();
            return version.isEmpty() ? defaultValue : version;
        } catch (final IOException ex) {
            LOGGER.debug("Cannot read " + path, ex);
            return defaultValue;
        } finally {
            closeQuietly(stream);
        }
    }

    public static void closeQuietly(@Nullable final Closeable closeable) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (final IOException | RuntimeException ex) {
                LOGGER.warn("Ignoring failure closing " + closeable.getClass().getSimpleName(),
                        ex);
            }
        }
    }

    /**
     * Returns a factory of named threads. Threads inherit the MDC of the thread calling this
     * method and log their uncaught exceptions at ERROR level.
     *
     * @param nameFormat
     *            the thread name format, e.g. {@code "loader-%d"}
     * @param daemon
     *            whether created threads are daemon threads
     * @return the created factory
     */
    public static ThreadFactory newThreadFactory(final String nameFormat, final boolean daemon) {
        final Map<String, String> mdc = Logging.getMDC();
        final ThreadFactory factory = new ThreadFactoryBuilder().setNameFormat(nameFormat)
                .setDaemon(daemon).build();
        return new ThreadFactory() {

            @Override
            public Thread newThread(final Runnable runnable) {
                final Thread thread = factory.newThread(new Runnable() {

                    @Override
                    public void run() {
                        Logging.setMDC(mdc);
                        runnable.run();
                    }

                });
                thread.setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {

                    @Override
                    public void uncaughtException(final Thread t, final Throwable ex) {
                        LOGGER.error("Thread " + t.getName() + " died", ex);
                    }

                });
                return thread;
            }

        };
    }

}
