package eu.fbk.wikistore.server.http;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.annotation.Nullable;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.net.HostAndPort;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;

import eu.fbk.wikistore.internal.Logging;
import eu.fbk.wikistore.internal.Util;
import eu.fbk.wikistore.loader.WikibaseLoader;
import eu.fbk.wikistore.triplestore.LoggingTripleStore;
import eu.fbk.wikistore.triplestore.RepositoryTripleStore;
import eu.fbk.wikistore.triplestore.SynchronizedTripleStore;
import eu.fbk.wikistore.triplestore.TripleStore;
import eu.fbk.wikistore.server.http.jaxrs.QueryGateway;

/**
 * Command line entry point of the Wikistore server.
 * <p>
 * The launcher opens (or creates) the persistent store in the directory given with {@code -f},
 * starts the {@link WikibaseLoader} on a dedicated thread (initial import, then incremental
 * synchronization) and serves SPARQL queries over HTTP at the address given with {@code -b}
 * (default {@code localhost:7878}). The program runs until it is interrupted or the loader
 * fails for good.
 * </p>
 * <p>
 * Exit codes follow {@code sysexit.h}: 0 success, 64 command line syntax errors, 74 I/O errors
 * (including loader failures), 69 other errors.
 * </p>
 */
public final class Launcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(Launcher.class);

    private static final int EX_OK = 0; // success (sysexit.h)

    private static final int EX_USAGE = 64; // command used incorrectly (sysexit.h)

    private static final int EX_IOERR = 74; // some error occurred while doing I/O (sysexit.h)

    private static final int EX_UNAVAILABLE = 69; // catch-all when something fails (sysexit.h)

    private static final String PROGRAM_EXECUTABLE = "wikistore";

    private static final String PROGRAM_VERSION = Util.getVersion("eu.fbk.wikistore",
            "ws-server-http", "devel");

    private static final String PROGRAM_DESCRIPTION = "Mirrors the entities of a Wikibase "
            + "instance in a local RDF store and exposes them via a SPARQL endpoint.";

    private static final String DEFAULT_BIND = "localhost:7878";

    private static final long DEFAULT_INTERVAL = 10; // s

    private static final int DEFAULT_THREADS = 32;

    private static final String DEFAULT_LOG_CONFIG = "logback.xml";

    private static final int WIDTH = 80;

    /**
     * Program entry point.
     *
     * @param args
     *            command line arguments
     */
    public static void main(final String... args) {

        // Configure command line options
        final Options options = new Options();
        options.addOption("b", "bind", true, "listen on HOST:PORT (default '" + DEFAULT_BIND
                + "')");
        options.addOption("f", "file", true, "store data in directory DIR (mandatory)");
        options.addOption(Option.builder().longOpt("mediawiki-api").hasArg().argName("URL")
                .desc("MediaWiki API endpoint, e.g. https://www.wikidata.org/w/api.php "
                        + "(mandatory)").build());
        options.addOption(Option.builder().longOpt("mediawiki-base-url").hasArg()
                .argName("URL").desc("base URL of wiki pages, e.g. "
                        + "https://www.wikidata.org/wiki/ (mandatory)").build());
        options.addOption(Option.builder().longOpt("namespaces").hasArg().argName("IDS")
                .desc("comma separated ids of the namespaces to load (default 0)").build());
        options.addOption(Option.builder().longOpt("slot").hasArg().argName("NAME")
                .desc("load entities stored in page slot NAME, e.g. mediainfo").build());
        options.addOption(Option.builder().longOpt("interval").hasArg().argName("SECONDS")
                .desc("polling interval for changes (default " + DEFAULT_INTERVAL + ")")
                .build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("N")
                .desc("number of HTTP worker threads (default " + DEFAULT_THREADS + ")")
                .build());
        options.addOption(Option.builder().longOpt("log-config").hasArg().argName("LOCATION")
                .desc("logback configuration file / classpath resource (default '"
                        + DEFAULT_LOG_CONFIG + "')").build());
        options.addOption("v", "version", false,
                "display version and copyright information, then exit");
        options.addOption("h", "help", false, "display usage information, then exit");

        // Initialize exit status
        int status = EX_OK;

        try {
            final CommandLine cmd = new DefaultParser().parse(options, args);
            if (cmd.hasOption("v")) {
                System.out.println(String.format("%s %s\njava %s (%s) %s", PROGRAM_EXECUTABLE,
                        PROGRAM_VERSION, System.getProperty("sun.arch.data.model"),
                        System.getProperty("java.vendor"), System.getProperty("java.version")));

            } else if (cmd.hasOption("h")) {
                status = EX_USAGE;

            } else {
                run(cmd);
            }

        } catch (final ParseException ex) {
            // Display error message and then usage on syntax error
            System.err.println("SYNTAX ERROR: " + ex.getMessage());
            status = EX_USAGE;

        } catch (final Throwable ex) {
            // Display error message and stack trace on generic error
            System.err.print("EXECUTION FAILED: ");
            ex.printStackTrace();
            status = ex instanceof IOException ? EX_IOERR : EX_UNAVAILABLE;
        }

        // Display usage information if necessary
        if (status == EX_USAGE) {
            final PrintWriter out = new PrintWriter(System.out);
            final HelpFormatter formatter = new HelpFormatter();
            formatter.printUsage(out, WIDTH, PROGRAM_EXECUTABLE, options);
            formatter.printWrapped(out, WIDTH, "\n" + PROGRAM_DESCRIPTION);
            out.println("\nOptions");
            formatter.printOptions(out, WIDTH, options, 2, 2);
            out.flush();
        }

        if (status != EX_OK) {
            System.err.println("[exit status: " + status + "]");
        }

        // Flush STDIN and STDOUT before exiting (we noted truncated outputs otherwise)
        System.out.flush();
        System.err.flush();

        // Force exiting (in case there are threads still running)
        System.exit(status);
    }

    private static void run(final CommandLine cmd) throws Throwable {

        // Validate options before doing anything
        final File directory = new File(getMandatoryOption(cmd, "f"));
        final String apiUrl = getMandatoryOption(cmd, "mediawiki-api");
        final String baseUrl = getMandatoryOption(cmd, "mediawiki-base-url");
        final HostAndPort bind = parseBind(cmd.getOptionValue("b", DEFAULT_BIND));
        final List<Integer> namespaces = parseNamespaces(cmd.getOptionValue("namespaces"));
        final String slot = Strings.emptyToNull(cmd.getOptionValue("slot"));
        final long interval = parseNumber(cmd, "interval", DEFAULT_INTERVAL);
        final int threads = (int) parseNumber(cmd, "threads", DEFAULT_THREADS);
        final String logConfig = cmd.getOptionValue("log-config", DEFAULT_LOG_CONFIG);
        if (slot != null && !namespaces.isEmpty()) {
            throw new ParseException("Options --slot and --namespaces are mutually exclusive");
        }

        configureLogging(logConfig);
        LOGGER.info("{} {} / java {} / {}", PROGRAM_EXECUTABLE, PROGRAM_VERSION,
                System.getProperty("java.version"), System.getProperty("os.name"));
        LOGGER.info("Using: {} (store), {} (api), {} (base)", directory, apiUrl, baseUrl);

        // The loader counts as an additional (writer) transaction
        final TripleStore store = new LoggingTripleStore(new SynchronizedTripleStore(
                RepositoryTripleStore.newNativeStore(directory), (threads + 1) + ":CX"));
        final WikibaseLoader loader = new WikibaseLoader(store, apiUrl, baseUrl, namespaces,
                slot, interval * 1000L);
        final HttpServer server = HttpServer.builder(new QueryGateway(store))
                .host(bind.getHost()).port(bind.getPort()).threads(threads).build();
        final ExecutorService executor = Executors.newSingleThreadExecutor(Util
                .newThreadFactory("loader-%d", true));

        final AtomicBoolean closed = new AtomicBoolean(false);
        final Thread shutdownHandler = new Thread("shutdown") {

            @Override
            public void run() {
                if (closed.compareAndSet(false, true)) {
                    LOGGER.info("Stopping service ...");
                    executor.shutdownNow();
                    server.close();
                    loader.close();
                    store.close();
                    LOGGER.info("Service stopped");
                }
            }

        };
        Runtime.getRuntime().addShutdownHook(shutdownHandler);

        try {
            store.init();
            final Future<?> future = executor.submit(new Callable<Void>() {

                @Override
                public Void call() throws Exception {
                    Logging.enterContext(Logging.CONTEXT_LOADER);
                    loader.initialLoading();
                    loader.updateLoop();
                    return null;
                }

            });
            server.init();
            LOGGER.info("Service started");

            // Block until the loader fails (it never completes normally)
            try {
                future.get();
            } catch (final ExecutionException ex) {
                if (ex.getCause() instanceof InterruptedException) {
                    return;
                }
                LOGGER.error("Synchronization with " + apiUrl + " failed", ex.getCause());
                throw ex.getCause();
            }

        } finally {
            shutdownHandler.run();
        }
    }

    private static void configureLogging(final String location) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(Util.getURL(location));
        } catch (final JoranException je) {
            StatusPrinter.printInCaseOfErrorsOrWarnings(context);
        }
        SLF4JBridgeHandler.removeHandlersForRootLogger();
        SLF4JBridgeHandler.install();
    }

    private static String getMandatoryOption(final CommandLine cmd, final String option)
            throws ParseException {
        final String value = cmd.getOptionValue(option);
        if (Strings.isNullOrEmpty(value)) {
            throw new ParseException("Missing mandatory option " + option);
        }
        return value;
    }

    private static long parseNumber(final CommandLine cmd, final String option,
            final long defaultValue) throws ParseException {
        final String value = cmd.getOptionValue(option);
        if (value == null) {
            return defaultValue;
        }
        try {
            final long number = Long.parseLong(value.trim());
            if (number <= 0) {
                throw new NumberFormatException();
            }
            return number;
        } catch (final NumberFormatException ex) {
            throw new ParseException("Invalid value for option " + option + ": " + value);
        }
    }

    static HostAndPort parseBind(final String bind) throws ParseException {
        try {
            final HostAndPort result = HostAndPort.fromString(bind.trim());
            if (!result.hasPort()) {
                throw new IllegalArgumentException("missing port");
            }
            return result;
        } catch (final IllegalArgumentException ex) {
            throw new ParseException("Invalid bind address " + bind + ": " + ex.getMessage());
        }
    }

    static List<Integer> parseNamespaces(@Nullable final String namespaces)
            throws ParseException {
        if (namespaces == null) {
            return ImmutableList.of();
        }
        final ImmutableList.Builder<Integer> builder = ImmutableList.builder();
        for (final String token : Splitter.on(',').trimResults().omitEmptyStrings()
                .split(namespaces)) {
            try {
                builder.add(Integer.parseInt(token));
            } catch (final NumberFormatException ex) {
                throw new ParseException("Invalid namespace id: " + token);
            }
        }
        return builder.build();
    }

}
