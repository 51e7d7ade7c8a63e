package eu.fbk.wikistore.server.http;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.servlet.ServletContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.wikistore.runtime.Component;
import eu.fbk.wikistore.server.http.jaxrs.Application;
import eu.fbk.wikistore.server.http.jaxrs.QueryGateway;

/**
 * The HTTP frontend of Wikistore, exposing the SPARQL query endpoint of a {@link QueryGateway}
 * via an embedded Jetty server.
 * <p>
 * Connections are accepted and multiplexed by NIO selectors; requests are served by a bounded
 * pool of worker threads. The server is started by {@link #init()} and stopped by
 * {@link #close()}; the gateway and its store are not managed by this component.
 * </p>
 */
public final class HttpServer implements Component {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServer.class);

    private static final String DEFAULT_HOST = "localhost";

    private static final int DEFAULT_PORT = 7878;

    private static final int DEFAULT_THREADS = 32;

    private static final int DEFAULT_ACCEPTORS = -1; // -1 = platform specific

    private static final int DEFAULT_SELECTORS = -1; // -1 = platform specific

    private static final long STOP_TIMEOUT = 1000; // wait 1 s before forcing closure

    private final Server server;

    private final ServerConnector connector;

    private HttpServer(final Builder builder) {

        final String host = MoreObjects.firstNonNull(builder.host, DEFAULT_HOST);
        final int port = MoreObjects.firstNonNull(builder.port, DEFAULT_PORT);
        final int threads = MoreObjects.firstNonNull(builder.threads, DEFAULT_THREADS);
        Preconditions.checkArgument(port >= 0 && port < 65536, "Invalid HTTP port %s", port);
        Preconditions.checkArgument(threads > 0, "Invalid number of threads %s", threads);

        // Worker pool: acceptors and selectors take threads from it, so keep some margin
        final QueuedThreadPool pool = new QueuedThreadPool(threads + 8, Math.min(threads, 8));
        pool.setName("http");

        final Server server = new Server(pool);
        server.setDumpAfterStart(false);
        server.setDumpBeforeStop(false);
        server.setStopAtShutdown(false);

        final HttpConfiguration config = new HttpConfiguration();
        config.setOutputBufferSize(32 * 1024);
        config.setRequestHeaderSize(8 * 1024);
        config.setResponseHeaderSize(8 * 1024);
        config.setSendServerVersion(false); // custom header sent
        config.setSendDateHeader(true);

        final ServerConnector connector = new ServerConnector(server, null, null, null,
                DEFAULT_ACCEPTORS, DEFAULT_SELECTORS, new HttpConnectionFactory(config));
        connector.setHost(host);
        connector.setPort(port);
        connector.setReuseAddress(true);
        server.addConnector(connector);

        final ServletContextHandler handler = new ServletContextHandler(
                ServletContextHandler.NO_SESSIONS);
        handler.setContextPath("/");
        handler.setMaxFormContentSize(-1);
        handler.addServlet(new ServletHolder(new ServletContainer(ResourceConfig
                .forApplication(new Application(builder.gateway)))), "/*");
        server.setHandler(handler);

        this.server = server;
        this.connector = connector;
    }

    @Override
    public void init() throws IOException {
        try {
            this.server.start();
            LOGGER.info("Jetty {} started, listening on {}:{}", Server.getVersion(),
                    this.connector.getHost(), this.connector.getLocalPort());
        } catch (final IOException ex) {
            throw ex;
        } catch (final Exception ex) {
            throw new IOException("Cannot start Jetty: " + ex.getMessage(), ex);
        }
    }

    /**
     * Returns the port the server is listening on; useful when port 0 was requested.
     *
     * @return the local port, or a negative number if the server is not started
     */
    public int getPort() {
        return this.connector.getLocalPort();
    }

    @Override
    public void close() {
        if (!this.server.isStarted()) {
            return;
        }
        try {
            this.server.setStopTimeout(STOP_TIMEOUT);
            this.server.stop();
            LOGGER.info("Jetty {} stopped", Server.getVersion());
        } catch (final Exception ex) {
            // Just log a warning without additional detail, as Jetty already prints log info
            LOGGER.warn("Jetty {} stopped (with errors)", Server.getVersion());
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("host", this.connector.getHost())
                .add("port", this.connector.getPort()).toString();
    }

    public static Builder builder(final QueryGateway gateway) {
        return new Builder(gateway);
    }

    public static class Builder {

        final QueryGateway gateway;

        @Nullable
        String host;

        @Nullable
        Integer port;

        @Nullable
        Integer threads;

        Builder(final QueryGateway gateway) {
            this.gateway = Preconditions.checkNotNull(gateway);
        }

        public Builder host(@Nullable final String host) {
            this.host = host;
            return this;
        }

        public Builder port(@Nullable final Integer port) {
            this.port = port;
            return this;
        }

        public Builder threads(@Nullable final Integer threads) {
            this.threads = threads;
            return this;
        }

        public HttpServer build() {
            return new HttpServer(this);
        }

    }

}
