package eu.fbk.wikistore.server.http.jaxrs;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

import javax.ws.rs.HttpMethod;
import javax.ws.rs.WebApplicationException;
import javax.ws.rs.container.ContainerRequestContext;
import javax.ws.rs.container.ContainerRequestFilter;
import javax.ws.rs.container.ContainerResponseContext;
import javax.ws.rs.container.ContainerResponseFilter;
import javax.ws.rs.container.PreMatching;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.core.Response.Status;
import javax.ws.rs.core.UriInfo;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.glassfish.jersey.server.ResourceConfig;
import org.glassfish.jersey.server.ServerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.wikistore.OperationException;
import eu.fbk.wikistore.internal.Logging;
import eu.fbk.wikistore.internal.Util;
import eu.fbk.wikistore.internal.jaxrs.Protocol;

public final class Application extends javax.ws.rs.core.Application {

    private static final Logger LOGGER = LoggerFactory.getLogger(Application.class);

    private static final String SERVER = String.format("Wikistore/%s",
            Util.getVersion("eu.fbk.wikistore", "ws-server-http", "devel"));

    private static final MediaType TEXT_PLAIN_UTF8 = MediaType.TEXT_PLAIN_TYPE
            .withCharset("UTF-8");

    private final QueryGateway gateway;

    private final Set<Class<?>> classes;

    private final Map<String, Object> properties;

    public Application(final QueryGateway gateway) {

        this.gateway = Preconditions.checkNotNull(gateway);

        this.classes = ImmutableSet.<Class<?>>of(Sparql.class, Filter.class, Mapper.class);

        final ImmutableMap.Builder<String, Object> properties = ImmutableMap.builder();
        properties.put(ServerProperties.APPLICATION_NAME, "Wikistore");
        properties.put(ServerProperties.WADL_FEATURE_DISABLE, true);
        properties.put(ServerProperties.METAINF_SERVICES_LOOKUP_DISABLE, true);
        properties.put(ServerProperties.MOXY_JSON_FEATURE_DISABLE, true);
        properties.put(ServerProperties.JSON_PROCESSING_FEATURE_DISABLE, true);
        this.properties = properties.build();
    }

    public QueryGateway getGateway() {
        return this.gateway;
    }

    @Override
    public Set<Class<?>> getClasses() {
        return this.classes;
    }

    @Override
    public Map<String, Object> getProperties() {
        return this.properties;
    }

    static Application unwrap(final javax.ws.rs.core.Application application) {
        if (application instanceof Application) {
            return (Application) application;
        } else if (application instanceof ResourceConfig) {
            return (Application) ((ResourceConfig) application).getApplication();
        }
        Preconditions.checkNotNull(application, "Null application");
        throw new IllegalArgumentException("Invalid application class "
                + application.getClass().getName());
    }

    static Response newErrorResponse(final int status, final String message) {
        return Response.status(status).entity(message).type(TEXT_PLAIN_UTF8).build();
    }

    @Provider
    @PreMatching
    static final class Filter implements ContainerRequestFilter, ContainerResponseFilter {

        private static final Set<String> ROUTES = ImmutableSet.of(
                HttpMethod.GET + " " + Protocol.PATH_QUERY,
                HttpMethod.POST + " " + Protocol.PATH_QUERY);

        private static final String PROPERTY_START = "wikistore.start";

        @Override
        public void filter(final ContainerRequestContext request) throws IOException {
            Logging.enterRequestContext();
            request.setProperty(PROPERTY_START, System.nanoTime());

            final String method = request.getMethod();
            final UriInfo uri = request.getUriInfo();
            LOGGER.debug("Request {} {}, Accept: {}", method, uri.getRequestUri(),
                    request.getHeaderString(HttpHeaders.ACCEPT));

            if (!ROUTES.contains(method + " " + uri.getPath())) {
                request.abortWith(newErrorResponse(Status.NOT_FOUND.getStatusCode(), method
                        + " " + uri.getRequestUri().getPath()
                        + " is not supported by this server"));
            }
        }

        @Override
        public void filter(final ContainerRequestContext request,
                final ContainerResponseContext response) throws IOException {
            response.getHeaders().putSingle(Protocol.HEADER_SERVER, SERVER);
            try {
                final Object start = request.getProperty(PROPERTY_START);
                if (LOGGER.isDebugEnabled() && start instanceof Long) {
                    final long elapsed = (System.nanoTime() - (Long) start) / 1000000L;
                    LOGGER.debug("Response {} {} after {} ms", response.getStatus(),
                            response.hasEntity() ? response.getMediaType() : "(no body)",
                            elapsed);
                }
            } finally {
                Logging.leaveContext();
            }
        }

    }

    @Provider
    static final class Mapper implements ExceptionMapper<Throwable> {

        @Override
        public Response toResponse(final Throwable throwable) {

            final Throwable ex = throwable instanceof RuntimeException
                    && throwable.getCause() instanceof OperationException ? throwable.getCause()
                    : throwable;

            final int httpStatus;
            final String message;
            if (ex instanceof OperationException) {
                httpStatus = ((OperationException) ex).getStatus().getHTTPStatus();
                message = ex.getMessage();
            } else if (ex instanceof WebApplicationException) {
                httpStatus = ((WebApplicationException) ex).getResponse().getStatus();
                message = ex.getMessage();
            } else {
                httpStatus = Status.INTERNAL_SERVER_ERROR.getStatusCode();
                message = "Internal server error: " + ex.getMessage() + " ["
                        + ex.getClass().getSimpleName() + "]";
            }

            if (httpStatus >= 500) {
                LOGGER.error("Failing with " + httpStatus, ex);
            } else {
                LOGGER.debug("Rejecting with {}: {}", httpStatus, message);
            }

            return newErrorResponse(httpStatus, message == null ? "" : message);
        }

    }

}
