package eu.fbk.wikistore.server.http.jaxrs;

import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.net.MediaType;

import org.apache.http.NameValuePair;
import org.apache.http.client.utils.URLEncodedUtils;

import eu.fbk.wikistore.OperationException;
import eu.fbk.wikistore.OperationException.Status;
import eu.fbk.wikistore.internal.jaxrs.Protocol;

/**
 * The parameters of a SPARQL protocol query request: the query string and the optional default
 * and named graph IRIs, in arrival order.
 * <p>
 * Parameters are extracted from the URL query string for GET requests, and from either the body
 * ({@code application/sparql-query}, plus graphs in the URL) or the form-encoded body
 * ({@code application/x-www-form-urlencoded}) for POST requests. Graph IRIs are returned as
 * supplied, without validation. Unknown parameters are ignored.
 * </p>
 */
public final class SparqlParameters {

    private static final MediaType SPARQL_QUERY = MediaType.parse(Protocol.MIME_TYPE_SPARQL_QUERY);

    private static final MediaType FORM = MediaType.parse(Protocol.MIME_TYPE_FORM);

    private final String query;

    private final List<String> defaultGraphs;

    private final List<String> namedGraphs;

    private SparqlParameters(final String query, final List<String> defaultGraphs,
            final List<String> namedGraphs) {
        this.query = query;
        this.defaultGraphs = defaultGraphs;
        this.namedGraphs = namedGraphs;
    }

    /**
     * Extracts the parameters of a GET request.
     *
     * @param rawQueryString
     *            the raw (percent encoded) URL query string, null if missing
     * @return the extracted parameters
     * @throws OperationException
     *             with status 400 if the query is missing or supplied multiple times
     */
    public static SparqlParameters forGet(@Nullable final String rawQueryString)
            throws OperationException {
        final Builder builder = new Builder();
        builder.addAll(rawQueryString);
        return builder.build();
    }

    /**
     * Extracts the parameters of a POST request.
     *
     * @param rawQueryString
     *            the raw (percent encoded) URL query string, null if missing
     * @param contentType
     *            the request content type, null if missing
     * @param body
     *            the request body
     * @return the extracted parameters
     * @throws OperationException
     *             with status 415 for an unsupported content type, status 400 if the content type
     *             is missing or the query is missing or supplied multiple times
     */
    public static SparqlParameters forPost(@Nullable final String rawQueryString,
            @Nullable final String contentType, final byte[] body) throws OperationException {

        if (Strings.isNullOrEmpty(contentType)) {
            throw new OperationException(Status.ERROR_INVALID_INPUT, "No Content-Type given");
        }

        MediaType type;
        try {
            type = MediaType.parse(contentType.trim()).withoutParameters();
        } catch (final IllegalArgumentException ex) {
            type = null;
        }

        final Builder builder = new Builder();
        if (SPARQL_QUERY.equals(type)) {
            builder.addAll(rawQueryString);
            builder.setQuery(new String(body, StandardCharsets.UTF_8));
        } else if (FORM.equals(type)) {
            builder.addAll(new String(body, StandardCharsets.UTF_8));
        } else {
            throw new OperationException(Status.ERROR_UNSUPPORTED_MEDIA_TYPE,
                    "Not supported Content-Type given: " + contentType);
        }
        return builder.build();
    }

    public String getQuery() {
        return this.query;
    }

    public List<String> getDefaultGraphs() {
        return this.defaultGraphs;
    }

    public List<String> getNamedGraphs() {
        return this.namedGraphs;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("query", this.query)
                .add("default", this.defaultGraphs).add("named", this.namedGraphs).toString();
    }

    private static final class Builder {

        @Nullable
        private String query;

        private final ImmutableList.Builder<String> defaultGraphs = ImmutableList.builder();

        private final ImmutableList.Builder<String> namedGraphs = ImmutableList.builder();

        void addAll(@Nullable final String encoded) throws OperationException {
            if (Strings.isNullOrEmpty(encoded)) {
                return;
            }
            for (final NameValuePair pair : URLEncodedUtils.parse(encoded,
                    StandardCharsets.UTF_8)) {
                final String value = Strings.nullToEmpty(pair.getValue());
                if (Protocol.PARAMETER_QUERY.equals(pair.getName())) {
                    setQuery(value);
                } else if (Protocol.PARAMETER_DEFAULT_GRAPH.equals(pair.getName())) {
                    this.defaultGraphs.add(value);
                } else if (Protocol.PARAMETER_NAMED_GRAPH.equals(pair.getName())) {
                    this.namedGraphs.add(value);
                }
            }
        }

        void setQuery(final String query) throws OperationException {
            if (this.query != null) {
                throw new OperationException(Status.ERROR_INVALID_INPUT,
                        "Multiple query parameters provided");
            }
            this.query = query;
        }

        SparqlParameters build() throws OperationException {
            if (this.query == null) {
                throw new OperationException(Status.ERROR_INVALID_INPUT,
                        "You should set the 'query' parameter");
            }
            return new SparqlParameters(this.query, this.defaultGraphs.build(),
                    this.namedGraphs.build());
        }

    }

}
