package eu.fbk.wikistore.server.http.jaxrs;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.wikistore.OperationException;
import eu.fbk.wikistore.OperationException.Status;
import eu.fbk.wikistore.data.Iri;
import eu.fbk.wikistore.data.ParseException;
import eu.fbk.wikistore.data.QueryResult;
import eu.fbk.wikistore.data.SparqlQuery;
import eu.fbk.wikistore.data.SparqlQuery.Form;
import eu.fbk.wikistore.internal.jaxrs.Protocol;
import eu.fbk.wikistore.triplestore.TripleStore;
import eu.fbk.wikistore.triplestore.TripleTransaction;

/**
 * Evaluates SPARQL protocol requests against a {@code TripleStore}, producing serialized results.
 * <p>
 * Request processing is split in two steps, so that the response MIME type can be negotiated in
 * between based on the query form: {@link #prepare(SparqlParameters)} parses the query and
 * replaces its dataset with the one supplied via protocol parameters (if any), while
 * {@link #execute(SparqlQuery, String)} evaluates the query in a read-only transaction and fully
 * serializes the result in the MIME type given.
 * </p>
 */
public final class QueryGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryGateway.class);

    private static final Map<Form, List<String>> MIME_TYPES = ImmutableMap.of(
            Form.GRAPH, split(Protocol.MIME_TYPES_RDF),
            Form.SOLUTIONS, split(Protocol.MIME_TYPES_SPARQL_TUPLE),
            Form.BOOLEAN, split(Protocol.MIME_TYPES_SPARQL_BOOLEAN));

    private final TripleStore store;

    public QueryGateway(final TripleStore store) {
        this.store = Preconditions.checkNotNull(store);
    }

    public TripleStore getStore() {
        return this.store;
    }

    /**
     * Returns the MIME types results of the query form specified can be serialized to, the
     * default one first.
     *
     * @param form
     *            the query form
     * @return the supported MIME types, in order of preference
     */
    public static List<String> getMimeTypes(final Form form) {
        return MIME_TYPES.get(Preconditions.checkNotNull(form));
    }

    /**
     * Parses the query of the request specified, applying the dataset given by protocol
     * parameters. When either the default or the named graph list of the request is non-empty,
     * both lists replace the ones of the query.
     *
     * @param parameters
     *            the request parameters
     * @return the parsed query, ready to be executed
     * @throws OperationException
     *             with status 400 if the query or a graph IRI is not valid
     */
    public SparqlQuery prepare(final SparqlParameters parameters) throws OperationException {

        final SparqlQuery query;
        try {
            query = SparqlQuery.parse(parameters.getQuery());
        } catch (final ParseException ex) {
            throw new OperationException(Status.ERROR_INVALID_INPUT, ex.getMessage(), ex);
        }

        final List<Iri> defaultGraphs = parseGraphs(parameters.getDefaultGraphs());
        final List<Iri> namedGraphs = parseGraphs(parameters.getNamedGraphs());
        if (!defaultGraphs.isEmpty() || !namedGraphs.isEmpty()) {
            query.getDefaultGraphs().clear();
            query.getDefaultGraphs().addAll(defaultGraphs);
            query.getNamedGraphs().clear();
            query.getNamedGraphs().addAll(namedGraphs);
        }
        return query;
    }

    /**
     * Evaluates a prepared query and serializes its result.
     *
     * @param query
     *            the query, as returned by {@link #prepare(SparqlParameters)}
     * @param mimeType
     *            the result MIME type, one of {@link #getMimeTypes(Form)} for the query form
     * @return the serialized result, with its MIME type
     * @throws OperationException
     *             with status 400 if the store rejects the query, 500 on store failures
     */
    public Output execute(final SparqlQuery query, final String mimeType)
            throws OperationException {

        Preconditions.checkArgument(getMimeTypes(query.getForm()).contains(mimeType),
                "Unsupported MIME type %s for %s query", mimeType, query.getForm());

        final QueryResult result;
        try {
            final TripleTransaction transaction = this.store.begin(true);
            try {
                result = transaction.query(query, null);
            } finally {
                transaction.end(false);
            }
        } catch (final UnsupportedOperationException ex) {
            throw new OperationException(Status.ERROR_INVALID_INPUT, "Query rejected: "
                    + ex.getMessage(), ex);
        } catch (final IOException ex) {
            throw new OperationException(Status.ERROR_UNEXPECTED, "Query evaluation failed: "
                    + ex.getMessage(), ex);
        }

        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            result.write(out, mimeType);
        } catch (final IOException ex) {
            throw new OperationException(Status.ERROR_UNEXPECTED, "Result serialization failed: "
                    + ex.getMessage(), ex);
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} query returned {} as {} ({} bytes)", query.getForm(), result,
                    mimeType, out.size());
        }
        return new Output(mimeType, out.toByteArray());
    }

    private static List<Iri> parseGraphs(final List<String> strings) throws OperationException {
        final List<Iri> graphs = Lists.newArrayListWithCapacity(strings.size());
        for (final String string : strings) {
            try {
                graphs.add(Iri.parse(string));
            } catch (final ParseException ex) {
                throw new OperationException(Status.ERROR_INVALID_INPUT, "Invalid graph IRI '"
                        + string + "': " + ex.getMessage(), ex);
            }
        }
        return graphs;
    }

    private static List<String> split(final String mimeTypes) {
        return ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings()
                .split(mimeTypes));
    }

    /**
     * A serialized query result.
     */
    public static final class Output {

        private final String mimeType;

        private final byte[] content;

        Output(final String mimeType, final byte[] content) {
            this.mimeType = mimeType;
            this.content = content;
        }

        public String getMimeType() {
            return this.mimeType;
        }

        public byte[] getContent() {
            return this.content;
        }

    }

}
