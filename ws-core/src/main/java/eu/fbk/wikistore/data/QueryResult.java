package eu.fbk.wikistore.data;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.net.MediaType;

import org.openrdf.model.Statement;
import org.openrdf.query.BindingSet;
import org.openrdf.query.QueryResultHandlerException;
import org.openrdf.query.resultio.BooleanQueryResultFormat;
import org.openrdf.query.resultio.BooleanQueryResultWriter;
import org.openrdf.query.resultio.QueryResultIO;
import org.openrdf.query.resultio.TupleQueryResultFormat;
import org.openrdf.rio.RDFFormat;

import eu.fbk.wikistore.internal.jaxrs.Protocol;
import eu.fbk.wikistore.internal.rdf.RDFUtil;

/**
 * The result of a SPARQL query: either a {@link Graph}, a sequence of {@link Solutions} or a
 * {@link Bool}ean.
 * <p>
 * Each kind of result declares the ordered list of MIME types it can be serialized to, via
 * {@link #getMimeTypes()}, and serializes itself with {@link #write(OutputStream, String)}. The
 * first MIME type of the list is the default one. No other subclasses of {@code QueryResult}
 * exist.
 * </p>
 */
public abstract class QueryResult {

    private QueryResult() {
    }

    /**
     * Returns the MIME types this result can be serialized to, in order of preference.
     *
     * @return an immutable list of MIME types, without parameters
     */
    public abstract List<String> getMimeTypes();

    /**
     * Serializes the result to the stream specified, using the MIME type specified.
     *
     * @param out
     *            the stream where to write the result, not closed by this method
     * @param mimeType
     *            one of the types returned by {@link #getMimeTypes()}; parameters are ignored
     * @throws IOException
     *             on failure
     */
    public abstract void write(OutputStream out, String mimeType) throws IOException;

    private static String essence(final String mimeType) {
        return MediaType.parse(mimeType).withoutParameters().toString();
    }

    private static List<String> split(final String mimeTypes) {
        return ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings()
                .split(mimeTypes));
    }

    public static final class Graph extends QueryResult {

        private static final List<String> MIME_TYPES = split(Protocol.MIME_TYPES_RDF);

        private static final Map<String, RDFFormat> FORMATS = ImmutableMap.of(
                "application/n-triples", RDFFormat.NTRIPLES, //
                "text/turtle", RDFFormat.TURTLE, //
                "application/rdf+xml", RDFFormat.RDFXML);

        private final Map<String, String> namespaces;

        private final List<Statement> statements;

        public Graph(final Map<String, String> namespaces, final List<Statement> statements) {
            this.namespaces = ImmutableMap.copyOf(namespaces);
            this.statements = ImmutableList.copyOf(statements);
        }

        public Map<String, String> getNamespaces() {
            return this.namespaces;
        }

        public List<Statement> getStatements() {
            return this.statements;
        }

        @Override
        public List<String> getMimeTypes() {
            return MIME_TYPES;
        }

        @Override
        public void write(final OutputStream out, final String mimeType) throws IOException {
            final RDFFormat format = FORMATS.get(essence(mimeType));
            Preconditions.checkArgument(format != null, "Unsupported MIME type %s", mimeType);
            RDFUtil.writeRDF(out, format, this.namespaces, this.statements);
        }

        @Override
        public String toString() {
            return this.statements.size() + " statements";
        }

    }

    public static final class Solutions extends QueryResult {

        private static final List<String> MIME_TYPES = split(Protocol.MIME_TYPES_SPARQL_TUPLE);

        private static final Map<String, TupleQueryResultFormat> FORMATS = ImmutableMap.of(
                "application/sparql-results+xml", TupleQueryResultFormat.SPARQL, //
                "application/sparql-results+json", TupleQueryResultFormat.JSON, //
                "text/csv", TupleQueryResultFormat.CSV, //
                "text/tab-separated-values", TupleQueryResultFormat.TSV);

        private final List<String> variables;

        private final List<BindingSet> tuples;

        public Solutions(final List<String> variables, final List<BindingSet> tuples) {
            this.variables = ImmutableList.copyOf(variables);
            this.tuples = ImmutableList.copyOf(tuples);
        }

        public List<String> getVariables() {
            return this.variables;
        }

        public List<BindingSet> getTuples() {
            return this.tuples;
        }

        @Override
        public List<String> getMimeTypes() {
            return MIME_TYPES;
        }

        @Override
        public void write(final OutputStream out, final String mimeType) throws IOException {
            final TupleQueryResultFormat format = FORMATS.get(essence(mimeType));
            Preconditions.checkArgument(format != null, "Unsupported MIME type %s", mimeType);
            RDFUtil.writeSparqlTuples(out, format, this.variables, this.tuples);
        }

        @Override
        public String toString() {
            return this.tuples.size() + " solutions";
        }

    }

    public static final class Bool extends QueryResult {

        private static final List<String> MIME_TYPES = split(Protocol.MIME_TYPES_SPARQL_BOOLEAN);

        private static final Map<String, BooleanQueryResultFormat> FORMATS = ImmutableMap.of(
                "application/sparql-results+xml", BooleanQueryResultFormat.SPARQL, //
                "application/sparql-results+json", BooleanQueryResultFormat.JSON);

        private final boolean value;

        public Bool(final boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return this.value;
        }

        @Override
        public List<String> getMimeTypes() {
            return MIME_TYPES;
        }

        @Override
        public void write(final OutputStream out, final String mimeType) throws IOException {
            final String essence = essence(mimeType);
            final BooleanQueryResultFormat format = FORMATS.get(essence);
            if (format != null) {
                final BooleanQueryResultWriter writer = QueryResultIO.createWriter(format, out);
                try {
                    writer.startDocument();
                    writer.startHeader();
                    writer.handleBoolean(this.value);
                } catch (final QueryResultHandlerException ex) {
                    throw new IOException("Cannot write boolean result in format "
                            + format.getName(), ex);
                }
            } else {
                // no standard CSV / TSV serialization for booleans
                Preconditions.checkArgument(MIME_TYPES.contains(essence),
                        "Unsupported MIME type %s", mimeType);
                out.write((this.value ? "true" : "false").getBytes(StandardCharsets.UTF_8));
            }
        }

        @Override
        public String toString() {
            return Boolean.toString(this.value);
        }

    }

}
