package eu.fbk.wikistore.data;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import org.openrdf.model.URI;
import org.openrdf.query.Dataset;
import org.openrdf.query.MalformedQueryException;
import org.openrdf.query.QueryLanguage;
import org.openrdf.query.parser.ParsedBooleanQuery;
import org.openrdf.query.parser.ParsedGraphQuery;
import org.openrdf.query.parser.ParsedQuery;
import org.openrdf.query.parser.ParsedTupleQuery;
import org.openrdf.query.parser.QueryParserUtil;

/**
 * A parsed SPARQL query, together with its dataset scope.
 * <p>
 * A {@code SparqlQuery} is obtained by parsing a SPARQL query string with {@link #parse(String)},
 * which detects the query {@link Form} and initializes the default and named graph lists from the
 * {@code FROM} and {@code FROM NAMED} clauses of the query. Both lists are mutable and can be
 * overwritten after parsing, e.g., with the graphs supplied by the SPARQL protocol parameters
 * {@code default-graph-uri} and {@code named-graph-uri}. When both lists are empty, the query is
 * evaluated against the default dataset of the store (all the graphs).
 * </p>
 * <p>
 * Instances are not thread safe.
 * </p>
 */
public final class SparqlQuery {

    private final String string;

    private final Form form;

    private final List<Iri> defaultGraphs;

    private final List<Iri> namedGraphs;

    private SparqlQuery(final String string, final Form form, final List<Iri> defaultGraphs,
            final List<Iri> namedGraphs) {
        this.string = string;
        this.form = form;
        this.defaultGraphs = defaultGraphs;
        this.namedGraphs = namedGraphs;
    }

    /**
     * Parses the supplied SPARQL query string.
     *
     * @param string
     *            the query string, without relative IRIs
     * @return the parsed query
     * @throws ParseException
     *             if the string is not a valid SPARQL query
     */
    public static SparqlQuery parse(final String string) throws ParseException {

        Preconditions.checkNotNull(string);

        final ParsedQuery parsedQuery;
        try {
            parsedQuery = QueryParserUtil.parseQuery(QueryLanguage.SPARQL, string, null);
        } catch (final MalformedQueryException ex) {
            throw new ParseException(string, "Invalid SPARQL query: " + ex.getMessage(), ex);
        }

        final Form form;
        if (parsedQuery instanceof ParsedTupleQuery) {
            form = Form.SOLUTIONS;
        } else if (parsedQuery instanceof ParsedGraphQuery) {
            form = Form.GRAPH;
        } else if (parsedQuery instanceof ParsedBooleanQuery) {
            form = Form.BOOLEAN;
        } else {
            throw new ParseException(string, "Unsupported SPARQL query form");
        }

        final List<Iri> defaultGraphs = Lists.newArrayList();
        final List<Iri> namedGraphs = Lists.newArrayList();
        final Dataset dataset = parsedQuery.getDataset();
        if (dataset != null) {
            for (final URI graph : dataset.getDefaultGraphs()) {
                defaultGraphs.add(Iri.valueOf(graph));
            }
            for (final URI graph : dataset.getNamedGraphs()) {
                namedGraphs.add(Iri.valueOf(graph));
            }
        }

        return new SparqlQuery(string, form, defaultGraphs, namedGraphs);
    }

    /**
     * Returns the query string, as supplied at parsing time.
     *
     * @return the query string
     */
    public String getString() {
        return this.string;
    }

    /**
     * Returns the form of the query, which determines the kind of {@link QueryResult} it
     * produces.
     *
     * @return the query form
     */
    public Form getForm() {
        return this.form;
    }

    /**
     * Returns the mutable list of graphs whose merge is the default graph of the query dataset.
     *
     * @return the default graphs list
     */
    public List<Iri> getDefaultGraphs() {
        return this.defaultGraphs;
    }

    /**
     * Returns the mutable list of named graphs of the query dataset.
     *
     * @return the named graphs list
     */
    public List<Iri> getNamedGraphs() {
        return this.namedGraphs;
    }

    /**
     * Returns whether an explicit dataset is associated to the query, i.e., whether at least one
     * of the default and named graphs lists is not empty.
     *
     * @return true if an explicit dataset is defined
     */
    public boolean hasDataset() {
        return !this.defaultGraphs.isEmpty() || !this.namedGraphs.isEmpty();
    }

    @Override
    public String toString() {
        return this.string;
    }

    /**
     * The form of a SPARQL query, grouping query types producing the same kind of result.
     */
    public enum Form {

        /** CONSTRUCT and DESCRIBE queries, producing RDF statements. */
        GRAPH,

        /** SELECT queries, producing a sequence of variable bindings. */
        SOLUTIONS,

        /** ASK queries, producing a boolean. */
        BOOLEAN

    }

}
