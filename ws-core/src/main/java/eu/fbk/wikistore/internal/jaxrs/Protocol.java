package eu.fbk.wikistore.internal.jaxrs;

public final class Protocol {

    // MIME types

    public static final String MIME_TYPE_SPARQL_QUERY = "application/sparql-query";

    public static final String MIME_TYPE_FORM = "application/x-www-form-urlencoded";

    public static final String MIME_TYPES_RDF = "" //
            + "application/n-triples," //
            + "text/turtle," //
            + "application/rdf+xml";

    public static final String MIME_TYPES_SPARQL_TUPLE = "" //
            + "application/sparql-results+xml," //
            + "application/sparql-results+json," //
            + "text/csv," //
            + "text/tab-separated-values";

    public static final String MIME_TYPES_SPARQL_BOOLEAN = MIME_TYPES_SPARQL_TUPLE;

    // Paths

    public static final String PATH_QUERY = "query";

    // Parameters

    public static final String PARAMETER_QUERY = "query";

    public static final String PARAMETER_DEFAULT_GRAPH = "default-graph-uri";

    public static final String PARAMETER_NAMED_GRAPH = "named-graph-uri";

    // Headers

    public static final String HEADER_SERVER = "Server";

    // Limits

    /** Maximum number of bytes read from a request body; further bytes are ignored. */
    public static final int MAX_BODY_SIZE = 1024 * 1024;

    private Protocol() {
    }

}
