package eu.fbk.wikistore.server.http.jaxrs;

import java.nio.charset.StandardCharsets;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.wikistore.OperationException;
import eu.fbk.wikistore.OperationException.Status;

public class SparqlParametersTest {

    private static final byte[] EMPTY = new byte[0];

    @Test
    public void testGet() throws Throwable {
        final SparqlParameters parameters = SparqlParameters.forGet("query=SELECT%20*%20WHERE"
                + "+%7B%7D&default-graph-uri=http%3A%2F%2Fa&named-graph-uri=http%3A%2F%2Fb"
                + "&default-graph-uri=http%3A%2F%2Fc&other=x");
        Assert.assertEquals("SELECT * WHERE {}", parameters.getQuery());
        Assert.assertEquals(ImmutableList.of("http://a", "http://c"),
                parameters.getDefaultGraphs());
        Assert.assertEquals(ImmutableList.of("http://b"), parameters.getNamedGraphs());
    }

    @Test
    public void testGetMissingQuery() {
        assertFailure(null, null, null, Status.ERROR_INVALID_INPUT,
                "You should set the 'query' parameter");
        assertFailure("default-graph-uri=http%3A%2F%2Fa", null, null,
                Status.ERROR_INVALID_INPUT, "You should set the 'query' parameter");
    }

    @Test
    public void testGetMultipleQueries() {
        assertFailure("query=ASK%7B%7D&query=ASK%7B%7D", null, null, Status.ERROR_INVALID_INPUT,
                "Multiple query parameters provided");
    }

    @Test
    public void testPostDirect() throws Throwable {
        final SparqlParameters parameters = SparqlParameters.forPost(
                "named-graph-uri=http%3A%2F%2Fb", "application/sparql-query; charset=UTF-8",
                "ASK { ?s ?p \"è\" }".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals("ASK { ?s ?p \"è\" }", parameters.getQuery());
        Assert.assertEquals(ImmutableList.of(), parameters.getDefaultGraphs());
        Assert.assertEquals(ImmutableList.of("http://b"), parameters.getNamedGraphs());
    }

    @Test
    public void testPostDirectWithQueryInUrl() {
        assertFailure("query=ASK%7B%7D", "application/sparql-query",
                "ASK {}".getBytes(StandardCharsets.UTF_8), Status.ERROR_INVALID_INPUT,
                "Multiple query parameters provided");
    }

    @Test
    public void testPostForm() throws Throwable {
        final SparqlParameters parameters = SparqlParameters.forPost(null,
                "application/x-www-form-urlencoded",
                "query=ASK+%7B%7D&default-graph-uri=http%3A%2F%2Fa".getBytes(
                        StandardCharsets.UTF_8));
        Assert.assertEquals("ASK {}", parameters.getQuery());
        Assert.assertEquals(ImmutableList.of("http://a"), parameters.getDefaultGraphs());
    }

    @Test
    public void testPostContentTypes() {
        assertFailure(null, null, EMPTY, Status.ERROR_INVALID_INPUT, "No Content-Type given");
        assertFailure(null, "text/plain", EMPTY, Status.ERROR_UNSUPPORTED_MEDIA_TYPE,
                "Not supported Content-Type given: text/plain");
        assertFailure(null, "not a type", EMPTY, Status.ERROR_UNSUPPORTED_MEDIA_TYPE,
                "Not supported Content-Type given: not a type");
    }

    private static void assertFailure(final String queryString, final String contentType,
            final byte[] body, final Status status, final String message) {
        try {
            if (body == null) {
                SparqlParameters.forGet(queryString);
            } else {
                SparqlParameters.forPost(queryString, contentType, body);
            }
            Assert.fail();
        } catch (final OperationException ex) {
            Assert.assertEquals(status, ex.getStatus());
            Assert.assertEquals(message, ex.getMessage());
        }
    }

}
