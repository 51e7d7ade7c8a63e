package eu.fbk.wikistore.server.http.jaxrs;

import java.nio.charset.StandardCharsets;

import com.google.common.collect.ImmutableList;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

import eu.fbk.wikistore.OperationException;
import eu.fbk.wikistore.OperationException.Status;
import eu.fbk.wikistore.data.Iri;
import eu.fbk.wikistore.data.SparqlQuery;
import eu.fbk.wikistore.data.SparqlQuery.Form;
import eu.fbk.wikistore.triplestore.RepositoryTripleStore;
import eu.fbk.wikistore.triplestore.TripleStore;
import eu.fbk.wikistore.triplestore.TripleTransaction;

public class QueryGatewayTest {

    private static final ValueFactory FACTORY = ValueFactoryImpl.getInstance();

    private static final URI G1 = FACTORY.createURI("http://example.com/g1");

    private static final URI G2 = FACTORY.createURI("http://example.com/g2");

    private TripleStore store;

    private QueryGateway gateway;

    @Before
    public void setUp() throws Throwable {
        this.store = RepositoryTripleStore.newMemoryStore();
        this.store.init();
        final URI s = FACTORY.createURI("http://example.com/s");
        final URI p = FACTORY.createURI("http://example.com/p");
        final TripleTransaction tx = this.store.begin(false);
        tx.add(ImmutableList.of(FACTORY.createStatement(s, p, FACTORY.createLiteral("one"), G1),
                FACTORY.createStatement(s, p, FACTORY.createLiteral("two"), G2)));
        tx.end(true);
        this.gateway = new QueryGateway(this.store);
    }

    @After
    public void tearDown() {
        this.store.close();
    }

    @Test
    public void testSelect() throws Throwable {
        final SparqlQuery query = prepare(
                "query=SELECT+%3Fo+WHERE+%7B+GRAPH+%3Fg+%7B+%3Fs+%3Fp+%3Fo+%7D+%7D");
        Assert.assertEquals(Form.SOLUTIONS, query.getForm());
        final QueryGateway.Output output = this.gateway.execute(query,
                "application/sparql-results+xml");
        Assert.assertEquals("application/sparql-results+xml", output.getMimeType());
        final String content = new String(output.getContent(), StandardCharsets.UTF_8);
        Assert.assertTrue(content.contains("one"));
        Assert.assertTrue(content.contains("two"));
    }

    @Test
    public void testAskAsCsv() throws Throwable {
        final SparqlQuery query = prepare(
                "query=ASK+%7B+GRAPH+%3Fg+%7B+%3Fs+%3Fp+%22one%22+%7D+%7D");
        final QueryGateway.Output csv = this.gateway.execute(query, "text/csv");
        Assert.assertEquals("true", new String(csv.getContent(), StandardCharsets.UTF_8));
    }

    @Test
    public void testMimeTypes() {
        Assert.assertEquals(ImmutableList.of("application/n-triples", "text/turtle",
                "application/rdf+xml"), QueryGateway.getMimeTypes(Form.GRAPH));
        Assert.assertEquals("application/sparql-results+xml",
                QueryGateway.getMimeTypes(Form.SOLUTIONS).get(0));
        Assert.assertEquals(QueryGateway.getMimeTypes(Form.SOLUTIONS),
                QueryGateway.getMimeTypes(Form.BOOLEAN));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMimeTypeNotMatchingForm() throws Throwable {
        this.gateway.execute(prepare("query=ASK+%7B%7D"), "text/turtle");
    }

    @Test
    public void testConstruct() throws Throwable {
        final SparqlQuery query = prepare("query=CONSTRUCT+%7B+%3Fs+%3Fp+%3Fo+%7D+"
                + "WHERE+%7B+GRAPH+%3Fg+%7B+%3Fs+%3Fp+%3Fo+%7D+%7D");
        Assert.assertEquals(Form.GRAPH, query.getForm());
        final String turtle = new String(this.gateway.execute(query, "text/turtle")
                .getContent(), StandardCharsets.UTF_8);
        Assert.assertTrue(turtle.contains("\"one\""));
    }

    @Test
    public void testDatasetOverride() throws Throwable {
        final String query = "query=SELECT+%3Fo+FROM+%3Chttp%3A%2F%2Fexample.com%2Fg1%3E+"
                + "WHERE+%7B+%3Fs+%3Fp+%3Fo+%7D";
        final String own = new String(this.gateway.execute(prepare(query), "text/csv")
                .getContent(), StandardCharsets.UTF_8);
        Assert.assertTrue(own.contains("one"));
        Assert.assertFalse(own.contains("two"));
        final SparqlQuery override = prepare(query
                + "&default-graph-uri=http%3A%2F%2Fexample.com%2Fg2");
        Assert.assertEquals(ImmutableList.of(Iri.parse("http://example.com/g2")),
                override.getDefaultGraphs());
        final String overridden = new String(this.gateway.execute(override, "text/csv")
                .getContent(), StandardCharsets.UTF_8);
        Assert.assertFalse(overridden.contains("one"));
        Assert.assertTrue(overridden.contains("two"));
    }

    @Test
    public void testInvalidInput() throws Throwable {
        for (final String query : new String[] { "query=SELECT", "query=ASK+%7B%7D"
                + "&named-graph-uri=not%20an%20iri" }) {
            try {
                prepare(query);
                Assert.fail("Accepted: " + query);
            } catch (final OperationException ex) {
                Assert.assertEquals(Status.ERROR_INVALID_INPUT, ex.getStatus());
            }
        }
    }

    private SparqlQuery prepare(final String queryString) throws OperationException {
        return this.gateway.prepare(SparqlParameters.forGet(queryString));
    }

}
