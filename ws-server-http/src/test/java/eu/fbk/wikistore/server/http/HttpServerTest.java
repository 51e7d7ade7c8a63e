package eu.fbk.wikistore.server.http;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.collect.ImmutableList;
import com.google.common.net.HttpHeaders;

import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.util.EntityUtils;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

import eu.fbk.wikistore.internal.jaxrs.Protocol;
import eu.fbk.wikistore.server.http.jaxrs.QueryGateway;
import eu.fbk.wikistore.triplestore.RepositoryTripleStore;
import eu.fbk.wikistore.triplestore.SynchronizedTripleStore;
import eu.fbk.wikistore.triplestore.TripleStore;
import eu.fbk.wikistore.triplestore.TripleTransaction;

public class HttpServerTest {

    private static final String ASK = "ASK { GRAPH ?g { ?s ?p \"one\" } }";

    private TripleStore store;

    private HttpServer server;

    private CloseableHttpClient client;

    private String base;

    @Before
    public void setUp() throws Throwable {
        this.store = new SynchronizedTripleStore(RepositoryTripleStore.newMemoryStore(), "8:CX");
        this.store.init();
        final ValueFactory factory = ValueFactoryImpl.getInstance();
        final URI s = factory.createURI("http://example.com/s");
        final TripleTransaction tx = this.store.begin(false);
        tx.add(ImmutableList.of(factory.createStatement(s, s, factory.createLiteral("one"),
                factory.createURI("http://example.com/g"))));
        tx.end(true);

        this.server = HttpServer.builder(new QueryGateway(this.store)).host("localhost")
                .port(0).threads(4).build();
        this.server.init();
        this.base = "http://localhost:" + this.server.getPort();
        this.client = HttpClients.createDefault();
    }

    @After
    public void tearDown() throws Throwable {
        this.client.close();
        this.server.close();
        this.store.close();
    }

    @Test
    public void testGet() throws Throwable {
        final HttpGet request = new HttpGet(this.base + "/query?query=ASK+%7B+GRAPH+%3Fg+"
                + "%7B+%3Fs+%3Fp+%22one%22+%7D+%7D");
        request.setHeader(HttpHeaders.ACCEPT, "text/csv");
        final Reply reply = send(request);
        Assert.assertEquals(200, reply.status);
        Assert.assertEquals("true", reply.body);
        Assert.assertTrue(reply.contentType.startsWith("text/csv"));
        Assert.assertTrue(reply.server.startsWith("Wikistore/"));
    }

    @Test
    public void testPostDirect() throws Throwable {
        final HttpPost request = new HttpPost(this.base + "/query");
        request.setEntity(new StringEntity(ASK, ContentType.create("application/sparql-query",
                StandardCharsets.UTF_8)));
        request.setHeader(HttpHeaders.ACCEPT, "application/sparql-results+json");
        final Reply reply = send(request);
        Assert.assertEquals(200, reply.status);
        Assert.assertTrue(reply.contentType.startsWith("application/sparql-results+json"));
        Assert.assertTrue(reply.body.contains("true"));
    }

    @Test
    public void testPostForm() throws Throwable {
        final HttpPost request = new HttpPost(this.base + "/query");
        request.setEntity(new StringEntity("query=SELECT+%3Fo+WHERE+%7B+GRAPH+%3Fg+%7B+%3Fs+"
                + "%3Fp+%3Fo+%7D+%7D", ContentType.APPLICATION_FORM_URLENCODED));
        request.setHeader(HttpHeaders.ACCEPT, "text/tab-separated-values");
        final Reply reply = send(request);
        Assert.assertEquals(200, reply.status);
        Assert.assertTrue(reply.body.contains("\"one\""));
    }

    @Test
    public void testNegotiation() throws Throwable {
        final String ask = this.base + "/query?query=ASK+%7B%7D";
        final String construct = this.base + "/query?query=CONSTRUCT+%7B+%3Fs+%3Fp+%3Fo+%7D+"
                + "WHERE+%7B+GRAPH+%3Fg+%7B+%3Fs+%3Fp+%3Fo+%7D+%7D";

        Reply reply = send(new HttpGet(ask));
        Assert.assertEquals(200, reply.status);
        Assert.assertTrue(reply.contentType.startsWith("application/sparql-results+xml"));

        reply = send(get(ask, "text/html;q=0.9, application/sparql-results+json"));
        Assert.assertTrue(reply.contentType.startsWith("application/sparql-results+json"));

        reply = send(get(construct, "text/*"));
        Assert.assertEquals(200, reply.status);
        Assert.assertTrue(reply.contentType.startsWith("text/turtle"));
        Assert.assertTrue(reply.body.contains("\"one\""));

        reply = send(get(construct, "application/rdf+xml;q=0.5, application/n-triples;q=0.2"));
        Assert.assertTrue(reply.contentType.startsWith("application/rdf+xml"));

        reply = send(get(ask, "text/turtle"));
        Assert.assertEquals(406, reply.status);

        reply = send(get(construct, "text/turtle;q=NaN"));
        Assert.assertEquals(400, reply.status);
    }

    @Test
    public void testBodyTruncated() throws Throwable {
        final StringBuilder builder = new StringBuilder("ASK {}\n#");
        while (builder.length() < Protocol.MAX_BODY_SIZE + 1024) {
            builder.append("xxxxxxxxxxxxxxxxxxxxxxxxxxxxxxx");
        }
        builder.append("\nthis tail is not valid SPARQL {");
        final HttpPost request = new HttpPost(this.base + "/query");
        request.setEntity(new StringEntity(builder.toString(), ContentType.create(
                "application/sparql-query", StandardCharsets.UTF_8)));
        request.setHeader(HttpHeaders.ACCEPT, "text/csv");
        final Reply reply = send(request);
        Assert.assertEquals(200, reply.status);
        Assert.assertEquals("true", reply.body);
        Assert.assertTrue(reply.server.startsWith("Wikistore/"));
    }

    @Test
    public void testErrors() throws Throwable {
        Reply reply = send(new HttpGet(this.base + "/sparql"));
        Assert.assertEquals(404, reply.status);
        Assert.assertEquals("GET /sparql is not supported by this server", reply.body);
        Assert.assertTrue(reply.server.startsWith("Wikistore/"));

        reply = send(new HttpPut(this.base + "/query"));
        Assert.assertEquals(404, reply.status);
        Assert.assertEquals("PUT /query is not supported by this server", reply.body);

        reply = send(new HttpGet(this.base + "/query"));
        Assert.assertEquals(400, reply.status);
        Assert.assertEquals("You should set the 'query' parameter", reply.body);

        HttpPost post = new HttpPost(this.base + "/query");
        post.setEntity(new ByteArrayEntity(ASK.getBytes(StandardCharsets.UTF_8)));
        reply = send(post);
        Assert.assertEquals(400, reply.status);
        Assert.assertEquals("No Content-Type given", reply.body);

        post = new HttpPost(this.base + "/query");
        post.setEntity(new StringEntity(ASK, ContentType.TEXT_PLAIN));
        reply = send(post);
        Assert.assertEquals(415, reply.status);
        Assert.assertTrue(reply.body.startsWith("Not supported Content-Type given: text/plain"));

        final HttpGet get = new HttpGet(this.base + "/query?query=ASK+%7B%7D");
        get.setHeader(HttpHeaders.ACCEPT, "text/turtle");
        reply = send(get);
        Assert.assertEquals(406, reply.status);

        reply = send(new HttpGet(this.base + "/query?query=SELEKT"));
        Assert.assertEquals(400, reply.status);
    }

    private static HttpGet get(final String uri, final String accept) {
        final HttpGet request = new HttpGet(uri);
        request.setHeader(HttpHeaders.ACCEPT, accept);
        return request;
    }

    private Reply send(final HttpUriRequest request) throws IOException {
        final HttpResponse response = this.client.execute(request);
        final Reply reply = new Reply();
        reply.status = response.getStatusLine().getStatusCode();
        reply.body = response.getEntity() == null ? "" : EntityUtils.toString(
                response.getEntity(), StandardCharsets.UTF_8);
        reply.contentType = response.getFirstHeader(HttpHeaders.CONTENT_TYPE) == null ? ""
                : response.getFirstHeader(HttpHeaders.CONTENT_TYPE).getValue();
        reply.server = response.getFirstHeader(HttpHeaders.SERVER) == null ? "" : response
                .getFirstHeader(HttpHeaders.SERVER).getValue();
        return reply;
    }

    private static final class Reply {

        int status;

        String body;

        String contentType;

        String server;

    }

}
