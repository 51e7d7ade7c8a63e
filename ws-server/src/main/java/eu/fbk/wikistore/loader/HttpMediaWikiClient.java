package eu.fbk.wikistore.loader;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.net.HttpHeaders;

import org.apache.http.HttpEntity;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.openrdf.model.Model;
import org.openrdf.model.Statement;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.Rio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.wikistore.internal.Util;

/**
 * {@code MediaWikiClient} implementation based on Apache HttpClient, decoding API responses with
 * Jackson and entity data with the Sesame N-Triples parser.
 */
public final class HttpMediaWikiClient implements MediaWikiClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpMediaWikiClient.class);

    private static final String USER_AGENT = String.format("Wikistore/%s Apache-HttpClient/%s",
            Util.getVersion("eu.fbk.wikistore", "ws-server", "devel"),
            Util.getVersion("org.apache.httpcomponents", "httpclient", "unknown"));

    private static final int DEFAULT_CONNECTION_TIMEOUT = 60000; // ms

    private static final int DEFAULT_SOCKET_TIMEOUT = 300000; // ms

    private static final int MAX_CONNECTIONS = 4;

    private final String apiUrl;

    private final String baseUrl;

    private final CloseableHttpClient client;

    private final ObjectMapper mapper;

    public HttpMediaWikiClient(final String apiUrl, final String baseUrl) {
        this.apiUrl = Preconditions.checkNotNull(apiUrl);
        this.baseUrl = Preconditions.checkNotNull(baseUrl);
        this.mapper = new ObjectMapper();

        final PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(MAX_CONNECTIONS);
        manager.setDefaultMaxPerRoute(MAX_CONNECTIONS);
        manager.setValidateAfterInactivity(1000);

        final RequestConfig config = RequestConfig.custom()
                .setConnectionRequestTimeout(DEFAULT_CONNECTION_TIMEOUT)
                .setConnectTimeout(DEFAULT_CONNECTION_TIMEOUT)
                .setSocketTimeout(DEFAULT_SOCKET_TIMEOUT).setRedirectsEnabled(true).build();

        this.client = HttpClients.custom().setConnectionManager(manager)
                .setDefaultRequestConfig(config).setUserAgent(USER_AGENT).build();
    }

    @Override
    public Batch listPages(final int namespace, @Nullable final String slot,
            @Nullable final Map<String, String> continuation) throws IOException {
        final List<Page> pages = Lists.newArrayList();
        final URIBuilder builder = newApiRequest(continuation);
        if (slot == null) {
            builder.addParameter("list", "allpages");
            builder.addParameter("apnamespace", Integer.toString(namespace));
            builder.addParameter("aplimit", "max");
            final JsonNode json = invoke(builder);
            for (final JsonNode node : json.path("query").path("allpages")) {
                pages.add(new Page(node.path("title").asText(), node.path("pageid").asLong(),
                        null));
            }
            return new Batch(pages, getContinuation(json));
        }

        // Pages lacking the slot report it as missing (or omit it) in their latest revision
        builder.addParameter("generator", "allpages");
        builder.addParameter("gapnamespace", Integer.toString(namespace));
        builder.addParameter("gaplimit", "max");
        builder.addParameter("prop", "revisions");
        builder.addParameter("rvprop", "ids|contentmodel");
        builder.addParameter("rvslots", slot);
        builder.addParameter("formatversion", "2");
        final JsonNode json = invoke(builder);
        for (final JsonNode node : json.path("query").path("pages")) {
            final JsonNode content = node.path("revisions").path(0).path("slots").path(slot);
            if (!content.isMissingNode() && !content.path("missing").asBoolean(false)) {
                pages.add(new Page(node.path("title").asText(), node.path("pageid").asLong(),
                        null));
            }
        }
        return new Batch(pages, getContinuation(json));
    }

    @Override
    public Batch listChanges(final Date since, final List<Integer> namespaces,
            @Nullable final String slot, @Nullable final Map<String, String> continuation)
            throws IOException {
        final URIBuilder builder = newApiRequest(continuation);
        builder.addParameter("list", "recentchanges");
        builder.addParameter("rcdir", "newer");
        builder.addParameter("rcstart", formatTimestamp(since));
        if (slot != null) {
            builder.addParameter("rcslot", slot);
        } else {
            builder.addParameter("rcnamespace", Joiner.on('|').join(namespaces));
        }
        builder.addParameter("rcprop", "title|ids|timestamp");
        builder.addParameter("rclimit", "max");
        final JsonNode json = invoke(builder);
        final List<Page> pages = Lists.newArrayList();
        for (final JsonNode node : json.path("query").path("recentchanges")) {
            final String timestamp = node.path("timestamp").asText(null);
            pages.add(new Page(node.path("title").asText(), node.path("pageid").asLong(),
                    timestamp == null ? null : parseTimestamp(timestamp)));
        }
        return new Batch(pages, getContinuation(json));
    }

    @Override
    @Nullable
    public List<Statement> fetchEntity(final String entityId) throws IOException {
        final String url = this.baseUrl + "Special:EntityData/" + entityId + ".nt?flavor=dump";
        final HttpGet request = new HttpGet(url);
        request.setHeader(HttpHeaders.ACCEPT, RDFFormat.NTRIPLES.getDefaultMIMEType());
        try (CloseableHttpResponse response = this.client.execute(request)) {
            final int status = response.getStatusLine().getStatusCode();
            final HttpEntity entity = response.getEntity();
            if (status == HttpStatus.SC_NOT_FOUND) {
                EntityUtils.consumeQuietly(entity);
                LOGGER.debug("Entity {} not found", entityId);
                return null;
            }
            checkStatus(url, response);
            try (InputStream stream = entity.getContent()) {
                final Model model = Rio.parse(stream, url, RDFFormat.NTRIPLES);
                return ImmutableList.copyOf(model);
            } catch (final RDFParseException ex) {
                throw new IOException("Invalid N-Triples data for entity " + entityId + ": "
                        + ex.getMessage(), ex);
            }
        }
    }

    @Override
    public void close() {
        Util.closeQuietly(this.client);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("api", this.apiUrl)
                .add("base", this.baseUrl).toString();
    }

    private URIBuilder newApiRequest(@Nullable final Map<String, String> continuation)
            throws IOException {
        final URIBuilder builder;
        try {
            builder = new URIBuilder(this.apiUrl);
        } catch (final URISyntaxException ex) {
            throw new IOException("Invalid MediaWiki API URL " + this.apiUrl, ex);
        }
        builder.addParameter("action", "query");
        builder.addParameter("format", "json");
        if (continuation == null) {
            builder.addParameter("continue", "");
        } else {
            for (final Map.Entry<String, String> entry : continuation.entrySet()) {
                builder.addParameter(entry.getKey(), entry.getValue());
            }
        }
        return builder;
    }

    private JsonNode invoke(final URIBuilder builder) throws IOException {
        final URI uri;
        try {
            uri = builder.build();
        } catch (final URISyntaxException ex) {
            throw new IOException("Cannot build MediaWiki API request", ex);
        }
        final long ts = System.currentTimeMillis();
        final JsonNode json;
        try (CloseableHttpResponse response = this.client.execute(new HttpGet(uri))) {
            checkStatus(uri.toString(), response);
            try (InputStream stream = response.getEntity().getContent()) {
                json = this.mapper.readTree(stream);
            }
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("GET {} done in {} ms", uri, System.currentTimeMillis() - ts);
        }
        final JsonNode error = json.get("error");
        if (error != null) {
            throw new IOException("MediaWiki API error " + error.path("code").asText() + ": "
                    + error.path("info").asText());
        }
        return json;
    }

    private static void checkStatus(final String url, final CloseableHttpResponse response)
            throws IOException {
        final int status = response.getStatusLine().getStatusCode();
        if (status != HttpStatus.SC_OK) {
            EntityUtils.consumeQuietly(response.getEntity());
            throw new IOException("GET " + url + " failed: " + response.getStatusLine());
        }
    }

    @Nullable
    private static Map<String, String> getContinuation(final JsonNode json) {
        final JsonNode node = json.get("continue");
        if (node == null || !node.isObject()) {
            return null;
        }
        final Map<String, String> continuation = Maps.newLinkedHashMap();
        final Iterator<Map.Entry<String, JsonNode>> i = node.fields();
        while (i.hasNext()) {
            final Map.Entry<String, JsonNode> entry = i.next();
            continuation.put(entry.getKey(), entry.getValue().asText());
        }
        return continuation;
    }

    static String formatTimestamp(final Date date) {
        return newTimestampFormat().format(date);
    }

    static Date parseTimestamp(final String string) throws IOException {
        try {
            return newTimestampFormat().parse(string);
        } catch (final java.text.ParseException ex) {
            throw new IOException("Invalid MediaWiki timestamp " + string, ex);
        }
    }

    private static DateFormat newTimestampFormat() {
        final SimpleDateFormat format = new SimpleDateFormat("yyyy-MM-dd'T'HH:mm:ss'Z'");
        format.setTimeZone(TimeZone.getTimeZone("UTC"));
        return format;
    }

}
