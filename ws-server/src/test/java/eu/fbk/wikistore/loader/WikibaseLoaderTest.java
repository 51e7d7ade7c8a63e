package eu.fbk.wikistore.loader;

import java.io.IOException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

import info.aduna.iteration.Iterations;

import eu.fbk.wikistore.triplestore.RepositoryTripleStore;
import eu.fbk.wikistore.triplestore.SynchronizedTripleStore;
import eu.fbk.wikistore.triplestore.TripleStore;
import eu.fbk.wikistore.triplestore.TripleTransaction;

public class WikibaseLoaderTest {

    private static final ValueFactory FACTORY = ValueFactoryImpl.getInstance();

    private static final String BASE_URL = "http://wiki.example.com/wiki/";

    private TripleStore store;

    private StubClient client;

    @Before
    public void setUp() throws Throwable {
        this.store = new SynchronizedTripleStore(RepositoryTripleStore.newMemoryStore(), "4:CX");
        this.store.init();
        this.client = new StubClient();
        this.client.pages.put(0, ImmutableList.of(page("Q1", 1), page("Q2", 2), page("Q3", 3)));
        this.client.pages.put(120, ImmutableList.of(page("Property:P1", 4)));
        this.client.entities.put("Q1", entity("Q1", 2));
        this.client.entities.put("Q2", entity("Q2", 1));
        this.client.entities.put("Q3", entity("Q3", 3));
        this.client.entities.put("P1", entity("P1", 1));
        this.client.entities.put("M7", entity("M7", 2));
    }

    @After
    public void tearDown() {
        this.store.close();
    }

    @Test
    public void testInitialLoading() throws Throwable {
        final WikibaseLoader loader = newLoader(ImmutableList.of(0, 120), null);
        final Date before = new Date();
        loader.initialLoading();
        Assert.assertEquals(2, count("Q1"));
        Assert.assertEquals(1, count("Q2"));
        Assert.assertEquals(3, count("Q3"));
        Assert.assertEquals(1, count("P1"));
        Assert.assertEquals(4, this.client.fetched.size());
        final Date cursor = loader.readCursor();
        Assert.assertNotNull(cursor);
        Assert.assertFalse(cursor.before(new Date(before.getTime() - 1000)));
    }

    @Test
    public void testDefaultNamespace() throws Throwable {
        final WikibaseLoader loader = newLoader(ImmutableList.<Integer>of(), null);
        Assert.assertEquals(ImmutableList.of(0), loader.getNamespaces());
        loader.initialLoading();
        Assert.assertEquals(0, count("P1"));
        Assert.assertEquals(3, count("Q3"));
    }

    @Test
    public void testInitialLoadingResumes() throws Throwable {
        newLoader(ImmutableList.of(0), null).initialLoading();
        this.client.fetched.clear();
        newLoader(ImmutableList.of(0), null).initialLoading();
        Assert.assertTrue(this.client.fetched.isEmpty());
    }

    @Test
    public void testSlotMode() throws Throwable {
        this.client.pages.put(6, ImmutableList.of(page("File:Example.jpg", 7)));
        this.client.slotPages.add(7L);
        final WikibaseLoader loader = newLoader(ImmutableList.<Integer>of(), "mediainfo");
        Assert.assertEquals(ImmutableList.of(6), loader.getNamespaces());
        loader.initialLoading();
        Assert.assertEquals(ImmutableList.of("M7"), this.client.fetched);
        Assert.assertEquals(2, count("M7"));
    }

    @Test
    public void testSlotRestrictsListing() throws Throwable {
        this.client.pages.put(6, ImmutableList.of(page("File:Example.jpg", 7),
                page("File:Plain.png", 8)));
        this.client.slotPages.add(7L);
        final WikibaseLoader loader = newLoader(ImmutableList.<Integer>of(), "mediainfo");
        loader.initialLoading();
        Assert.assertEquals(ImmutableList.of("M7"), this.client.fetched);
        Assert.assertEquals(0, count("M8"));

        this.client.changes.add(new MediaWikiClient.Page("File:Example.jpg", 7,
                new Date(System.currentTimeMillis() + 60000)));
        Assert.assertEquals(1, loader.update());
        Assert.assertEquals(ImmutableList.of("mediainfo"), this.client.pageSlots);
        Assert.assertEquals(ImmutableList.of("mediainfo"), this.client.changeSlots);
    }

    @Test
    public void testNoSlotByDefault() throws Throwable {
        final WikibaseLoader loader = newLoader(ImmutableList.of(0), null);
        loader.initialLoading();
        loader.update();
        Assert.assertEquals(Lists.newArrayList((String) null), this.client.pageSlots);
        Assert.assertEquals(Lists.newArrayList((String) null), this.client.changeSlots);
    }

    @Test
    public void testCloseReleasesClient() {
        final WikibaseLoader loader = newLoader(ImmutableList.of(0), null);
        Assert.assertFalse(this.client.closed);
        loader.close();
        Assert.assertTrue(this.client.closed);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSlotAndNamespaces() {
        newLoader(ImmutableList.of(0), "mediainfo");
    }

    @Test
    public void testUpdate() throws Throwable {
        final WikibaseLoader loader = newLoader(ImmutableList.of(0), null);
        loader.initialLoading();

        final long now = System.currentTimeMillis();
        final Date t1 = new Date(now + 60000);
        final Date t2 = new Date(now + 120000);
        this.client.entities.put("Q1", entity("Q1", 5));
        this.client.entities.remove("Q2");
        this.client.changes.add(new MediaWikiClient.Page("Q1", 1, t1));
        this.client.changes.add(new MediaWikiClient.Page("Q2", 2, t1));
        this.client.changes.add(new MediaWikiClient.Page("Q1", 1, t2));
        this.client.fetched.clear();

        Assert.assertEquals(2, loader.update());
        Assert.assertEquals(ImmutableList.of("Q2", "Q1"), this.client.fetched);
        Assert.assertEquals(5, count("Q1"));
        Assert.assertEquals(0, count("Q2"));
        Assert.assertEquals(3, count("Q3"));
        Assert.assertEquals(t2.getTime() / 1000, loader.readCursor().getTime() / 1000);
    }

    @Test
    public void testUpdateFailureKeepsCursor() throws Throwable {
        final WikibaseLoader loader = newLoader(ImmutableList.of(0), null);
        loader.initialLoading();
        final Date cursor = loader.readCursor();

        this.client.changes.add(new MediaWikiClient.Page("Q1", 1,
                new Date(System.currentTimeMillis() + 60000)));
        this.client.failing.add("Q1");
        try {
            loader.update();
            Assert.fail();
        } catch (final IOException ex) {
            // expected
        }
        Assert.assertEquals(cursor, loader.readCursor());
        Assert.assertEquals(2, count("Q1"));
    }

    @Test(expected = IllegalStateException.class)
    public void testUpdateWithoutInitialLoading() throws Throwable {
        newLoader(ImmutableList.of(0), null).update();
    }

    @Test
    public void testUpdateLoopGivesUp() throws Throwable {
        final WikibaseLoader loader = new WikibaseLoader(this.store, this.client, BASE_URL,
                ImmutableList.of(0), null, new Backoff(1, 10, 3));
        loader.initialLoading();
        this.client.changesFailing = true;
        try {
            loader.updateLoop();
            Assert.fail();
        } catch (final IOException ex) {
            Assert.assertEquals(3, this.client.changesCalls);
        }
    }

    @Test
    public void testEntityIds() {
        final WikibaseLoader loader = newLoader(ImmutableList.of(0), null);
        Assert.assertEquals("Q42", loader.getEntityId(page("Q42", 1)));
        Assert.assertEquals("P31", loader.getEntityId(page("Property:P31", 2)));
        Assert.assertEquals("L1", loader.getEntityId(page("Lexeme:L1", 3)));
        Assert.assertEquals(FACTORY.createURI(BASE_URL + "Special:EntityData/Q42"),
                loader.getEntityGraph("Q42"));
    }

    private WikibaseLoader newLoader(final List<Integer> namespaces, @Nullable final String slot) {
        return new WikibaseLoader(this.store, this.client, BASE_URL, namespaces, slot,
                new Backoff(1));
    }

    private int count(final String entityId) throws Throwable {
        final URI graph = FACTORY.createURI(BASE_URL + "Special:EntityData/" + entityId);
        final TripleTransaction tx = this.store.begin(true);
        try {
            return Iterations.asList(tx.get(null, null, null, graph)).size();
        } finally {
            tx.end(false);
        }
    }

    private static MediaWikiClient.Page page(final String title, final long pageId) {
        return new MediaWikiClient.Page(title, pageId, null);
    }

    private static List<Statement> entity(final String id, final int size) {
        final URI subject = FACTORY.createURI("http://wiki.example.com/entity/" + id);
        final List<Statement> statements = Lists.newArrayList();
        for (int i = 0; i < size; ++i) {
            statements.add(FACTORY.createStatement(subject,
                    FACTORY.createURI("http://schema.org/name"),
                    FACTORY.createLiteral(id + " label " + i, "en")));
        }
        return statements;
    }

    private static final class StubClient implements MediaWikiClient {

        final Map<Integer, List<Page>> pages = Maps.newHashMap();

        final Map<String, List<Statement>> entities = Maps.newHashMap();

        final List<Page> changes = Lists.newArrayList();

        final List<String> fetched = Lists.newArrayList();

        final List<String> failing = Lists.newArrayList();

        final Set<Long> slotPages = Sets.newHashSet();

        final List<String> pageSlots = Lists.newArrayList();

        final List<String> changeSlots = Lists.newArrayList();

        boolean changesFailing;

        boolean closed;

        int changesCalls;

        @Override
        public Batch listPages(final int namespace, @Nullable final String slot,
                @Nullable final Map<String, String> continuation) throws IOException {
            if (continuation == null) {
                this.pageSlots.add(slot);
            }
            final List<Page> all = Lists.newArrayList();
            if (this.pages.containsKey(namespace)) {
                for (final Page page : this.pages.get(namespace)) {
                    if (slot == null || this.slotPages.contains(page.getPageId())) {
                        all.add(page);
                    }
                }
            }
            final int start = continuation == null ? 0 : Integer.parseInt(continuation
                    .get("apcontinue"));
            final int end = Math.min(start + 2, all.size());
            return new Batch(all.subList(start, end), end < all.size() ? ImmutableMap.of(
                    "apcontinue", Integer.toString(end), "continue", "-||") : null);
        }

        @Override
        public Batch listChanges(final Date since, final List<Integer> namespaces,
                @Nullable final String slot, @Nullable final Map<String, String> continuation)
                throws IOException {
            ++this.changesCalls;
            this.changeSlots.add(slot);
            if (this.changesFailing) {
                throw new IOException("Service unavailable");
            }
            final List<Page> result = Lists.newArrayList();
            for (final Page change : this.changes) {
                if (!change.getTimestamp().before(since)) {
                    result.add(change);
                }
            }
            return new Batch(result, null);
        }

        @Override
        @Nullable
        public List<Statement> fetchEntity(final String entityId) throws IOException {
            if (this.failing.contains(entityId)) {
                throw new IOException("Cannot fetch " + entityId);
            }
            this.fetched.add(entityId);
            return this.entities.get(entityId);
        }

        @Override
        public void close() {
            this.closed = true;
        }

    }

}
