package eu.fbk.wikistore.loader;

import java.io.Closeable;
import java.io.IOException;
import java.util.Date;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.Iterations;

import eu.fbk.wikistore.data.Iri;
import eu.fbk.wikistore.loader.MediaWikiClient.Batch;
import eu.fbk.wikistore.loader.MediaWikiClient.Page;
import eu.fbk.wikistore.triplestore.TripleStore;
import eu.fbk.wikistore.triplestore.TripleTransaction;
import eu.fbk.wikistore.vocabulary.SCHEMA;

/**
 * Keeps a {@code TripleStore} synchronized with the entities of a Wikibase instance.
 * <p>
 * Each entity is stored in its own named graph, whose name is the IRI of the entity data
 * document ({@code <baseUrl>Special:EntityData/<id>}). The timestamp up to which changes have
 * been applied (the cursor) is stored in graph {@link #SYNC_GRAPH} as a
 * {@code schema:dateModified} value, so that synchronization resumes after a restart. The loader
 * is meant to be the only writer of the store; every batch of changes is applied in a single
 * write transaction together with the advanced cursor. Closing the loader closes its
 * {@code MediaWikiClient}.
 * </p>
 */
public final class WikibaseLoader implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WikibaseLoader.class);

    public static final URI SYNC_GRAPH = ValueFactoryImpl.getInstance().createURI(
            "urn:wikistore:sync");

    static final int DEFAULT_NAMESPACE = 0;

    static final int FILE_NAMESPACE = 6;

    private final TripleStore store;

    private final MediaWikiClient client;

    private final String baseUrl;

    private final List<Integer> namespaces;

    @Nullable
    private final String slot;

    private final Backoff backoff;

    public WikibaseLoader(final TripleStore store, final String apiUrl, final String baseUrl,
            final List<Integer> namespaces, @Nullable final String slot, final long interval) {
        this(store, new HttpMediaWikiClient(apiUrl, baseUrl), baseUrl, namespaces, slot,
                new Backoff(interval));
    }

    public WikibaseLoader(final TripleStore store, final MediaWikiClient client,
            final String baseUrl, final List<Integer> namespaces, @Nullable final String slot,
            final Backoff backoff) {
        Preconditions.checkArgument(slot == null || namespaces.isEmpty(),
                "Namespaces and slot cannot be both specified");
        Preconditions.checkArgument(Iri.isValid(baseUrl), "Invalid base URL %s", baseUrl);
        this.store = Preconditions.checkNotNull(store);
        this.client = Preconditions.checkNotNull(client);
        this.baseUrl = baseUrl;
        this.slot = slot;
        this.backoff = Preconditions.checkNotNull(backoff);
        if (slot != null) {
            this.namespaces = ImmutableList.of(FILE_NAMESPACE);
        } else if (namespaces.isEmpty()) {
            this.namespaces = ImmutableList.of(DEFAULT_NAMESPACE);
        } else {
            this.namespaces = ImmutableList.copyOf(namespaces);
        }
    }

    public List<Integer> getNamespaces() {
        return this.namespaces;
    }

    @Nullable
    public String getSlot() {
        return this.slot;
    }

    /**
     * Imports all the entities of the wiki, unless a previous import has already been completed.
     *
     * @throws IOException
     *             on failure, in which case the import has to be restarted
     */
    public void initialLoading() throws IOException {

        final Date previous = readCursor();
        if (previous != null) {
            LOGGER.info("Resuming synchronization from {}",
                    HttpMediaWikiClient.formatTimestamp(previous));
            return;
        }

        final Date start = new Date();
        final long ts = System.currentTimeMillis();
        int count = 0;
        LOGGER.info("Initial loading of namespaces {} started", this.namespaces);

        for (final Integer namespace : this.namespaces) {
            Map<String, String> continuation = null;
            do {
                final Batch batch = this.client.listPages(namespace, this.slot,
                        continuation);
                apply(fetch(batch.getPages()), null);
                count += batch.getPages().size();
                continuation = batch.getContinuation();
                LOGGER.info("{} entities loaded", count);
            } while (continuation != null);
        }

        apply(ImmutableList.<Change>of(), start);
        LOGGER.info("Initial loading of {} entities completed in {} ms", count,
                System.currentTimeMillis() - ts);
    }

    /**
     * Polls the wiki for changes and applies them, forever. A failed iteration is retried
     * according to the {@code Backoff} policy of the loader.
     *
     * @throws IOException
     *             if the maximum number of consecutive failures is reached
     * @throws InterruptedException
     *             if the calling thread is interrupted
     */
    public void updateLoop() throws IOException, InterruptedException {
        while (true) {
            Thread.sleep(this.backoff.nextDelay());
            try {
                update();
                this.backoff.recordSuccess();
            } catch (final IOException | RuntimeException ex) {
                this.backoff.recordFailure();
                if (this.backoff.isExhausted()) {
                    throw new IOException("Synchronization failed "
                            + this.backoff.getFailures() + " consecutive times", ex);
                }
                LOGGER.warn("Synchronization failed (attempt " + this.backoff.getFailures()
                        + "/" + this.backoff.getMaxFailures() + "), retrying in "
                        + this.backoff.nextDelay() + " ms", ex);
            }
        }
    }

    /**
     * Applies the changes since the stored cursor, advancing it.
     *
     * @return the number of entities refreshed
     * @throws IOException
     *             on failure, in which case the store and the cursor are left unchanged
     */
    public int update() throws IOException {

        final Date cursor = readCursor();
        if (cursor == null) {
            throw new IllegalStateException("Initial loading not completed");
        }

        final Map<String, Page> pages = Maps.newLinkedHashMap();
        Date newCursor = cursor;
        Map<String, String> continuation = null;
        do {
            final Batch batch = this.client.listChanges(cursor, this.namespaces, this.slot,
                    continuation);
            for (final Page page : batch.getPages()) {
                final String entityId = getEntityId(page);
                if (entityId != null) {
                    pages.remove(entityId);
                    pages.put(entityId, page);
                }
                final Date timestamp = page.getTimestamp();
                if (timestamp != null && timestamp.after(newCursor)) {
                    newCursor = timestamp;
                }
            }
            continuation = batch.getContinuation();
        } while (continuation != null);

        if (pages.isEmpty() && newCursor.equals(cursor)) {
            return 0;
        }

        apply(fetch(pages.values()), newCursor);
        LOGGER.debug("{} entities refreshed, cursor at {}", pages.size(),
                HttpMediaWikiClient.formatTimestamp(newCursor));
        return pages.size();
    }

    @Nullable
    Date readCursor() throws IOException {
        final TripleTransaction transaction = this.store.begin(true);
        try {
            final List<Statement> statements = Lists.newArrayList();
            try {
                Iterations.addAll(transaction.get(SYNC_GRAPH, SCHEMA.DATE_MODIFIED.toURI(), null,
                        SYNC_GRAPH), statements);
            } catch (final IOException ex) {
                throw ex;
            } catch (final Exception ex) {
                throw new IOException("Cannot read synchronization cursor", ex);
            }
            for (final Statement statement : statements) {
                if (statement.getObject() instanceof Literal) {
                    return ((Literal) statement.getObject()).calendarValue()
                            .toGregorianCalendar().getTime();
                }
            }
            return null;
        } finally {
            transaction.end(false);
        }
    }

    @Nullable
    String getEntityId(final Page page) {
        if (this.slot != null) {
            return page.getPageId() > 0 ? "M" + page.getPageId() : null;
        }
        final String title = page.getTitle();
        final String id = title.substring(title.lastIndexOf(':') + 1);
        return id.isEmpty() ? null : id;
    }

    URI getEntityGraph(final String entityId) {
        return ValueFactoryImpl.getInstance().createURI(
                this.baseUrl + "Special:EntityData/" + entityId);
    }

    private List<Change> fetch(final Iterable<Page> pages) throws IOException {
        final ValueFactory factory = ValueFactoryImpl.getInstance();
        final List<Change> changes = Lists.newArrayList();
        for (final Page page : pages) {
            final String entityId = getEntityId(page);
            if (entityId == null) {
                continue;
            }
            final URI graph = getEntityGraph(entityId);
            final List<Statement> data = this.client.fetchEntity(entityId);
            final List<Statement> statements = Lists.newArrayList();
            if (data != null) {
                for (final Statement s : data) {
                    statements.add(factory.createStatement(s.getSubject(), s.getPredicate(),
                            s.getObject(), graph));
                }
            }
            changes.add(new Change(graph, statements));
        }
        return changes;
    }

    private void apply(final List<Change> changes, @Nullable final Date cursor)
            throws IOException {
        final TripleTransaction transaction = this.store.begin(false);
        boolean success = false;
        try {
            for (final Change change : changes) {
                transaction.clear(change.graph);
                if (!change.statements.isEmpty()) {
                    transaction.add(change.statements);
                }
            }
            if (cursor != null) {
                final ValueFactory factory = ValueFactoryImpl.getInstance();
                transaction.clear(SYNC_GRAPH);
                transaction.add(ImmutableList.of(factory.createStatement(SYNC_GRAPH,
                        SCHEMA.DATE_MODIFIED.toURI(), factory.createLiteral(cursor), SYNC_GRAPH)));
            }
            success = true;
        } finally {
            transaction.end(success);
        }
    }

    @Override
    public void close() {
        this.client.close();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("client", this.client)
                .add("namespaces", this.namespaces).add("slot", this.slot).toString();
    }

    private static final class Change {

        final URI graph;

        final List<Statement> statements;

        Change(final URI graph, final List<Statement> statements) {
            this.graph = graph;
            this.statements = statements;
        }

    }

}
