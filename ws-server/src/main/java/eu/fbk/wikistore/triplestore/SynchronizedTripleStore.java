package eu.fbk.wikistore.triplestore;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;
import info.aduna.iteration.IterationWrapper;

import eu.fbk.wikistore.data.QueryResult;
import eu.fbk.wikistore.data.SparqlQuery;
import eu.fbk.wikistore.runtime.Component;
import eu.fbk.wikistore.runtime.Synchronizer;

/**
 * A {@code TripleStore} wrapper coordinating the HTTP query threads and the synchronization
 * loader over a shared store.
 * <p>
 * Admission of transactions and of commits is delegated to a {@link Synchronizer}. Created with
 * a {@code N:CX} synchronizer, the wrapper admits up to {@code N} concurrent transactions and
 * runs the commit of the (single) read-write transaction of the loader only when no read-only
 * transaction is active, so that a query sees either none or all of the changes of a
 * synchronization batch. In addition the wrapper:
 * </p>
 * <ul>
 * <li>rejects with {@code IllegalStateException} any access outside the {@link Component}
 * lifecycle (before {@code init()} or after {@code close()});</li>
 * <li>rejects with {@code IllegalStateException} any operation on an ended transaction, and
 * serializes the operations on the same transaction (with the exception of
 * {@link TripleTransaction#end(boolean)});</li>
 * <li>closes the statement iterations still open when their transaction ends;</li>
 * <li>rolls back pending transactions when the store is closed;</li>
 * <li>runs {@link #reset()} with no transaction active.</li>
 * </ul>
 */
public class SynchronizedTripleStore extends TripleStoreDecorator {

    private static final Logger LOGGER = LoggerFactory.getLogger(SynchronizedTripleStore.class);

    private enum State {
        NEW, ACTIVE, CLOSED
    }

    private final Synchronizer synchronizer;

    private final Set<SynchronizedTripleTransaction> pending;

    private final AtomicReference<State> state;

    public SynchronizedTripleStore(final TripleStore delegate, final String synchronizerSpec) {
        this(delegate, Synchronizer.create(synchronizerSpec));
    }

    public SynchronizedTripleStore(final TripleStore delegate, final Synchronizer synchronizer) {
        super(delegate);
        this.synchronizer = Preconditions.checkNotNull(synchronizer);
        this.pending = Sets.newConcurrentHashSet();
        this.state = new AtomicReference<State>(State.NEW);
    }

    private void ensureActive() {
        final State current = this.state.get();
        if (current == State.NEW) {
            throw new IllegalStateException("Triple store not initialized");
        } else if (current == State.CLOSED) {
            throw new IllegalStateException("Triple store closed");
        }
    }

    @Override
    public synchronized void init() throws IOException {
        if (this.state.get() != State.NEW) {
            throw new IllegalStateException("Triple store already initialized or closed");
        }
        super.init();
        this.state.set(State.ACTIVE);
        LOGGER.debug("{} ready, admission policy {}", delegate(), this.synchronizer);
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws IOException {
        ensureActive();
        this.synchronizer.beginTransaction(readOnly);
        boolean admitted = false;
        try {
            final SynchronizedTripleTransaction transaction;
            synchronized (this) {
                ensureActive();
                transaction = new SynchronizedTripleTransaction(super.begin(readOnly),
                        readOnly);
                this.pending.add(transaction);
            }
            admitted = true;
            return transaction;
        } finally {
            if (!admitted) {
                this.synchronizer.endTransaction(readOnly);
            }
        }
    }

    @Override
    public void reset() throws IOException {
        ensureActive();
        this.synchronizer.beginExclusive();
        try {
            synchronized (this) {
                ensureActive();
                super.reset();
            }
        } finally {
            this.synchronizer.endExclusive();
        }
    }

    @Override
    public void close() {
        if (this.state.getAndSet(State.CLOSED) == State.CLOSED) {
            return;
        }
        try {
            for (final SynchronizedTripleTransaction transaction : ImmutableList
                    .copyOf(this.pending)) {
                LOGGER.warn("Rolling back {} still pending at store shutdown", transaction);
                try {
                    transaction.end(false);
                } catch (final IOException | RuntimeException ex) {
                    LOGGER.error("Rollback of " + transaction + " failed", ex);
                }
            }
        } finally {
            super.close();
        }
    }

    private final class SynchronizedTripleTransaction extends TransactionDecorator {

        private final boolean readOnly;

        private final Set<CloseableIteration<?, ?>> iterations;

        private final AtomicBoolean ended;

        SynchronizedTripleTransaction(final TripleTransaction delegate, final boolean readOnly) {
            super(delegate);
            this.readOnly = readOnly;
            this.iterations = Sets.newConcurrentHashSet();
            this.ended = new AtomicBoolean(false);
        }

        private void ensureOpen() {
            if (this.ended.get()) {
                throw new IllegalStateException("Transaction already ended");
            }
        }

        private <T, E extends Exception> CloseableIteration<T, E> track(
                final CloseableIteration<T, E> iteration) {
            final CloseableIteration<T, E> tracked = new IterationWrapper<T, E>(iteration) {

                @Override
                protected void handleClose() throws E {
                    SynchronizedTripleTransaction.this.iterations.remove(this);
                    super.handleClose();
                }

            };
            this.iterations.add(tracked);
            return tracked;
        }

        @Override
        public synchronized CloseableIteration<? extends Statement, ? extends Exception> get(
                @Nullable final Resource subject, @Nullable final URI predicate,
                @Nullable final Value object, @Nullable final Resource context)
                throws IOException, IllegalStateException {
            ensureOpen();
            return track(super.get(subject, predicate, object, context));
        }

        @Override
        public synchronized QueryResult query(final SparqlQuery query,
                @Nullable final Long timeout) throws IOException, UnsupportedOperationException {
            ensureOpen();
            return super.query(query, timeout);
        }

        @Override
        public synchronized void add(final Iterable<? extends Statement> statements)
                throws IOException, IllegalStateException {
            ensureOpen();
            super.add(statements);
        }

        @Override
        public synchronized void remove(final Iterable<? extends Statement> statements)
                throws IOException, IllegalStateException {
            ensureOpen();
            super.remove(statements);
        }

        @Override
        public synchronized void clear(final Resource... contexts) throws IOException,
                IllegalStateException {
            ensureOpen();
            super.clear(contexts);
        }

        @Override
        public void end(final boolean commit) throws IOException {
            if (!this.ended.compareAndSet(false, true)) {
                return;
            }
            for (final CloseableIteration<?, ?> iteration : ImmutableList
                    .copyOf(this.iterations)) {
                try {
                    iteration.close();
                } catch (final Exception ex) {
                    LOGGER.error("Failed to close iteration of " + this, ex);
                }
            }
            final Synchronizer synchronizer = SynchronizedTripleStore.this.synchronizer;
            final boolean exclusive = !this.readOnly;
            if (exclusive) {
                synchronizer.beginCommit();
            }
            try {
                super.end(commit);
            } finally {
                if (exclusive) {
                    synchronizer.endCommit();
                }
                synchronizer.endTransaction(this.readOnly);
                SynchronizedTripleStore.this.pending.remove(this);
            }
        }

    }

}
