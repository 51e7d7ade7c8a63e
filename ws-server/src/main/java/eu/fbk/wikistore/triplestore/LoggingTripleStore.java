package eu.fbk.wikistore.triplestore;

import java.io.IOException;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;

import eu.fbk.wikistore.data.QueryResult;
import eu.fbk.wikistore.data.SparqlQuery;
import eu.fbk.wikistore.internal.rdf.RDFUtil;

/**
 * A {@code TripleStore} wrapper logging the transactions of the wrapped store.
 * <p>
 * Every transaction is given a sequence number ({@code tx<N>}). Queries and lookups are logged at
 * DEBUG level when issued, added and removed statements at TRACE level; when a transaction ends, a single summary line reports its duration
 * and, for read-write transactions, the number of statements added and removed and of graphs
 * cleared. Read-write transactions whose commit takes longer than a configurable threshold are
 * reported at INFO level.
 * </p>
 */
public final class LoggingTripleStore extends TripleStoreDecorator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingTripleStore.class);

    /** Default commit duration above which a read-write transaction is logged at INFO level. */
    public static final long DEFAULT_SLOW_COMMIT_MILLIS = 5000L;

    private static final AtomicInteger TRANSACTION_COUNTER = new AtomicInteger(0);

    private final long slowCommitMillis;

    public LoggingTripleStore(final TripleStore delegate) {
        this(delegate, DEFAULT_SLOW_COMMIT_MILLIS);
    }

    public LoggingTripleStore(final TripleStore delegate, final long slowCommitMillis) {
        super(delegate);
        Preconditions.checkArgument(slowCommitMillis >= 0, "Negative threshold: %s",
                slowCommitMillis);
        this.slowCommitMillis = slowCommitMillis;
    }

    @Override
    public void init() throws IOException {
        final Stopwatch stopwatch = Stopwatch.createStarted();
        super.init();
        LOGGER.debug("{} initialized in {} ms", delegate(),
                stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws IOException {
        final Stopwatch stopwatch = Stopwatch.createStarted();
        final TripleTransaction transaction = super.begin(readOnly);
        final String name = "tx" + TRANSACTION_COUNTER.incrementAndGet();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} {} started in {} ms", name, readOnly ? "(ro)" : "(rw)",
                    stopwatch.elapsed(TimeUnit.MILLISECONDS));
        }
        return new LoggingTripleTransaction(transaction, name, readOnly);
    }

    @Override
    public void reset() throws IOException {
        LOGGER.info("Resetting {}", delegate());
        super.reset();
    }

    @Override
    public String toString() {
        return "logging(" + delegate() + ")";
    }

    private final class LoggingTripleTransaction extends TransactionDecorator {

        private final String name;

        private final boolean readOnly;

        private final Stopwatch stopwatch;

        private int added;

        private int removed;

        private int cleared;

        LoggingTripleTransaction(final TripleTransaction delegate, final String name,
                final boolean readOnly) {
            super(delegate);
            this.name = name;
            this.readOnly = readOnly;
            this.stopwatch = Stopwatch.createStarted();
        }

        @Override
        public CloseableIteration<? extends Statement, ? extends Exception> get(
                @Nullable final Resource subject, @Nullable final URI predicate,
                @Nullable final Value object, @Nullable final Resource context)
                throws IOException, IllegalStateException {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{} get {} {} {} {}", this.name, pattern(subject),
                        pattern(predicate), pattern(object), pattern(context));
            }
            return super.get(subject, predicate, object, context);
        }

        @Override
        public QueryResult query(final SparqlQuery query, @Nullable final Long timeout)
                throws IOException, UnsupportedOperationException {
            if (!LOGGER.isDebugEnabled()) {
                return super.query(query, timeout);
            }
            LOGGER.debug("{} {} query, default graphs {}, named graphs {}:\n{}", this.name,
                    query.getForm(), query.getDefaultGraphs(), query.getNamedGraphs(),
                    query.getString());
            final Stopwatch watch = Stopwatch.createStarted();
            final QueryResult result = super.query(query, timeout);
            LOGGER.debug("{} {} result in {} ms", this.name, query.getForm(),
                    watch.elapsed(TimeUnit.MILLISECONDS));
            return result;
        }

        @Override
        public void add(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {
            final Collection<? extends Statement> batch = materialize(statements);
            trace("+", batch);
            super.add(batch);
            this.added += batch.size();
        }

        @Override
        public void remove(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {
            final Collection<? extends Statement> batch = materialize(statements);
            trace("-", batch);
            super.remove(batch);
            this.removed += batch.size();
        }

        @Override
        public void clear(final Resource... contexts) throws IOException, IllegalStateException {
            super.clear(contexts);
            this.cleared += contexts.length;
        }

        @Override
        public void end(final boolean commit) throws IOException {
            final Stopwatch watch = Stopwatch.createStarted();
            boolean ended = false;
            try {
                super.end(commit);
                ended = true;
            } finally {
                final long endMillis = watch.elapsed(TimeUnit.MILLISECONDS);
                final long totalMillis = this.stopwatch.elapsed(TimeUnit.MILLISECONDS);
                if (this.readOnly) {
                    LOGGER.debug("{} ended after {} ms", this.name, totalMillis);
                } else {
                    final String outcome = !ended ? "failed" : commit ? "committed"
                            : "rolled back";
                    if (ended && commit && endMillis > LoggingTripleStore.this.slowCommitMillis) {
                        LOGGER.info("{} {} in {} ms (slow commit, {} ms total): +{} -{} "
                                + "statements, {} graphs cleared", this.name, outcome,
                                endMillis, totalMillis, this.added, this.removed, this.cleared);
                    } else if (LOGGER.isDebugEnabled()) {
                        LOGGER.debug("{} {} in {} ms ({} ms total): +{} -{} statements, "
                                + "{} graphs cleared", this.name, outcome, endMillis,
                                totalMillis, this.added, this.removed, this.cleared);
                    }
                }
            }
        }

        private void trace(final String operation,
                final Collection<? extends Statement> statements) {
            if (LOGGER.isTraceEnabled()) {
                for (final Statement statement : statements) {
                    LOGGER.trace("{} {} {}", this.name, operation, RDFUtil.toString(statement));
                }
            }
        }

        @Override
        public String toString() {
            return this.name;
        }

    }

    private static String pattern(@Nullable final Value value) {
        return value == null ? "?" : RDFUtil.toString(value);
    }

    @SuppressWarnings("unchecked")
    private static <T> Collection<T> materialize(final Iterable<T> iterable) {
        return iterable instanceof Collection<?> ? (Collection<T>) iterable : ImmutableList
                .copyOf(iterable);
    }

}
