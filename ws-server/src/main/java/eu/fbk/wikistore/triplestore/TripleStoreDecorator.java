package eu.fbk.wikistore.triplestore;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ForwardingObject;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import info.aduna.iteration.CloseableIteration;

import eu.fbk.wikistore.data.QueryResult;
import eu.fbk.wikistore.data.SparqlQuery;

/**
 * Base class of the {@code TripleStore} wrappers stacked in front of the backend store, such as
 * {@link SynchronizedTripleStore} (admission control) and {@link LoggingTripleStore}.
 * <p>
 * The wrapped store is fixed at construction time and every method is forwarded to it. Wrappers
 * override the lifecycle methods they care about and wrap the transactions returned by
 * {@link #begin(boolean)} into a subclass of {@link TransactionDecorator}.
 * </p>
 */
public abstract class TripleStoreDecorator extends ForwardingObject implements TripleStore {

    private final TripleStore delegate;

    protected TripleStoreDecorator(final TripleStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
    }

    @Override
    protected final TripleStore delegate() {
        return this.delegate;
    }

    @Override
    public void init() throws IOException {
        this.delegate.init();
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws IOException {
        return this.delegate.begin(readOnly);
    }

    @Override
    public void reset() throws IOException {
        this.delegate.reset();
    }

    @Override
    public void close() {
        this.delegate.close();
    }

    /**
     * Base class of the transactions returned by a {@code TripleStoreDecorator}, forwarding every
     * call to the transaction of the wrapped store.
     */
    protected abstract static class TransactionDecorator extends ForwardingObject implements
            TripleTransaction {

        private final TripleTransaction delegate;

        protected TransactionDecorator(final TripleTransaction delegate) {
            this.delegate = Preconditions.checkNotNull(delegate);
        }

        @Override
        protected final TripleTransaction delegate() {
            return this.delegate;
        }

        @Override
        public CloseableIteration<? extends Statement, ? extends Exception> get(
                @Nullable final Resource subject, @Nullable final URI predicate,
                @Nullable final Value object, @Nullable final Resource context)
                throws IOException, IllegalStateException {
            return this.delegate.get(subject, predicate, object, context);
        }

        @Override
        public QueryResult query(final SparqlQuery query, @Nullable final Long timeout)
                throws IOException, UnsupportedOperationException {
            return this.delegate.query(query, timeout);
        }

        @Override
        public void add(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {
            this.delegate.add(statements);
        }

        @Override
        public void remove(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {
            this.delegate.remove(statements);
        }

        @Override
        public void clear(final Resource... contexts) throws IOException,
                IllegalStateException {
            this.delegate.clear(contexts);
        }

        @Override
        public void end(final boolean commit) throws IOException {
            this.delegate.end(commit);
        }

    }

}
