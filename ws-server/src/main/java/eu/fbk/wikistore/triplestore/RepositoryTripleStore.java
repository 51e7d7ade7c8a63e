package eu.fbk.wikistore.triplestore;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.impl.ContextStatementImpl;
import org.openrdf.query.BindingSet;
import org.openrdf.query.BooleanQuery;
import org.openrdf.query.GraphQuery;
import org.openrdf.query.GraphQueryResult;
import org.openrdf.query.MalformedQueryException;
import org.openrdf.query.Query;
import org.openrdf.query.QueryEvaluationException;
import org.openrdf.query.QueryLanguage;
import org.openrdf.query.TupleQuery;
import org.openrdf.query.TupleQueryResult;
import org.openrdf.query.impl.DatasetImpl;
import org.openrdf.repository.Repository;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.RepositoryException;
import org.openrdf.repository.sail.SailRepository;
import org.openrdf.sail.Sail;
import org.openrdf.sail.memory.MemoryStore;
import org.openrdf.sail.nativerdf.NativeStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;
import info.aduna.iteration.CloseableIteratorIteration;
import info.aduna.iteration.Iterations;

import eu.fbk.wikistore.data.Iri;
import eu.fbk.wikistore.data.QueryResult;
import eu.fbk.wikistore.data.SparqlQuery;
import eu.fbk.wikistore.runtime.DataCorruptedException;

/**
 * A {@code TripleStore} backed by a Sesame {@code Repository}.
 * <p>
 * Factory methods {@link #newNativeStore(File)} and {@link #newMemoryStore()} create stores
 * backed, respectively, by a persistent Sesame native store and by a volatile memory store. Each
 * {@code TripleTransaction} is mapped to a repository connection and its transaction.
 * </p>
 */
public final class RepositoryTripleStore implements TripleStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RepositoryTripleStore.class);

    private static final String NATIVE_INDEXES = "spoc,posc,cosp";

    private final Repository repository;

    public RepositoryTripleStore(final Sail sail) {
        this(new SailRepository(sail));
    }

    public RepositoryTripleStore(final Repository repository) {
        this.repository = Preconditions.checkNotNull(repository);
        LOGGER.info("RepositoryTripleStore configured, backend={}", repository.getClass()
                .getSimpleName());
    }

    /**
     * Creates a store persisting its data in the directory specified, which is created if
     * missing.
     *
     * @param directory
     *            the data directory
     * @return the created store, not yet initialized
     */
    public static RepositoryTripleStore newNativeStore(final File directory) {
        return new RepositoryTripleStore(new NativeStore(directory, NATIVE_INDEXES));
    }

    /**
     * Creates a store keeping its data in memory.
     *
     * @return the created store, not yet initialized
     */
    public static RepositoryTripleStore newMemoryStore() {
        return new RepositoryTripleStore(new MemoryStore());
    }

    @Override
    public void init() throws IOException {
        try {
            this.repository.initialize();
        } catch (final RepositoryException ex) {
            throw new IOException("Could not initialize Sesame repository", ex);
        }
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws IOException {
        return new RepositoryTripleTransaction(readOnly);
    }

    @Override
    public void reset() throws IOException {
        RepositoryConnection connection = null;
        try {
            connection = this.repository.getConnection();
            connection.clear();
            connection.clearNamespaces();
            LOGGER.info("Sesame repository successfully reset");
        } catch (final RepositoryException ex) {
            throw new IOException("Could not reset Sesame repository", ex);
        } finally {
            closeQuietly(connection);
        }
    }

    @Override
    public void close() {
        try {
            this.repository.shutDown();
        } catch (final RepositoryException ex) {
            LOGGER.error("Failed to shutdown Sesame repository", ex);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }

    private static void closeQuietly(@Nullable final RepositoryConnection connection) {
        if (connection != null) {
            try {
                connection.close();
            } catch (final RepositoryException ex) {
                LOGGER.error("Failed to close connection", ex);
            }
        }
    }

    private class RepositoryTripleTransaction implements TripleTransaction {

        private final RepositoryConnection connection;

        private final boolean readOnly;

        private final long ts;

        private boolean dirty;

        RepositoryTripleTransaction(final boolean readOnly) throws IOException {

            final long ts = System.currentTimeMillis();
            final RepositoryConnection connection;
            try {
                connection = RepositoryTripleStore.this.repository.getConnection();
            } catch (final RepositoryException ex) {
                throw new IOException("Could not connect to Sesame repository", ex);
            }

            try {
                connection.begin();
            } catch (final RepositoryException ex) {
                closeQuietly(connection);
                throw new IOException("Could not begin Sesame transaction", ex);
            }

            this.connection = connection;
            this.readOnly = readOnly;
            this.ts = ts;
            this.dirty = false;

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(this + " started in " + (readOnly ? "read-only" : "read-write")
                        + " mode, " + (System.currentTimeMillis() - ts) + " ms");
            }
        }

        private void checkWritable() {
            if (this.readOnly) {
                throw new IllegalStateException(
                        "Write operation not allowed on read-only transaction");
            }
        }

        @Override
        public CloseableIteration<? extends Statement, ? extends Exception> get(
                @Nullable final Resource subject, @Nullable final URI predicate,
                @Nullable final Value object, @Nullable final Resource context)
                throws IOException, IllegalStateException {

            try {
                if (subject == null || predicate == null || object == null || context == null) {
                    return context == null ? this.connection.getStatements(subject, predicate,
                            object, false) : this.connection.getStatements(subject, predicate,
                            object, false, context);
                }
                final List<Statement> statements;
                if (this.connection.hasStatement(subject, predicate, object, false, context)) {
                    statements = Collections.<Statement>singletonList(new ContextStatementImpl(
                            subject, predicate, object, context));
                } else {
                    statements = Collections.emptyList();
                }
                return new CloseableIteratorIteration<Statement, RuntimeException>(
                        Iterators.unmodifiableIterator(statements.iterator()));

            } catch (final RepositoryException ex) {
                throw new IOException("Error while retrieving matching statements", ex);
            }
        }

        @Override
        public QueryResult query(final SparqlQuery query, @Nullable final Long timeout)
                throws IOException, UnsupportedOperationException, IllegalStateException {

            final Query preparedQuery;
            try {
                preparedQuery = this.connection.prepareQuery(QueryLanguage.SPARQL,
                        query.getString());

            } catch (final RepositoryException ex) {
                throw new IOException("Failed to prepare SPARQL query:\n" + query, ex);

            } catch (final MalformedQueryException ex) {
                // should not happen, as SparqlQuery can only be created with valid queries
                throw new UnsupportedOperationException(
                        "SPARQL query rejected as malformed by Sesame repository: "
                                + ex.getMessage(), ex);
            }

            if (query.hasDataset()) {
                final DatasetImpl dataset = new DatasetImpl();
                for (final Iri graph : query.getDefaultGraphs()) {
                    dataset.addDefaultGraph(graph.toURI());
                }
                for (final Iri graph : query.getNamedGraphs()) {
                    dataset.addNamedGraph(graph.toURI());
                }
                preparedQuery.setDataset(dataset);
            }

            if (timeout != null) {
                preparedQuery.setMaxQueryTime((int) Math.max(1L, (timeout + 999L) / 1000L));
            }

            final long ts = System.currentTimeMillis();
            try {
                final QueryResult result;
                if (preparedQuery instanceof TupleQuery) {
                    final TupleQueryResult tuples = ((TupleQuery) preparedQuery).evaluate();
                    try {
                        final List<String> variables = tuples.getBindingNames();
                        final List<BindingSet> solutions = Lists.newArrayList();
                        Iterations.addAll(tuples, solutions);
                        result = new QueryResult.Solutions(variables, solutions);
                    } finally {
                        tuples.close();
                    }
                } else if (preparedQuery instanceof GraphQuery) {
                    final GraphQueryResult graph = ((GraphQuery) preparedQuery).evaluate();
                    try {
                        final Map<String, String> namespaces = graph.getNamespaces();
                        final List<Statement> statements = Lists.newArrayList();
                        Iterations.addAll(graph, statements);
                        result = new QueryResult.Graph(namespaces, statements);
                    } finally {
                        graph.close();
                    }
                } else {
                    result = new QueryResult.Bool(((BooleanQuery) preparedQuery).evaluate());
                }
                LOGGER.debug("Query evaluated in {} ms", System.currentTimeMillis() - ts);
                return result;

            } catch (final QueryEvaluationException ex) {
                final StringBuilder builder = new StringBuilder();
                builder.append("Query evaluation failed after ")
                        .append(System.currentTimeMillis() - ts).append(" ms");
                if (ex.getMessage() != null) {
                    builder.append(": ").append(ex.getMessage());
                }
                throw new IOException(builder.toString(), ex);
            }
        }

        @Override
        public void add(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {

            Preconditions.checkNotNull(statements);
            checkWritable();

            try {
                this.dirty = true;
                this.connection.add(statements);
            } catch (final RepositoryException ex) {
                throw new IOException("Error while adding statements", ex);
            }
        }

        @Override
        public void remove(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {

            Preconditions.checkNotNull(statements);
            checkWritable();

            try {
                this.dirty = true;
                this.connection.remove(statements);
            } catch (final RepositoryException ex) {
                throw new IOException("Error while removing statements", ex);
            }
        }

        @Override
        public void clear(final Resource... contexts) throws IOException, IllegalStateException {

            // an empty context array would clear the whole repository
            Preconditions.checkArgument(contexts.length > 0, "No graph to clear specified");
            checkWritable();

            try {
                this.dirty = true;
                this.connection.clear(contexts);
            } catch (final RepositoryException ex) {
                throw new IOException("Error while clearing graphs", ex);
            }
        }

        @Override
        public void end(final boolean commit) throws DataCorruptedException, IOException {

            final long ts = System.currentTimeMillis();
            boolean committed = false;

            try {
                if (commit && this.dirty) {
                    try {
                        this.connection.commit();
                        committed = true;

                    } catch (final Throwable ex) {
                        try {
                            this.connection.rollback();
                            LOGGER.debug("{} rolled back after commit failure", this);

                        } catch (final RepositoryException ex2) {
                            throw new DataCorruptedException(
                                    "Failed to rollback transaction after commit failure", ex);
                        }
                        throw new IOException("Failed to commit transaction (rollback forced)",
                                ex);
                    }
                } else {
                    try {
                        this.connection.rollback();
                    } catch (final RepositoryException ex) {
                        if (this.dirty) {
                            throw new DataCorruptedException("Failed to rollback transaction", ex);
                        }
                        LOGGER.warn("Failed to end read-only transaction", ex);
                    }
                }
            } finally {
                closeQuietly(this.connection);
                if (LOGGER.isDebugEnabled()) {
                    final long now = System.currentTimeMillis();
                    LOGGER.debug("{} {} and closed in {} ms, tx duration {} ms", this,
                            committed ? "committed" : "rolled back", now - ts, now - this.ts);
                }
            }
        }

        @Override
        public String toString() {
            return "RepositoryTripleTransaction@" + Integer.toHexString(hashCode());
        }

    }

}
