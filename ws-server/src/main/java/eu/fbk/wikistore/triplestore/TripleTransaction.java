package eu.fbk.wikistore.triplestore;

import java.io.IOException;

import javax.annotation.Nullable;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import info.aduna.iteration.CloseableIteration;

import eu.fbk.wikistore.data.QueryResult;
import eu.fbk.wikistore.data.SparqlQuery;
import eu.fbk.wikistore.runtime.DataCorruptedException;

/**
 * A triple store transaction.
 * <p>
 * A {@code TripleTransaction} is a unit of work over the contents of a {@link TripleStore},
 * providing atomicity (changes are either completely stored or discarded), isolation (other
 * transactions see either none or all of the changes of a committed transaction) and durability.
 * It supports statement retrieval ({@link #get(Resource, URI, Value, Resource)}), SPARQL querying
 * ({@link #query(SparqlQuery, Long)}) and, for read/write transactions only, modification of
 * statements ({@link #add(Iterable)}, {@link #remove(Iterable)}, {@link #clear(Resource...)}).
 * </p>
 * <p>
 * Transactions are terminated via {@link #end(boolean)}. If it throws an {@code IOException} a
 * rollback must be assumed, even if a commit was asked; if it throws a
 * {@code DataCorruptedException}, neither commit nor rollback were possible and the store is left
 * in an unknown state.
 * </p>
 * <p>
 * {@code TripleTransaction} objects are not thread safe, with the exception of method
 * {@link #end(boolean)} that can be called at any moment by any thread to roll back the
 * transaction.
 * </p>
 */
public interface TripleTransaction {

    /**
     * Returns an iteration over all the statements matching the optional subject, predicate,
     * object and context supplied; null values act as wildcards.
     *
     * @param subject
     *            the subject to match, null to match any subject
     * @param predicate
     *            the predicate to match, null to match any predicate
     * @param object
     *            the object to match, null to match any object
     * @param context
     *            the context to match, null to match any context
     * @return an iteration over matching statements, to be closed after use
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    CloseableIteration<? extends Statement, ? extends Exception> get(@Nullable Resource subject,
            @Nullable URI predicate, @Nullable Value object, @Nullable Resource context)
            throws IOException, IllegalStateException;

    /**
     * Evaluates the supplied SPARQL query, returning its materialized result. If the query
     * defines default or named graphs, evaluation is restricted to that dataset; otherwise all
     * the graphs of the store are queried.
     *
     * @param query
     *            the query to evaluate
     * @param timeout
     *            optional timeout in milliseconds
     * @return the query result, whose kind depends on the query form
     * @throws IOException
     *             in case some IO error occurs during evaluation
     * @throws UnsupportedOperationException
     *             in case the query, while syntactically valid, is rejected by the store
     * @throws IllegalStateException
     *             if the transaction has been already ended
     */
    QueryResult query(SparqlQuery query, @Nullable Long timeout) throws IOException,
            UnsupportedOperationException, IllegalStateException;

    /**
     * Adds the statements specified. Statements with a context are added to that named graph.
     *
     * @param statements
     *            the statements to add
     * @throws IOException
     *             in case some IO error occurs; the caller should roll back the transaction
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    void add(Iterable<? extends Statement> statements) throws IOException, IllegalStateException;

    /**
     * Removes the statements specified.
     *
     * @param statements
     *            the statements to remove
     * @throws IOException
     *             in case some IO error occurs; the caller should roll back the transaction
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    void remove(Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException;

    /**
     * Removes all the statements in the named graphs specified.
     *
     * @param contexts
     *            the named graphs to clear, at least one
     * @throws IOException
     *             in case some IO error occurs; the caller should roll back the transaction
     * @throws IllegalStateException
     *             if the transaction has been already ended, or if it is read-only
     */
    void clear(Resource... contexts) throws IOException, IllegalStateException;

    /**
     * Ends the transaction, either committing or rolling back its changes. If commit is requested
     * but fails, a rollback is forced and an {@code IOException} is thrown.
     *
     * @param commit
     *            true in case changes made by the transaction should be committed
     * @throws IOException
     *             in case the commit request cannot be satisfied; a rollback has been performed
     * @throws DataCorruptedException
     *             in case it was possible neither to commit nor to roll back
     */
    void end(boolean commit) throws DataCorruptedException, IOException;

}
