package eu.fbk.wikistore.triplestore;

import java.io.IOException;

import eu.fbk.wikistore.runtime.Component;
import eu.fbk.wikistore.runtime.DataCorruptedException;

/**
 * A storage for triples organized in named graphs, supporting SPARQL queries and transactions.
 * <p>
 * All the accesses to the contents of a {@code TripleStore} occur in the scope of a
 * {@link TripleTransaction}, which is either read-only or read/write and provides atomicity,
 * isolation and durability guarantees. Implementations are thread safe: transactions can be
 * started and used concurrently by different threads. A {@code TripleStore} obeys the contract
 * and lifecycle of {@link Component}.
 * </p>
 */
public interface TripleStore extends Component {

    /**
     * Begins a new read-only / read-write transaction. Transactions should be ended as soon as
     * possible, as they may block other transactions.
     *
     * @param readOnly
     *            true if the transaction is not allowed to modify the contents of the store
     * @return the created transaction
     * @throws DataCorruptedException
     *             in case a transaction cannot be started due to the store files being damaged
     * @throws IOException
     *             if another IO error occurs while starting the transaction
     */
    TripleTransaction begin(boolean readOnly) throws DataCorruptedException, IOException;

    /**
     * Removes all the contents of the store, which is left empty.
     *
     * @throws IOException
     *             on failure
     */
    void reset() throws IOException;

}
