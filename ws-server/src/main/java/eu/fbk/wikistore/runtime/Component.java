package eu.fbk.wikistore.runtime;

import java.io.Closeable;
import java.io.IOException;

/**
 * A Wikistore internal component.
 * <p>
 * This interface defines the lifecycle shared by the long-lived parts of the server, i.e., the
 * triple store and the HTTP frontend:
 * <ul>
 * <li>the {@code Component} is created and configured via its constructor, which validates the
 * configuration but allocates no resource and touches no persistent data;</li>
 * <li>method {@link #init()} makes the component operational, e.g. by opening files or binding
 * network ports;</li>
 * <li>the component is used by external code; whether it is thread safe is documented by the
 * specific component interface;</li>
 * <li>method {@link #close()} releases all the allocated resources. It can be called at any time
 * after the component has been created, even before initialization or while another thread is
 * using the component, and has no effect if called again.</li>
 * </ul>
 * </p>
 * <p>
 * Components access external resources, hence their methods may throw {@link IOException}s. As
 * a special kind of {@code IOException}, a {@link DataCorruptedException} signals that persistent
 * data may have been left in an unknown state.
 * </p>
 */
public interface Component extends Closeable {

    /**
     * Initializes the {@code Component}, allocating the resources it needs.
     *
     * @throws IOException
     *             in case initialization fails
     * @throws IllegalStateException
     *             in case the component has already been initialized or closed
     */
    void init() throws IOException, IllegalStateException;

    /**
     * Closes this {@code Component}, freeing allocated resources and aborting ongoing operations.
     * Calling this method on a component not initialized or already closed has no effect.
     */
    @Override
    void close();

}
