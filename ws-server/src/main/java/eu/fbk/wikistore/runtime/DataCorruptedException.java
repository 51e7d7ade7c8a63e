package eu.fbk.wikistore.runtime;

import java.io.IOException;

/**
 * An {@code IOException} reporting that a store transaction could be neither committed nor
 * rolled back. The content of the store is unknown afterwards; the store directory should be
 * deleted and synchronized again from scratch.
 */
public class DataCorruptedException extends IOException {

    private static final long serialVersionUID = 1L;

    public DataCorruptedException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
