package eu.fbk.wikistore.data;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Thrown when an IRI or a SPARQL query supplied by a client is not valid. The message is meant
 * to be returned to the client as is; the rejected input is available via
 * {@link #getParsedString()}.
 */
public class ParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String parsedString;

    public ParseException(final String parsedString, final String message) {
        this(parsedString, message, null);
    }

    public ParseException(final String parsedString, final String message,
            @Nullable final Throwable cause) {
        super(Preconditions.checkNotNull(message), cause);
        this.parsedString = Preconditions.checkNotNull(parsedString);
    }

    public final String getParsedString() {
        return this.parsedString;
    }

}
