package eu.fbk.wikistore.data;

import java.io.Serializable;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.openrdf.model.URI;
import org.openrdf.model.impl.URIImpl;

/**
 * An absolute RDF IRI, validated against the RFC 3987 grammar.
 * <p>
 * An {@code Iri} wraps the IRI string, which is validated once at construction time via
 * {@link #parse(String)} and trusted thereafter. Method {@link #unchecked(String)} skips
 * validation and is reserved to IRI constants known to be valid (e.g., vocabulary terms).
 * Instances are immutable and thread safe; equality, hashing and ordering are based on the IRI
 * string. The string form returned by {@link #toString()} encloses the IRI in angle brackets, as
 * done by N-Triples, Turtle and SPARQL; the bare IRI string is returned by
 * {@link #stringValue()}.
 * </p>
 * <p>
 * Interoperability with the Sesame model is provided by {@link #toURI()} and
 * {@link #valueOf(URI)}; an {@code Iri} and the Sesame {@code URI} obtained from it always
 * denote the same IRI string, but they are never equal to each other: convert one into the other
 * before comparing them.
 * </p>
 */
public final class Iri implements Comparable<Iri>, Serializable {

    private static final long serialVersionUID = 1L;

    private final String iri;

    private Iri(final String iri) {
        this.iri = iri;
    }

    /**
     * Parses and validates the supplied string as an absolute IRI.
     *
     * @param iri
     *            the IRI string
     * @return the corresponding {@code Iri}
     * @throws ParseException
     *             if the string is not a valid absolute IRI
     */
    public static Iri parse(final String iri) throws ParseException {
        Preconditions.checkNotNull(iri);
        final String error = Validator.validate(iri);
        if (error != null) {
            throw new ParseException(iri, "Invalid IRI '" + iri + "': " + error);
        }
        return new Iri(iri);
    }

    /**
     * Creates an {@code Iri} without validating the supplied string. It is the caller's
     * responsibility to ensure that the string is a valid absolute IRI.
     *
     * @param iri
     *            the IRI string, assumed valid
     * @return the corresponding {@code Iri}
     */
    public static Iri unchecked(final String iri) {
        return new Iri(Preconditions.checkNotNull(iri));
    }

    /**
     * Returns the {@code Iri} corresponding to the supplied Sesame {@code URI}, validating it.
     *
     * @param uri
     *            the Sesame URI
     * @return the corresponding {@code Iri}
     * @throws ParseException
     *             if the URI string is not a valid absolute IRI
     */
    public static Iri valueOf(final URI uri) throws ParseException {
        return parse(uri.stringValue());
    }

    /**
     * Checks whether the supplied string is a valid absolute IRI.
     *
     * @param iri
     *            the string to check
     * @return true if the string can be parsed with {@link #parse(String)}
     */
    public static boolean isValid(final String iri) {
        return Validator.validate(iri) == null;
    }

    /**
     * Returns the IRI string, without angle brackets.
     *
     * @return the IRI string
     */
    public String stringValue() {
        return this.iri;
    }

    /**
     * Returns a Sesame {@code URI} with the same IRI string.
     *
     * @return the Sesame URI
     */
    public URI toURI() {
        return new URIImpl(this.iri);
    }

    @Override
    public int compareTo(final Iri other) {
        return this.iri.compareTo(other.iri);
    }

    /**
     * {@inheritDoc} Two {@code Iri}s are equal if they have the same IRI string. An {@code Iri}
     * is never equal to a Sesame {@code URI}, not even to the one returned by {@link #toURI()};
     * compare {@code iri.toURI()} with the {@code URI}, or {@code Iri.valueOf(uri)} with the
     * {@code Iri}.
     */
    @Override
    public boolean equals(@Nullable final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Iri)) {
            return false;
        }
        return this.iri.equals(((Iri) object).iri);
    }

    @Override
    public int hashCode() {
        return this.iri.hashCode();
    }

    /**
     * Returns the IRI enclosed in angle brackets, e.g. {@code <http://example.com/foo>}.
     */
    @Override
    public String toString() {
        return "<" + this.iri + ">";
    }

    // Recognizer for the RFC 3987 IRI production. Each method advances 'index' past the
    // component it recognizes, or throws a Failure with the position and reason of the error.

    private static final class Validator {

        private final String string;

        private int index;

        private Validator(final String string) {
            this.string = string;
            this.index = 0;
        }

        @Nullable
        static String validate(final String string) {
            try {
                new Validator(string).parseIRI();
                return null;
            } catch (final Failure ex) {
                return ex.getMessage();
            }
        }

        private void parseIRI() {
            parseScheme();
            if (this.string.startsWith("//", this.index)) {
                this.index += 2;
                parseAuthority();
            }
            while (this.index < this.string.length()) {
                final int c = this.string.codePointAt(this.index);
                if (c == '?' || c == '#') {
                    break;
                }
                consumeIpchar(c, "/");
            }
            if (this.index < this.string.length() && this.string.charAt(this.index) == '?') {
                ++this.index;
                while (this.index < this.string.length()) {
                    final int c = this.string.codePointAt(this.index);
                    if (c == '#') {
                        break;
                    } else if (isPrivate(c)) {
                        this.index += Character.charCount(c);
                    } else {
                        consumeIpchar(c, "/?");
                    }
                }
            }
            if (this.index < this.string.length() && this.string.charAt(this.index) == '#') {
                ++this.index;
                while (this.index < this.string.length()) {
                    consumeIpchar(this.string.codePointAt(this.index), "/?");
                }
            }
        }

        private void parseScheme() {
            if (this.string.isEmpty() || !isAlpha(this.string.charAt(0))) {
                throw fail("no scheme found in an absolute IRI");
            }
            for (int i = 1; i < this.string.length(); ++i) {
                final char c = this.string.charAt(i);
                if (c == ':') {
                    this.index = i + 1;
                    return;
                } else if (!isAlpha(c) && !isDigit(c) && c != '+' && c != '-' && c != '.') {
                    break;
                }
            }
            throw fail("no scheme found in an absolute IRI");
        }

        private void parseAuthority() {
            int end = this.index;
            while (end < this.string.length() && "/?#".indexOf(this.string.charAt(end)) < 0) {
                ++end;
            }
            final int at = this.string.indexOf('@', this.index);
            if (at >= 0 && at < end) {
                while (this.index < at) {
                    consumeIpchar(this.string.codePointAt(this.index), "");
                }
                this.index = at + 1;
            }
            if (this.index < end && this.string.charAt(this.index) == '[') {
                final int close = this.string.indexOf(']', this.index);
                if (close < 0 || close >= end) {
                    throw fail("unterminated IP literal");
                }
                for (int i = this.index + 1; i < close; ++i) {
                    final char c = this.string.charAt(i);
                    if (!isHex(c) && c != ':' && c != '.' && c != 'v' && c != 'V'
                            && !isUnreservedAscii(c) && !isSubDelim(c)) {
                        this.index = i;
                        throw fail("invalid character in IP literal");
                    }
                }
                this.index = close + 1;
            } else {
                while (this.index < end) {
                    final int c = this.string.codePointAt(this.index);
                    if (c == ':') {
                        break;
                    }
                    consumeIpchar(c, "");
                }
            }
            if (this.index < end) {
                if (this.string.charAt(this.index) != ':') {
                    throw fail("invalid character in host");
                }
                ++this.index;
                while (this.index < end) {
                    if (!isDigit(this.string.charAt(this.index))) {
                        throw fail("invalid port");
                    }
                    ++this.index;
                }
            }
        }

        private void consumeIpchar(final int c, final String extra) {
            if (c == '%') {
                if (this.index + 2 >= this.string.length()
                        || !isHex(this.string.charAt(this.index + 1))
                        || !isHex(this.string.charAt(this.index + 2))) {
                    throw fail("invalid percent encoding");
                }
                this.index += 3;
            } else if (c < 0x80 && (isUnreservedAscii((char) c) || isSubDelim((char) c)
                    || c == ':' || c == '@' || extra.indexOf(c) >= 0)) {
                ++this.index;
            } else if (isUcschar(c)) {
                this.index += Character.charCount(c);
            } else {
                throw fail("invalid character '" + new String(Character.toChars(c)) + "'");
            }
        }

        private Failure fail(final String reason) {
            return new Failure(reason + " at position " + this.index);
        }

        private static boolean isAlpha(final char c) {
            return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
        }

        private static boolean isDigit(final char c) {
            return c >= '0' && c <= '9';
        }

        private static boolean isHex(final char c) {
            return isDigit(c) || c >= 'a' && c <= 'f' || c >= 'A' && c <= 'F';
        }

        private static boolean isUnreservedAscii(final char c) {
            return isAlpha(c) || isDigit(c) || c == '-' || c == '.' || c == '_' || c == '~';
        }

        private static boolean isSubDelim(final char c) {
            return "!$&'()*+,;=".indexOf(c) >= 0;
        }

        private static boolean isUcschar(final int c) {
            if (c >= 0xA0 && c <= 0xD7FF || c >= 0xF900 && c <= 0xFDCF || c >= 0xFDF0
                    && c <= 0xFFEF) {
                return true;
            }
            // planes 1 to 14, excluding the last two code points of each plane
            return c >= 0x10000 && c <= 0xEFFFD && (c & 0xFFFF) <= 0xFFFD;
        }

        private static boolean isPrivate(final int c) {
            return c >= 0xE000 && c <= 0xF8FF || c >= 0xF0000 && c <= 0xFFFFD || c >= 0x100000
                    && c <= 0x10FFFD;
        }

    }

    private static final class Failure extends RuntimeException {

        private static final long serialVersionUID = 1L;

        Failure(final String message) {
            super(message, null, false, false);
        }

    }

}
