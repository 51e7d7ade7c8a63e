package eu.fbk.wikistore.internal.rdf;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.query.BindingSet;
import org.openrdf.query.QueryResultHandlerException;
import org.openrdf.query.resultio.BasicQueryWriterSettings;
import org.openrdf.query.resultio.QueryResultIO;
import org.openrdf.query.resultio.TupleQueryResultFormat;
import org.openrdf.query.resultio.TupleQueryResultWriter;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFWriter;
import org.openrdf.rio.Rio;
import org.openrdf.rio.WriterConfig;
import org.openrdf.rio.helpers.BasicWriterSettings;
import org.openrdf.rio.helpers.XMLWriterSettings;

public final class RDFUtil {

    private static final Escaper ESCAPER = Escapers.builder() //
            .addEscape('\t', "\\t") //
            .addEscape('\b', "\\b") //
            .addEscape('\n', "\\n") //
            .addEscape('\r', "\\r") //
            .addEscape('\f', "\\f") //
            .addEscape('\\', "\\\\") //
            .addEscape('\'', "\\'") //
            .addEscape('"', "\\\"") //
            .build();

    private RDFUtil() {
    }

    /**
     * Escapes the supplied text so that it can be embedded in a quoted string of the N-Triples,
     * Turtle or SPARQL syntaxes. Only tab, backspace, newline, carriage return, form feed,
     * backslash and quote characters are escaped; all other characters are returned unchanged.
     *
     * @param text
     *            the text to escape
     * @return the escaped text; the same string object is returned if no escaping was needed
     */
    public static String escape(final String text) {
        return ESCAPER.escape(text);
    }

    public static String toString(@Nullable final Value value) {
        if (value == null) {
            return "null";
        } else if (value instanceof URI) {
            return "<" + value.stringValue() + ">";
        } else if (value instanceof BNode) {
            return "_:" + ((BNode) value).getID();
        }
        final Literal literal = (Literal) value;
        final StringBuilder builder = new StringBuilder();
        builder.append('"').append(escape(literal.getLabel())).append('"');
        if (literal.getLanguage() != null) {
            builder.append('@').append(literal.getLanguage());
        } else if (literal.getDatatype() != null) {
            builder.append("^^<").append(literal.getDatatype().stringValue()).append('>');
        }
        return builder.toString();
    }

    public static String toString(final Statement statement) {
        final StringBuilder builder = new StringBuilder();
        builder.append(toString(statement.getSubject())).append(' ');
        builder.append(toString(statement.getPredicate())).append(' ');
        builder.append(toString(statement.getObject()));
        if (statement.getContext() != null) {
            builder.append(' ').append(toString(statement.getContext()));
        }
        return builder.append(" .").toString();
    }

    public static void writeRDF(final OutputStream out, final RDFFormat format,
            @Nullable final Map<String, String> namespaces,
            final Collection<? extends Statement> statements) throws IOException {

        final RDFWriter writer = Rio.createWriter(format, out);

        final WriterConfig config = writer.getWriterConfig();
        config.set(BasicWriterSettings.PRETTY_PRINT, true);
        config.set(BasicWriterSettings.RDF_LANGSTRING_TO_LANG_LITERAL, true);
        config.set(BasicWriterSettings.XSD_STRING_TO_PLAIN_LITERAL, true);
        if (format.equals(RDFFormat.RDFXML)) {
            config.set(XMLWriterSettings.INCLUDE_XML_PI, true);
            config.set(XMLWriterSettings.INCLUDE_ROOT_RDF_TAG, true);
        }

        try {
            writer.startRDF();
            if (namespaces != null && format.supportsNamespaces()) {
                for (final Map.Entry<String, String> entry : namespaces.entrySet()) {
                    writer.handleNamespace(entry.getKey(), entry.getValue());
                }
            }
            for (final Statement statement : statements) {
                writer.handleStatement(statement);
            }
            writer.endRDF();
        } catch (final RDFHandlerException ex) {
            throw new IOException("Cannot write RDF in format " + format.getName(), ex);
        }
    }

    public static void writeSparqlTuples(final OutputStream out,
            final TupleQueryResultFormat format, final List<String> variables,
            final Collection<? extends BindingSet> tuples) throws IOException {

        final TupleQueryResultWriter writer = QueryResultIO.createWriter(format, out);

        final WriterConfig config = writer.getWriterConfig();
        if (format.equals(TupleQueryResultFormat.JSON)
                || format.equals(TupleQueryResultFormat.SPARQL)) {
            config.set(BasicWriterSettings.PRETTY_PRINT, true);
            config.set(BasicWriterSettings.XSD_STRING_TO_PLAIN_LITERAL, true);
            config.set(BasicWriterSettings.RDF_LANGSTRING_TO_LANG_LITERAL, true);
            config.set(BasicQueryWriterSettings.ADD_SESAME_QNAME, false);
        }

        try {
            writer.startDocument();
            writer.startHeader();
            writer.startQueryResult(variables);
            for (final BindingSet tuple : tuples) {
                writer.handleSolution(tuple);
            }
            writer.endQueryResult();
        } catch (final QueryResultHandlerException ex) {
            throw new IOException("Cannot write SPARQL solutions in format " + format.getName(),
                    ex);
        }
    }

}
