package eu.fbk.wikistore.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

import eu.fbk.wikistore.data.Iri;

/**
 * Constants for the RDF 1.1 vocabulary.
 *
 * @see <a href="https://www.w3.org/TR/rdf11-concepts/">vocabulary specification</a>
 */
public final class RDF {

    /** Recommended prefix for the vocabulary namespace: "rdf". */
    public static final String PREFIX = "rdf";

    /** Vocabulary namespace: "http://www.w3.org/1999/02/22-rdf-syntax-ns#". */
    public static final String NAMESPACE = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class rdf:Alt. */
    public static final Iri ALT = createIri("Alt");

    /** Class rdf:Bag. */
    public static final Iri BAG = createIri("Bag");

    /** Class rdf:HTML. */
    public static final Iri HTML = createIri("HTML");

    /** Class rdf:langString. */
    public static final Iri LANG_STRING = createIri("langString");

    /** Class rdf:List. */
    public static final Iri LIST = createIri("List");

    /** Class rdf:Property. */
    public static final Iri PROPERTY = createIri("Property");

    /** Class rdf:Seq. */
    public static final Iri SEQ = createIri("Seq");

    /** Class rdf:Statement. */
    public static final Iri STATEMENT = createIri("Statement");

    /** Class rdf:XMLLiteral. */
    public static final Iri XML_LITERAL = createIri("XMLLiteral");

    // PROPERTIES

    /** Property rdf:first. */
    public static final Iri FIRST = createIri("first");

    /** Resource rdf:nil. */
    public static final Iri NIL = createIri("nil");

    /** Property rdf:object. */
    public static final Iri OBJECT = createIri("object");

    /** Property rdf:predicate. */
    public static final Iri PREDICATE = createIri("predicate");

    /** Property rdf:rest. */
    public static final Iri REST = createIri("rest");

    /** Property rdf:subject. */
    public static final Iri SUBJECT = createIri("subject");

    /** Property rdf:type. */
    public static final Iri TYPE = createIri("type");

    /** Property rdf:value. */
    public static final Iri VALUE = createIri("value");

    // HELPER METHODS

    private static Iri createIri(final String localName) {
        return Iri.unchecked(NAMESPACE + localName);
    }

    private RDF() {
    }

}
