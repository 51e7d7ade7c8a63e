package eu.fbk.wikistore.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

import eu.fbk.wikistore.data.Iri;

/**
 * Constants for the RDF compatible XML Schema datatypes.
 *
 * @see <a href="https://www.w3.org/TR/rdf11-concepts/#xsd-datatypes">vocabulary specification</a>
 */
public final class XSD {

    /** Recommended prefix for the vocabulary namespace: "xsd". */
    public static final String PREFIX = "xsd";

    /** Vocabulary namespace: "http://www.w3.org/2001/XMLSchema#". */
    public static final String NAMESPACE = "http://www.w3.org/2001/XMLSchema#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // DATATYPES

    /** Datatype xsd:boolean. */
    public static final Iri BOOLEAN = createIri("boolean");

    /** Datatype xsd:byte. */
    public static final Iri BYTE = createIri("byte");

    /** Datatype xsd:date. */
    public static final Iri DATE = createIri("date");

    /** Datatype xsd:dateTime. */
    public static final Iri DATE_TIME = createIri("dateTime");

    /** Datatype xsd:dateTimeStamp. */
    public static final Iri DATE_TIME_STAMP = createIri("dateTimeStamp");

    /** Datatype xsd:dayTimeDuration. */
    public static final Iri DAY_TIME_DURATION = createIri("dayTimeDuration");

    /** Datatype xsd:decimal. */
    public static final Iri DECIMAL = createIri("decimal");

    /** Datatype xsd:double. */
    public static final Iri DOUBLE = createIri("double");

    /** Datatype xsd:duration. */
    public static final Iri DURATION = createIri("duration");

    /** Datatype xsd:float. */
    public static final Iri FLOAT = createIri("float");

    /** Datatype xsd:gDay. */
    public static final Iri G_DAY = createIri("gDay");

    /** Datatype xsd:gMonth. */
    public static final Iri G_MONTH = createIri("gMonth");

    /** Datatype xsd:gMonthDay. */
    public static final Iri G_MONTH_DAY = createIri("gMonthDay");

    /** Datatype xsd:gYear. */
    public static final Iri G_YEAR = createIri("gYear");

    /** Datatype xsd:gYearMonth. */
    public static final Iri G_YEAR_MONTH = createIri("gYearMonth");

    /** Datatype xsd:int. */
    public static final Iri INT = createIri("int");

    /** Datatype xsd:integer. */
    public static final Iri INTEGER = createIri("integer");

    /** Datatype xsd:language. */
    public static final Iri LANGUAGE = createIri("language");

    /** Datatype xsd:long. */
    public static final Iri LONG = createIri("long");

    /** Datatype xsd:negativeInteger. */
    public static final Iri NEGATIVE_INTEGER = createIri("negativeInteger");

    /** Datatype xsd:nonNegativeInteger. */
    public static final Iri NON_NEGATIVE_INTEGER = createIri("nonNegativeInteger");

    /** Datatype xsd:nonPositiveInteger. */
    public static final Iri NON_POSITIVE_INTEGER = createIri("nonPositiveInteger");

    /** Datatype xsd:normalizedString. */
    public static final Iri NORMALIZED_STRING = createIri("normalizedString");

    /** Datatype xsd:positiveInteger. */
    public static final Iri POSITIVE_INTEGER = createIri("positiveInteger");

    /** Datatype xsd:short. */
    public static final Iri SHORT = createIri("short");

    /** Datatype xsd:string. */
    public static final Iri STRING = createIri("string");

    /** Datatype xsd:time. */
    public static final Iri TIME = createIri("time");

    /** Datatype xsd:token. */
    public static final Iri TOKEN = createIri("token");

    /** Datatype xsd:unsignedByte. */
    public static final Iri UNSIGNED_BYTE = createIri("unsignedByte");

    /** Datatype xsd:unsignedInt. */
    public static final Iri UNSIGNED_INT = createIri("unsignedInt");

    /** Datatype xsd:unsignedLong. */
    public static final Iri UNSIGNED_LONG = createIri("unsignedLong");

    /** Datatype xsd:unsignedShort. */
    public static final Iri UNSIGNED_SHORT = createIri("unsignedShort");

    /** Datatype xsd:yearMonthDuration. */
    public static final Iri YEAR_MONTH_DURATION = createIri("yearMonthDuration");

    // HELPER METHODS

    private static Iri createIri(final String localName) {
        return Iri.unchecked(NAMESPACE + localName);
    }

    private XSD() {
    }

}
