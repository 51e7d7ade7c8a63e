package eu.fbk.wikistore.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

import eu.fbk.wikistore.data.Iri;

/**
 * Constants for the RDF Schema vocabulary.
 *
 * @see <a href="https://www.w3.org/TR/rdf-schema/">vocabulary specification</a>
 */
public final class RDFS {

    /** Recommended prefix for the vocabulary namespace: "rdfs". */
    public static final String PREFIX = "rdfs";

    /** Vocabulary namespace: "http://www.w3.org/2000/01/rdf-schema#". */
    public static final String NAMESPACE = "http://www.w3.org/2000/01/rdf-schema#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class rdfs:Class. */
    public static final Iri CLASS = createIri("Class");

    /** Class rdfs:Container. */
    public static final Iri CONTAINER = createIri("Container");

    /** Class rdfs:ContainerMembershipProperty. */
    public static final Iri CONTAINER_MEMBERSHIP_PROPERTY = createIri("ContainerMembershipProperty");

    /** Class rdfs:Datatype. */
    public static final Iri DATATYPE = createIri("Datatype");

    /** Class rdfs:Literal. */
    public static final Iri LITERAL = createIri("Literal");

    /** Class rdfs:Resource. */
    public static final Iri RESOURCE = createIri("Resource");

    // PROPERTIES

    /** Property rdfs:comment. */
    public static final Iri COMMENT = createIri("comment");

    /** Property rdfs:domain. */
    public static final Iri DOMAIN = createIri("domain");

    /** Property rdfs:isDefinedBy. */
    public static final Iri IS_DEFINED_BY = createIri("isDefinedBy");

    /** Property rdfs:label. */
    public static final Iri LABEL = createIri("label");

    /** Property rdfs:member. */
    public static final Iri MEMBER = createIri("member");

    /** Property rdfs:range. */
    public static final Iri RANGE = createIri("range");

    /** Property rdfs:seeAlso. */
    public static final Iri SEE_ALSO = createIri("seeAlso");

    /** Property rdfs:subClassOf. */
    public static final Iri SUB_CLASS_OF = createIri("subClassOf");

    /** Property rdfs:subPropertyOf. */
    public static final Iri SUB_PROPERTY_OF = createIri("subPropertyOf");

    // HELPER METHODS

    private static Iri createIri(final String localName) {
        return Iri.unchecked(NAMESPACE + localName);
    }

    private RDFS() {
    }

}
