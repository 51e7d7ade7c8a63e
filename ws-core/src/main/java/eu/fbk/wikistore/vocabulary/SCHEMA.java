package eu.fbk.wikistore.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

import eu.fbk.wikistore.data.Iri;

/**
 * Constants for the schema.org terms used by Wikibase entity data.
 *
 * @see <a href="https://schema.org/">vocabulary specification</a>
 */
public final class SCHEMA {

    /** Recommended prefix for the vocabulary namespace: "schema". */
    public static final String PREFIX = "schema";

    /** Vocabulary namespace: "http://schema.org/". */
    public static final String NAMESPACE = "http://schema.org/";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class schema:Article. */
    public static final Iri ARTICLE = createIri("Article");

    /** Class schema:Dataset. */
    public static final Iri DATASET = createIri("Dataset");

    // PROPERTIES

    /** Property schema:about. */
    public static final Iri ABOUT = createIri("about");

    /** Property schema:dateModified. */
    public static final Iri DATE_MODIFIED = createIri("dateModified");

    /** Property schema:description. */
    public static final Iri DESCRIPTION = createIri("description");

    /** Property schema:inLanguage. */
    public static final Iri IN_LANGUAGE = createIri("inLanguage");

    /** Property schema:isPartOf. */
    public static final Iri IS_PART_OF = createIri("isPartOf");

    /** Property schema:name. */
    public static final Iri NAME = createIri("name");

    /** Property schema:version. */
    public static final Iri VERSION = createIri("version");

    // HELPER METHODS

    private static Iri createIri(final String localName) {
        return Iri.unchecked(NAMESPACE + localName);
    }

    private SCHEMA() {
    }

}
