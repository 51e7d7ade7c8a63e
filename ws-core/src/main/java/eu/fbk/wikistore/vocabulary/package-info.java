/**
 * Vocabulary constants, exposed as {@link eu.fbk.wikistore.data.Iri} objects created once at
 * class initialization.
 */
package eu.fbk.wikistore.vocabulary;

