/**
 * Synchronization of the triple store with a Wikibase instance.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.wikistore.loader;
