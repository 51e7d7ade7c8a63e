/**
 * {@code TripleStore} server-side component API ({@code ws-server}).
 * <p>
 * This package defines the {@code TripleStore} component, storing RDF triples within named graphs
 * and answering SPARQL queries on them, and provides:
 * </p>
 * <ul>
 * <li>the {@code TripleStore} API ({@link eu.fbk.wikistore.triplestore.TripleStore},
 * {@link eu.fbk.wikistore.triplestore.TripleTransaction});</li>
 * <li>a base class for store wrappers ({@link eu.fbk.wikistore.triplestore.TripleStoreDecorator})
 * with its transaction counterpart;</li>
 * <li>two decorators providing, respectively, logging support (
 * {@link eu.fbk.wikistore.triplestore.LoggingTripleStore}) and synchronization support (
 * {@link eu.fbk.wikistore.triplestore.SynchronizedTripleStore});</li>
 * <li>an implementation on top of Sesame repositories (
 * {@link eu.fbk.wikistore.triplestore.RepositoryTripleStore}).</li>
 * </ul>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.wikistore.triplestore;
