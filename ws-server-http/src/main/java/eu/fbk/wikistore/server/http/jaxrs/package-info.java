/**
 * JAX-RS implementation of the SPARQL protocol query endpoint.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.wikistore.server.http.jaxrs;
