/**
 * HTTP frontend ({@link eu.fbk.wikistore.server.http.HttpServer}) and command line launcher
 * ({@link eu.fbk.wikistore.server.http.Launcher}) of Wikistore.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.wikistore.server.http;
