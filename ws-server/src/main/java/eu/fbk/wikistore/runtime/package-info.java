/**
 * Server-side runtime services ({@code ws-server}): component lifecycle (
 * {@link eu.fbk.wikistore.runtime.Component}), transaction synchronization (
 * {@link eu.fbk.wikistore.runtime.Synchronizer}) and the signalling of corrupted data (
 * {@link eu.fbk.wikistore.runtime.DataCorruptedException}).
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.wikistore.runtime;
