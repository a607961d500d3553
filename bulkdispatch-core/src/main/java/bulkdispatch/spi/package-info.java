/**
 * Service provider interfaces the engine depends on: identity and route pools, recipient
 * sets, template store, provider channels, job persistence and metrics.
 */
package bulkdispatch.spi;
