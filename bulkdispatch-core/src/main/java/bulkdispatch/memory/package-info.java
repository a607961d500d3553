/**
 * In-memory collaborators: identity and route pools, recipient sets with import,
 * deduplication and blacklist, and a template store.
 *
 * <p>Suitable for tests and single-process deployments where identities, routes and
 * templates are loaded at startup. Only jobs need durable storage, see
 * {@link bulkdispatch.spi.JobStore}.
 */
package bulkdispatch.memory;
