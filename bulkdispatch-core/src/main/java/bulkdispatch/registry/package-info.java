/**
 * Registry of active job executions, keyed by job id.
 *
 * @see bulkdispatch.registry.ActiveJobRegistry
 */
package bulkdispatch.registry;
