/**
 * Domain model: jobs and their status machine, sender identities, egress routes,
 * recipients and message templates.
 *
 * <p>{@link bulkdispatch.model.Job} is the only mutable type; everything else is an
 * immutable record.
 */
package bulkdispatch.model;
