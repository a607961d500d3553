/**
 * Deferred job starts.
 */
package bulkdispatch.schedule;
