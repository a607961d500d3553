/**
 * Internal utilities.
 */
package bulkdispatch.util;
