/**
 * The dispatch engine and its per-execution machinery.
 *
 * <p>{@link bulkdispatch.dispatch.DispatchEngine} runs a job on the caller's thread;
 * {@link bulkdispatch.dispatch.JobControl} is the gate operators use to pause, resume and
 * cancel it; {@link bulkdispatch.dispatch.PacingPolicy} decides how fast it sends; and
 * {@link bulkdispatch.dispatch.TemplateRenderer} turns templates into provider content.
 */
package bulkdispatch.dispatch;
