/**
 * Root API of the bulk dispatch engine: deliver one message template to a deduplicated
 * recipient list through a rotating set of sender identities, with pausable, resumable and
 * cancellable jobs.
 *
 * <h2>Core Design</h2>
 * <p>A {@linkplain bulkdispatch.model.Job job} names a template, a recipient set and a list of
 * identity handles. The {@link bulkdispatch.JobManager} persists it through a
 * {@link bulkdispatch.spi.JobStore} and runs it on a bounded worker pool using the
 * {@linkplain bulkdispatch.dispatch.DispatchEngine dispatch engine}. The engine paces sends,
 * rotates identities after a fixed number of messages, waits out provider throttling and
 * checkpoints its cursor after every recipient, so a paused or interrupted job resumes exactly
 * where it stopped. Delivery is at-least-once across process restarts.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>bulkdispatch-core</b> - model, engine, manager, SPI and in-memory collaborators
 *       (zero external deps)</li>
 *   <li><b>bulkdispatch-jdbc</b> - {@linkplain bulkdispatch.jdbc JDBC job store hierarchy}
 *       (H2, MySQL, PostgreSQL)</li>
 *   <li><b>bulkdispatch-micrometer</b> - Micrometer metrics exporter</li>
 *   <li><b>bulkdispatch-spring-boot-starter</b> - auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var routes     = new InMemoryRoutePool();
 * var identities = new InMemoryIdentityPool(myChannelFactory, routes)
 *     .add(Identity.active("alice"))
 *     .add(Identity.active("bob"));
 * var recipients = new InMemoryRecipientSets();
 * String setId   = recipients.createSet();
 * recipients.importLines(setId, List.of("@carol", "123456789", "+44 7700 900123"));
 * var templates  = new InMemoryTemplateStore()
 *     .put(Template.text("welcome", "Welcome", "Hi {username}, today is {date}"));
 *
 * try (JobManager manager = JobManager.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .jobStore(JdbcJobStores.detect(dataSource))
 *     .identityPool(identities)
 *     .recipientSets(recipients)
 *     .templateStore(templates)
 *     .build()) {
 *   JobSnapshot job = manager.create("welcome wave", "welcome", setId, List.of("alice", "bob"));
 *   manager.start(job.id());
 * }
 * }</pre>
 *
 * @see bulkdispatch.JobManager
 * @see bulkdispatch.JobListener
 * @see bulkdispatch.dispatch.DispatchEngine
 */
package bulkdispatch;
