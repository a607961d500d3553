package bulkdispatch.dispatch;

import bulkdispatch.model.Job;

/**
 * Persists a job's state. The engine calls it after every status transition and every
 * cursor advance.
 */
@FunctionalInterface
public interface JobCheckpoint {

  JobCheckpoint NONE = job -> {
  };

  void save(Job job);
}
