package bulkdispatch.dispatch;

import bulkdispatch.model.Identity;
import bulkdispatch.model.Job;
import bulkdispatch.spi.Channel;
import bulkdispatch.spi.IdentityPool;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State owned by one running {@link DispatchEngine#execute} invocation: the sendable
 * identities, the identity cursor, lazily acquired channels and rotation counters.
 *
 * <p>Not thread-safe; confined to the job's worker thread.
 */
final class ExecutionContext {
  private static final Logger logger = Logger.getLogger(ExecutionContext.class.getName());

  private final Job job;
  private final List<Identity> identities;
  private final IdentityPool identityPool;
  private final Map<String, Channel> channels = new HashMap<>();
  private int cursor;
  private int sentWithCurrent;
  private int consecutiveUnavailable;

  ExecutionContext(Job job, List<Identity> identities, IdentityPool identityPool) {
    if (identities.isEmpty()) {
      throw new IllegalArgumentException("identities must not be empty");
    }
    this.job = job;
    this.identities = List.copyOf(identities);
    this.identityPool = identityPool;
    this.cursor = Math.floorMod(job.identityCursor(), this.identities.size());
    job.identityCursor(cursor);
  }

  Identity currentIdentity() {
    return identities.get(cursor);
  }

  int identityCount() {
    return identities.size();
  }

  /**
   * Returns the cached channel of the current identity, acquiring it on first use.
   *
   * @throws bulkdispatch.spi.ChannelUnavailableException if it cannot be acquired
   */
  Channel channel() {
    Identity identity = currentIdentity();
    Channel channel = channels.get(identity.handle());
    if (channel == null) {
      channel = identityPool.acquireChannel(identity);
      channels.put(identity.handle(), channel);
    }
    return channel;
  }

  /**
   * Releases the current identity's channel and moves to the next identity (wrapping around).
   *
   * @return the new current identity
   */
  Identity rotate() {
    release(currentIdentity());
    cursor = (cursor + 1) % identities.size();
    sentWithCurrent = 0;
    job.identityCursor(cursor);
    return currentIdentity();
  }

  /** @return sends made with the current identity since the last rotation */
  int recordSent() {
    return ++sentWithCurrent;
  }

  /**
   * Records that the current identity could not be used.
   *
   * @return {@code true} once every identity has failed in a row
   */
  boolean markUnavailable() {
    return ++consecutiveUnavailable >= identities.size();
  }

  /** Records that a recipient reached its final outcome with the current identity. */
  void markAvailable() {
    consecutiveUnavailable = 0;
  }

  void releaseAll() {
    for (Identity identity : new ArrayList<>(identities)) {
      release(identity);
    }
  }

  private void release(Identity identity) {
    Channel channel = channels.remove(identity.handle());
    if (channel == null) return;
    try {
      identityPool.releaseChannel(identity, channel);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to release channel of identity " + identity.handle()
          + " for job " + job.id(), e);
    }
  }
}
