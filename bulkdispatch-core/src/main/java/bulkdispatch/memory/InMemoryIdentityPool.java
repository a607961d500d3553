package bulkdispatch.memory;

import bulkdispatch.model.Identity;
import bulkdispatch.model.Route;
import bulkdispatch.spi.Channel;
import bulkdispatch.spi.ChannelUnavailableException;
import bulkdispatch.spi.IdentityPool;
import bulkdispatch.spi.RoutePool;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link IdentityPool}. Channels are opened through a {@link ChannelFactory}, over
 * the identity's assigned route when it has one.
 *
 * <p>Acquisition fails with {@link ChannelUnavailableException} when the identity cannot send,
 * is banned or invalid, or its route is missing or inactive.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryIdentityPool implements IdentityPool {
  private final ChannelFactory channelFactory;
  private final RoutePool routePool;
  private final Clock clock;
  private final Map<String, Identity> identities = new ConcurrentHashMap<>();

  public InMemoryIdentityPool(ChannelFactory channelFactory, RoutePool routePool) {
    this(channelFactory, routePool, Clock.systemUTC());
  }

  public InMemoryIdentityPool(ChannelFactory channelFactory, RoutePool routePool, Clock clock) {
    this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
    this.routePool = Objects.requireNonNull(routePool, "routePool");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Adds or replaces an identity. */
  public InMemoryIdentityPool add(Identity identity) {
    identities.put(identity.handle(), identity);
    return this;
  }

  public Optional<Identity> get(String handle) {
    return Optional.ofNullable(identities.get(handle));
  }

  public boolean remove(String handle) {
    return identities.remove(handle) != null;
  }

  public Collection<Identity> all() {
    return List.copyOf(identities.values());
  }

  @Override
  public List<Identity> listByHandles(List<String> handles) {
    List<Identity> result = new ArrayList<>(handles.size());
    for (String handle : handles) {
      Identity identity = identities.get(handle);
      if (identity != null) {
        result.add(identity);
      }
    }
    return result;
  }

  @Override
  public Channel acquireChannel(Identity identity) {
    Identity current = identities.getOrDefault(identity.handle(), identity);
    if (!current.canSend() || !current.status().isUsable()) {
      throw new ChannelUnavailableException(current.handle(),
          "Identity " + current.handle() + " cannot send (" + current.status() + ")");
    }
    Route route = null;
    if (current.routeId() != null) {
      route = routePool.get(current.routeId())
          .filter(Route::active)
          .orElseThrow(() -> new ChannelUnavailableException(current.handle(),
              "Route " + current.routeId() + " of identity " + current.handle() + " is not active"));
    }
    return channelFactory.open(current, route);
  }

  @Override
  public void releaseChannel(Identity identity, Channel channel) {
    channelFactory.close(identity, channel);
  }

  @Override
  public void recordUsage(String handle, boolean success) {
    identities.computeIfPresent(handle, (h, identity) -> identity.withUsage(success, clock.instant()));
  }
}
