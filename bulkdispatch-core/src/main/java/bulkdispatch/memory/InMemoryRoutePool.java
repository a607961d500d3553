package bulkdispatch.memory;

import bulkdispatch.model.Route;
import bulkdispatch.spi.RoutePool;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link RoutePool} with round-robin selection over active routes.
 */
public final class InMemoryRoutePool implements RoutePool {
  private final Map<String, Route> routes = new ConcurrentHashMap<>();
  private final AtomicInteger next = new AtomicInteger();

  public InMemoryRoutePool add(Route route) {
    routes.put(route.id(), route);
    return this;
  }

  public boolean remove(String routeId) {
    return routes.remove(routeId) != null;
  }

  /** Activates or deactivates a route; identities on an inactive route cannot send. */
  public boolean setActive(String routeId, boolean active) {
    return routes.computeIfPresent(routeId, (id, route) -> route.withActive(active)) != null;
  }

  public List<Route> list() {
    List<Route> sorted = new ArrayList<>(routes.values());
    sorted.sort((a, b) -> a.id().compareTo(b.id()));
    return sorted;
  }

  @Override
  public Optional<Route> get(String routeId) {
    return Optional.ofNullable(routes.get(routeId));
  }

  @Override
  public Optional<Route> nextActive() {
    List<Route> active = list().stream().filter(Route::active).toList();
    if (active.isEmpty()) {
      return Optional.empty();
    }
    int index = (next.getAndIncrement() & 0x7FFFFFFF) % active.size();
    return Optional.of(active.get(index));
  }
}
