package bulkdispatch.spi;

import bulkdispatch.model.Route;

import java.util.Optional;

public interface RoutePool {

  Optional<Route> get(String routeId);

  /** Next active route in round-robin order, or empty if none is active. */
  Optional<Route> nextActive();
}
