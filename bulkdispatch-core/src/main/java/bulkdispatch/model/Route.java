package bulkdispatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Egress route (proxy) an identity connects through.
 */
public record Route(
    String id,
    RouteType type,
    String host,
    int port,
    String username,
    String password,
    boolean active,
    Instant lastTested,
    boolean working
) {
  public Route {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(host, "host");
    if (port < 1 || port > 65535) {
      throw new IllegalArgumentException("port out of range: " + port);
    }
  }

  public static Route of(String id, RouteType type, String host, int port) {
    return new Route(id, type, host, port, null, null, true, null, true);
  }

  public boolean hasCredentials() {
    return username != null && !username.isEmpty();
  }

  /** Renders {@code scheme://[user:pass@]host:port}. */
  public String connectionUri() {
    StringBuilder sb = new StringBuilder(type.scheme()).append("://");
    if (hasCredentials()) {
      sb.append(username);
      if (password != null) {
        sb.append(':').append(password);
      }
      sb.append('@');
    }
    return sb.append(host).append(':').append(port).toString();
  }

  public Route withActive(boolean active) {
    return new Route(id, type, host, port, username, password, active, lastTested, working);
  }

  public Route withTestResult(boolean working, Instant testedAt) {
    return new Route(id, type, host, port, username, password, active, testedAt, working);
  }

  @Override
  public String toString() {
    return "Route[" + id + ", " + type.scheme() + "://" + host + ":" + port + "]";
  }
}
