package bulkdispatch.memory;

import bulkdispatch.model.Identity;
import bulkdispatch.model.IdentityStatus;
import bulkdispatch.model.Route;
import bulkdispatch.model.RouteType;
import bulkdispatch.spi.Channel;
import bulkdispatch.spi.ChannelUnavailableException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryIdentityPoolTest {
  private final AtomicReference<Route> openedRoute = new AtomicReference<>();
  private final Channel channel = new bulkdispatch.dispatch.ScriptedChannelFactory()
      .open(Identity.active("stub"), null);
  private InMemoryRoutePool routes;
  private InMemoryIdentityPool pool;

  @BeforeEach
  void setUp() {
    routes = new InMemoryRoutePool();
    pool = new InMemoryIdentityPool((identity, route) -> {
      openedRoute.set(route);
      return channel;
    }, routes, Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
  }

  @Test
  void listByHandlesKeepsOrderAndDropsUnknown() {
    pool.add(Identity.active("a")).add(Identity.active("b"));

    assertEquals(List.of("b", "a"), pool.listByHandles(List.of("b", "x", "a")).stream()
        .map(Identity::handle).toList());
  }

  @Test
  void acquireOpensThroughActiveRoute() {
    routes.add(Route.of("r1", RouteType.SOCKS5, "10.0.0.1", 1080));
    pool.add(Identity.active("a").withRoute("r1"));

    assertSame(channel, pool.acquireChannel(pool.get("a").orElseThrow()));
    assertEquals("r1", openedRoute.get().id());
  }

  @Test
  void acquireFailsOnInactiveOrMissingRoute() {
    routes.add(Route.of("r1", RouteType.HTTP, "proxy", 8080));
    routes.setActive("r1", false);
    Identity onInactive = Identity.active("a").withRoute("r1");
    Identity onMissing = Identity.active("b").withRoute("nope");
    pool.add(onInactive).add(onMissing);

    var e = assertThrows(ChannelUnavailableException.class, () -> pool.acquireChannel(onInactive));
    assertEquals("a", e.identity());
    assertThrows(ChannelUnavailableException.class, () -> pool.acquireChannel(onMissing));
  }

  @Test
  void acquireFailsForBannedIdentity() {
    Identity banned = Identity.active("a").withStatus(IdentityStatus.BANNED, true);
    pool.add(banned);

    assertThrows(ChannelUnavailableException.class, () -> pool.acquireChannel(banned));
  }

  @Test
  void recordUsageUpdatesCounters() {
    pool.add(Identity.active("a"));

    pool.recordUsage("a", true);
    pool.recordUsage("a", true);
    pool.recordUsage("a", false);
    pool.recordUsage("unknown", true);

    Identity a = pool.get("a").orElseThrow();
    assertEquals(2, a.sentCount());
    assertEquals(1, a.errorCount());
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), a.lastUsed());
  }
}
