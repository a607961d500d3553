package bulkdispatch.memory;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlacklistTest {

  @Test
  void matchingIgnoresCaseAndAt() {
    var blacklist = new Blacklist();

    assertTrue(blacklist.add("@Spammer"));
    assertFalse(blacklist.add("spammer"));
    assertTrue(blacklist.contains("SPAMMER"));
    assertTrue(blacklist.contains("@spammer"));
    assertEquals(List.of("spammer"), blacklist.entries());
  }

  @Test
  void removeAndClear() {
    var blacklist = new Blacklist();
    blacklist.add("a");
    blacklist.add("b");

    assertTrue(blacklist.remove("@A"));
    assertFalse(blacklist.contains("a"));
    assertEquals(1, blacklist.clear());
    assertEquals(0, blacklist.size());
  }
}
