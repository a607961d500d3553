package bulkdispatch.model;

import java.util.Objects;

public record LinkButton(String label, String url) {
  public LinkButton {
    Objects.requireNonNull(label, "label");
    Objects.requireNonNull(url, "url");
  }
}
