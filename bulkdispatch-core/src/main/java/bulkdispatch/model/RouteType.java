package bulkdispatch.model;

public enum RouteType {
  HTTP("http"),
  SOCKS5("socks5");

  private final String scheme;

  RouteType(String scheme) {
    this.scheme = scheme;
  }

  public String scheme() {
    return scheme;
  }
}
