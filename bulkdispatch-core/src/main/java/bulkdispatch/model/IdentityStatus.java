package bulkdispatch.model;

public enum IdentityStatus {
  UNKNOWN(0),
  ACTIVE(1),
  RESTRICTED(2),
  BANNED(3),
  INVALID(4);

  private final int code;

  IdentityStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Banned and invalid identities can never open a channel. */
  public boolean isUsable() {
    return this != BANNED && this != INVALID;
  }
}
