package bulkdispatch.model;

public enum ContentMode {
  TEXT,
  MEDIA,
  FORWARD
}
