package bulkdispatch.model;

public enum MediaType {
  PHOTO,
  DOCUMENT,
  VIDEO
}
