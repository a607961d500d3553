package bulkdispatch.model;

public enum RecipientKind {
  HANDLE,
  NUMERIC_ID,
  PHONE
}
