package com.gentoro.substrate.exception;

/** Malformed reference name. A caller error; retrying with the same input never succeeds. */
public class InvalidReferenceNameException extends SubstrateException {
  public InvalidReferenceNameException(String name, String operation, String reason) {
    super(
        SubstrateErrorCode.INVALID_REFERENCE_NAME,
        "Invalid reference name '" + printable(name) + "': " + reason,
        referenceContext(name, operation));
  }

  private static String printable(String name) {
    if (name == null) return "null";
    StringBuilder sb = new StringBuilder(name.length());
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (Character.isISOControl(c)) {
        sb.append(String.format("\\u%04x", (int) c));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
