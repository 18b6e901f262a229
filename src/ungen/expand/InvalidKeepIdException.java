package ungen.expand;

import ungen.UnGenException;

/** An entry of a keep list is not a non-negative integer. */
public class InvalidKeepIdException extends UnGenException {
  private static final long serialVersionUID = 1L;

  private final String entry;

  public InvalidKeepIdException(String entry) {
    super("Invalid _GEN id to keep: '" + entry + "' (expected a non-negative integer)");
    this.entry = entry;
  }

  public String getEntry() { return entry; }
}
