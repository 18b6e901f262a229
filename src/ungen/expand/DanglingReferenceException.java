package ungen.expand;

import ungen.UnGenException;

/** A generated signal is referenced but the source has neither a declaration nor an assignment for it. */
public class DanglingReferenceException extends UnGenException {
  private static final long serialVersionUID = 1L;

  private final String name;
  private final String referencedFrom;

  /**
   * @param name the generated signal without definition
   * @param referencedFrom the signal whose definition contains the reference
   */
  public DanglingReferenceException(String name, String referencedFrom) {
    super("Generated signal " + name + " referenced by " + referencedFrom + " has no definition");
    this.name = name;
    this.referencedFrom = referencedFrom;
  }

  public String getName() { return name; }
  public String getReferencedFrom() { return referencedFrom; }
}
