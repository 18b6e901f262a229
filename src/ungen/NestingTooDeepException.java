package ungen;

/** A definition, or the chain of generated signals below it, nests deeper than the expansion can follow. */
public class NestingTooDeepException extends UnGenException {
  private static final long serialVersionUID = 1L;

  private final String target;

  public NestingTooDeepException(String target, long stackSize, Throwable cause) {
    super("Expression nesting of " + target + " exceeds the expansion stack of " + (stackSize >> 10) + " KiB", cause);
    this.target = target;
  }

  /** Description of the requested signal. */
  public String getTarget() { return target; }
}
