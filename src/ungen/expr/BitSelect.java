package ungen.expr;

import java.util.Optional;

/**
 * Bit-select or part-select suffix.
 * @param kind select form
 * @param first index, msb or base
 * @param second lsb or width; empty for {@link Kind#INDEX}
 */
public record BitSelect(Kind kind, Expression first, Optional<Expression> second) {
  public enum Kind {
    /** <code>[idx]</code> */
    INDEX(""),
    /** <code>[msb:lsb]</code> */
    RANGE(":"),
    /** <code>[base+:width]</code> */
    INDEXED_UP("+:"),
    /** <code>[base-:width]</code> */
    INDEXED_DOWN("-:");

    private final String separator;

    Kind(String separator) { this.separator = separator; }

    public String getSeparator() { return separator; }
  }

  public BitSelect {
    if ((kind == Kind.INDEX) != second.isEmpty())
      throw new IllegalArgumentException("only an index select has a single operand");
  }

  public static BitSelect index(Expression index) { return new BitSelect(Kind.INDEX, index, Optional.empty()); }
  public static BitSelect range(Expression msb, Expression lsb) { return new BitSelect(Kind.RANGE, msb, Optional.of(lsb)); }
}
