package ungen.expand;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Naming convention of compiler generated signals. A name is generated iff it matches the pattern as a whole;
 * the first capture group, if it participated in the match, holds the numeric id.
 */
public class GeneratedSignals {
  /** Matches <code>_GEN</code> and <code>_GEN_&lt;n&gt;</code>. */
  public static final String DEFAULT_PATTERN = "_GEN(?:_(\\d+))?";

  private final Pattern pattern;

  public GeneratedSignals() { this(DEFAULT_PATTERN); }

  /**
   * @param regex whole-name pattern with at least one capture group for the id
   * @throws IllegalArgumentException if the pattern is invalid or has no capture group
   */
  public GeneratedSignals(String regex) {
    try {
      this.pattern = Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid generated signal pattern '" + regex + "': " + e.getDescription(), e);
    }
    if (pattern.matcher("").groupCount() < 1)
      throw new IllegalArgumentException("Generated signal pattern '" + regex + "' has no capture group for the id");
  }

  public String getPattern() { return pattern.pattern(); }

  public boolean isGenerated(String name) { return pattern.matcher(name).matches(); }

  /**
   * Extracts the id of a generated name.
   * @return the id, empty for real signals, for generated names without id and for ids that do not fit an int
   */
  public OptionalInt idOf(String name) {
    Matcher matcher = pattern.matcher(name);
    if (!matcher.matches() || matcher.group(1) == null)
      return OptionalInt.empty();
    try {
      return OptionalInt.of(Integer.parseInt(matcher.group(1)));
    } catch (NumberFormatException e) {
      return OptionalInt.empty();
    }
  }
}
