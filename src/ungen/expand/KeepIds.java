package ungen.expand;

import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/** Parsing of keep lists, the generated ids that must not be expanded. */
public final class KeepIds {
  private static final Pattern decimal = Pattern.compile("\\d+");

  private KeepIds() {}

  /**
   * Parses a comma separated list such as <code>3,12, 40</code>. Null or blank text gives an empty set.
   * @throws InvalidKeepIdException for an entry that is not a non-negative int
   */
  public static Set<Integer> parse(String text) throws InvalidKeepIdException {
    Set<Integer> ret = new TreeSet<>();
    if (text == null || text.isBlank())
      return ret;
    for (String entry : text.split(",", -1))
      ret.add(parseEntry(entry.trim()));
    return ret;
  }

  /**
   * Converts list entries as loaded from a configuration file; entries may be numbers or strings.
   * @throws InvalidKeepIdException for an entry that is not a non-negative int
   */
  public static Set<Integer> of(Collection<?> entries) throws InvalidKeepIdException {
    Set<Integer> ret = new TreeSet<>();
    for (Object entry : entries) {
      if (entry instanceof Integer) {
        int id = (Integer)entry;
        if (id < 0)
          throw new InvalidKeepIdException(entry.toString());
        ret.add(id);
      } else {
        ret.add(parseEntry(String.valueOf(entry).trim()));
      }
    }
    return ret;
  }

  private static int parseEntry(String entry) throws InvalidKeepIdException {
    if (!decimal.matcher(entry).matches())
      throw new InvalidKeepIdException(entry);
    try {
      return Integer.parseInt(entry);
    } catch (NumberFormatException e) {
      throw new InvalidKeepIdException(entry);
    }
  }
}
