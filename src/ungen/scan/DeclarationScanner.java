package ungen.scan;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Extracts the <code>wire</code>/<code>reg</code> declarations and the assignment statements of a Verilog source into a {@link SignalTable}.
 * <p>
 * Recognized statements (each starting on a new line or after the <code>;</code> of the previous statement, possibly continued over
 * several lines up to the terminating <code>;</code>):
 * <ul>
 * <li><code>wire [7:0] name;</code>, <code>reg name;</code>, port declarations like <code>output [3:0] io_out,</code></li>
 * <li><code>wire [7:0] name = expr;</code></li>
 * <li><code>assign name = expr;</code></li>
 * <li><code>name &lt;= expr;</code>, optionally preceded by <code>begin</code>, <code>end</code>, <code>else</code>, <code>if (...)</code> or an
 * <code>always @(...)</code> header on the same line</li>
 * </ul>
 * Everything else is ignored. Right-hand sides are stored as raw text; they are only parsed when a signal is actually visited.
 */
public class DeclarationScanner {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  static final String IDENT = "[A-Za-z_][A-Za-z0-9_$]*";

  private static final Pattern declStart = Pattern.compile("^(?:input|output|inout|wire|reg)\\b");
  private static final Pattern declHead = Pattern.compile(
      "^(?:(input|output|inout)\\b\\s*)?(?:(wire|reg)\\b\\s*)?(?:(?:signed|unsigned)\\b\\s*)?(\\[[^\\]]*\\])?\\s*");
  private static final Pattern declarator = Pattern.compile("^(" + IDENT + ")\\s*((?:\\[[^\\]]*\\]\\s*)*)");
  private static final Pattern assignStart = Pattern.compile("^assign\\b\\s*");
  private static final Pattern assignTarget = Pattern.compile("^(" + IDENT + ")\\s*");
  private static final Pattern nonblockingTarget = Pattern.compile("^(" + IDENT + ")\\s*(\\[[^\\]]*\\]\\s*)*<=");

  private static final Pattern whitespace = Pattern.compile("\\s+");

  /** Right-hand side text collected up to the terminating semicolon. */
  private record Collected(String raw, int lastLineIdx, String rest) {}

  private String[] lines;
  private SignalTable.Builder table;

  /**
   * Scans a complete source text.
   * @param sourceText Verilog source
   * @return the signal table of the source
   * @throws ScanException if a recognized declaration or assignment is malformed, or contradicts another one
   */
  public SignalTable scan(String sourceText) throws ScanException {
    lines = stripComments(sourceText).split("\r?\n", -1);
    // a final line break does not start another line
    int lineCount = (lines.length > 1 && lines[lines.length - 1].isEmpty()) ? lines.length - 1 : lines.length;
    table = new SignalTable.Builder(lineCount);
    int ignored = 0;
    int idx = 0;
    while (idx < lines.length) {
      String line = lines[idx].trim();
      int nextIdx = idx + 1;
      if (line.isEmpty()) {
        idx = nextIdx;
        continue;
      }
      Matcher matcher;
      if (line.startsWith("`")) {
        logger.trace("Line {}: skipping directive", idx + 1);
        ignored++;
      } else if ((matcher = assignStart.matcher(line)).find()) {
        nextIdx = scanContinuousAssign(idx, line.substring(matcher.end()));
      } else if (declStart.matcher(line).find()) {
        nextIdx = scanDeclaration(idx, line);
      } else {
        Optional<String> statement = stripProceduralPrefix(line);
        if (statement.isPresent() && (matcher = nonblockingTarget.matcher(statement.get())).find()) {
          if (matcher.group(2) != null) {
            logger.trace("Line {}: skipping partial procedural assignment to {}", idx + 1, matcher.group(1));
            ignored++;
          } else {
            Collected rhs = collectExpression(idx, statement.get().substring(matcher.end()), statement.get());
            table.addAssignment(matcher.group(1), SignalKind.REG, rhs.raw, idx + 1);
            nextIdx = resume(rhs.lastLineIdx, rhs.rest);
          }
        } else {
          logger.trace("Line {}: ignoring '{}'", idx + 1, line);
          ignored++;
        }
      }
      idx = nextIdx;
    }
    SignalTable ret = table.build();
    logger.debug("Scanned {} lines: {} declarations, {} assignments, {} lines ignored", ret.getLineCount(), ret.getDeclarationCount(),
                 ret.getAssignmentCount(), ignored);
    lines = null;
    table = null;
    return ret;
  }

  /**
   * Continues after a statement ending on line lastIdx.
   * @param afterSemicolon text following the terminating ';' on that line
   * @return index of the next line to scan, lastIdx itself (now holding only afterSemicolon) if more statements follow
   */
  private int resume(int lastIdx, String afterSemicolon) {
    if (afterSemicolon.isBlank())
      return lastIdx + 1;
    logger.trace("Line {}: scanning the text after ';'", lastIdx + 1);
    lines[lastIdx] = afterSemicolon;
    return lastIdx;
  }

  /** @return index of the next line to scan */
  private int scanContinuousAssign(int idx, String rest) throws ScanException {
    Matcher target = assignTarget.matcher(rest);
    if (!target.find())
      throw new ScanException(idx + 1, lines[idx].trim(), "expected an identifier after 'assign'");
    String afterName = rest.substring(target.end());
    if (afterName.startsWith("[")) {
      logger.trace("Line {}: skipping partial continuous assignment to {}", idx + 1, target.group(1));
      return skipStatement(idx);
    }
    if (!afterName.startsWith("=") || afterName.startsWith("==")) {
      throw new ScanException(idx + 1, lines[idx].trim(), "expected '=' after 'assign " + target.group(1) + "'");
    }
    Collected rhs = collectExpression(idx, afterName.substring(1), lines[idx].trim());
    table.addAssignment(target.group(1), SignalKind.WIRE, rhs.raw, idx + 1);
    return resume(rhs.lastLineIdx, rhs.rest);
  }

  /** @return index of the next line to scan */
  private int scanDeclaration(int idx, String line) throws ScanException {
    Matcher head = declHead.matcher(line);
    head.find(); // always matches, possibly empty
    Optional<String> direction = Optional.ofNullable(head.group(1));
    SignalKind kind = "reg".equals(head.group(2)) ? SignalKind.REG : SignalKind.WIRE;
    Optional<String> range = Optional.ofNullable(head.group(3)).map(r -> whitespace.matcher(r).replaceAll(""));
    String rest = line.substring(head.end());
    while (true) {
      Matcher decl = declarator.matcher(rest);
      if (!decl.find())
        throw new ScanException(idx + 1, line, "expected an identifier in declaration");
      String name = decl.group(1);
      table.addDeclaration(new Declaration(name, kind, range, direction, idx + 1), line);
      rest = rest.substring(decl.end());
      if (rest.isEmpty() || rest.startsWith(")"))
        return idx + 1;
      if (rest.startsWith(";"))
        return resume(idx, rest.substring(1));
      if (rest.startsWith(",")) {
        rest = rest.substring(1).trim();
        if (rest.isEmpty())
          return idx + 1; // port list, one port per line
        continue;
      }
      if (rest.startsWith("=") && !rest.startsWith("==")) {
        Collected rhs = collectExpression(idx, rest.substring(1), line);
        if (kind == SignalKind.WIRE)
          table.addAssignment(name, SignalKind.WIRE, rhs.raw, idx + 1);
        else
          logger.trace("Line {}: ignoring initial value of reg {}", idx + 1, name);
        return resume(rhs.lastLineIdx, rhs.rest);
      }
      throw new ScanException(idx + 1, line, "unexpected '" + rest + "' in declaration of " + name);
    }
  }

  /**
   * Collects the right-hand side starting with firstPart (the rest of line idx after the assignment operator) up to the first ';'.
   */
  private Collected collectExpression(int idx, String firstPart, String statement) throws ScanException {
    StringBuilder raw = new StringBuilder();
    String part = firstPart;
    for (int cur = idx; cur < lines.length; ++cur) {
      if (cur != idx)
        part = lines[cur];
      int semicolon = part.indexOf(';');
      if (semicolon >= 0) {
        raw.append(' ').append(part, 0, semicolon);
        String rhs = whitespace.matcher(raw).replaceAll(" ").trim();
        if (rhs.isEmpty())
          throw new ScanException(idx + 1, statement, "empty right-hand side");
        return new Collected(rhs, cur, part.substring(semicolon + 1));
      }
      raw.append(' ').append(part);
    }
    throw new ScanException(idx + 1, statement, "assignment not terminated with ';'");
  }

  /** Skips an ignored statement up to its ';'. @return index of the next line to scan */
  private int skipStatement(int idx) {
    for (int cur = idx; cur < lines.length; ++cur) {
      int semicolon = lines[cur].indexOf(';');
      if (semicolon >= 0)
        return resume(cur, lines[cur].substring(semicolon + 1));
    }
    return lines.length;
  }

  /**
   * Removes the control-flow prefixes generators put in front of procedural assignments on the same line,
   * e.g. <code>end else if (io_en) begin</code>.
   * @return the remaining statement, empty if a condition is not closed on this line
   */
  static Optional<String> stripProceduralPrefix(String line) {
    String cur = line.trim();
    while (true) {
      if (startsWithWord(cur, "begin")) {
        cur = cur.substring(5).trim();
      } else if (startsWithWord(cur, "end")) {
        cur = cur.substring(3).trim();
      } else if (startsWithWord(cur, "else")) {
        cur = cur.substring(4).trim();
      } else if (startsWithWord(cur, "if")) {
        cur = cur.substring(2).trim();
        int close = skipParenthesized(cur);
        if (close < 0)
          return Optional.empty();
        cur = cur.substring(close).trim();
      } else if (startsWithWord(cur, "always")) {
        cur = cur.substring(6).trim();
        if (!cur.startsWith("@"))
          return Optional.empty();
        cur = cur.substring(1).trim();
        if (cur.startsWith("*")) {
          cur = cur.substring(1).trim();
        } else {
          int close = skipParenthesized(cur);
          if (close < 0)
            return Optional.empty();
          cur = cur.substring(close).trim();
        }
      } else {
        return Optional.of(cur);
      }
    }
  }

  private static boolean startsWithWord(String text, String word) {
    if (!text.startsWith(word))
      return false;
    if (text.length() == word.length())
      return true;
    char next = text.charAt(word.length());
    return !(Character.isLetterOrDigit(next) || next == '_' || next == '$');
  }

  /** @return index after the ')' matching the '(' text starts with, -1 if there is none */
  private static int skipParenthesized(String text) {
    if (!text.startsWith("("))
      return -1;
    int depth = 0;
    for (int i = 0; i < text.length(); ++i) {
      char c = text.charAt(i);
      if (c == '(')
        depth++;
      else if (c == ')' && --depth == 0)
        return i + 1;
    }
    return -1;
  }

  /**
   * Replaces <code>//</code> and <code>/* *&#47;</code> comments by spaces, keeping line breaks so that line numbers are preserved.
   * String literals are copied unchanged.
   */
  static String stripComments(String text) {
    StringBuilder out = new StringBuilder(text.length());
    int i = 0;
    int n = text.length();
    while (i < n) {
      char c = text.charAt(i);
      if (c == '"') {
        int end = i + 1;
        while (end < n && text.charAt(end) != '"' && text.charAt(end) != '\n') {
          if (text.charAt(end) == '\\' && end + 1 < n)
            end++;
          end++;
        }
        end = Math.min(end + 1, n);
        out.append(text, i, end);
        i = end;
      } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
        while (i < n && text.charAt(i) != '\n') {
          out.append(' ');
          i++;
        }
      } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
        out.append("  ");
        i += 2;
        while (i < n && !(text.charAt(i) == '*' && i + 1 < n && text.charAt(i + 1) == '/')) {
          out.append(text.charAt(i) == '\n' ? '\n' : ' ');
          i++;
        }
        if (i < n) {
          out.append("  ");
          i += 2;
        }
      } else {
        out.append(c);
        i++;
      }
    }
    return out.toString();
  }
}
