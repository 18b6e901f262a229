package ungen;

import java.util.List;
import java.util.Set;
import ungen.scan.Signal;

/**
 * Everything the command line prints about one expansion.
 * @param signal the expanded signal
 * @param expandedText rendered expansion
 * @param expanded generated signals that were substituted, in first substitution order
 * @param kept definitions of the generated signals whose id was kept
 * @param missingKeepIds kept ids no generated signal in the source carries
 */
public record ExpansionReport(Signal signal, String expandedText, List<Signal> expanded, List<Signal> kept, Set<Integer> missingKeepIds) {

  public String getOriginalText() { return signal.rawExpression(); }

  /**
   * Formats the report.
   * @param withOriginal include the original expression
   * @param withExpanded include the definitions of the substituted generated signals
   * @param withKept include the definitions of the kept generated signals (only if ids were kept)
   */
  public String format(boolean withOriginal, boolean withExpanded, boolean withKept) {
    StringBuilder out = new StringBuilder();
    if (withOriginal) {
      out.append("Original expression for signal ").append(signal.name()).append(":\n");
      out.append(signal.rawExpression()).append("\n\n");
    }
    out.append("Expanded expression for signal ").append(signal.name()).append(":\n");
    out.append(expandedText).append("\n");
    if (withExpanded) {
      out.append("\nAll expanded _GEN signals:\n");
      for (Signal gen : expanded)
        out.append(gen).append("\n");
    }
    if (withKept && (!kept.isEmpty() || !missingKeepIds.isEmpty())) {
      out.append("\nAll kept _GEN signals:\n");
      for (Signal gen : kept)
        out.append(gen).append("\n");
      for (int id : missingKeepIds)
        out.append("(no generated signal with id ").append(id).append(")\n");
    }
    return out.toString();
  }
}
