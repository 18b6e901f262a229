package ungen.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Declarations and assignments of one Verilog source, keyed by signal name and by assignment line.
 * Built once by {@link DeclarationScanner} and read-only afterwards.
 */
public class SignalTable {
  private final int lineCount;
  private final LinkedHashMap<String, Declaration> declarations;
  private final LinkedHashMap<String, Signal> wireAssignments;
  private final LinkedHashMap<String, List<Signal>> regAssignments;
  private final TreeMap<Integer, List<Signal>> assignmentsByLine;

  private SignalTable(int lineCount, LinkedHashMap<String, Declaration> declarations, LinkedHashMap<String, Signal> wireAssignments,
                      LinkedHashMap<String, List<Signal>> regAssignments, TreeMap<Integer, List<Signal>> assignmentsByLine) {
    this.lineCount = lineCount;
    this.declarations = declarations;
    this.wireAssignments = wireAssignments;
    this.regAssignments = regAssignments;
    this.assignmentsByLine = assignmentsByLine;
  }

  /** Number of lines of the scanned source. */
  public int getLineCount() { return lineCount; }

  public Optional<Declaration> getDeclaration(String name) { return Optional.ofNullable(declarations.get(name)); }

  /** The single continuous assignment (or initializer) of a wire. */
  public Optional<Signal> getWireAssignment(String name) { return Optional.ofNullable(wireAssignments.get(name)); }

  /** All procedural assignments of a register, in source order. Empty if there are none. */
  public List<Signal> getRegisterAssignments(String name) {
    List<Signal> ret = regAssignments.get(name);
    return ret == null ? List.of() : Collections.unmodifiableList(ret);
  }

  /** The assignment statement starting on the given 1-based line, the first one if several statements start there. */
  public Optional<Signal> getAssignmentAt(int line) {
    List<Signal> ret = assignmentsByLine.get(line);
    return ret == null ? Optional.empty() : Optional.of(ret.get(0));
  }

  /**
   * Kind of a name: the declared kind if declared, otherwise the kind implied by its assignments.
   * Empty if the source neither declares nor assigns the name.
   */
  public Optional<SignalKind> getKind(String name) {
    Declaration decl = declarations.get(name);
    if (decl != null)
      return Optional.of(decl.kind());
    if (wireAssignments.containsKey(name))
      return Optional.of(SignalKind.WIRE);
    if (regAssignments.containsKey(name))
      return Optional.of(SignalKind.REG);
    return Optional.empty();
  }

  /** Returns true iff the source declares or assigns the name. */
  public boolean contains(String name) { return getKind(name).isPresent(); }

  /** All assignments in line order. */
  public Stream<Signal> streamAssignments() { return assignmentsByLine.values().stream().flatMap(List::stream); }

  public int getDeclarationCount() { return declarations.size(); }
  public int getAssignmentCount() { return (int)streamAssignments().count(); }

  /** Collects declarations and assignments while scanning; validates them on {@link #build()}. */
  static class Builder {
    private record PendingAssignment(String name, SignalKind kind, String rawExpression, int line) {}

    private final int lineCount;
    private final LinkedHashMap<String, Declaration> declarations = new LinkedHashMap<>();
    private final List<PendingAssignment> assignments = new ArrayList<>();

    Builder(int lineCount) { this.lineCount = lineCount; }

    /**
     * Adds a declaration. A non-port redeclaration of a port (Verilog-1995 style <code>output x; reg x;</code>) refines the port's kind.
     * @throws ScanException on any other redeclaration
     */
    void addDeclaration(Declaration decl, String text) throws ScanException {
      Declaration existing = declarations.get(decl.name());
      if (existing != null) {
        if (existing.isPort() != decl.isPort()) {
          Declaration port = existing.isPort() ? existing : decl;
          Declaration net = existing.isPort() ? decl : existing;
          declarations.put(decl.name(), new Declaration(decl.name(), net.kind(), net.range().or(() -> port.range()), port.direction(),
                                                        Math.min(existing.line(), decl.line())));
          return;
        }
        throw new ScanException(decl.line(), text, "duplicate declaration of " + decl.name() + " (first declared at line " + existing.line() + ")");
      }
      declarations.put(decl.name(), decl);
    }

    void addAssignment(String name, SignalKind kind, String rawExpression, int line) {
      assignments.add(new PendingAssignment(name, kind, rawExpression, line));
    }

    /**
     * Checks assignment kinds against declarations and builds the table.
     * @throws ScanException on a duplicate wire assignment or an assignment that contradicts the declared kind
     */
    SignalTable build() throws ScanException {
      var wires = new LinkedHashMap<String, Signal>();
      var regs = new LinkedHashMap<String, List<Signal>>();
      var byLine = new TreeMap<Integer, List<Signal>>();
      HashMap<String, SignalKind> assignedKinds = new HashMap<>();
      for (PendingAssignment pending : assignments) {
        Declaration decl = declarations.get(pending.name);
        if (decl != null && decl.kind() != pending.kind) {
          throw new ScanException(pending.line, pending.name + " " + (pending.kind == SignalKind.WIRE ? "=" : "<=") + " " + pending.rawExpression,
                                  (pending.kind == SignalKind.WIRE ? "continuous assignment to " : "procedural assignment to ") +
                                      decl.kind().getKeyword() + " " + pending.name + " declared at line " + decl.line());
        }
        SignalKind prevKind = assignedKinds.putIfAbsent(pending.name, pending.kind);
        if (prevKind != null && prevKind != pending.kind) {
          throw new ScanException(pending.line, pending.rawExpression,
                                  pending.name + " has both continuous and procedural assignments");
        }
        Signal signal = new Signal(pending.name, pending.kind, pending.rawExpression, decl == null ? 0 : decl.line(), pending.line);
        if (pending.kind == SignalKind.WIRE) {
          Signal prev = wires.putIfAbsent(pending.name, signal);
          if (prev != null) {
            throw new ScanException(pending.line, pending.rawExpression,
                                    "duplicate assignment to wire " + pending.name + " (first assigned at line " + prev.assignmentLine() + ")");
          }
        } else {
          regs.computeIfAbsent(pending.name, name_ -> new ArrayList<>()).add(signal);
        }
        byLine.computeIfAbsent(pending.line, line_ -> new ArrayList<>()).add(signal);
      }
      return new SignalTable(lineCount, new LinkedHashMap<>(declarations), wires, regs, byLine);
    }
  }
}
