package ungen.expand;

import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import ungen.scan.Signal;
import ungen.scan.SignalKind;
import ungen.scan.SignalTable;

/**
 * Looks up signal definitions in a {@link SignalTable}.
 * <p>
 * Registers cannot be resolved by name: a register usually has several conditional assignments, and merging them into one
 * expression is not supported. Select a single register assignment by its line instead.
 */
public class SignalResolver {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final SignalTable table;

  public SignalResolver(SignalTable table) { this.table = table; }

  public SignalTable getTable() { return table; }

  /**
   * Resolves a wire by name.
   * @throws SignalNotFoundException if the name has no assignment
   * @throws UnsupportedKindException if the name is a register
   */
  public Signal resolveByName(String name) throws SignalNotFoundException, UnsupportedKindException {
    Optional<Signal> wire = table.getWireAssignment(name);
    if (wire.isPresent())
      return wire.get();
    if (table.getKind(name).orElse(null) == SignalKind.REG)
      throw new UnsupportedKindException(name, SignalKind.REG);
    throw SignalNotFoundException.forName(name);
  }

  /**
   * Resolves the assignment statement starting on a line, for wires and registers.
   * @param line 1-based line number
   * @throws SignalNotFoundException if no assignment starts on that line
   */
  public Signal resolveByLine(int line) throws SignalNotFoundException {
    return table.getAssignmentAt(line).orElseThrow(() -> SignalNotFoundException.forLine(line));
  }

  /**
   * Resolves a generated signal referenced from another definition.
   * @param name the generated name
   * @param referencedFrom name of the signal whose definition holds the reference
   * @return the wire definition, or empty for a register, which stays a leaf of the expansion
   * @throws DanglingReferenceException if the source does not define the name
   */
  public Optional<Signal> resolveGenerated(String name, String referencedFrom) throws DanglingReferenceException {
    Optional<Signal> wire = table.getWireAssignment(name);
    if (wire.isPresent())
      return wire;
    if (table.getKind(name).orElse(null) == SignalKind.REG) {
      logger.debug("{} is a register, keeping it as a leaf", name);
      return Optional.empty();
    }
    throw new DanglingReferenceException(name, referencedFrom);
  }
}
