package ungen;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import ungen.expand.ExpansionEngine;
import ungen.expand.ExpansionResult;
import ungen.expand.GeneratedSignals;
import ungen.expand.SignalResolver;
import ungen.expr.ExpressionRenderer;
import ungen.scan.DeclarationScanner;
import ungen.scan.Signal;
import ungen.scan.SignalKind;
import ungen.scan.SignalTable;

/**
 * Entry point of the expansion: scans a Verilog source, resolves the target signal, expands its generated references and renders
 * the result.
 */
public class UnGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Stack of the expansion thread. Parsing, substitution and rendering recurse along the nesting of the expression. */
  public static final long DEFAULT_STACK_SIZE = 512L << 20;

  private final GeneratedSignals generated;
  private final long stackSize;

  public UnGen() { this(new GeneratedSignals()); }
  public UnGen(GeneratedSignals generated) { this(generated, DEFAULT_STACK_SIZE); }
  /** @param stackSize stack size in bytes of the thread running an expansion */
  public UnGen(GeneratedSignals generated, long stackSize) {
    this.generated = generated;
    this.stackSize = stackSize;
  }

  /**
   * Expands a signal of a Verilog file.
   * @param sourcePath the Verilog file
   * @param target the signal to expand
   * @param keepIds generated ids to leave unexpanded
   * @throws IOException if the file cannot be read
   * @throws UnGenException if scanning, resolution, parsing or expansion fails
   */
  public ExpansionReport expandSignal(Path sourcePath, Target target, Set<Integer> keepIds) throws IOException, UnGenException {
    logger.debug("Reading {}", sourcePath);
    return expandSource(Files.readString(sourcePath, StandardCharsets.UTF_8), target, keepIds);
  }

  /**
   * Same as {@link #expandSignal(Path, Target, Set)} for source text that is already in memory.
   * @throws NestingTooDeepException if the expression nests deeper than the stack of the expansion thread allows
   */
  public ExpansionReport expandSource(String sourceText, Target target, Set<Integer> keepIds) throws UnGenException {
    FutureTask<ExpansionReport> task = new FutureTask<>(() -> expandOnCurrentThread(sourceText, target, keepIds));
    Thread worker = new Thread(null, task, "ungen-expand", stackSize);
    worker.start();
    try {
      return task.get();
    } catch (InterruptedException e) {
      worker.interrupt();
      Thread.currentThread().interrupt();
      throw new UnGenException("Interrupted while expanding " + target, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof UnGenException)
        throw (UnGenException)cause;
      if (cause instanceof StackOverflowError)
        throw new NestingTooDeepException(target.toString(), stackSize, cause);
      if (cause instanceof RuntimeException)
        throw (RuntimeException)cause;
      if (cause instanceof Error)
        throw (Error)cause;
      throw new IllegalStateException(cause);
    }
  }

  private ExpansionReport expandOnCurrentThread(String sourceText, Target target, Set<Integer> keepIds) throws UnGenException {
    SignalTable table = new DeclarationScanner().scan(sourceText);
    SignalResolver resolver = new SignalResolver(table);
    Signal signal = target.resolve(resolver);
    logger.debug("Expanding {} ({} assigned at line {})", signal.name(), signal.kind().getKeyword(), signal.assignmentLine());

    ExpansionResult result = new ExpansionEngine(resolver, generated).expand(signal, keepIds);
    String expandedText = new ExpressionRenderer().render(result.expression());
    logger.debug("Substituted {} generated signal(s)", result.expanded().size());

    List<Signal> kept = table.streamAssignments()
                            .filter(assignment -> assignment.kind() == SignalKind.WIRE && isKept(assignment.name(), keepIds))
                            .collect(Collectors.toList());
    Set<Integer> missing = new TreeSet<>(keepIds);
    kept.forEach(keptSignal -> missing.remove(generated.idOf(keptSignal.name()).getAsInt()));
    for (int id : missing)
      logger.warn("No generated signal with id {} is assigned in the source", id);
    return new ExpansionReport(signal, expandedText, result.expanded(), kept, missing);
  }

  private boolean isKept(String name, Set<Integer> keepIds) {
    OptionalInt id = generated.idOf(name);
    return id.isPresent() && keepIds.contains(id.getAsInt());
  }
}
