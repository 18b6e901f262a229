package ungen.expand;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import ungen.expr.Expression;
import ungen.scan.Signal;

/**
 * State of one top-level expansion request.
 * <p>
 * Colours of the depth-first search: a name on the active stack is being expanded (a reference to it closes a cycle and stays
 * unexpanded), a name in the completed map has a finished expansion that did not depend on the active stack, any other name
 * has not been visited.
 */
public class ExpansionContext {
  private final Set<Integer> keepIds;
  private final ArrayDeque<String> activeStack = new ArrayDeque<>();
  private final HashSet<String> activeNames = new HashSet<>();
  private final HashMap<String, Expression> completed = new HashMap<>();
  private final LinkedHashMap<String, Signal> expanded = new LinkedHashMap<>();
  private final List<String> cycleBoundaries = new ArrayList<>();

  public ExpansionContext(Set<Integer> keepIds) { this.keepIds = Set.copyOf(keepIds); }

  public Set<Integer> getKeepIds() { return keepIds; }

  public boolean isKept(OptionalInt id) { return id.isPresent() && keepIds.contains(id.getAsInt()); }

  /** Returns true iff the name is currently being expanded. */
  public boolean isActive(String name) { return activeNames.contains(name); }

  /** Marks a name as being expanded. */
  public void push(String name) {
    if (!activeNames.add(name))
      throw new IllegalStateException(name + " is already being expanded");
    activeStack.push(name);
  }

  /** Ends the expansion of the most recently pushed name. */
  public void pop(String name) {
    if (!name.equals(activeStack.peek()))
      throw new IllegalStateException("Expected " + activeStack.peek() + " on top of the expansion stack, not " + name);
    activeStack.pop();
    activeNames.remove(name);
  }

  /** The names currently being expanded, outermost first. */
  public List<String> getActiveStack() {
    List<String> ret = new ArrayList<>(activeStack);
    Collections.reverse(ret);
    return ret;
  }

  public Optional<Expression> getCompleted(String name) { return Optional.ofNullable(completed.get(name)); }
  public void putCompleted(String name, Expression expansion) { completed.put(name, expansion); }

  /** Records a generated signal that has been substituted; keeps the first substitution order. */
  public void recordExpanded(Signal signal) { expanded.putIfAbsent(signal.name(), signal); }
  public List<Signal> getExpanded() { return List.copyOf(expanded.values()); }

  /** Records a reference left unexpanded because it closes a cycle. */
  public void recordCycleBoundary(String name) { cycleBoundaries.add(name); }
  public int getCycleBoundaryCount() { return cycleBoundaries.size(); }
  /** Names of the references left unexpanded at cycle boundaries, in encounter order (with repetitions). */
  public List<String> getCycleBoundaries() { return Collections.unmodifiableList(cycleBoundaries); }
}
