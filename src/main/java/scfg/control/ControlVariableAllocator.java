package scfg.control;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import org.pcollections.ConsPStack;
import org.pcollections.PStack;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import scfg.region.Region;

/**
 * Allocates control variable ids in nested scopes.
 *
 * <p>A scope starts numbering where its parent currently stands, so sibling scopes reuse the same
 * ids. Once a scope opened a child it is sealed: allocating in it again would hand out an id that
 * the child might still use.
 */
public class ControlVariableAllocator {

  private static final class Scope {
    final int nextId;
    final boolean sealed;

    Scope(int nextId, boolean sealed) {
      this.nextId = nextId;
      this.sealed = sealed;
    }
  }

  private PStack<Scope> scopes = ConsPStack.singleton(new Scope(0, false));
  private PVector<ControlVariable> allocated = TreePVector.empty();
  private final ListMultimap<Region, ControlVariable> owners = LinkedListMultimap.create();

  public void openScope() {
    Scope current = scopes.get(0);
    scopes = scopes.with(0, new Scope(current.nextId, true)).plus(new Scope(current.nextId, false));
  }

  public void closeScope() {
    Preconditions.checkState(scopes.size() > 1, "Cannot close the outermost scope");
    scopes = scopes.minus(0);
  }

  /** Number of currently open scopes, not counting the outermost one. */
  public int depth() {
    return scopes.size() - 1;
  }

  public ControlVariable allocate(ControlVariable.Purpose purpose) {
    Scope current = scopes.get(0);
    Preconditions.checkState(
        !current.sealed, "Allocating %s in a scope that already opened a child", purpose);
    ControlVariable variable = new ControlVariable(current.nextId, purpose);
    scopes = scopes.with(0, new Scope(current.nextId + 1, false));
    allocated = allocated.plus(variable);
    return variable;
  }

  /** Records {@code owner} as the region a variable belongs to. */
  public void assign(Region owner, ControlVariable variable) {
    owners.put(owner, variable);
  }

  /** Every allocation, in allocation order. Ids repeat across sibling scopes. */
  public ImmutableList<ControlVariable> allocated() {
    return ImmutableList.copyOf(allocated);
  }

  public ImmutableListMultimap<Region, ControlVariable> table() {
    return ImmutableListMultimap.copyOf(owners);
  }
}
