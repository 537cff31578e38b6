package hdlrefine.semantics;

import hdlrefine.design.Declaration;
import hdlrefine.design.Design;
import hdlrefine.design.Instance;
import hdlrefine.design.Module;
import hdlrefine.design.Process;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out collision-free names. A generated name never equals a name of the design
 * or a name handed out earlier.
 */
public class NameTable {
  private final Set<String> used = new HashSet<>();

  public NameTable() {}

  /** Creates a table that knows every name declared in the design. */
  public static NameTable of(Design design) {
    NameTable ret = new NameTable();
    design.streamSubtree().forEach(node -> {
      if (node instanceof Declaration)
        ret.reserve(((Declaration)node).getName());
      else if (node instanceof Process)
        ret.reserve(((Process)node).getName());
      else if (node instanceof Instance)
        ret.reserve(((Instance)node).getName());
      else if (node instanceof Module)
        ret.reserve(((Module)node).getName());
    });
    return ret;
  }

  /** Marks a name as taken. */
  public void reserve(String name) { used.add(name); }

  public boolean isUsed(String name) { return used.contains(name); }

  /** @return <code>base</code> if free, otherwise <code>base_N</code> with the smallest free N >= 1 */
  public String freshName(String base) {
    String candidate = base;
    for (int i = 1; used.contains(candidate); ++i)
      candidate = base + "_" + i;
    used.add(candidate);
    return candidate;
  }

  /** @return a fresh name built from <code>base + suffix</code> */
  public String freshName(String base, String suffix) { return freshName(base + suffix); }
}
