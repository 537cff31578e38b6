package hdlrefine.analysis;

import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Node;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** UsageInfo per classified declaration, in classification order. */
public class UsageMap {
  private final LinkedHashMap<DataDeclaration, UsageInfo> infos = new LinkedHashMap<>();

  /** @return the info of a declaration, created empty on first access */
  public UsageInfo get(DataDeclaration decl) { return infos.computeIfAbsent(decl, key -> new UsageInfo()); }

  /** @return the info of a declaration, or null if it was never classified */
  public UsageInfo find(DataDeclaration decl) { return infos.get(decl); }

  public boolean contains(DataDeclaration decl) { return infos.containsKey(decl); }

  /** Drops a use from the info of its declaration. */
  public void remove(DataDeclaration decl, Node ref) {
    UsageInfo info = infos.get(decl);
    if (info != null)
      info.remove(ref);
  }

  public Map<DataDeclaration, UsageInfo> asMap() { return Collections.unmodifiableMap(infos); }

  /** @return deep copies of all infos */
  public Map<DataDeclaration, UsageInfo> snapshot() {
    LinkedHashMap<DataDeclaration, UsageInfo> ret = new LinkedHashMap<>();
    infos.forEach((decl, info) -> ret.put(decl, info.snapshot()));
    return ret;
  }
}
