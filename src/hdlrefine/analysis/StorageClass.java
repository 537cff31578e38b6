package hdlrefine.analysis;

import hdlrefine.design.DataDeclaration;
import hdlrefine.design.Port;

/**
 * Required storage of a declaration, derived from its uses.
 * A connection is always a signal. A declaration can need both signal and variable storage.
 */
public record StorageClass(boolean connection, boolean signal, boolean variable) {

  public static StorageClass of(DataDeclaration decl, UsageInfo info) {
    boolean connection = decl instanceof Port || info.has(ReferenceRole.PORT_BINDING) || info.has(ReferenceRole.BIND_ARGUMENT);
    boolean signal = connection || info.has(ReferenceRole.SENSITIVITY) || info.has(ReferenceRole.WAIT) ||
                     info.has(ReferenceRole.NON_BLOCKING_WRITE);
    boolean variable = info.hasContinuousWrite() || info.has(ReferenceRole.BLOCKING_WRITE) || info.wasContinuousWrite();
    return new StorageClass(connection, signal, variable);
  }

  public boolean isDual() { return signal && variable; }

  public boolean isSignalOnly() { return signal && !variable; }

  /** @return true iff the declaration is refined into a plain variable */
  public boolean isVariableStorage() { return !signal; }
}
