package hdlrefine.design;

/** Module port. Ports always stay signals. */
public class Port extends DataDeclaration {
  public enum Direction {
    IN("in"),
    OUT("out"),
    INOUT("inout"),
    NONE("none");

    public final String serialName;
    private Direction(String serialName) { this.serialName = serialName; }

    public static Direction fromSerialName(String serialName) {
      for (Direction dir : values()) {
        if (dir.serialName.equals(serialName))
          return dir;
      }
      throw new IllegalArgumentException("Unknown port direction '" + serialName + "'");
    }
  }

  private final Direction direction;

  public Port(String name, Direction direction, String type, Expr initialValue) {
    super(name, type, initialValue);
    this.direction = direction;
  }

  public Direction getDirection() { return direction; }

  public boolean isOutput() { return direction == Direction.OUT || direction == Direction.INOUT; }

  @Override
  public Port copy() {
    return new Port(name, direction, type, copyInitialValue());
  }
}
