package hdlrefine.design;

import java.util.List;

/**
 * Reference to a data declaration by name.
 * The declaration link is set by the resolver and kept up to date by all rewrites.
 */
public class Identifier extends Expr {
  private String name;
  private DataDeclaration declaration;

  public Identifier(String name) {
    this.name = name;
    this.declaration = null;
  }

  public Identifier(DataDeclaration declaration) {
    this.name = declaration.getName();
    this.declaration = declaration;
  }

  public String getName() { return name; }
  public DataDeclaration getDeclaration() { return declaration; }

  public void setDeclaration(DataDeclaration declaration) { this.declaration = declaration; }

  /** Makes this identifier refer to another declaration, updating the name as well. */
  public void redirect(DataDeclaration target) {
    this.name = target.getName();
    this.declaration = target;
  }

  @Override
  public List<Node> getChildren() {
    return List.of();
  }

  @Override
  public Identifier copy() {
    Identifier ret = new Identifier(name);
    ret.declaration = declaration;
    return ret;
  }
}
