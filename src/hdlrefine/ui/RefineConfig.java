package hdlrefine.ui;

/**
 * Data-Class to hold refinement options.
 */
public class RefineConfig {

  /** Apply the design normalizer before the refinement. */
  public boolean normalize = true;
  /** Warn about processes reading signals that are missing from their sensitivity. */
  public boolean check_original_design = true;

  /** Name prefix of generated cone procedures. */
  public String cone_prefix = "hif_cone_";
  /** Order cone procedures by name within each module. */
  public boolean sort_cones = true;

  /** Warn about connections with port binding uses that also need variable storage. */
  public boolean warn_on_bindings = true;
}
