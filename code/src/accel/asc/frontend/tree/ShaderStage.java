package accel.asc.frontend.tree;

/**
 * Pipeline stage a shader is declared for
 */
public enum ShaderStage {
  COMPUTE("compute"),
  VERTEX("vertex"),
  FRAGMENT("fragment");

  private final String keyword;

  ShaderStage(String keyword) {
    this.keyword = keyword;
  }

  /**
   * @return the keyword introducing a shader of this stage in source
   */
  public String keyword() {
    return keyword;
  }
}
