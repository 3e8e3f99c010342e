package nestedtx.spi;

/**
 * Transaction-control statements issued by the coordinator.
 */
public enum StatementKind {
  BEGIN("begin"),
  SAVEPOINT("savepoint"),
  RELEASE_SAVEPOINT("release_savepoint"),
  ROLLBACK_TO_SAVEPOINT("rollback_to_savepoint"),
  COMMIT("commit"),
  ROLLBACK("rollback");

  private final String tagValue;

  StatementKind(String tagValue) {
    this.tagValue = tagValue;
  }

  /** Lower-case identifier, suitable as a metric tag. */
  public String tagValue() {
    return tagValue;
  }

  /**
   * Renders the SQL text of this statement.
   *
   * @param savepoint savepoint name; ignored for {@link #BEGIN}, {@link #COMMIT}, {@link #ROLLBACK}
   */
  public String sql(String savepoint) {
    return switch (this) {
      case BEGIN -> "BEGIN";
      case SAVEPOINT -> "SAVEPOINT " + savepoint;
      case RELEASE_SAVEPOINT -> "RELEASE SAVEPOINT " + savepoint;
      case ROLLBACK_TO_SAVEPOINT -> "ROLLBACK TO SAVEPOINT " + savepoint;
      case COMMIT -> "COMMIT";
      case ROLLBACK -> "ROLLBACK";
    };
  }
}
