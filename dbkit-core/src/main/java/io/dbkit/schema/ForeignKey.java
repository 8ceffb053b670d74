package io.dbkit.schema;

/**
 * A single-column reference from a child table to a parent table.
 *
 * @param column           column in the declaring (child) table
 * @param referencedTable  parent table
 * @param referencedColumn column in the parent table
 */
public record ForeignKey(String column, String referencedTable, String referencedColumn) {

  public ForeignKey {
    Identifiers.column(column);
    Identifiers.table(referencedTable);
    Identifiers.column(referencedColumn);
  }

  /**
   * Parses a {@code table.column} target, e.g. {@code ForeignKey.of("team_id", "ncaa_m_teams.id")}.
   */
  public static ForeignKey of(String column, String target) {
    int dot = target.indexOf('.');
    if (dot <= 0 || dot == target.length() - 1) {
      throw new IllegalArgumentException("Foreign key target must be 'table.column': " + target);
    }
    return new ForeignKey(column, target.substring(0, dot), target.substring(dot + 1));
  }
}
