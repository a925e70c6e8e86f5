package paystore.jdbc;

import java.util.Objects;

/**
 * Validation for table and column names that are concatenated into SQL.
 */
public final class SqlIdentifiers {
  private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private SqlIdentifiers() {}

  public static String validate(String identifier) {
    Objects.requireNonNull(identifier, "identifier");
    if (!identifier.matches(IDENTIFIER_PATTERN)) {
      throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
    }
    return identifier;
  }
}
