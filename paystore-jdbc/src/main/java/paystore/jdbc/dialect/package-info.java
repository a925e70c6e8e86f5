/**
 * Built-in dialects and the {@link paystore.jdbc.dialect.Dialects} registry.
 */
package paystore.jdbc.dialect;
