/**
 * Rows and write inputs of the payin databases.
 *
 * <p>Persisted rows are records. Inserts take {@code *Create} inputs, reads take {@code *Lookup}
 * keys and updates take {@code *Update} set-clauses built from
 * {@link paystore.model.FieldUpdate}s.
 */
package paystore.payin.model;
