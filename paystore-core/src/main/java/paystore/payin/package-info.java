/**
 * Payin repositories: payers, gateway customers, legacy Stripe customers and payment methods.
 *
 * <p>Gets read from master, lists read from the replica. JDBC implementations live in the
 * {@code paystore-jdbc} module.
 */
package paystore.payin;
