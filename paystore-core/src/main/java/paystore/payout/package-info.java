/**
 * Payout repositories.
 */
package paystore.payout;
