/**
 * Non-database clients owned by the application context.
 */
package paystore.client;
