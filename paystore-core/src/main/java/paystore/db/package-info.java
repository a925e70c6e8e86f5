/**
 * Database handles, statement execution and error types.
 */
package paystore.db;
