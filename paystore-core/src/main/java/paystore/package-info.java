/**
 * Application context of the payment platform's database access layer.
 *
 * <p>{@link paystore.AppContext} owns the six logical databases and the client pools;
 * {@link paystore.AppConfig} configures it.
 */
package paystore;
