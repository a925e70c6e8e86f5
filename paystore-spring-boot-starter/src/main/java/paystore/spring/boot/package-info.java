/**
 * Spring Boot auto-configuration: binds {@code paystore.*} properties, creates the
 * {@link paystore.AppContext} and registers the JDBC repositories.
 */
package paystore.spring.boot;
