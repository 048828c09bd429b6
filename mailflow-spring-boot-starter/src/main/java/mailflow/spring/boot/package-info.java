/**
 * Spring Boot auto-configuration for the mailflow runtime.
 *
 * <p>Add the starter and a {@link javax.sql.DataSource}, supply the delivery, content and
 * customer beans, and a started {@link mailflow.Mailflow} is available for injection.
 */
package mailflow.spring.boot;
