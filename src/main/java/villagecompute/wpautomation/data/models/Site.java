package villagecompute.wpautomation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * A WordPress site owned by one user, with the application-password credentials used for REST calls.
 *
 * <p>
 * Sites are managed by the surrounding dashboard; the automation engine only reads them.
 */
@Entity
@Table(
        name = "wordpress_sites")
public class Site extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            nullable = false)
    public String name;

    @Column(
            nullable = false,
            length = 2048)
    public String url;

    @Column(
            name = "wp_username")
    public String wpUsername;

    @Column(
            name = "wp_application_password")
    public String wpApplicationPassword;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Whether both REST credentials are present.
     */
    public boolean hasCredentials() {
        return url != null && !url.isBlank() && wpUsername != null && !wpUsername.isBlank()
                && wpApplicationPassword != null && !wpApplicationPassword.isBlank();
    }
}
