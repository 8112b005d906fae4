package villagecompute.wpautomation.api.types;

/**
 * A WordPress category or tag as returned by the REST API.
 */
public record WordPressTermType(long id, String name) {
}
