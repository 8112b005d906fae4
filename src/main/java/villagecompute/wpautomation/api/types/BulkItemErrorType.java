package villagecompute.wpautomation.api.types;

/**
 * Failure of one target inside a bulk operation. {@code postId} is {@code null} for operation-level errors.
 */
public record BulkItemErrorType(Long postId, String error) {
}
