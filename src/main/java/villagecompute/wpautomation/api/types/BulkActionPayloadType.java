package villagecompute.wpautomation.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Payload of a bulk action, one variant per kind of remote call.
 *
 * <p>
 * Serialized with a {@code type} discriminator so the stored operation can be replayed after a restart.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        property = "type")
@JsonSubTypes({@JsonSubTypes.Type(
        value = BulkActionPayloadType.StatusChange.class,
        name = "status_change"),
        @JsonSubTypes.Type(
                value = BulkActionPayloadType.Delete.class,
                name = "delete"),
        @JsonSubTypes.Type(
                value = BulkActionPayloadType.PublishMetadataUpdate.class,
                name = "metadata_update")})
public interface BulkActionPayloadType {

    /**
     * Sets the post status ("publish", "draft", "pending", "private").
     */
    record StatusChange(String status) implements BulkActionPayloadType {
    }

    /**
     * Deletes the post; {@code force} bypasses the trash.
     */
    record Delete(boolean force) implements BulkActionPayloadType {
    }

    /**
     * Partial update of taxonomy and status. At least one field must be set.
     */
    record PublishMetadataUpdate(List<Long> categories, List<Long> tags, String status)
            implements BulkActionPayloadType {

        public boolean isEmpty() {
            return (categories == null || categories.isEmpty()) && (tags == null || tags.isEmpty())
                    && (status == null || status.isBlank());
        }
    }
}
