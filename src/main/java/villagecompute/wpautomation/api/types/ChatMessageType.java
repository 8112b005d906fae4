package villagecompute.wpautomation.api.types;

/**
 * A role-tagged message sent to the text-generation collaborator.
 */
public record ChatMessageType(Role role, String content) {

    public enum Role {
        SYSTEM,
        USER,
        ASSISTANT
    }

    public static ChatMessageType system(String content) {
        return new ChatMessageType(Role.SYSTEM, content);
    }

    public static ChatMessageType user(String content) {
        return new ChatMessageType(Role.USER, content);
    }
}
