package com.acme.invoicemail.core.graph;

/**
 * Resource paths used by change notifications and subscriptions.
 */
public final class GraphResourcePath {

    private GraphResourcePath() {
    }

    /**
     * Mailbox and message id addressed by a notification resource.
     */
    public record MessageRef(String mailbox, String messageId) {
    }

    /**
     * Resource a subscription watches: new messages in the mailbox inbox.
     */
    public static String inboxMessages(String mailbox) {
        return "users/" + mailbox + "/mailFolders('Inbox')/messages";
    }

    /**
     * Parses {@code users/{mailbox}/messages/{id}}. Segment names are matched
     * case-insensitively since the provider sends {@code Users/.../Messages/...}.
     *
     * @throws IllegalArgumentException if the path does not have that shape
     */
    public static MessageRef parseMessage(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("Resource path is empty");
        }
        String[] parts = resource.strip().split("/");
        if (parts.length != 4
                || !"users".equalsIgnoreCase(parts[0])
                || !"messages".equalsIgnoreCase(parts[2])) {
            throw new IllegalArgumentException("Invalid message resource path: " + resource);
        }
        if (parts[1].isBlank() || parts[3].isBlank()) {
            throw new IllegalArgumentException("Missing mailbox or message id in resource: " + resource);
        }
        return new MessageRef(parts[1], parts[3]);
    }
}
