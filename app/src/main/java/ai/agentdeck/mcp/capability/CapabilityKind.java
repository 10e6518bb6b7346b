package ai.agentdeck.mcp.capability;

import java.util.Arrays;
import java.util.Optional;

public enum CapabilityKind {
    TOOLS("tools/list", "tools", "notifications/tools/list_changed"),
    RESOURCES("resources/list", "resources", "notifications/resources/list_changed"),
    PROMPTS("prompts/list", "prompts", "notifications/prompts/list_changed");

    private final String listMethod;
    private final String resultField;
    private final String changedNotification;

    CapabilityKind(String listMethod, String resultField, String changedNotification) {
        this.listMethod = listMethod;
        this.resultField = resultField;
        this.changedNotification = changedNotification;
    }

    public String listMethod() {
        return listMethod;
    }

    public String resultField() {
        return resultField;
    }

    public String changedNotification() {
        return changedNotification;
    }

    /** The kind whose {@code list_changed} notification is {@code method}, if any. */
    public static Optional<CapabilityKind> forChangedNotification(String method) {
        return Arrays.stream(values())
                .filter(kind -> kind.changedNotification.equals(method))
                .findFirst();
    }
}
