package io.github.drompincen.remindclaw.tools;

import io.github.drompincen.remindclaw.protocol.api.ToolRiskProfile;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import io.github.drompincen.remindclaw.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

import static io.github.drompincen.remindclaw.tools.ReminderToolSupport.*;

public class ListRemindersTool implements Tool {

    private ReminderOperations reminderOperations;

    @Override public String name() { return "list_reminders"; }

    @Override public String description() {
        return "List all active reminders with their ids, texts and time until the next fire.";
    }

    @Override public JsonNode inputSchema() { return objectSchema(); }
    @Override public JsonNode outputSchema() { return messageSchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setReminderOperations(ReminderOperations reminderOperations) {
        this.reminderOperations = reminderOperations;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (reminderOperations == null) return ToolResult.failure(NOT_AVAILABLE);
        return reply(reminderOperations.listReminders());
    }
}
