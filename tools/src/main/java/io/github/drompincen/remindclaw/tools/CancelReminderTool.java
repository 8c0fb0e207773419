package io.github.drompincen.remindclaw.tools;

import io.github.drompincen.remindclaw.protocol.api.ToolRiskProfile;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import io.github.drompincen.remindclaw.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

import static io.github.drompincen.remindclaw.tools.ReminderToolSupport.*;

public class CancelReminderTool implements Tool {

    private ReminderOperations reminderOperations;

    @Override public String name() { return "cancel_reminder"; }

    @Override public String description() {
        return "Cancel an active reminder by id (as shown by list_reminders, e.g. r_3 or rec_1).";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        ((ObjectNode) schema.get("properties")).putObject("reminderId").put("type", "string")
                .put("description", "Id of the reminder to cancel");
        schema.putArray("required").add("reminderId");
        return schema;
    }

    @Override public JsonNode outputSchema() { return messageSchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.AGENT_INTERNAL); }

    public void setReminderOperations(ReminderOperations reminderOperations) {
        this.reminderOperations = reminderOperations;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (reminderOperations == null) return ToolResult.failure(NOT_AVAILABLE);

        String reminderId = text(input, "reminderId");
        if (reminderId == null) return ToolResult.failure("'reminderId' is required");

        return reply(reminderOperations.cancelReminder(reminderId));
    }
}
