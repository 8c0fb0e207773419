package io.github.drompincen.remindclaw.tools;

import io.github.drompincen.remindclaw.protocol.api.ToolRiskProfile;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import io.github.drompincen.remindclaw.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

import static io.github.drompincen.remindclaw.tools.ReminderToolSupport.*;

public class GetCurrentTimeTool implements Tool {

    private ReminderOperations reminderOperations;

    @Override public String name() { return "get_current_time"; }

    @Override public String description() {
        return "Get the current date and time, optionally in a given timezone. " +
               "Useful before setting reminders relative to a wall-clock time.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        timezoneProperty(schema);
        return schema;
    }

    @Override public JsonNode outputSchema() { return messageSchema(); }
    @Override public Set<ToolRiskProfile> riskProfiles() { return Set.of(ToolRiskProfile.READ_ONLY); }

    public void setReminderOperations(ReminderOperations reminderOperations) {
        this.reminderOperations = reminderOperations;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
        if (reminderOperations == null) return ToolResult.failure(NOT_AVAILABLE);
        return reply(reminderOperations.getCurrentTime(timezone(input, ctx)));
    }
}
