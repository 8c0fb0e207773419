package io.github.drompincen.remindclaw.tools;

import io.github.drompincen.remindclaw.protocol.api.ToolRiskProfile;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import io.github.drompincen.remindclaw.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

import static io.github.drompincen.remindclaw.tools.ReminderToolSupport.*;

public class SetReminderTool implements Tool {

    private ReminderOperations reminderOperations;

    @Override public String name() { return "set_reminder"; }

    @Override public String description() {
        return "Set a one-time reminder. 'when' accepts durations like '30s', '5m', 'in 2 hours', " +
               "natural phrases like 'tomorrow at 3pm' or 'next friday', and dates like '2024-12-25 10:00'.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        ObjectNode props = (ObjectNode) schema.get("properties");
        props.putObject("text").put("type", "string")
                .put("description", "What to remind about");
        props.putObject("when").put("type", "string")
                .put("description", "When to fire the reminder");
        timezoneProperty(schema);
        schema.putArray("required").add("text").add("when");
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

        String text = text(input, "text");
        String when = text(input, "when");
        if (text == null) return ToolResult.failure("'text' is required");
        if (when == null) return ToolResult.failure("'when' is required");

        String message = reminderOperations.setReminder(text, when, timezone(input, ctx));
        stream.progress(100, message);
        return reply(message);
    }
}
