package io.github.drompincen.remindclaw.tools;

import io.github.drompincen.remindclaw.protocol.api.ToolRiskProfile;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import io.github.drompincen.remindclaw.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Set;

import static io.github.drompincen.remindclaw.tools.ReminderToolSupport.*;

public class SetRecurringReminderTool implements Tool {

    private ReminderOperations reminderOperations;

    @Override public String name() { return "set_recurring_reminder"; }

    @Override public String description() {
        return "Set a recurring reminder. 'pattern' accepts 'daily at 9am', 'every monday at 10am', " +
               "'every hour', or a five-field cron expression such as '30 8 * * 1-5'.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = objectSchema();
        ObjectNode props = (ObjectNode) schema.get("properties");
        props.putObject("text").put("type", "string")
                .put("description", "What to remind about");
        props.putObject("pattern").put("type", "string")
                .put("description", "Recurrence pattern");
        timezoneProperty(schema);
        schema.putArray("required").add("text").add("pattern");
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
        String pattern = text(input, "pattern");
        if (text == null) return ToolResult.failure("'text' is required");
        if (pattern == null) return ToolResult.failure("'pattern' is required");

        String message = reminderOperations.setRecurringReminder(text, pattern, timezone(input, ctx));
        stream.progress(100, message);
        return reply(message);
    }
}
