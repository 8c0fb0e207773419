package io.github.drompincen.remindclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.remindclaw.runtime.tools.ToolContext;
import io.github.drompincen.remindclaw.runtime.tools.ToolResult;

/** Shared input and output handling for the reminder tools. */
final class ReminderToolSupport {

    static final ObjectMapper MAPPER = new ObjectMapper();
    static final String NOT_AVAILABLE = "ReminderOperations not available, is the reminder runtime running?";

    private ReminderToolSupport() {}

    /** Wraps an operation message; messages starting with the failure marker are reported as {@code ok=false}. */
    static ToolResult reply(String message) {
        ObjectNode result = MAPPER.createObjectNode();
        result.put("message", message);
        result.put("ok", !message.startsWith("❌"));
        return ToolResult.success(result);
    }

    static String text(JsonNode input, String field) {
        String value = input == null ? null : input.path(field).asText(null);
        return value == null || value.isBlank() ? null : value;
    }

    /** The input's {@code timezone}, else the caller's, else null for the configured default. */
    static String timezone(JsonNode input, ToolContext ctx) {
        String tz = text(input, "timezone");
        if (tz != null) return tz;
        return ctx != null ? ctx.timezone() : null;
    }

    static ObjectNode objectSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    static void timezoneProperty(ObjectNode schema) {
        ((ObjectNode) schema.get("properties")).putObject("timezone").put("type", "string")
                .put("description", "IANA timezone name, e.g. America/New_York (defaults to the server zone)");
    }

    static JsonNode messageSchema() {
        ObjectNode schema = objectSchema();
        ObjectNode props = (ObjectNode) schema.get("properties");
        props.putObject("message").put("type", "string");
        props.putObject("ok").put("type", "boolean");
        return schema;
    }
}
