package io.github.drompincen.remindclaw.runtime.tools;

import io.github.drompincen.remindclaw.protocol.api.ToolRiskProfile;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * An operation the conversational agent may call. Implementations are discovered through
 * {@link java.util.ServiceLoader} and receive collaborators through public setters.
 */
public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    JsonNode outputSchema();

    Set<ToolRiskProfile> riskProfiles();

    ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream);
}
