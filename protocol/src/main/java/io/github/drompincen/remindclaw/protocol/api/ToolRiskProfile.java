package io.github.drompincen.remindclaw.protocol.api;

public enum ToolRiskProfile {
    READ_ONLY,
    AGENT_INTERNAL
}
