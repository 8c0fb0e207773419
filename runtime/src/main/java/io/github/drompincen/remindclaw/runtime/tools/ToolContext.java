package io.github.drompincen.remindclaw.runtime.tools;

/**
 * Who is calling a tool. {@code timezone} is the caller's preferred zone and is used when the
 * tool input does not name one; it may be null.
 */
public record ToolContext(
        String sessionId,
        String timezone
) {}
