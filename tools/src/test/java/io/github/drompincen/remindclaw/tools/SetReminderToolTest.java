package io.github.drompincen.remindclaw.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.remindclaw.protocol.api.ToolRiskProfile;
import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import io.github.drompincen.remindclaw.runtime.tools.ToolContext;
import io.github.drompincen.remindclaw.runtime.tools.ToolResult;
import io.github.drompincen.remindclaw.runtime.tools.ToolStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SetReminderToolTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock private ReminderOperations reminderOperations;
    @Mock private ToolStream stream;

    private SetReminderTool tool;
    private ToolContext ctx;

    @BeforeEach
    void setUp() {
        tool = new SetReminderTool();
        tool.setReminderOperations(reminderOperations);
        ctx = new ToolContext("session-1", "Europe/London");
    }

    @Test
    void schemaRequiresTextAndWhen() {
        assertThat(tool.name()).isEqualTo("set_reminder");
        assertThat(tool.inputSchema().path("required").toString()).isEqualTo("[\"text\",\"when\"]");
        assertThat(tool.riskProfiles()).containsExactly(ToolRiskProfile.AGENT_INTERNAL);
    }

    @Test
    void failsWithoutReminderOperations() {
        SetReminderTool unwired = new SetReminderTool();
        ObjectNode input = MAPPER.createObjectNode().put("text", "tea").put("when", "5m");

        ToolResult result = unwired.execute(ctx, input, stream);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not available");
    }

    @Test
    void failsWithoutText() {
        ObjectNode input = MAPPER.createObjectNode().put("when", "5m");

        ToolResult result = tool.execute(ctx, input, stream);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("'text'");
        verifyNoInteractions(reminderOperations);
    }

    @Test
    void failsWithBlankWhen() {
        ObjectNode input = MAPPER.createObjectNode().put("text", "tea").put("when", "  ");

        ToolResult result = tool.execute(ctx, input, stream);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("'when'");
    }

    @Test
    void usesExplicitTimezoneOverContext() {
        when(reminderOperations.setReminder("tea", "5m", "Asia/Tokyo"))
                .thenReturn("✅ Reminder set for Mar 02 at 05:05 PM (5m) [r_1]");
        ObjectNode input = MAPPER.createObjectNode().put("text", "tea").put("when", "5m").put("timezone", "Asia/Tokyo");

        ToolResult result = tool.execute(ctx, input, stream);

        assertThat(result.success()).isTrue();
        assertThat(result.output().path("message").asText()).endsWith("[r_1]");
        assertThat(result.output().path("ok").asBoolean()).isTrue();
        verify(stream).progress(eq(100), any());
    }

    @Test
    void fallsBackToContextTimezone() {
        when(reminderOperations.setReminder(any(), any(), any())).thenReturn("✅ ok");
        ObjectNode input = MAPPER.createObjectNode().put("text", "tea").put("when", "5m");

        tool.execute(ctx, input, stream);

        verify(reminderOperations).setReminder("tea", "5m", "Europe/London");
    }

    @Test
    void operationErrorIsReportedAsNotOk() {
        when(reminderOperations.setReminder(any(), any(), any())).thenReturn("❌ Time must be in the future");
        ObjectNode input = MAPPER.createObjectNode().put("text", "tea").put("when", "2001-01-01");

        ToolResult result = tool.execute(ctx, input, stream);

        assertThat(result.success()).isTrue();
        assertThat(result.output().path("ok").asBoolean()).isFalse();
        assertThat(result.output().path("message").asText()).isEqualTo("❌ Time must be in the future");
    }
}
