package io.github.drompincen.remindclaw.tools;

import io.github.drompincen.remindclaw.runtime.reminder.ReminderOperations;
import io.github.drompincen.remindclaw.runtime.tools.ToolContext;
import io.github.drompincen.remindclaw.runtime.tools.ToolResult;
import io.github.drompincen.remindclaw.runtime.tools.ToolStream;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class ClearAllRemindersToolTest {

    @Test
    void clearsAndReportsProgress() {
        ReminderOperations ops = mock(ReminderOperations.class);
        ToolStream stream = mock(ToolStream.class);
        when(ops.clearAllReminders()).thenReturn("✅ Cleared 3 reminder(s)");
        ClearAllRemindersTool tool = new ClearAllRemindersTool();
        tool.setReminderOperations(ops);

        ToolResult result = tool.execute(new ToolContext("s", null), null, stream);

        assertThat(result.output().path("message").asText()).isEqualTo("✅ Cleared 3 reminder(s)");
        verify(stream).progress(100, "✅ Cleared 3 reminder(s)");
    }

    @Test
    void failsWithoutReminderOperations() {
        ToolResult result = new ClearAllRemindersTool().execute(new ToolContext("s", null), null, ToolStream.NO_OP);

        assertThat(result.success()).isFalse();
    }
}
