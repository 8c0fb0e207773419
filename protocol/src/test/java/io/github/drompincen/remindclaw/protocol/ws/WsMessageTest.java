package io.github.drompincen.remindclaw.protocol.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WsMessageTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void ofFactoryCreatesMessage() {
        WsMessage msg = WsMessage.of(WsMessageType.REMINDER, "ws-1", new TextNode("⏰ stretch"));

        assertThat(msg.type()).isEqualTo(WsMessageType.REMINDER);
        assertThat(msg.destination()).isEqualTo("ws-1");
        assertThat(msg.payload().asText()).isEqualTo("⏰ stretch");
        assertThat(msg.ts()).isNotNull();
    }

    @Test
    void errorFactoryCreatesErrorMessage() {
        WsMessage msg = WsMessage.error("ws-1", new TextNode("unknown message type"));

        assertThat(msg.type()).isEqualTo(WsMessageType.ERROR);
        assertThat(msg.destination()).isEqualTo("ws-1");
    }

    @Test
    void serializesTypeByName() throws Exception {
        String json = mapper.writeValueAsString(WsMessage.of(WsMessageType.BOUND, "ws-2", null));

        assertThat(json).contains("\"type\":\"BOUND\"");
        assertThat(json).contains("\"destination\":\"ws-2\"");
    }

    @Test
    void wsMessageTypesIncludeClientAndServerTypes() {
        assertThat(WsMessageType.valueOf("BIND_DESTINATION")).isNotNull();
        assertThat(WsMessageType.valueOf("UNBIND_DESTINATION")).isNotNull();
        assertThat(WsMessageType.valueOf("REMINDER")).isNotNull();
        assertThat(WsMessageType.valueOf("BOUND")).isNotNull();
        assertThat(WsMessageType.valueOf("ERROR")).isNotNull();
    }
}
