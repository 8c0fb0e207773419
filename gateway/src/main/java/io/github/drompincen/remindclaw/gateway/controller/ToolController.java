package io.github.drompincen.remindclaw.gateway.controller;

import io.github.drompincen.remindclaw.protocol.api.ToolDescriptor;
import io.github.drompincen.remindclaw.runtime.tools.*;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tools")
public class ToolController {

    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping
    public List<ToolDescriptor> list() {
        return toolRegistry.descriptors();
    }

    @GetMapping("/{name}")
    public ResponseEntity<ToolDescriptor> describe(@PathVariable String name) {
        return toolRegistry.get(name)
                .map(t -> ResponseEntity.ok(ToolRegistry.describe(t)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{name}/invoke")
    public ResponseEntity<?> invoke(@PathVariable String name,
                                    @RequestBody JsonNode input,
                                    @RequestParam(required = false) String timezone) {
        return toolRegistry.get(name).map(tool -> {
            ToolContext ctx = new ToolContext("rest", timezone);
            ToolResult result = tool.execute(ctx, input, ToolStream.NO_OP);
            return ResponseEntity.ok(Map.of(
                    "success", result.success(),
                    "output", result.output() != null ? result.output() : "",
                    "error", result.error() != null ? result.error() : ""));
        }).orElse(ResponseEntity.notFound().build());
    }
}
