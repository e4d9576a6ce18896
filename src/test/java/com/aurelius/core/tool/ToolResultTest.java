package com.aurelius.core.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testSuccessCarriesOutputAndArtifact() {
        ObjectNode output = mapper.createObjectNode().put("key", "value");

        ToolResult result = ToolResult.success(output, "test_id_123");

        assertTrue(result.isSuccess());
        assertEquals("value", result.getOutput().get("key").asText());
        assertEquals("test_id_123", result.getArtifactId());
        assertNull(result.getError());
        assertTrue(result.toString().contains("Success"));
    }

    @Test
    void testFailureAlwaysHasError() {
        ToolResult explicit = ToolResult.failure("Something went wrong");
        ToolResult blank = ToolResult.failure("   ");
        ToolResult missing = ToolResult.failure(null);

        assertFalse(explicit.isSuccess());
        assertEquals("Something went wrong", explicit.getError());
        assertTrue(explicit.toString().contains("Error"));

        assertNotNull(blank.getError());
        assertFalse(blank.getError().isBlank());
        assertNotNull(missing.getError());
        assertFalse(missing.getError().isBlank());
    }

    @Test
    void testFailureKeepsStructuredOutput() {
        ObjectNode output = mapper.createObjectNode();
        output.putObject("crv_report").put("passed", false);

        ToolResult result = ToolResult.failure("crv_verify exited with 1", output);

        assertFalse(result.isSuccess());
        assertTrue(result.hasOutput());
        assertFalse(result.getOutput().path("crv_report").path("passed").asBoolean(true));
    }

    @Test
    void testToolCallParametersAreOrderedAndImmutable() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("spec_path", "spec.json");
        params.put("data_path", "data.parquet");
        params.put("runs", 3);

        ToolCall call = new ToolCall(ToolType.CHECK_DETERMINISM, params);
        params.put("late", "ignored");

        assertEquals(List.of("spec_path", "data_path", "runs"), List.copyOf(call.getParameters().keySet()));
        assertEquals("3", call.getString("runs"));
        assertNull(call.getString("missing"));
        assertThrows(UnsupportedOperationException.class, () -> call.getParameters().put("x", 1));
    }

    @Test
    void testToolTypeWireNames() {
        assertEquals("backtest", ToolType.BACKTEST.getWireName());
        assertEquals("crv_verify", ToolType.CRV_VERIFY.getWireName());
        assertEquals("hipcortex_commit", ToolType.MEMORY_COMMIT.getWireName());
        assertEquals(ToolType.Backend.MEMORY, ToolType.MEMORY_SEARCH.getBackend());
        assertEquals(ToolType.Backend.ENGINE, ToolType.LINT.getBackend());
    }

    @Test
    void testArtifactIdsAreSha256Hex() {
        String id = ArtifactIds.sha256("abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", id);
        assertTrue(ArtifactIds.isArtifactId(id));
        assertFalse(ArtifactIds.isArtifactId("test_id_123"));
        assertFalse(ArtifactIds.isArtifactId(null));
    }
}
