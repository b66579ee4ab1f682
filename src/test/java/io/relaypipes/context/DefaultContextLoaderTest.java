package io.relaypipes.context;

import com.fasterxml.jackson.databind.JsonNode;
import io.relaypipes.model.Params;
import io.relaypipes.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class DefaultContextLoaderTest {
    private final DefaultContextLoader loader = new DefaultContextLoader();

    @TempDir
    Path dir;

    @Test
    void loadsContextFromPathShape() throws Exception {
        Path file = dir.resolve("ctx.json");
        Files.writeString(file, "{\"run_id\":\"abc\",\"asset_keys\":[\"a\"],\"extras\":{}}", StandardCharsets.UTF_8);

        RunContext context = loader.loadContext(Params.of(Map.of("path", file.toString())));

        Assertions.assertEquals("abc", context.runId());
        Assertions.assertEquals(List.of("a"), context.assetKeys());
        Assertions.assertTrue(context.extras().isEmpty());
        Assertions.assertTrue(context.partitionKey().isEmpty());
        Assertions.assertTrue(context.codeVersionTag().isEmpty());
        Assertions.assertEquals(0, context.retryNumber());
    }

    @Test
    void loadsInlineContextWithEveryOptionalField() throws Exception {
        JsonNode inline = Jsons.mapper().readTree("""
                {
                  "run_id": "run-7",
                  "job_name": "nightly_etl",
                  "asset_keys": ["orders", "customers"],
                  "partition_key": "2026-10-01",
                  "partition_key_range": {"start": "2026-10-01", "end": "2026-10-03"},
                  "partition_time_window": {"start": "2026-10-01T00:00:00Z", "end": "2026-10-04T00:00:00Z"},
                  "code_version_tag": "v12",
                  "retry_number": 2,
                  "extras": {"bucket": "s3://raw", "limits": {"rows": 1000, "ratio": 0.25}, "tags": ["a", null]}
                }
                """);

        RunContext context = loader.loadContext(Params.of(Map.of("context", inline)));

        Assertions.assertEquals("run-7", context.runId());
        Assertions.assertEquals("nightly_etl", context.jobName().orElseThrow());
        Assertions.assertEquals(List.of("orders", "customers"), context.assetKeys());
        Assertions.assertEquals("2026-10-01", context.partitionKey().orElseThrow());
        Assertions.assertEquals(new PartitionKeyRange("2026-10-01", "2026-10-03"), context.partitionKeyRange().orElseThrow());
        Assertions.assertEquals("2026-10-04T00:00:00Z", context.partitionTimeWindow().orElseThrow().end());
        Assertions.assertEquals("v12", context.codeVersionTag().orElseThrow());
        Assertions.assertEquals(2, context.retryNumber());
        Assertions.assertTrue(context.isAssetStep());
        Assertions.assertTrue(context.isPartitionStep());
        Assertions.assertEquals(inline.get("extras"), context.extrasJson());
        Assertions.assertEquals("s3://raw", context.extras().get("bucket"));
    }

    @Test
    void inlineShapeWinsOverPath() throws Exception {
        JsonNode inline = Jsons.mapper().readTree("{\"run_id\":\"inline\",\"asset_keys\":[]}");

        RunContext context = loader.loadContext(Params.of(Map.of(
                "context", inline,
                "path", dir.resolve("missing.json").toString()
        )));

        Assertions.assertEquals("inline", context.runId());
        Assertions.assertFalse(context.isAssetStep());
    }

    @Test
    void extrasCannotBeMutatedThroughAccessors() throws Exception {
        JsonNode inline = Jsons.mapper().readTree("{\"run_id\":\"r\",\"asset_keys\":[\"a\"],\"extras\":{\"k\":\"v\"}}");
        RunContext context = loader.loadContext(Params.of(Map.of("context", inline)));

        context.extras().put("k", "changed");
        context.extrasJson().put("k", "changed");

        Assertions.assertEquals("v", context.extra("k").orElseThrow().asText());
        Assertions.assertThrows(UnsupportedOperationException.class, () -> context.assetKeys().add("b"));
    }

    @Test
    void missingRunIdFails() {
        assertDecodeFails("{\"asset_keys\":[\"a\"],\"extras\":{}}", "run_id");
    }

    @Test
    void missingAssetKeysFails() {
        assertDecodeFails("{\"run_id\":\"abc\",\"extras\":{}}", "asset_keys");
    }

    @Test
    void wrongFieldTypesFail() {
        assertDecodeFails("{\"run_id\":42,\"asset_keys\":[\"a\"]}", "run_id");
        assertDecodeFails("{\"run_id\":\"abc\",\"asset_keys\":\"a\"}", "asset_keys");
        assertDecodeFails("{\"run_id\":\"abc\",\"asset_keys\":[1]}", "asset_keys");
        assertDecodeFails("{\"run_id\":\"abc\",\"asset_keys\":[],\"extras\":[]}", "extras");
        assertDecodeFails("{\"run_id\":\"abc\",\"asset_keys\":[],\"retry_number\":-1}", "retry_number");
        assertDecodeFails("{\"run_id\":\"abc\",\"asset_keys\":[],\"partition_key_range\":{\"start\":\"a\"}}", "end");
    }

    @Test
    void malformedJsonFileFails() throws Exception {
        Path file = dir.resolve("ctx.json");
        Files.writeString(file, "{\"run_id\": \"abc\", \"asset_keys\": [", StandardCharsets.UTF_8);

        ContextDecodeException e = Assertions.assertThrows(ContextDecodeException.class,
                () -> loader.loadContext(Params.of(Map.of("path", file.toString()))));
        Assertions.assertTrue(e.getMessage().contains("not valid JSON"));
    }

    @Test
    void unreadableFileFails() {
        Path missing = dir.resolve("nope.json");

        ContextDecodeException e = Assertions.assertThrows(ContextDecodeException.class,
                () -> loader.loadContext(Params.of(Map.of("path", missing.toString()))));
        Assertions.assertNotNull(e.getCause());
    }

    @Test
    void unknownShapeFails() {
        Assertions.assertThrows(ContextDecodeException.class,
                () -> loader.loadContext(Params.of(Map.of("stdio", "stdout"))));
        Assertions.assertThrows(ContextDecodeException.class,
                () -> loader.loadContext(Params.of(Map.of("path", 12))));
        Assertions.assertThrows(ContextDecodeException.class,
                () -> loader.loadContext(Params.of(Map.of("context", "not-an-object"))));
    }

    private void assertDecodeFails(String json, String expectedInMessage) {
        ContextDecodeException e = Assertions.assertThrows(ContextDecodeException.class,
                () -> loader.loadContext(Params.of(Map.of("context", Jsons.mapper().readTree(json)))));
        Assertions.assertTrue(e.getMessage().contains(expectedInMessage),
                () -> "expected '" + expectedInMessage + "' in: " + e.getMessage());
    }
}
