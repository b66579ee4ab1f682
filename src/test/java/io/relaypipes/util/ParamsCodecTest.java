package io.relaypipes.util;

import io.relaypipes.model.Params;
import io.relaypipes.params.ParamsException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParamsCodecTest {
    @Test
    void decodesBlobProducedByAnotherZlibImplementation() {
        Params params = ParamsCodec.decode("eJyrVipILMlQslJQ0i/JLdBPLqnQyyrOz1OqBQBpjQhu");
        assertEquals("/tmp/ctx.json", params.text("path").orElseThrow());
    }

    @Test
    void encodeThenDecodePreservesNestedValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("path", "/tmp/msgs.jsonl");
        values.put("count", 42);
        values.put("ratio", 0.5);
        values.put("flags", List.of(true, false));
        values.put("nested", Map.of("unicode", "café ✓"));
        Params params = Params.of(values);

        Params decoded = ParamsCodec.decode(ParamsCodec.encode(params));

        assertEquals(params, decoded);
        assertEquals(values, decoded.toMap());
    }

    @Test
    void emptyObjectRoundTrips() {
        Params empty = Params.of(Map.of());
        assertEquals(empty, ParamsCodec.decode(ParamsCodec.encode(empty)));
    }

    @Test
    void decodeRejectsInvalidBase64() {
        ParamsException e = assertThrows(ParamsException.class, () -> ParamsCodec.decode("%%% not base64 %%%"));
        assertTrue(e.getMessage().contains("base64"));
    }

    @Test
    void decodeRejectsUncompressedData() {
        ParamsException e = assertThrows(ParamsException.class, () -> ParamsCodec.decode("bm90IGNvbXByZXNzZWQgYXQgYWxs"));
        assertTrue(e.getMessage().contains("zlib"));
    }

    @Test
    void decodeRejectsTruncatedStream() {
        String blob = ParamsCodec.encode(Params.of(Map.of("path", "/tmp/some/long/enough/path.jsonl")));
        byte[] raw = java.util.Base64.getDecoder().decode(blob);
        String truncated = java.util.Base64.getEncoder().encodeToString(java.util.Arrays.copyOf(raw, raw.length / 2));
        assertThrows(ParamsException.class, () -> ParamsCodec.decode(truncated));
    }

    @Test
    void decodeRejectsInvalidJson() {
        ParamsException e = assertThrows(ParamsException.class, () -> ParamsCodec.decode("eJyrzssvUcgqzs8DABJ6A6c="));
        assertTrue(e.getMessage().contains("JSON"));
    }

    @Test
    void decodeRejectsJsonThatIsNotAnObject() {
        ParamsException e = assertThrows(ParamsException.class, () -> ParamsCodec.decode("eJyLNtRRMIoFAATuAWg="));
        assertTrue(e.getMessage().contains("object"));
    }

    @Test
    void decodeRejectsBlankBlob() {
        assertThrows(ParamsException.class, () -> ParamsCodec.decode("  "));
        assertThrows(ParamsException.class, () -> ParamsCodec.decode(null));
    }
}
