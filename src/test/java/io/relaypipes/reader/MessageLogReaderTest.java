package io.relaypipes.reader;

import io.relaypipes.model.PipesMethod;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class MessageLogReaderTest {

    @Test
    void recoversValidPrefixBeforeTornLine() {
        MessageLog log = MessageLogReader.parse(List.of(
                "{\"method\":\"log\",\"params\":{\"message\":\"hi\",\"level\":\"INFO\"}}",
                "{\"method\":\"report_asset_materialization\",\"params\":{\"metadata\":{},\"asset_key\":\"a\",\"data_version\":null}}",
                "{\"method\":\"report_asset_ch"
        ));

        Assertions.assertEquals(2, log.messages().size());
        Assertions.assertEquals(PipesMethod.REPORT_ASSET_MATERIALIZATION, log.messages().get(1).method());
        Assertions.assertEquals(1, log.skippedTail());
        Assertions.assertFalse(log.complete());
    }

    @Test
    void stopsAtUnknownMethodAndSkipsEverythingAfter() {
        MessageLog log = MessageLogReader.parse(List.of(
                "{\"method\":\"log\",\"params\":{}}",
                "{\"method\":\"teleport\",\"params\":{}}",
                "{\"method\":\"closed\",\"params\":{}}"
        ));

        Assertions.assertEquals(1, log.messages().size());
        Assertions.assertEquals(2, log.skippedTail());
    }

    @Test
    void completeLogEndsWithClosed() throws Exception {
        Path file = Files.createTempFile("relaypipes-log-", ".jsonl");
        try {
            Files.writeString(file, "{\"method\":\"log\",\"params\":{\"message\":\"x\",\"level\":\"INFO\"}}\n\n"
                    + "{\"method\":\"closed\",\"params\":{}}\n");

            MessageLog log = MessageLogReader.read(file);

            Assertions.assertEquals(2, log.messages().size());
            Assertions.assertEquals(0, log.skippedTail());
            Assertions.assertTrue(log.complete());
        } finally {
            Files.deleteIfExists(file);
        }
    }

    @Test
    void stopsAtLineCutInsideMultiByteCharacter() throws Exception {
        Path file = Files.createTempFile("relaypipes-torn-", ".jsonl");
        try {
            byte[] valid = "{\"method\":\"log\",\"params\":{\"message\":\"ok\",\"level\":\"INFO\"}}\n"
                    .getBytes(StandardCharsets.UTF_8);
            byte[] torn = "{\"method\":\"log\",\"params\":{\"message\":\"caf\u00e9".getBytes(StandardCharsets.UTF_8);
            byte[] content = new byte[valid.length + torn.length - 1];
            System.arraycopy(valid, 0, content, 0, valid.length);
            System.arraycopy(torn, 0, content, valid.length, torn.length - 1);
            Files.write(file, content);

            MessageLog log = MessageLogReader.read(file);

            Assertions.assertEquals(1, log.messages().size());
            Assertions.assertEquals("ok", log.messages().get(0).params().path("message").asText());
            Assertions.assertEquals(1, log.skippedTail());
            Assertions.assertFalse(log.complete());
        } finally {
            Files.deleteIfExists(file);
        }
    }
}
