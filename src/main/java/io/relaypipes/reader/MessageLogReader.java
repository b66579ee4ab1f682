package io.relaypipes.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.relaypipes.model.PipesMessage;
import io.relaypipes.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launcher-side reader for a newline-delimited messages file. Reading stops at the first line
 * that is not a whole message, which is what a writer killed mid-line leaves behind.
 */
public final class MessageLogReader {
    private static final Logger LOG = LoggerFactory.getLogger(MessageLogReader.class);

    private MessageLogReader() {
    }

    public static MessageLog read(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        int totalLines = countLines(bytes);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < bytes.length) {
            int end = start;
            while (end < bytes.length && bytes[end] != '\n') {
                end++;
            }
            int contentEnd = end > start && bytes[end - 1] == '\r' ? end - 1 : end;
            try {
                lines.add(decoder.decode(ByteBuffer.wrap(bytes, start, contentEnd - start)).toString());
            } catch (CharacterCodingException e) {
                // A writer killed mid-character leaves an undecodable final line.
                int skipped = totalLines - lines.size();
                LOG.warn("Stopped reading messages at line {}: not valid UTF-8", lines.size() + 1);
                MessageLog prefix = parse(lines);
                return new MessageLog(prefix.messages(), prefix.skippedTail() + skipped);
            }
            start = end + 1;
        }
        return parse(lines);
    }

    private static int countLines(byte[] bytes) {
        int count = 0;
        for (byte b : bytes) {
            if (b == '\n') {
                count++;
            }
        }
        if (bytes.length > 0 && bytes[bytes.length - 1] != '\n') {
            count++;
        }
        return count;
    }

    static MessageLog parse(List<String> lines) {
        List<PipesMessage> messages = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                JsonNode node = Jsons.mapper().readTree(line);
                messages.add(PipesMessage.fromJson(node));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                int skipped = lines.size() - i;
                LOG.warn("Stopped reading messages at line {}: {}", i + 1, e.getMessage());
                return new MessageLog(messages, skipped);
            }
        }
        return new MessageLog(messages, 0);
    }
}
