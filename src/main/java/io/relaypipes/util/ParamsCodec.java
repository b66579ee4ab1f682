package io.relaypipes.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.relaypipes.model.Params;
import io.relaypipes.params.ParamsException;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Params blob encoding: JSON object, zlib-compressed, standard base64.
 */
public final class ParamsCodec {
    private static final int CHUNK = 4096;

    private ParamsCodec() {
    }

    public static String encode(Params params) {
        return encode(params == null ? Jsons.mapper().createObjectNode() : params.toJson());
    }

    public static String encode(ObjectNode json) {
        byte[] raw = Jsons.toJson(json).getBytes(StandardCharsets.UTF_8);
        return Base64.getEncoder().encodeToString(deflate(raw));
    }

    public static Params decode(String blob) {
        if (blob == null || blob.isBlank()) {
            throw new ParamsException("params blob is empty");
        }
        byte[] compressed;
        try {
            compressed = Base64.getDecoder().decode(blob.trim());
        } catch (IllegalArgumentException e) {
            throw new ParamsException("params blob is not valid base64", e);
        }
        byte[] raw;
        try {
            raw = inflate(compressed);
        } catch (DataFormatException e) {
            throw new ParamsException("params blob is not valid zlib data", e);
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(new String(raw, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new ParamsException("params blob does not contain valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new ParamsException("params blob must decode to a JSON object");
        }
        return Params.of((ObjectNode) node);
    }

    private static byte[] deflate(byte[] input) {
        Deflater deflater = new Deflater();
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
            byte[] buffer = new byte[CHUNK];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    private static byte[] inflate(byte[] input) throws DataFormatException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(input);
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length * 4));
            byte[] buffer = new byte[CHUNK];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    // Truncated stream.
                    throw new DataFormatException("truncated zlib stream");
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            inflater.end();
        }
    }
}
