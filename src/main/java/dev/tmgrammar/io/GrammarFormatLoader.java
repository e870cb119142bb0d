package dev.tmgrammar.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tmgrammar.exception.MachineFormatException;
import dev.tmgrammar.model.Direction;
import dev.tmgrammar.model.GrammarFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;

/**
 * Loads grammar format overrides from JSON. Fields that are absent keep
 * the value of {@link GrammarFormat#defaults()}; field names are the record
 * component names, directions under {@code "directionCodes"} keyed
 * {@code "right"}, {@code "left"} and {@code "stay"}.
 */
public final class GrammarFormatLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GrammarFormatLoader() {}

    public static GrammarFormat loadFromFile(Path path) throws IOException {
        return parseFormat(MAPPER.readTree(path.toFile()));
    }

    public static GrammarFormat loadFromString(String json) throws IOException {
        return parseFormat(MAPPER.readTree(json));
    }

    private static GrammarFormat parseFormat(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new MachineFormatException("grammar format must be a JSON object");
        }
        GrammarFormat d = GrammarFormat.defaults();

        var codes = new EnumMap<Direction, String>(d.directionCodes());
        JsonNode codesNode = node.get("directionCodes");
        if (codesNode != null) {
            for (var entry : codesNode.properties()) {
                Direction direction;
                try {
                    direction = Direction.valueOf(entry.getKey().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new MachineFormatException("unknown direction \"%s\"".formatted(entry.getKey()), e);
                }
                codes.put(direction, entry.getValue().asText());
            }
        }

        try {
            return new GrammarFormat(
                text(node, "reservedCharacters", d.reservedCharacters()),
                text(node, "escapeMarker", d.escapeMarker()),
                codes,
                text(node, "stateKey", d.stateKey()),
                text(node, "tapeKey", d.tapeKey()),
                text(node, "tapePrefix", d.tapePrefix()),
                text(node, "directionKey", d.directionKey()),
                text(node, "popKeyword", d.popKeyword()),
                text(node, "continuationKey", d.continuationKey()),
                text(node, "activationKey", d.activationKey()),
                text(node, "activationMarker", d.activationMarker()),
                text(node, "dispatcherKey", d.dispatcherKey()),
                text(node, "initTapeKey", d.initTapeKey()),
                text(node, "initStateKey", d.initStateKey()),
                text(node, "blankKey", d.blankKey()),
                text(node, "leftPaddingPrefix", d.leftPaddingPrefix()),
                text(node, "rightPaddingPrefix", d.rightPaddingPrefix())
            );
        } catch (IllegalArgumentException e) {
            throw new MachineFormatException("invalid grammar format: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode node, String field, String fallback) {
        return node.has(field) ? node.get(field).asText() : fallback;
    }
}
