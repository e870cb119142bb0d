package dev.tmgrammar.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tmgrammar.exception.MachineFormatException;
import dev.tmgrammar.model.MachineDescription;
import dev.tmgrammar.model.TransitionEntry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads machine descriptions from JSON:
 * <pre>
 * {"states": [...], "symbols": [...], "blank_symbol": "B",
 *  "start_state": "q0", "accept_state": "qa", "reject_state": "qr",
 *  "delta": [[["q0", "0"], ["q0", "1", "&gt;"]], ...]}
 * </pre>
 */
public final class MachineLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MachineLoader() {}

    /**
     * Load a machine description from a JSON file.
     */
    public static MachineDescription loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseMachine(root);
    }

    /**
     * Load a machine description from a JSON string.
     */
    public static MachineDescription loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseMachine(root);
    }

    private static MachineDescription parseMachine(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new MachineFormatException("machine description must be a JSON object");
        }
        List<String> states = textArray(root, "states");
        List<String> symbols = textArray(root, "symbols");
        String blank = text(root, "blank_symbol");
        String start = text(root, "start_state");
        String accept = text(root, "accept_state");
        String reject = text(root, "reject_state");
        List<TransitionEntry> transitions = parseDelta(root.get("delta"));

        return new MachineDescription(states, symbols, blank, start, accept, reject, transitions);
    }

    private static List<TransitionEntry> parseDelta(JsonNode delta) {
        if (delta == null || !delta.isArray()) {
            throw new MachineFormatException("field \"delta\" must be an array");
        }
        var transitions = new ArrayList<TransitionEntry>();
        int index = 0;
        for (JsonNode entry : delta) {
            JsonNode key = entry.get(0);
            JsonNode action = entry.get(1);
            if (!entry.isArray() || entry.size() != 2
                || !isTextTuple(key, 2) || !isTextTuple(action, 3)) {
                throw new MachineFormatException(
                    "delta entry %d must be [[state, symbol], [state, symbol, direction]]: %s".formatted(index, entry));
            }
            transitions.add(new TransitionEntry(
                key.get(0).asText(), key.get(1).asText(),
                action.get(0).asText(), action.get(1).asText(), action.get(2).asText()
            ));
            index++;
        }
        return transitions;
    }

    private static boolean isTextTuple(JsonNode node, int size) {
        if (node == null || !node.isArray() || node.size() != size) {
            return false;
        }
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                return false;
            }
        }
        return true;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new MachineFormatException("field \"%s\" must be a string".formatted(field));
        }
        return node.asText();
    }

    private static List<String> textArray(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new MachineFormatException("field \"%s\" must be an array of strings".formatted(field));
        }
        var values = new ArrayList<String>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new MachineFormatException("field \"%s\" contains a non-string value: %s".formatted(field, element));
            }
            values.add(element.asText());
        }
        return values;
    }
}
