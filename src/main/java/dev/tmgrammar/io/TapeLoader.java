package dev.tmgrammar.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads input tapes from text files.
 */
public final class TapeLoader {

    private TapeLoader() {}

    /**
     * Read a tape file as UTF-8, dropping one trailing line terminator
     * left by editors.
     */
    public static String loadFromFile(Path path) throws IOException {
        return stripLineTerminator(Files.readString(path, StandardCharsets.UTF_8));
    }

    static String stripLineTerminator(String content) {
        if (content.endsWith("\r\n")) {
            return content.substring(0, content.length() - 2);
        }
        if (content.endsWith("\n")) {
            return content.substring(0, content.length() - 1);
        }
        return content;
    }
}
