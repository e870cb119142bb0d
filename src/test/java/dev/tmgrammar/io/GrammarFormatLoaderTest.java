package dev.tmgrammar.io;

import dev.tmgrammar.exception.MachineFormatException;
import dev.tmgrammar.model.Direction;
import dev.tmgrammar.model.GrammarFormat;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarFormatLoaderTest {

    @Test
    void emptyObjectGivesDefaults() throws IOException {
        assertThat(GrammarFormatLoader.loadFromString("{}")).isEqualTo(GrammarFormat.defaults());
    }

    @Test
    void overridesSelectedFields() throws IOException {
        GrammarFormat format = GrammarFormatLoader.loadFromString("""
            {"escapeMarker": "~", "stateKey": "st", "directionCodes": {"right": "R", "stay": "S"}}
            """);

        assertThat(format.escapeMarker()).isEqualTo("~");
        assertThat(format.stateKey()).isEqualTo("st");
        assertThat(format.codeOf(Direction.RIGHT)).isEqualTo("R");
        assertThat(format.codeOf(Direction.LEFT)).isEqualTo("<");
        assertThat(format.codeOf(Direction.STAY)).isEqualTo("S");
        assertThat(format.tapeKey()).isEqualTo(GrammarFormat.defaults().tapeKey());
    }

    @Test
    void rejectsUnknownDirection() {
        assertThatThrownBy(() -> GrammarFormatLoader.loadFromString("{\"directionCodes\": {\"up\": \"^\"}}"))
            .isInstanceOf(MachineFormatException.class)
            .hasMessageContaining("unknown direction \"up\"");
    }

    @Test
    void rejectsClashingDirectionCodes() {
        assertThatThrownBy(() -> GrammarFormatLoader.loadFromString("{\"directionCodes\": {\"left\": \">\"}}"))
            .isInstanceOf(MachineFormatException.class)
            .hasMessageContaining("distinct");
    }

    @Test
    void rejectsLongEscapeMarker() {
        assertThatThrownBy(() -> GrammarFormatLoader.loadFromString("{\"escapeMarker\": \"**\"}"))
            .isInstanceOf(MachineFormatException.class)
            .hasMessageContaining("single character");
    }
}
