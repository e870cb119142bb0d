package dev.tmgrammar.model;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GrammarFormatTest {

    private final GrammarFormat format = GrammarFormat.defaults();

    @Test
    void mapsDirectionCodesBothWays() {
        assertThat(format.codeOf(Direction.RIGHT)).isEqualTo(">");
        assertThat(format.codeOf(Direction.LEFT)).isEqualTo("<");
        assertThat(format.codeOf(Direction.STAY)).isEqualTo("_");

        assertThat(format.directionOf(">")).contains(Direction.RIGHT);
        assertThat(format.directionOf("<")).contains(Direction.LEFT);
        assertThat(format.directionOf("_")).contains(Direction.STAY);
        assertThat(format.directionOf("R")).isEmpty();
    }

    @Test
    void reservesGrammarCharactersMarkerAndWhitespace() {
        for (char c : "[],{}#\"* \t\n\r".toCharArray()) {
            assertThat(format.isReserved(c)).as("'%s'", c).isTrue();
        }
        assertThat(format.isReserved('\u2003')).isTrue();
        assertThat(format.isReserved('a')).isFalse();
        assertThat(format.isReserved('_')).isFalse();
    }

    @Test
    void buildsModifiersAndReferences() {
        assertThat(format.push("state", "q0")).isEqualTo("[state:q0]");
        assertThat(format.reference("activate_next")).isEqualTo("#activate_next#");
    }

    @Test
    void rejectsDuplicateDirectionCodes() {
        var codes = new EnumMap<Direction, String>(Direction.class);
        codes.put(Direction.RIGHT, ">");
        codes.put(Direction.LEFT, ">");
        codes.put(Direction.STAY, "_");

        assertThatThrownBy(() -> withCodes(codes))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("distinct");
    }

    @Test
    void rejectsMissingDirectionCode() {
        var codes = new EnumMap<Direction, String>(Direction.class);
        codes.put(Direction.RIGHT, ">");
        codes.put(Direction.LEFT, "<");

        assertThatThrownBy(() -> withCodes(codes))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("STAY");
    }

    private GrammarFormat withCodes(EnumMap<Direction, String> codes) {
        GrammarFormat d = GrammarFormat.defaults();
        return new GrammarFormat(d.reservedCharacters(), d.escapeMarker(), codes,
            d.stateKey(), d.tapeKey(), d.tapePrefix(), d.directionKey(), d.popKeyword(),
            d.continuationKey(), d.activationKey(), d.activationMarker(), d.dispatcherKey(),
            d.initTapeKey(), d.initStateKey(), d.blankKey(),
            d.leftPaddingPrefix(), d.rightPaddingPrefix());
    }
}
