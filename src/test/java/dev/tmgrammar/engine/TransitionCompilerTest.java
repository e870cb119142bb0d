package dev.tmgrammar.engine;

import dev.tmgrammar.model.*;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.HashSet;

import static dev.tmgrammar.engine.TestMachines.*;
import static org.assertj.core.api.Assertions.assertThat;

class TransitionCompilerTest {

    private static final GrammarFormat FORMAT = GrammarFormat.defaults();

    private final TransitionCompiler compiler = new TransitionCompiler(FORMAT);

    @Test
    void namesRuleWithMarkerStateMarkerSymbol() {
        assertThat(compiler.ruleName(new StateSymbol("q0", "1"))).isEqualTo("*q0*1");
        assertThat(compiler.ruleName(new StateSymbol("scan", "B"))).isEqualTo("*scan*B");
    }

    @Test
    void continuesWhenTargetStateIsLive() {
        Machine machine = MachineValidator.validate(flipper(), FORMAT, false);

        String body = compiler.compileAction(new Action("q1", "0", Direction.LEFT), machine);

        assertThat(body).isEqualTo(
            "[state:q1][tape_right:POP][tape_right:0][direction:<][run_next:#activate_next#]");
    }

    @Test
    void stopsWhenTargetStateAccepts() {
        Machine machine = MachineValidator.validate(flipper(), FORMAT, false);

        String body = compiler.compileAction(new Action("qa", "B", Direction.STAY), machine);

        assertThat(body).isEqualTo("[state:qa][tape_right:POP][tape_right:B][direction:_]");
    }

    @Test
    void stopsWhenTargetStateRejects() {
        Machine machine = MachineValidator.validate(flipper(), FORMAT, false);

        String body = compiler.compileAction(new Action("qr", "0", Direction.RIGHT), machine);

        assertThat(body).doesNotContain("run_next");
    }

    @Test
    void continuationPresentIffTargetIsNotHalting() {
        Machine machine = MachineValidator.validate(flipper(), FORMAT, false);

        Grammar rules = compiler.compile(machine);

        for (var entry : machine.transitions().entrySet()) {
            String body = rules.get(compiler.ruleName(entry.getKey()));
            boolean halts = machine.isHalting(entry.getValue().state());
            assertThat(body.endsWith("[run_next:#activate_next#]"))
                .as("rule for %s", entry.getKey())
                .isEqualTo(!halts);
        }
    }

    @Test
    void compilesOneRulePerLiveStateAndSymbol() {
        Machine machine = MachineValidator.validate(flipper(), FORMAT, false);

        Grammar rules = compiler.compile(machine);

        assertThat(rules.size()).isEqualTo((machine.states().size() - 2) * machine.symbols().size());
        assertThat(new HashSet<>(rules.names())).hasSize(rules.size());
        assertThat(rules.names()).containsExactly(
            "*q0*0", "*q0*1", "*q0*B", "*q1*0", "*q1*1", "*q1*B");
    }

    @Test
    void skipsUndefinedPairsOfLenientMachines() {
        Machine machine = MachineValidator.validate(unaryIncrement(), FORMAT, true);

        Grammar rules = compiler.compile(machine);

        assertThat(rules.names()).containsExactly("*q0*0", "*q0*B");
    }

    @Test
    void usesConfiguredMarkerAndCodes() {
        GrammarFormat d = GrammarFormat.defaults();
        var codes = new EnumMap<Direction, String>(Direction.class);
        codes.put(Direction.RIGHT, "R");
        codes.put(Direction.LEFT, "L");
        codes.put(Direction.STAY, "S");
        var format = new GrammarFormat(d.reservedCharacters(), "~", codes,
            d.stateKey(), d.tapeKey(), d.tapePrefix(), d.directionKey(), d.popKeyword(),
            d.continuationKey(), d.activationKey(), d.activationMarker(), d.dispatcherKey(),
            d.initTapeKey(), d.initStateKey(), d.blankKey(),
            d.leftPaddingPrefix(), d.rightPaddingPrefix());
        var custom = new TransitionCompiler(format);
        var description = withTransitions(flipper(), flipper().transitions().stream()
            .map(e -> t(e.state(), e.symbol(), e.targetState(), e.writeSymbol(),
                e.directionCode().equals(">") ? "R" : e.directionCode().equals("<") ? "L" : "S"))
            .toList());
        Machine machine = MachineValidator.validate(description, format, false);

        Grammar rules = custom.compile(machine);

        assertThat(rules.get("~q0~0")).isEqualTo(
            "[state:q0][tape_right:POP][tape_right:1][direction:R][run_next:#activate_next#]");
    }
}
