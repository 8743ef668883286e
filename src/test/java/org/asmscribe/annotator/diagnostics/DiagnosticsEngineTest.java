package org.asmscribe.annotator.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DiagnosticsEngineTest {

    @Test
    void infoOnlyRunHasNoWarnings() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportInfo(DiagnosticKind.UNKNOWN_OPCODE, "No classification for opcode 'vfmadd231sd'", 4);

        assertThat(engine.hasWarnings()).isFalse();
        assertThat(engine.getDiagnostics()).hasSize(1);
        assertThat(engine.getWarnings()).isEmpty();
    }

    @Test
    void countsByKindAndListsWarningsInSummary() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportInfo(DiagnosticKind.UNRESOLVED_SYMBOL, "No display name for 'f'", 1);
        engine.reportInfo(DiagnosticKind.UNRESOLVED_SYMBOL, "No display name for 'g'", 9);
        engine.reportWarning(DiagnosticKind.UNTERMINATED_FUNCTION, "Function 'g' is not terminated", 9);

        assertThat(engine.hasWarnings()).isTrue();
        assertThat(engine.count(DiagnosticKind.UNRESOLVED_SYMBOL)).isEqualTo(2);
        assertThat(engine.summary())
                .contains("UNRESOLVED_SYMBOL: 2")
                .contains("UNTERMINATED_FUNCTION: 1")
                .contains("WARNING line 9: Function 'g' is not terminated")
                .doesNotContain("No display name for 'f'");
    }

    @Test
    void emptyEngineHasEmptySummary() {
        assertThat(new DiagnosticsEngine().summary()).isEmpty();
    }
}
