package org.asmscribe.annotator.frontend.lexer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AsmTextTest {

    private static final List<String> PREFIXES = List.of("#", ";", "//");

    @Test
    void stripTrailingComment_removesCommentAfterWhitespace() {
        assertThat(AsmText.stripTrailingComment("movsd xmm0, qword ptr [rdx]   # xmm0 = mem[0],zero", PREFIXES))
                .isEqualTo("movsd xmm0, qword ptr [rdx]");
        assertThat(AsmText.stripTrailingComment("mov eax, 1 ; one", PREFIXES)).isEqualTo("mov eax, 1");
    }

    @Test
    void stripTrailingComment_keepsPrefixCharactersInsideSymbols() {
        assertThat(AsmText.stripTrailingComment("\"??H@YA#x\":", PREFIXES)).isEqualTo("\"??H@YA#x\":");
        assertThat(AsmText.stripTrailingComment("jmp $LN3@main", PREFIXES)).isEqualTo("jmp $LN3@main");
        assertThat(AsmText.stripTrailingComment("mov eax, a#b", PREFIXES)).isEqualTo("mov eax, a#b");
    }

    @Test
    void stripTrailingComment_commentOnlyBecomesEmpty() {
        assertThat(AsmText.stripTrailingComment("# -- End function", PREFIXES)).isEmpty();
    }

    @Test
    void unquote_removesOnePairOfQuotes() {
        assertThat(AsmText.unquote("\"??D@YA?AUPoint@@AEBU0@N@Z\"")).isEqualTo("??D@YA?AUPoint@@AEBU0@N@Z");
        assertThat(AsmText.unquote("main")).isEqualTo("main");
        assertThat(AsmText.unquote("\"")).isEqualTo("\"");
    }

    @Test
    void startsWithWord_requiresWordBoundary() {
        assertThat(AsmText.startsWithWord(".globl main", ".globl")).isTrue();
        assertThat(AsmText.startsWithWord(".globl", ".globl")).isTrue();
        assertThat(AsmText.startsWithWord(".globlx main", ".globl")).isFalse();
    }
}
