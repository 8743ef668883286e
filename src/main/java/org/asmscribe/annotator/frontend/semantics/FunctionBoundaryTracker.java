package org.asmscribe.annotator.frontend.semantics;

import org.asmscribe.annotator.api.ClassifiedLine;
import org.asmscribe.annotator.api.FunctionContext;
import org.asmscribe.annotator.diagnostics.DiagnosticKind;
import org.asmscribe.annotator.diagnostics.DiagnosticsEngine;
import org.asmscribe.annotator.frontend.lexer.LineClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * State machine that opens and closes function scopes while classified lines stream past.
 * <p>
 * States are {@link State#OUTSIDE} and {@link State#INSIDE}; at most one function context is
 * open at any time. Boundary errors never abort the pass:
 * <ul>
 *   <li>a start while a function is open closes the open one and reports {@link DiagnosticKind#NESTED_FUNCTION}</li>
 *   <li>an end outside any function is ignored and reported as {@link DiagnosticKind#STRAY_FUNCTION_END}</li>
 *   <li>input ending inside a function is reported by {@link #finish()} as {@link DiagnosticKind#UNTERMINATED_FUNCTION}</li>
 * </ul>
 * Thread Safety: Not thread-safe. One tracker per pass.
 */
public class FunctionBoundaryTracker {

    private static final Logger log = LoggerFactory.getLogger(FunctionBoundaryTracker.class);

    public enum State {
        OUTSIDE,
        INSIDE
    }

    private final LineClassifier classifier;
    private final SymbolTable symbols;
    private final DiagnosticsEngine diagnostics;
    private final List<FunctionContext> functions = new ArrayList<>();

    private FunctionContext current;
    private boolean finished;

    public FunctionBoundaryTracker(LineClassifier classifier, SymbolTable symbols, DiagnosticsEngine diagnostics) {
        this.classifier = classifier;
        this.symbols = symbols;
        this.diagnostics = diagnostics;
    }

    /**
     * Consumes the next line and applies its transition.
     *
     * @param line The next classified line in input order.
     * @return the context the line belongs to, or {@code null} if it is outside any function.
     *         A start line belongs to the function it opens, an end line to the function it closes.
     */
    public FunctionContext accept(ClassifiedLine line) {
        if (finished) {
            throw new IllegalStateException("Tracker already finished");
        }
        switch (line.tag()) {
            case FUNCTION_START -> {
                Optional<String> name = classifier.declaredName(line.text());
                if (name.isEmpty()) {
                    log.debug("Line {}: declaration without a name, no boundary", line.lineNumber());
                    return current;
                }
                open(name.get(), line.lineNumber());
                return current;
            }
            case FUNCTION_END -> {
                if (current == null) {
                    diagnostics.reportWarning(DiagnosticKind.STRAY_FUNCTION_END,
                            "End-of-function marker outside any function", line.lineNumber());
                    log.warn("Line {}: end-of-function marker outside any function, ignored", line.lineNumber());
                    return null;
                }
                FunctionContext closing = current;
                closing.close();
                current = null;
                log.trace("Line {}: closed {}", line.lineNumber(), closing.displayName());
                return closing;
            }
            default -> {
                return current;
            }
        }
    }

    /**
     * Signals end of input. Closes a still-open function and reports it as unterminated.
     */
    public void finish() {
        if (finished) {
            return;
        }
        finished = true;
        if (current != null) {
            diagnostics.reportWarning(DiagnosticKind.UNTERMINATED_FUNCTION,
                    "Function '" + current.displayName() + "' is not terminated", current.startLine());
            log.warn("Input ended inside function '{}' (opened at line {})", current.displayName(),
                    current.startLine());
            current.close();
            current = null;
        }
    }

    public State state() {
        return current == null ? State.OUTSIDE : State.INSIDE;
    }

    public Optional<FunctionContext> current() {
        return Optional.ofNullable(current);
    }

    /**
     * @return every context opened so far, in order.
     */
    public List<FunctionContext> functions() {
        return Collections.unmodifiableList(functions);
    }

    private void open(String spelling, int lineNumber) {
        if (current != null) {
            diagnostics.reportWarning(DiagnosticKind.NESTED_FUNCTION,
                    "Function '" + spelling + "' starts before '" + current.displayName() + "' ended", lineNumber);
            log.warn("Line {}: function '{}' starts inside '{}', closing the open function", lineNumber, spelling,
                    current.displayName());
            current.close();
        }
        if (!symbols.contains(spelling)) {
            diagnostics.reportInfo(DiagnosticKind.UNRESOLVED_SYMBOL,
                    "No display name for '" + spelling + "', keeping the compiler spelling", lineNumber);
        }
        current = new FunctionContext(spelling, symbols.resolve(spelling), lineNumber);
        functions.add(current);
        log.debug("Line {}: opened function {} ({})", lineNumber, current.displayName(), spelling);
    }
}
