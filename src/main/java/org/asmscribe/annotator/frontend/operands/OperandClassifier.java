package org.asmscribe.annotator.frontend.operands;

import org.asmscribe.annotator.config.ArgumentConvention;
import org.asmscribe.annotator.config.ArgumentRole;
import org.asmscribe.annotator.config.RecordField;
import org.asmscribe.annotator.config.RecordLayout;
import org.asmscribe.annotator.frontend.lexer.AsmText;
import org.asmscribe.annotator.frontend.semantics.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Infers the intent of one instruction from its mnemonic and operands.
 * <p>
 * The mnemonic check and the operand checks run independently and their tags concatenate,
 * general first: the {@link SemanticTag.OpcodeTag} (or {@link SemanticTag.UnclassifiedOpcode}),
 * then memory, stack-frame and call-target tags in operand order.
 * <p>
 * Record fields are matched by exact offset only. The classifier holds no mutable state, so
 * identical inputs always produce identical tag lists.
 */
public class OperandClassifier {

    private final OpcodeTable opcodes;
    private final SymbolTable symbols;

    public OperandClassifier(OpcodeTable opcodes, SymbolTable symbols) {
        this.opcodes = opcodes;
        this.symbols = symbols;
    }

    /**
     * Classifies an instruction given as mnemonic and raw operand text.
     *
     * @param opcode      The mnemonic.
     * @param operandText Everything after the mnemonic.
     * @param layout      Record layout argument pointers refer to.
     * @param convention  Calling convention deciding which registers are argument pointers.
     * @return the tags, never empty: at least the opcode tag.
     */
    public List<SemanticTag> classify(String opcode, String operandText, RecordLayout layout,
                                      ArgumentConvention convention) {
        List<String> operands = InstructionParser.splitOperands(operandText);
        return classify(new ParsedInstruction(opcode, operandText.trim(), operands,
                Syntax.detect(operandText, operands)), layout, convention);
    }

    public List<SemanticTag> classify(ParsedInstruction instruction, RecordLayout layout,
                                      ArgumentConvention convention) {
        List<SemanticTag> tags = new ArrayList<>();
        Optional<OpcodeClass> opcodeClass = opcodes.lookup(instruction.mnemonic());
        Action action = opcodeClass.map(OpcodeClass::action).orElse(null);
        if (opcodeClass.isPresent()) {
            tags.add(new SemanticTag.OpcodeTag(instruction.mnemonic(), opcodeClass.get()));
        } else {
            tags.add(new SemanticTag.UnclassifiedOpcode(instruction.mnemonic()));
        }

        List<String> operands = instruction.operands();
        int destination = destinationIndex(instruction, action);
        for (int i = 0; i < operands.size(); i++) {
            Optional<MemoryOperand> memory = MemoryOperandParser.parse(operands.get(i));
            if (memory.isPresent()) {
                String verb = verb(action, i == destination);
                memoryTag(memory.get(), verb, layout, convention).ifPresent(tags::add);
            }
        }

        stackFrameTag(instruction, action).ifPresent(tags::add);
        callTargetTag(instruction, action).ifPresent(tags::add);
        return tags;
    }

    private static int destinationIndex(ParsedInstruction instruction, Action action) {
        if (instruction.operands().size() == 1) {
            return action != null && action.unaryDestination() ? 0 : -1;
        }
        return instruction.destinationIndex();
    }

    private static String verb(Action action, boolean destination) {
        if (action == null) {
            return destination ? "write" : "read";
        }
        return destination ? action.destinationVerb() : action.sourceVerb();
    }

    private static Optional<SemanticTag> memoryTag(MemoryOperand memory, String verb, RecordLayout layout,
                                                   ArgumentConvention convention) {
        if (memory.base() == null || memory.index() != null) {
            return Optional.empty();
        }
        if (isStackRegister(memory.base())) {
            return Optional.of(new SemanticTag.StackSlot(verb, memory.base(), memory.displacement(), memory.symbol()));
        }
        if (!memory.isBaseDisplacement()) {
            return Optional.empty();
        }
        Optional<ArgumentRole> role = convention.roleOf(memory.base());
        if (role.isEmpty()) {
            return Optional.empty();
        }
        Optional<RecordField> field = layout.fieldAt(memory.displacement());
        if (field.isPresent()) {
            return Optional.of(new SemanticTag.FieldAccess(verb, field.get(), memory.base(), role.get()));
        }
        return Optional.of(new SemanticTag.OutsideLayout(verb, memory.displacement(), memory.base(), role.get(),
                layout.name()));
    }

    private static Optional<SemanticTag> stackFrameTag(ParsedInstruction instruction, Action action) {
        if ((action != Action.SUBTRACT && action != Action.ADD) || instruction.operands().size() != 2) {
            return Optional.empty();
        }
        int dest = instruction.destinationIndex();
        String target = instruction.operands().get(dest);
        String source = instruction.operands().get(1 - dest);
        if (!"rsp".equals(ArgumentConvention.normalizeRegister(target))) {
            return Optional.empty();
        }
        Long bytes = MemoryOperandParser.parseNumber(source);
        if (bytes == null) {
            return Optional.empty();
        }
        SemanticTag.StackFrame.Kind kind = action == Action.SUBTRACT
                ? SemanticTag.StackFrame.Kind.ALLOCATE : SemanticTag.StackFrame.Kind.RELEASE;
        return Optional.of(new SemanticTag.StackFrame(kind, bytes));
    }

    private Optional<SemanticTag> callTargetTag(ParsedInstruction instruction, Action action) {
        if ((action != Action.CALL && action != Action.JUMP) || instruction.operands().size() != 1) {
            return Optional.empty();
        }
        String operand = instruction.operands().get(0);
        if (operand.startsWith("*") || MemoryOperandParser.isRegister(operand)
                || MemoryOperandParser.parse(operand).isPresent()) {
            return Optional.empty();
        }
        String spelling = AsmText.unquote(operand);
        String lookupKey = spelling;
        if (!symbols.contains(lookupKey) && lookupKey.endsWith("@PLT")) {
            lookupKey = lookupKey.substring(0, lookupKey.length() - "@PLT".length());
        }
        boolean resolved = symbols.contains(lookupKey);
        if (action == Action.JUMP && !resolved) {
            return Optional.empty();
        }
        String display = resolved ? symbols.resolve(lookupKey) : spelling;
        return Optional.of(new SemanticTag.CallTarget(spelling, display, resolved, action == Action.JUMP));
    }

    private static boolean isStackRegister(String register) {
        return "rsp".equals(register) || "rbp".equals(register);
    }
}
