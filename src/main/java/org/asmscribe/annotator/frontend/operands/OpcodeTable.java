package org.asmscribe.annotator.frontend.operands;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.asmscribe.annotator.frontend.operands.Action.*;
import static org.asmscribe.annotator.frontend.operands.DataWidth.*;

/**
 * Registry mapping mnemonics to their {@link OpcodeClass}.
 * <p>
 * Lookup is case-insensitive. A mnemonic that is not registered but ends in an AT&T size
 * suffix ({@code addq}, {@code movl}) resolves to its base integer mnemonic with the
 * suffix width. Mnemonics starting with {@code .} are assembler pseudo-ops. Anything
 * else is unknown: callers get an empty result and must not guess.
 */
public class OpcodeTable {

    private static final OpcodeClass PSEUDO_OP = new OpcodeClass(PSEUDO, NONE, "Assembler directive");

    private static final String[][] CONDITIONS = {
        {"a", "above"}, {"ae", "above or equal"}, {"b", "below"}, {"be", "below or equal"},
        {"c", "carry"}, {"e", "equal"}, {"g", "greater"}, {"ge", "greater or equal"},
        {"l", "less"}, {"le", "less or equal"}, {"na", "not above"}, {"nae", "not above or equal"},
        {"nb", "not below"}, {"nbe", "not below or equal"}, {"nc", "not carry"}, {"ne", "not equal"},
        {"ng", "not greater"}, {"nge", "not greater or equal"}, {"nl", "not less"},
        {"nle", "not less or equal"}, {"no", "not overflow"}, {"np", "not parity"}, {"ns", "not sign"},
        {"nz", "not zero"}, {"o", "overflow"}, {"p", "parity"}, {"pe", "parity even"},
        {"po", "parity odd"}, {"s", "sign"}, {"z", "zero"}
    };

    private final Map<String, OpcodeClass> entries = new HashMap<>();

    /**
     * Registers or replaces the class of a mnemonic.
     * @param mnemonic    The mnemonic (case-insensitive).
     * @param opcodeClass Its class.
     */
    public void register(String mnemonic, OpcodeClass opcodeClass) {
        entries.put(mnemonic.toLowerCase(Locale.ROOT), opcodeClass);
    }

    /**
     * Looks up a mnemonic.
     * @param mnemonic The mnemonic as written in the source.
     * @return its class, or empty if the mnemonic is unknown.
     */
    public Optional<OpcodeClass> lookup(String mnemonic) {
        String key = mnemonic.toLowerCase(Locale.ROOT);
        OpcodeClass direct = entries.get(key);
        if (direct != null) {
            return Optional.of(direct);
        }
        if (key.startsWith(".") && key.length() > 1) {
            return Optional.of(PSEUDO_OP);
        }
        if (key.length() > 2) {
            DataWidth suffixWidth = DataWidth.fromAttSuffix(key.charAt(key.length() - 1));
            OpcodeClass base = entries.get(key.substring(0, key.length() - 1));
            if (suffixWidth != null && base != null && (base.width().isInteger() || base.width() == NONE)) {
                return Optional.of(base.withWidth(suffixWidth));
            }
        }
        return Optional.empty();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Creates a table with the x86-64 mnemonics compilers emit for scalar floating-point
     * and ordinary integer code.
     * @return A new table instance.
     */
    public static OpcodeTable initialize() {
        OpcodeTable t = new OpcodeTable();

        // SSE scalar / packed floating point
        t.register("movsd", new OpcodeClass(MOVE, FLOAT64, "Move scalar double"));
        t.register("movss", new OpcodeClass(MOVE, FLOAT32, "Move scalar single"));
        t.register("movapd", new OpcodeClass(MOVE, PACKED_FLOAT64, "Move aligned packed doubles"));
        t.register("movaps", new OpcodeClass(MOVE, PACKED_FLOAT32, "Move aligned packed singles"));
        t.register("movupd", new OpcodeClass(MOVE, PACKED_FLOAT64, "Move unaligned packed doubles"));
        t.register("movups", new OpcodeClass(MOVE, PACKED_FLOAT32, "Move unaligned packed singles"));
        t.register("movq", new OpcodeClass(MOVE, INT64, "Move 64-bit integer"));
        t.register("movd", new OpcodeClass(MOVE, INT32, "Move 32-bit integer"));
        t.register("movdqa", new OpcodeClass(MOVE, VECTOR128, "Move aligned 128-bit vector"));
        t.register("movdqu", new OpcodeClass(MOVE, VECTOR128, "Move unaligned 128-bit vector"));
        t.register("addsd", new OpcodeClass(ADD, FLOAT64, "Add scalar double"));
        t.register("addss", new OpcodeClass(ADD, FLOAT32, "Add scalar single"));
        t.register("addpd", new OpcodeClass(ADD, PACKED_FLOAT64, "Add packed doubles"));
        t.register("subsd", new OpcodeClass(SUBTRACT, FLOAT64, "Subtract scalar double"));
        t.register("subss", new OpcodeClass(SUBTRACT, FLOAT32, "Subtract scalar single"));
        t.register("subpd", new OpcodeClass(SUBTRACT, PACKED_FLOAT64, "Subtract packed doubles"));
        t.register("mulsd", new OpcodeClass(MULTIPLY, FLOAT64, "Multiply scalar double"));
        t.register("mulss", new OpcodeClass(MULTIPLY, FLOAT32, "Multiply scalar single"));
        t.register("mulpd", new OpcodeClass(MULTIPLY, PACKED_FLOAT64, "Multiply packed doubles"));
        t.register("divsd", new OpcodeClass(DIVIDE, FLOAT64, "Divide scalar double"));
        t.register("divss", new OpcodeClass(DIVIDE, FLOAT32, "Divide scalar single"));
        t.register("sqrtsd", new OpcodeClass(SQRT, FLOAT64, "Square root of scalar double"));
        t.register("sqrtss", new OpcodeClass(SQRT, FLOAT32, "Square root of scalar single"));
        t.register("minsd", new OpcodeClass(MIN_MAX, FLOAT64, "Minimum of scalar doubles"));
        t.register("maxsd", new OpcodeClass(MIN_MAX, FLOAT64, "Maximum of scalar doubles"));
        t.register("ucomisd", new OpcodeClass(COMPARE, FLOAT64, "Compare scalar doubles (unordered)"));
        t.register("comisd", new OpcodeClass(COMPARE, FLOAT64, "Compare scalar doubles"));
        t.register("ucomiss", new OpcodeClass(COMPARE, FLOAT32, "Compare scalar singles (unordered)"));
        t.register("comiss", new OpcodeClass(COMPARE, FLOAT32, "Compare scalar singles"));
        t.register("xorps", new OpcodeClass(BITWISE, PACKED_FLOAT32, "Bitwise XOR of packed singles"));
        t.register("xorpd", new OpcodeClass(BITWISE, PACKED_FLOAT64, "Bitwise XOR of packed doubles"));
        t.register("andpd", new OpcodeClass(BITWISE, PACKED_FLOAT64, "Bitwise AND of packed doubles"));
        t.register("andps", new OpcodeClass(BITWISE, PACKED_FLOAT32, "Bitwise AND of packed singles"));
        t.register("unpcklpd", new OpcodeClass(MOVE, PACKED_FLOAT64, "Interleave low doubles"));
        t.register("cvtsi2sd", new OpcodeClass(CONVERT, FLOAT64, "Convert integer to double"));
        t.register("cvttsd2si", new OpcodeClass(CONVERT, INT32, "Convert double to integer (truncate)"));
        t.register("cvtsd2si", new OpcodeClass(CONVERT, INT32, "Convert double to integer"));
        t.register("cvtsd2ss", new OpcodeClass(CONVERT, FLOAT32, "Convert double to single"));
        t.register("cvtss2sd", new OpcodeClass(CONVERT, FLOAT64, "Convert single to double"));

        // integer data movement
        t.register("mov", new OpcodeClass(MOVE, NONE, "Move data"));
        t.register("movabs", new OpcodeClass(MOVE, INT64, "Move 64-bit immediate"));
        t.register("movzx", new OpcodeClass(MOVE, NONE, "Move with zero extension"));
        t.register("movsx", new OpcodeClass(MOVE, NONE, "Move with sign extension"));
        t.register("movsxd", new OpcodeClass(MOVE, INT64, "Move with sign extension to 64-bit integer"));
        for (String att : new String[] {"movzbl", "movzbw", "movzbq", "movzwl", "movzwq"}) {
            t.register(att, new OpcodeClass(MOVE, NONE, "Move with zero extension"));
        }
        for (String att : new String[] {"movsbl", "movsbw", "movsbq", "movswl", "movswq", "movslq"}) {
            t.register(att, new OpcodeClass(MOVE, NONE, "Move with sign extension"));
        }
        t.register("lea", new OpcodeClass(LOAD_ADDRESS, NONE, "Load effective address"));
        t.register("push", new OpcodeClass(PUSH, NONE, "Push to stack"));
        t.register("pop", new OpcodeClass(POP, NONE, "Pop from stack"));
        t.register("cdq", new OpcodeClass(SIGN_EXTEND, INT32, "Sign-extend eax into edx"));
        t.register("cqo", new OpcodeClass(SIGN_EXTEND, INT64, "Sign-extend rax into rdx"));
        t.register("cdqe", new OpcodeClass(SIGN_EXTEND, INT64, "Sign-extend eax into rax"));
        t.register("cltq", new OpcodeClass(SIGN_EXTEND, INT64, "Sign-extend eax into rax"));
        t.register("cqto", new OpcodeClass(SIGN_EXTEND, INT64, "Sign-extend rax into rdx"));
        t.register("cltd", new OpcodeClass(SIGN_EXTEND, INT32, "Sign-extend eax into edx"));

        // integer arithmetic and logic
        t.register("add", new OpcodeClass(ADD, NONE, "Integer add"));
        t.register("sub", new OpcodeClass(SUBTRACT, NONE, "Integer subtract"));
        t.register("imul", new OpcodeClass(MULTIPLY, NONE, "Signed integer multiply"));
        t.register("mul", new OpcodeClass(MULTIPLY, NONE, "Unsigned integer multiply"));
        t.register("idiv", new OpcodeClass(DIVIDE, NONE, "Signed integer divide"));
        t.register("div", new OpcodeClass(DIVIDE, NONE, "Unsigned integer divide"));
        t.register("inc", new OpcodeClass(INCREMENT, NONE, "Increment by one"));
        t.register("dec", new OpcodeClass(DECREMENT, NONE, "Decrement by one"));
        t.register("neg", new OpcodeClass(NEGATE, NONE, "Two's complement negate"));
        t.register("not", new OpcodeClass(NEGATE, NONE, "Bitwise NOT"));
        t.register("and", new OpcodeClass(BITWISE, NONE, "Bitwise AND"));
        t.register("or", new OpcodeClass(BITWISE, NONE, "Bitwise OR"));
        t.register("xor", new OpcodeClass(BITWISE, NONE, "Bitwise XOR"));
        t.register("shl", new OpcodeClass(SHIFT, NONE, "Shift left"));
        t.register("sal", new OpcodeClass(SHIFT, NONE, "Shift left"));
        t.register("shr", new OpcodeClass(SHIFT, NONE, "Logical shift right"));
        t.register("sar", new OpcodeClass(SHIFT, NONE, "Arithmetic shift right"));
        t.register("cmp", new OpcodeClass(COMPARE, NONE, "Compare values"));
        t.register("test", new OpcodeClass(TEST, NONE, "Test (bitwise AND, flags only)"));

        // control flow
        t.register("call", new OpcodeClass(CALL, NONE, "Call function"));
        t.register("ret", new OpcodeClass(RETURN, NONE, "Return from function"));
        t.register("jmp", new OpcodeClass(JUMP, NONE, "Jump unconditionally"));
        t.register("nop", new OpcodeClass(NOP, NONE, "No operation"));
        t.register("int3", new OpcodeClass(NOP, NONE, "Breakpoint trap"));
        t.register("ud2", new OpcodeClass(NOP, NONE, "Undefined instruction trap"));
        for (String[] cc : CONDITIONS) {
            t.register("j" + cc[0], new OpcodeClass(CONDITIONAL_JUMP, NONE, "Jump if " + cc[1]));
            t.register("set" + cc[0], new OpcodeClass(CONDITIONAL_SET, INT8, "Set byte if " + cc[1]));
            t.register("cmov" + cc[0], new OpcodeClass(CONDITIONAL_MOVE, NONE, "Move if " + cc[1]));
        }
        return t;
    }
}
