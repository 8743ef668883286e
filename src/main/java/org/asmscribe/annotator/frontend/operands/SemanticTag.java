package org.asmscribe.annotator.frontend.operands;

import org.asmscribe.annotator.config.ArgumentRole;
import org.asmscribe.annotator.config.RecordField;

/**
 * What the annotator inferred about an instruction. Callers switch on the variant instead
 * of matching on comment text; {@link #describe()} renders the comment fragment.
 */
public sealed interface SemanticTag permits SemanticTag.OpcodeTag, SemanticTag.UnclassifiedOpcode,
        SemanticTag.FieldAccess, SemanticTag.OutsideLayout, SemanticTag.StackSlot, SemanticTag.StackFrame,
        SemanticTag.CallTarget {

    /**
     * @return the comment fragment for this tag.
     */
    String describe();

    /**
     * @return {@code true} for tags derived from the mnemonic alone; operand tags are more specific.
     */
    default boolean isGeneral() {
        return false;
    }

    /**
     * The mnemonic is known.
     */
    record OpcodeTag(String mnemonic, OpcodeClass opcodeClass) implements SemanticTag {
        @Override
        public String describe() {
            return opcodeClass.description();
        }

        @Override
        public boolean isGeneral() {
            return true;
        }
    }

    /**
     * The mnemonic is not in the opcode table. Rendered explicitly rather than left out.
     */
    record UnclassifiedOpcode(String mnemonic) implements SemanticTag {
        @Override
        public String describe() {
            return "no classification available for '" + mnemonic + "'";
        }

        @Override
        public boolean isGeneral() {
            return true;
        }
    }

    /**
     * A memory operand {@code [reg + offset]} where {@code reg} carries an argument pointer and
     * {@code offset} is exactly the start of a record field.
     */
    record FieldAccess(String verb, RecordField field, String register, ArgumentRole role) implements SemanticTag {
        @Override
        public String describe() {
            return verb + " field " + field.name() + " of " + role.describe();
        }
    }

    /**
     * A memory operand through an argument pointer whose offset starts no field.
     */
    record OutsideLayout(String verb, long offset, String register, ArgumentRole role, String layoutName)
            implements SemanticTag {
        @Override
        public String describe() {
            return verb + " offset " + offset + " of " + role.describe() + ": outside known record layout " + layoutName;
        }
    }

    /**
     * A memory operand relative to the stack or frame pointer.
     *
     * @param symbol MSVC-style local name in front of the bracket, or {@code null}.
     */
    record StackSlot(String verb, String register, long offset, String symbol) implements SemanticTag {

        /**
         * @return {@code stack_var_<n>} for 8-byte aligned non-negative {@code rsp} offsets, the
         *         MSVC local name if there is one, otherwise {@code null}.
         */
        public String slotName() {
            if (symbol != null) {
                return symbol;
            }
            if ("rsp".equals(register) && offset >= 0 && offset % 8 == 0) {
                return "stack_var_" + (offset / 8);
            }
            return null;
        }

        @Override
        public String describe() {
            String location = "[" + register + (offset < 0 ? " - " + (-offset) : offset > 0 ? " + " + offset : "") + "]";
            String name = slotName();
            return verb + " stack slot " + location + (name != null ? " (" + name + ")" : "");
        }
    }

    /**
     * {@code sub rsp, N} / {@code add rsp, N}.
     */
    record StackFrame(Kind kind, long bytes) implements SemanticTag {
        public enum Kind {
            ALLOCATE,
            RELEASE
        }

        @Override
        public String describe() {
            return (kind == Kind.ALLOCATE ? "allocate " : "release ") + bytes + " bytes of stack";
        }
    }

    /**
     * Direct call (or tail jump) to a named symbol.
     *
     * @param resolved Whether the symbol table knew the spelling; if not, {@code displayName}
     *                 equals {@code sourceSpelling}.
     */
    record CallTarget(String sourceSpelling, String displayName, boolean resolved, boolean tailCall)
            implements SemanticTag {
        @Override
        public String describe() {
            return (tailCall ? "tail call to " : "call ") + displayName;
        }
    }
}
