package org.asmscribe.annotator.frontend.operands;

/**
 * What an instruction does, independent of operand width.
 * <p>
 * Each action knows the verb used when one of its operands is a memory reference:
 * {@code sourceVerb} when memory is read, {@code destinationVerb} when memory is the
 * destination. {@code unaryDestination} tells whether the single operand of a one-operand
 * form is written ({@code pop}, {@code inc}) or read ({@code push}, {@code call}).
 */
public enum Action {
    MOVE("load", "store", false),
    LOAD_ADDRESS("take address of", "take address of", false),
    ADD("add", "update", true),
    SUBTRACT("subtract", "update", true),
    MULTIPLY("multiply by", "update", true),
    DIVIDE("divide by", "update", false),
    SQRT("take square root of", "update", false),
    MIN_MAX("compare", "update", false),
    CONVERT("convert", "store", false),
    BITWISE("combine with", "update", true),
    SHIFT("shift", "shift", true),
    NEGATE("negate", "negate", true),
    INCREMENT("increment", "increment", true),
    DECREMENT("decrement", "decrement", true),
    COMPARE("compare", "compare", false),
    TEST("test", "test", false),
    PUSH("push", "push", false),
    POP("pop into", "pop into", true),
    CALL("call through", "call through", false),
    RETURN("return", "return", false),
    JUMP("jump through", "jump through", false),
    CONDITIONAL_JUMP("jump through", "jump through", false),
    CONDITIONAL_SET("set", "set", true),
    CONDITIONAL_MOVE("load", "store", false),
    SIGN_EXTEND("extend", "extend", false),
    NOP("touch", "touch", false),
    PSEUDO("reference", "reference", false);

    private final String sourceVerb;
    private final String destinationVerb;
    private final boolean unaryDestination;

    Action(String sourceVerb, String destinationVerb, boolean unaryDestination) {
        this.sourceVerb = sourceVerb;
        this.destinationVerb = destinationVerb;
        this.unaryDestination = unaryDestination;
    }

    public String sourceVerb() {
        return sourceVerb;
    }

    public String destinationVerb() {
        return destinationVerb;
    }

    public boolean unaryDestination() {
        return unaryDestination;
    }
}
