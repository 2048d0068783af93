package minic.ir;

import java.util.Objects;

/**
 * One three-address instruction. {@link #toString()} gives the textual form,
 * e.g. {@code LOADI 10}, {@code JMP_FALSE else_label_1} or {@code end_label_1:}.
 */
public record Insn(Opcode op, String operand) {

    public Insn {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(operand, "operand");
    }

    public static Insn loadI(int value) {
        return new Insn(Opcode.LOADI, Integer.toString(value));
    }

    public static Insn load(String name) {
        return new Insn(Opcode.LOAD, name);
    }

    public static Insn store(String name) {
        return new Insn(Opcode.STORE, name);
    }

    public static Insn cmp(String temp) {
        return new Insn(Opcode.CMP, temp);
    }

    public static Insn jmpFalse(Label target) {
        return new Insn(Opcode.JMP_FALSE, target.name());
    }

    public static Insn jmp(Label target) {
        return new Insn(Opcode.JMP, target.name());
    }

    public static Insn label(Label l) {
        return new Insn(Opcode.LABEL, l.name());
    }

    @Override
    public String toString() {
        if (op == Opcode.LABEL) return operand + ":";
        return op.name() + " " + operand;
    }
}
