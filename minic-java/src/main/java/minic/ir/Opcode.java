package minic.ir;

public enum Opcode {
    // accumulator
    LOADI,      // ACC = immediate
    LOAD,       // ACC = var
    STORE,      // var = ACC
    CMP,        // compare ACC with var; every comparison operator lowers to this

    // jumps
    JMP_FALSE,  // jump to label if the last CMP was false
    JMP,

    LABEL       // jump target marker, no operand
}
