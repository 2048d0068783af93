package minic.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EmitterTest {

    @Test
    void temps_are_numbered_from_one() {
        var out = new Emitter();
        assertEquals("temp_1", out.newTemp());
        assertEquals("temp_2", out.newTemp());
        assertEquals("temp_3", out.newTemp());
    }

    @Test
    void labels_are_numbered_per_prefix() {
        var out = new Emitter();
        assertEquals(new Label("else_label_1"), out.newLabel("else_label"));
        assertEquals(new Label("end_label_1"), out.newLabel("end_label"));
        assertEquals(new Label("else_label_2"), out.newLabel("else_label"));
        assertEquals(new Label("end_label_2"), out.newLabel("end_label"));
    }

    @Test
    void label_cannot_be_bound_twice() {
        var out = new Emitter();
        Label l = out.newLabel("end_label");
        out.bind(l);
        assertThrows(IllegalStateException.class, () -> out.bind(l));
        assertEquals(1, out.code().size());
    }

    @Test
    void instruction_text_format() {
        var out = new Emitter();
        Label l = out.newLabel("else_label");
        out.loadI(-3);
        out.load("x");
        out.store("temp_1");
        out.cmp("temp_1");
        out.jmpF(l);
        out.jmp(l);
        out.bind(l);
        assertEquals(List.of(
                "LOADI -3",
                "LOAD x",
                "STORE temp_1",
                "CMP temp_1",
                "JMP_FALSE else_label_1",
                "JMP else_label_1",
                "else_label_1:"
        ), out.code().stream().map(Insn::toString).toList());
    }
}
