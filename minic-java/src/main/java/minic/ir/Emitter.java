package minic.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Instruction buffer plus the temp and label counters of one generation run.
 * Counters start at 1; labels are numbered per prefix.
 */
public final class Emitter {
    private final List<Insn> code = new ArrayList<>();
    private final Map<String, Integer> labelCounters = new HashMap<>();
    private final Set<Label> bound = new HashSet<>();
    private int tempCounter = 0;

    public List<Insn> code() { return Collections.unmodifiableList(code); }

    public String newTemp() {
        return "temp_" + (++tempCounter);
    }

    public Label newLabel(String prefix) {
        int n = labelCounters.merge(prefix, 1, Integer::sum);
        return new Label(prefix + "_" + n);
    }

    public void bind(Label l) {
        if (!bound.add(l)) throw new IllegalStateException("Label already bound: " + l.name());
        code.add(Insn.label(l));
    }

    public void loadI(int value) { code.add(Insn.loadI(value)); }

    public void load(String name) { code.add(Insn.load(name)); }

    public void store(String name) { code.add(Insn.store(name)); }

    public void cmp(String temp) { code.add(Insn.cmp(temp)); }

    // --- jumps ---

    public void jmp(Label target) { code.add(Insn.jmp(target)); }

    public void jmpF(Label target) { code.add(Insn.jmpFalse(target)); }
}
