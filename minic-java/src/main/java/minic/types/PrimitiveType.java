package minic.types;

public enum PrimitiveType {
    INT("int");

    private final String tag;

    PrimitiveType(String tag) {
        this.tag = tag;
    }

    /** Name recorded in the symbol table. */
    public String tag() {
        return tag;
    }
}
