package minic.ir;

public record Label(String name) {}
