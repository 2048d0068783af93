package minic.cli;

import minic.CompileException;
import minic.ast.stmt.IfStmt;
import minic.driver.Compiler;
import minic.lexer.Lexer;
import minic.lexer.Token;
import minic.types.PrimitiveType;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Main {
    static final String USAGE = "Usage: minic (<input.mc> | -e <source>) [-D name[,name...]]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Returns the process exit code: 0 ok, 1 compile error, 2 bad usage or unreadable input. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        String source = null;
        String label = null;
        Map<String, String> predeclared = new LinkedHashMap<>();

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.equals("-e") && i + 1 < args.length) {
                source = args[++i];
                label = "<inline>";
            } else if (a.equals("-D") && i + 1 < args.length) {
                for (String name : args[++i].split(",")) {
                    String n = name.trim();
                    if (n.isEmpty()) continue;
                    if (!Lexer.isIdentifier(n)) {
                        err.println("Not a variable name: '" + n + "'");
                        err.println(USAGE);
                        return 2;
                    }
                    predeclared.put(n, PrimitiveType.INT.tag());
                }
            } else if (!a.startsWith("-") && source == null) {
                Path input = Path.of(a);
                try {
                    source = Files.readString(input);
                } catch (IOException e) {
                    err.println("Cannot read " + input + ": " + e.getMessage());
                    return 2;
                }
                label = input.toString();
            } else {
                err.println(USAGE);
                return 2;
            }
        }
        if (source == null) {
            err.println(USAGE);
            return 2;
        }

        out.println("Reading: " + label);
        Compiler compiler = new Compiler();
        try {
            List<Token> tokens = compiler.tokenize(source).orElseThrow();
            out.println("[1/4] Lexer: " + (tokens.size() - 1) + " tokens");

            IfStmt ast = compiler.parse(tokens).orElseThrow();
            out.println("[2/4] Parser: " + ast.getClass().getSimpleName());

            Map<String, String> symbols = compiler.check(ast, predeclared).orElseThrow();
            out.println("[3/4] Semantic checker: OK, symbols " + symbols.keySet());

            List<String> code = compiler.generate(ast);
            out.println("[4/4] Code generator: " + code.size() + " instructions");

            out.println();
            for (int i = 0; i < code.size(); i++) {
                out.printf("%3d  %s%n", i + 1, code.get(i));
            }
            return 0;
        } catch (CompileException e) {
            err.println("Compilation failed (" + e.phase() + "): " + e.getMessage());
            return 1;
        }
    }
}
