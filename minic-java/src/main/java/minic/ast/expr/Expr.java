package minic.ast.expr;

import minic.ast.Node;

public sealed interface Expr extends Node
        permits IntLiteral, VarExpr, BinaryExpr {}
