package minic.ast.stmt;

import minic.ast.Node;

public sealed interface Stmt extends Node
        permits AssignStmt, IfStmt {}
