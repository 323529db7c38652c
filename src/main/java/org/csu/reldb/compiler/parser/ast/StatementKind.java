package org.csu.reldb.compiler.parser.ast;

public enum StatementKind {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    CREATE_TABLE,
    CREATE_INDEX,
    DROP_TABLE
}
