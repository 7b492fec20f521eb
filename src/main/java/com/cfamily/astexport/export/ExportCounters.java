package com.cfamily.astexport.export;

import lombok.Getter;

/**
 * Running totals for one export pass.
 */
@Getter
public class ExportCounters {
    private int declarations;
    private int statements;
    private int types;
    private int comments;
    private int sentinels;
    private int skippedDeclarations;
    private int danglingTypeReferences;

    void declaration(boolean sentinel) {
        declarations++;
        if (sentinel) {
            sentinels++;
        }
    }

    void statement(boolean sentinel) {
        statements++;
        if (sentinel) {
            sentinels++;
        }
    }

    void comment(boolean sentinel) {
        comments++;
        if (sentinel) {
            sentinels++;
        }
    }

    void type() {
        types++;
    }

    void skippedDeclaration() {
        skippedDeclarations++;
    }

    void danglingTypeReference() {
        danglingTypeReferences++;
    }
}
