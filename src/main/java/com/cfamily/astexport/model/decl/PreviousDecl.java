package com.cfamily.astexport.model.decl;

import lombok.Value;

/**
 * Redeclaration link. {@code FIRST} points at the canonical declaration of a mergeable
 * entity, {@code PREVIOUS} at the immediately preceding redeclaration.
 */
@Value
public class PreviousDecl {

    public enum Kind {
        FIRST,
        PREVIOUS
    }

    Kind kind;
    Decl target;

    public static PreviousDecl previous(Decl target) {
        return new PreviousDecl(Kind.PREVIOUS, target);
    }

    public static PreviousDecl first(Decl target) {
        return new PreviousDecl(Kind.FIRST, target);
    }
}
