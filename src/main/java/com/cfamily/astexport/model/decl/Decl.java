package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.Attribute;
import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.SourceRange;
import com.cfamily.astexport.model.comment.Comment;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for all declaration nodes.
 * <p>
 * Equality is identity: declaration graphs are cyclic through owning contexts and
 * redeclaration links, so nodes never compare structurally.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public abstract class Decl {

    private DeclKind kind;
    private NodeId id;

    @Builder.Default
    private SourceRange range = SourceRange.EMPTY;

    /** Semantic owner. */
    private DeclContext semanticContext;

    /** Lexical owner; differs from the semantic one for out-of-line definitions. */
    private DeclContext lexicalContext;

    private PreviousDecl previousDecl;
    private String owningModule;

    private boolean hidden;
    private boolean implicit;
    private boolean used;
    private boolean referenced;
    private boolean invalid;

    @Builder.Default
    private List<Attribute> attributes = new ArrayList<>();

    private Comment fullComment;
}
