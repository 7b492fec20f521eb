package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.SourceRange;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for statements and expressions.
 * <p>
 * {@code children} is the ordered child slot list. A {@code null} slot is a logically
 * absent child (for example the else branch of an {@code if}); it is emitted as the
 * statement sentinel so that every statement of a kind has the same slot count.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class Stmt {

    private StmtKind kind;
    private NodeId id;

    @Builder.Default
    private SourceRange range = SourceRange.EMPTY;

    @Builder.Default
    private List<Stmt> children = new ArrayList<>();
}
