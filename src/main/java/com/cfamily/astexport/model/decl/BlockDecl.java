package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.stmt.Stmt;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * A block literal's declaration. Parameters are not part of {@code decls}.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class BlockDecl extends Decl implements DeclContext {

    @Builder.Default
    private List<Decl> decls = new ArrayList<>();

    private boolean externalLexicalStorage;
    private boolean externalVisibleStorage;

    @Builder.Default
    private List<VarDecl> parameters = new ArrayList<>();

    private boolean variadic;
    private boolean capturesCxxThis;

    @Builder.Default
    private List<BlockCapture> captures = new ArrayList<>();

    private Stmt body;
}
