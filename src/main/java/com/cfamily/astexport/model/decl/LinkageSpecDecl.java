package com.cfamily.astexport.model.decl;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code extern "C" { ... }} block.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class LinkageSpecDecl extends Decl implements DeclContext {

    @Builder.Default
    private List<Decl> decls = new ArrayList<>();

    private boolean externalLexicalStorage;
    private boolean externalVisibleStorage;
}
