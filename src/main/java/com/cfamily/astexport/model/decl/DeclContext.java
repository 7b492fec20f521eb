package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.NodeId;

import java.util.List;

/**
 * A declaration that lexically contains other declarations.
 */
public interface DeclContext {

    NodeId getId();

    List<Decl> getDecls();

    boolean isExternalLexicalStorage();

    boolean isExternalVisibleStorage();
}
