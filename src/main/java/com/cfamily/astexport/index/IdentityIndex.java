package com.cfamily.astexport.index;

import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.decl.Decl;
import com.cfamily.astexport.model.stmt.Stmt;
import com.cfamily.astexport.model.type.Type;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Identity to node lookup for one exported tree, one map per family.
 * Sentinels and the absent type are included under their reserved identities.
 */
@Value
@Builder
public class IdentityIndex {

    @NonNull
    @Singular
    Map<NodeId, Decl> declarations;

    @NonNull
    @Singular
    Map<NodeId, Stmt> statements;

    @NonNull
    @Singular
    Map<NodeId, Type> types;

    public Optional<Decl> findDeclaration(NodeId id) {
        return Optional.ofNullable(declarations.get(id));
    }

    public Optional<Stmt> findStatement(NodeId id) {
        return Optional.ofNullable(statements.get(id));
    }

    public Optional<Type> findType(NodeId id) {
        return Optional.ofNullable(types.get(id));
    }

    public int size() {
        return declarations.size() + statements.size() + types.size();
    }
}
