package com.cfamily.astexport.model;

import com.cfamily.astexport.model.comment.CommentKind;
import com.cfamily.astexport.model.decl.DeclKind;
import com.cfamily.astexport.model.stmt.StmtKind;
import com.cfamily.astexport.model.type.TypeKind;

import java.util.List;

/**
 * The four node families of the exported tree.
 */
public enum NodeFamily {
    DECL("decl"),
    STMT("stmt"),
    TYPE("c_type"),
    COMMENT("comment");

    private final String schemaName;

    NodeFamily(String schemaName) {
        this.schemaName = schemaName;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public List<NodeKind> kinds() {
        return switch (this) {
            case DECL -> List.of(DeclKind.values());
            case STMT -> List.of(StmtKind.values());
            case TYPE -> List.of(TypeKind.values());
            case COMMENT -> List.of(CommentKind.values());
        };
    }
}
