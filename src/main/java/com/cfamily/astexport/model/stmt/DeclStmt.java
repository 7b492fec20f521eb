package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.decl.Decl;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Declaration statement. Its declarations are defined here; initializers belong to the
 * declarations, not to {@code children}.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class DeclStmt extends Stmt {
    @Builder.Default
    private List<Decl> decls = new ArrayList<>();
}
