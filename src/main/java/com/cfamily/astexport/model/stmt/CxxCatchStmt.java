package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.decl.VarDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * {@code catch} handler; {@code variable} is absent for {@code catch (...)}.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class CxxCatchStmt extends Stmt {
    private VarDecl variable;
}
