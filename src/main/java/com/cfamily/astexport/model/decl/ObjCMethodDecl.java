package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.QualType;
import com.cfamily.astexport.model.stmt.Stmt;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ObjCMethodDecl extends NamedDecl {

    private boolean instanceMethod;
    private QualType resultType;

    @Builder.Default
    private List<VarDecl> parameters = new ArrayList<>();

    private Stmt body;
}
