package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.QualType;
import com.cfamily.astexport.model.decl.ObjCMethodDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ObjCMessageExpr extends Expr {

    public enum ReceiverKind {
        INSTANCE,
        CLASS,
        SUPER_INSTANCE,
        SUPER_CLASS
    }

    private String selector;
    private ReceiverKind receiverKind;

    /** Receiver class for class messages. */
    private QualType classType;

    private ObjCMethodDecl method;
}
