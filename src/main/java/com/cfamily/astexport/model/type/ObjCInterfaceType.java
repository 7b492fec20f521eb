package com.cfamily.astexport.model.type;

import com.cfamily.astexport.model.decl.ObjCInterfaceDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ObjCInterfaceType extends ObjCObjectType {
    private ObjCInterfaceDecl decl;
}
