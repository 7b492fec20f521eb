package com.cfamily.astexport.model.type;

import com.cfamily.astexport.model.decl.ObjCProtocolDecl;
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
public class ObjCObjectType extends Type {

    private Type baseType;

    @Builder.Default
    private List<ObjCProtocolDecl> protocols = new ArrayList<>();

    @Override
    protected void collectReferencedTypes(List<Type> out) {
        super.collectReferencedTypes(out);
        if (baseType != null) {
            out.add(baseType);
        }
    }
}
