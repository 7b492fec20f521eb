package com.cfamily.astexport.model.type;

import com.cfamily.astexport.model.decl.TagDecl;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Record or enum type; refers to its declaration by identity.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class TagType extends Type {
    private TagDecl decl;
}
