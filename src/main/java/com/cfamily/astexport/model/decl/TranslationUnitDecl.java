package com.cfamily.astexport.model.decl;

import com.cfamily.astexport.model.type.Type;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of one exported document.
 * <p>
 * {@code types} is the front end's type registry in creation order. The exporter closes it
 * over type-to-type references before writing the unit's type list.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class TranslationUnitDecl extends Decl implements DeclContext {

    /** Main source file of the unit. */
    private String mainFile;

    @Builder.Default
    private List<Decl> decls = new ArrayList<>();

    private boolean externalLexicalStorage;
    private boolean externalVisibleStorage;

    @Builder.Default
    private List<Type> types = new ArrayList<>();
}
