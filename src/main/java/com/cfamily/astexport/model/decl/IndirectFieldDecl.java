package com.cfamily.astexport.model.decl;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Member of an anonymous struct or union, reachable through {@code chain}.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class IndirectFieldDecl extends ValueDecl {
    @Builder.Default
    private List<NamedDecl> chain = new ArrayList<>();
}
