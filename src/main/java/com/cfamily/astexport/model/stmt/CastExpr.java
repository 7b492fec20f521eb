package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.BaseSpecifier;
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
public class CastExpr extends Expr {
    private CastKind castKind;

    /** Base classes walked by a derived-to-base conversion. */
    @Builder.Default
    private List<BaseSpecifier> basePath = new ArrayList<>();
}
