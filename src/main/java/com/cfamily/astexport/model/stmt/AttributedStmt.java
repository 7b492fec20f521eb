package com.cfamily.astexport.model.stmt;

import com.cfamily.astexport.model.Attribute;
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
public class AttributedStmt extends Stmt {
    @Builder.Default
    private List<Attribute> attributes = new ArrayList<>();
}
