package com.cfamily.astexport.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A source attribute attached to a declaration or an attributed statement.
 * {@code name} is the attribute class without the {@code Attr} suffix, e.g. {@code Aligned}.
 */
@Value
@Builder
public class Attribute {
    String name;
    NodeId id;
    @Builder.Default
    SourceRange range = SourceRange.EMPTY;
    @Singular
    List<String> parameters;
    boolean inherited;
    boolean implicit;
}
