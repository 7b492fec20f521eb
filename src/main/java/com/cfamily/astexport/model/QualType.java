package com.cfamily.astexport.model;

import com.cfamily.astexport.model.type.Type;
import lombok.Builder;
import lombok.Value;

/**
 * A type as written at a use site: the underlying type node plus qualifiers and spelling.
 * Always emitted as a reference; the type node itself is defined in the unit's type list.
 */
@Value
@Builder
public class QualType {
    Type type;
    String spelling;
    String desugaredSpelling;
    boolean constQualified;
    boolean volatileQualified;
    boolean restrictQualified;

    public static QualType of(Type type) {
        return QualType.builder()
                .type(type)
                .spelling(type == null ? "" : type.getSpelling())
                .build();
    }
}
