package com.cfamily.astexport.schema;

import lombok.Value;

import java.util.List;

/**
 * All kind layouts of one family plus the concrete kinds forming its variant type.
 */
@Value
public class FamilyLayout {
    String schemaName;
    List<KindLayout> kinds;
    List<KindLayout> concreteKinds;
}
