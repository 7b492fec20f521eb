package com.cfamily.astexport.model;

import com.cfamily.astexport.model.type.Type;
import lombok.Value;

/**
 * A base class entry of a C++ record, also used for the base path of derived-to-base casts.
 */
@Value
public class BaseSpecifier {
    String name;
    Type type;
    boolean virtual;
}
