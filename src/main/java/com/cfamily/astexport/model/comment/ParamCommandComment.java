package com.cfamily.astexport.model.comment;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class ParamCommandComment extends BlockCommandComment {

    public enum Direction {
        IN,
        OUT,
        IN_OUT
    }

    private Direction direction;
    private boolean directionExplicit;
    private String paramName;

    /** Position of the documented parameter, when it resolved. */
    private Integer paramIndex;
}
