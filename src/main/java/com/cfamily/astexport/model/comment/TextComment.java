package com.cfamily.astexport.model.comment;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * Plain text, also used for the lines of a verbatim block.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class TextComment extends Comment {
    private String text;
}
