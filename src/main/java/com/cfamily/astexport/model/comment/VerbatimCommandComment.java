package com.cfamily.astexport.model.comment;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

/**
 * {@code \verbatim} blocks (text is the closing command name) and verbatim line commands
 * (text is the rest of the line).
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class VerbatimCommandComment extends BlockCommandComment {
    private String text;
}
