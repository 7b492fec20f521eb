package com.cfamily.astexport.model.comment;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Block command such as {@code \brief}. The paragraph is a required slot; a command
 * without text gets the comment sentinel.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class BlockCommandComment extends Comment {

    private String name;

    @Builder.Default
    private List<String> args = new ArrayList<>();

    private Comment paragraph;
}
