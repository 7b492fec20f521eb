package com.cfamily.astexport.model.comment;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Inline command such as {@code \c word}.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class InlineCommandComment extends Comment {

    public enum RenderKind {
        NORMAL,
        BOLD,
        MONOSPACED,
        EMPHASIZED
    }

    private String name;
    private RenderKind renderKind;

    @Builder.Default
    private List<String> args = new ArrayList<>();
}
