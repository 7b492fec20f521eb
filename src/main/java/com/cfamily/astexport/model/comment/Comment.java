package com.cfamily.astexport.model.comment;

import com.cfamily.astexport.model.NodeId;
import com.cfamily.astexport.model.SourceRange;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Documentation comment node. A declaration's full comment is a tree of these rooted at a
 * {@link CommentKind#FULL_COMMENT}.
 */
@Getter
@Setter
@SuperBuilder
@NoArgsConstructor
public class Comment {

    private CommentKind kind;
    private NodeId id;

    @Builder.Default
    private SourceRange range = SourceRange.EMPTY;

    @Builder.Default
    private List<Comment> children = new ArrayList<>();
}
