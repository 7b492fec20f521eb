package com.cfamily.astexport.model.comment;

import com.cfamily.astexport.model.NodeFamily;
import com.cfamily.astexport.model.NodeKind;
import lombok.Getter;

import java.util.List;

/**
 * Documentation comment kinds. {@link #NO_COMMENT} is the comment sentinel.
 */
@Getter
public enum CommentKind implements NodeKind {

    COMMENT(null, "Comment", true, Comment.class, "comment_info", "comment list"),

    NO_COMMENT(COMMENT, "NoComment", false, Comment.class),
    FULL_COMMENT(COMMENT, "FullComment", false, Comment.class),
    INLINE_CONTENT_COMMENT(COMMENT, "InlineContentComment", true, Comment.class),
    TEXT_COMMENT(INLINE_CONTENT_COMMENT, "TextComment", false, TextComment.class, "string"),
    INLINE_COMMAND_COMMENT(INLINE_CONTENT_COMMENT, "InlineCommandComment", false, InlineCommandComment.class,
            "inline_command_comment_info"),
    BLOCK_CONTENT_COMMENT(COMMENT, "BlockContentComment", true, Comment.class),
    PARAGRAPH_COMMENT(BLOCK_CONTENT_COMMENT, "ParagraphComment", false, Comment.class),
    BLOCK_COMMAND_COMMENT(BLOCK_CONTENT_COMMENT, "BlockCommandComment", false, BlockCommandComment.class,
            "block_command_comment_info", "comment"),
    PARAM_COMMAND_COMMENT(BLOCK_COMMAND_COMMENT, "ParamCommandComment", false, ParamCommandComment.class,
            "param_command_comment_info"),
    VERBATIM_BLOCK_COMMENT(BLOCK_COMMAND_COMMENT, "VerbatimBlockComment", false, VerbatimCommandComment.class,
            "string"),
    VERBATIM_LINE_COMMENT(BLOCK_COMMAND_COMMENT, "VerbatimLineComment", false, VerbatimCommandComment.class,
            "string"),
    VERBATIM_BLOCK_LINE_COMMENT(COMMENT, "VerbatimBlockLineComment", false, TextComment.class, "string");

    private final CommentKind parent;
    private final String variantName;
    private final boolean abstractKind;
    private final Class<? extends Comment> nodeClass;
    private final List<String> ownFields;

    CommentKind(CommentKind parent, String variantName, boolean abstractKind, Class<? extends Comment> nodeClass,
            String... ownFields) {
        this.parent = parent;
        this.variantName = variantName;
        this.abstractKind = abstractKind;
        this.nodeClass = nodeClass;
        this.ownFields = List.of(ownFields);
    }

    @Override
    public NodeFamily getFamily() {
        return NodeFamily.COMMENT;
    }
}
