package org.jsdetect.ast;

import java.util.List;

/**
 * 一个文件的 AST：根节点、按 id 排列的节点表、词法单元和注释。
 * 每个文件独立创建，分析结束后丢弃。
 */
public class ParsedScript {
    public final AstNode root;
    public final List<AstNode> nodes;
    public final List<Token> tokens;
    public final List<Comment> comments;
    public final String sourceType;

    public ParsedScript(AstNode root, List<AstNode> nodes, List<Token> tokens,
                        List<Comment> comments, String sourceType) {
        this.root = root;
        this.nodes = List.copyOf(nodes);
        this.tokens = List.copyOf(tokens);
        this.comments = List.copyOf(comments);
        this.sourceType = sourceType;
    }

    public AstNode node(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }
}
