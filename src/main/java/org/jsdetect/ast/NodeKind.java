package org.jsdetect.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * 规范化器认识的 ESTree 节点类型（封闭集合）。
 * <p>
 * 不认识的类型统一落到 {@link #UNSUPPORTED}，原始类型名保存在 {@link AstNode#type} 中，
 * 下游按不透明语句处理。
 */
public enum NodeKind {
    PROGRAM("Program", Category.OTHER),

    // 语句
    EXPRESSION_STATEMENT("ExpressionStatement", Category.STATEMENT),
    DIRECTIVE("Directive", Category.STATEMENT),
    BLOCK_STATEMENT("BlockStatement", Category.STATEMENT),
    EMPTY_STATEMENT("EmptyStatement", Category.STATEMENT),
    DEBUGGER_STATEMENT("DebuggerStatement", Category.STATEMENT),
    WITH_STATEMENT("WithStatement", Category.STATEMENT),
    RETURN_STATEMENT("ReturnStatement", Category.STATEMENT),
    LABELED_STATEMENT("LabeledStatement", Category.STATEMENT),
    BREAK_STATEMENT("BreakStatement", Category.STATEMENT),
    CONTINUE_STATEMENT("ContinueStatement", Category.STATEMENT),
    IF_STATEMENT("IfStatement", Category.STATEMENT),
    SWITCH_STATEMENT("SwitchStatement", Category.STATEMENT),
    THROW_STATEMENT("ThrowStatement", Category.STATEMENT),
    TRY_STATEMENT("TryStatement", Category.STATEMENT),
    WHILE_STATEMENT("WhileStatement", Category.STATEMENT),
    DO_WHILE_STATEMENT("DoWhileStatement", Category.STATEMENT),
    FOR_STATEMENT("ForStatement", Category.STATEMENT),
    FOR_IN_STATEMENT("ForInStatement", Category.STATEMENT),
    FOR_OF_STATEMENT("ForOfStatement", Category.STATEMENT),

    // 声明
    FUNCTION_DECLARATION("FunctionDeclaration", Category.STATEMENT),
    VARIABLE_DECLARATION("VariableDeclaration", Category.STATEMENT),
    CLASS_DECLARATION("ClassDeclaration", Category.STATEMENT),
    IMPORT_DECLARATION("ImportDeclaration", Category.STATEMENT),
    EXPORT_NAMED_DECLARATION("ExportNamedDeclaration", Category.STATEMENT),
    EXPORT_DEFAULT_DECLARATION("ExportDefaultDeclaration", Category.STATEMENT),
    EXPORT_ALL_DECLARATION("ExportAllDeclaration", Category.STATEMENT),

    // 子句 / 辅助节点
    VARIABLE_DECLARATOR("VariableDeclarator", Category.OTHER),
    SWITCH_CASE("SwitchCase", Category.OTHER),
    CATCH_CLAUSE("CatchClause", Category.OTHER),
    CLASS_BODY("ClassBody", Category.OTHER),
    METHOD_DEFINITION("MethodDefinition", Category.OTHER),
    PROPERTY_DEFINITION("PropertyDefinition", Category.OTHER),
    PROPERTY("Property", Category.OTHER),
    TEMPLATE_ELEMENT("TemplateElement", Category.OTHER),
    IMPORT_SPECIFIER("ImportSpecifier", Category.OTHER),
    IMPORT_DEFAULT_SPECIFIER("ImportDefaultSpecifier", Category.OTHER),
    IMPORT_NAMESPACE_SPECIFIER("ImportNamespaceSpecifier", Category.OTHER),
    EXPORT_SPECIFIER("ExportSpecifier", Category.OTHER),

    // 表达式
    IDENTIFIER("Identifier", Category.EXPRESSION),
    LITERAL("Literal", Category.EXPRESSION),
    THIS_EXPRESSION("ThisExpression", Category.EXPRESSION),
    SUPER("Super", Category.EXPRESSION),
    ARRAY_EXPRESSION("ArrayExpression", Category.EXPRESSION),
    OBJECT_EXPRESSION("ObjectExpression", Category.EXPRESSION),
    FUNCTION_EXPRESSION("FunctionExpression", Category.EXPRESSION),
    ARROW_FUNCTION_EXPRESSION("ArrowFunctionExpression", Category.EXPRESSION),
    CLASS_EXPRESSION("ClassExpression", Category.EXPRESSION),
    UNARY_EXPRESSION("UnaryExpression", Category.EXPRESSION),
    UPDATE_EXPRESSION("UpdateExpression", Category.EXPRESSION),
    BINARY_EXPRESSION("BinaryExpression", Category.EXPRESSION),
    LOGICAL_EXPRESSION("LogicalExpression", Category.EXPRESSION),
    ASSIGNMENT_EXPRESSION("AssignmentExpression", Category.EXPRESSION),
    MEMBER_EXPRESSION("MemberExpression", Category.EXPRESSION),
    CONDITIONAL_EXPRESSION("ConditionalExpression", Category.EXPRESSION),
    CALL_EXPRESSION("CallExpression", Category.EXPRESSION),
    NEW_EXPRESSION("NewExpression", Category.EXPRESSION),
    SEQUENCE_EXPRESSION("SequenceExpression", Category.EXPRESSION),
    TEMPLATE_LITERAL("TemplateLiteral", Category.EXPRESSION),
    TAGGED_TEMPLATE_EXPRESSION("TaggedTemplateExpression", Category.EXPRESSION),
    YIELD_EXPRESSION("YieldExpression", Category.EXPRESSION),
    AWAIT_EXPRESSION("AwaitExpression", Category.EXPRESSION),
    META_PROPERTY("MetaProperty", Category.EXPRESSION),
    CHAIN_EXPRESSION("ChainExpression", Category.EXPRESSION),
    IMPORT_EXPRESSION("Import", Category.EXPRESSION),
    SPREAD_ELEMENT("SpreadElement", Category.EXPRESSION),

    // 解构模式
    OBJECT_PATTERN("ObjectPattern", Category.PATTERN),
    ARRAY_PATTERN("ArrayPattern", Category.PATTERN),
    ASSIGNMENT_PATTERN("AssignmentPattern", Category.PATTERN),
    REST_ELEMENT("RestElement", Category.PATTERN),

    UNSUPPORTED("", Category.OTHER);

    public enum Category {
        STATEMENT, EXPRESSION, PATTERN, OTHER
    }

    private static final Map<String, NodeKind> BY_TYPE = new HashMap<>();

    static {
        for (NodeKind kind : values()) {
            if (kind != UNSUPPORTED) {
                BY_TYPE.put(kind.typeName, kind);
            }
        }
    }

    private final String typeName;
    private final Category category;

    NodeKind(String typeName, Category category) {
        this.typeName = typeName;
        this.category = category;
    }

    public String typeName() {
        return typeName;
    }

    public Category category() {
        return category;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    /**
     * 函数边界：进入这些节点意味着进入新的函数作用域和新的 CFG
     */
    public boolean isFunction() {
        return this == FUNCTION_DECLARATION || this == FUNCTION_EXPRESSION || this == ARROW_FUNCTION_EXPRESSION;
    }

    public boolean isLoop() {
        return this == WHILE_STATEMENT || this == DO_WHILE_STATEMENT || this == FOR_STATEMENT
                || this == FOR_IN_STATEMENT || this == FOR_OF_STATEMENT;
    }

    public static NodeKind fromType(String type) {
        if (type == null) {
            return UNSUPPORTED;
        }
        return BY_TYPE.getOrDefault(type, UNSUPPORTED);
    }
}
