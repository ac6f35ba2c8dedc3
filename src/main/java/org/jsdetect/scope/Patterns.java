package org.jsdetect.scope;

import org.jsdetect.ast.AstNode;
import org.jsdetect.ast.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 解构模式的拆分：哪些 Identifier 是被绑定的名字，哪些子树是普通表达式
 * （默认值、计算属性名、成员表达式目标）。
 */
public final class Patterns {

    private Patterns() {
    }

    public static List<AstNode> boundIdentifiers(AstNode pattern) {
        List<AstNode> ids = new ArrayList<>();
        collect(pattern, ids, null);
        return ids;
    }

    public static List<AstNode> embeddedExpressions(AstNode pattern) {
        List<AstNode> exprs = new ArrayList<>();
        collect(pattern, null, exprs);
        return exprs;
    }

    private static void collect(AstNode pattern, List<AstNode> ids, List<AstNode> exprs) {
        if (pattern == null) {
            return;
        }
        switch (pattern.kind) {
            case IDENTIFIER -> {
                if (ids != null) {
                    ids.add(pattern);
                }
            }
            case OBJECT_PATTERN -> {
                for (AstNode prop : pattern.children("properties")) {
                    if (prop.is(NodeKind.REST_ELEMENT)) {
                        collect(prop.child("argument"), ids, exprs);
                    } else {
                        if (prop.flag("computed") && exprs != null && prop.child("key") != null) {
                            exprs.add(prop.child("key"));
                        }
                        collect(prop.child("value"), ids, exprs);
                    }
                }
            }
            case ARRAY_PATTERN -> {
                for (AstNode element : pattern.children("elements")) {
                    collect(element, ids, exprs);
                }
            }
            case ASSIGNMENT_PATTERN -> {
                collect(pattern.child("left"), ids, exprs);
                if (exprs != null && pattern.child("right") != null) {
                    exprs.add(pattern.child("right"));
                }
            }
            case REST_ELEMENT -> collect(pattern.child("argument"), ids, exprs);
            default -> {
                // a.b = ... 这类赋值目标不是绑定，按表达式处理
                if (exprs != null) {
                    exprs.add(pattern);
                }
            }
        }
    }

    /**
     * @return 标识符是否是对变量的读/写引用（而非属性名、标签等）
     */
    public static boolean isReference(AstNode id) {
        AstNode parent = id.parent;
        if (parent == null) {
            return true;
        }
        String role = id.role;
        switch (parent.kind) {
            case MEMBER_EXPRESSION:
                return !("property".equals(role) && !parent.flag("computed"));
            case PROPERTY:
            case METHOD_DEFINITION:
            case PROPERTY_DEFINITION:
                return !("key".equals(role) && !parent.flag("computed"));
            case LABELED_STATEMENT:
            case BREAK_STATEMENT:
            case CONTINUE_STATEMENT:
                return !"label".equals(role);
            case META_PROPERTY:
            case IMPORT_SPECIFIER:
            case IMPORT_DEFAULT_SPECIFIER:
            case IMPORT_NAMESPACE_SPECIFIER:
            case EXPORT_ALL_DECLARATION:
                return false;
            case EXPORT_SPECIFIER:
                return !"exported".equals(role);
            default:
                return true;
        }
    }
}
