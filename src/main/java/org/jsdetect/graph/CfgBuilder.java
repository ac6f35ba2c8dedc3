package org.jsdetect.graph;

import org.jsdetect.ast.AstNode;
import org.jsdetect.ast.NodeKind;
import org.jsdetect.error.Deadline;
import org.jsdetect.error.GraphSizeExceededException;
import org.jsdetect.error.MalformedControlFlowException;
import org.jsdetect.scope.ScopeAnalysis;

import java.util.*;

/**
 * 为一个函数（或顶层脚本）构建控制流图。
 * <p>
 * 语句依次追加到当前基本块；分支目标、汇合点和循环头都开新块。
 * current 为 null 表示控制流已经断开（return / throw / break / continue 之后），
 * 之后的语句落到没有前驱的新块中（死代码）。
 */
public class CfgBuilder {

    private final ProgramGraph graph;
    private final ScopeAnalysis scopes;
    private final Deadline deadline;
    private final int maxItems;

    private ControlFlowGraph cfg;
    private BasicBlock current;

    // 跳转目标栈：循环、switch、标签、try
    private final List<Frame> frames = new ArrayList<>();
    // 紧贴在循环 / switch 之前的标签，由该语句的 Frame 接收
    private final Set<String> pendingLabels = new LinkedHashSet<>();

    public CfgBuilder(ProgramGraph graph, Deadline deadline, int maxItems) {
        this.graph = graph;
        this.scopes = graph.scopes;
        this.deadline = deadline;
        this.maxItems = maxItems;
    }

    /**
     * 构建控制流图
     *
     * @param function Program 或函数节点
     */
    public ControlFlowGraph build(AstNode function) {
        cfg = graph.newFunction(function);
        frames.clear();
        pendingLabels.clear();

        BasicBlock entry = newBlock();
        entry.entry = true;
        cfg.entry = entry;
        BasicBlock exit = newBlock();
        exit.exit = true;
        cfg.exit = exit;

        current = entry;
        // 入口项：参数在这里绑定，默认值表达式在这里求值
        cfg.entryItem = graph.newItem(function, function.children("params"), entry, true);
        DefUseCollector.collect(cfg.entryItem, scopes);

        if (function.is(NodeKind.PROGRAM)) {
            visitAll(function.children("body"));
        } else {
            AstNode body = function.child("body");
            if (body != null && body.is(NodeKind.BLOCK_STATEMENT)) {
                visitAll(body.children("body"));
            } else if (body != null) {
                // 箭头函数的表达式体，相当于隐式 return
                append(body, List.of(body));
            }
        }
        flowTo(exit, EdgeKind.UNCONDITIONAL);

        graph.linkItems(cfg);
        return cfg;
    }

    // ---------------------------------------------------------------- 跳转目标

    private abstract static class Frame {
    }

    private static final class LoopFrame extends Frame {
        final Set<String> labels;
        final BasicBlock continueTarget;
        final EdgeKind continueKind;
        final BasicBlock breakTarget;

        LoopFrame(Set<String> labels, BasicBlock continueTarget, EdgeKind continueKind, BasicBlock breakTarget) {
            this.labels = labels;
            this.continueTarget = continueTarget;
            this.continueKind = continueKind;
            this.breakTarget = breakTarget;
        }
    }

    private static final class SwitchFrame extends Frame {
        final Set<String> labels;
        final BasicBlock breakTarget;

        SwitchFrame(Set<String> labels, BasicBlock breakTarget) {
            this.labels = labels;
            this.breakTarget = breakTarget;
        }
    }

    private static final class LabelFrame extends Frame {
        final Set<String> labels;
        final BasicBlock breakTarget;

        LabelFrame(Set<String> labels, BasicBlock breakTarget) {
            this.labels = labels;
            this.breakTarget = breakTarget;
        }
    }

    private static final class TryFrame extends Frame {
        final BasicBlock handler;        // catch 块，没有 catch 时为 null
        final BasicBlock finallyEntry;   // finally 块，没有 finally 时为 null
        boolean inTry = true;            // false 表示正在构建 catch 部分
        // 受保护区域中紧接在可能抛异常的语句项之前结束的块
        final Set<BasicBlock> throwing = new LinkedHashSet<>();
        // 经过 finally 的跳转，在 finally 结束处重新分派
        final Set<PendingJump> pending = new LinkedHashSet<>();

        TryFrame(BasicBlock handler, BasicBlock finallyEntry) {
            this.handler = handler;
            this.finallyEntry = finallyEntry;
        }
    }

    private enum JumpKind {
        BREAK, CONTINUE, RETURN, THROW
    }

    private record PendingJump(JumpKind kind, String label, int offset) {
    }

    // ---------------------------------------------------------------- 语句

    private void visitAll(List<AstNode> statements) {
        for (AstNode s : statements) {
            visit(s);
        }
    }

    private void visit(AstNode stmt) {
        if (stmt == null) {
            return;
        }
        deadline.checkpoint();

        switch (stmt.kind) {
            case BLOCK_STATEMENT -> visitAll(stmt.children("body"));
            case IF_STATEMENT -> visitIf(stmt);
            case WHILE_STATEMENT -> visitWhile(stmt);
            case DO_WHILE_STATEMENT -> visitDoWhile(stmt);
            case FOR_STATEMENT -> visitFor(stmt);
            case FOR_IN_STATEMENT, FOR_OF_STATEMENT -> visitForIn(stmt);
            case SWITCH_STATEMENT -> visitSwitch(stmt);
            case TRY_STATEMENT -> visitTry(stmt);
            case LABELED_STATEMENT -> visitLabeled(stmt);
            case WITH_STATEMENT -> {
                append(stmt, nonNull(stmt.child("object")));
                visit(stmt.child("body"));
            }
            case RETURN_STATEMENT -> {
                append(stmt, List.of(stmt));
                jump(JumpKind.RETURN, stmt);
            }
            case THROW_STATEMENT -> {
                append(stmt, List.of(stmt));
                jump(JumpKind.THROW, stmt);
            }
            case BREAK_STATEMENT -> {
                append(stmt, List.of());
                jump(JumpKind.BREAK, stmt);
            }
            case CONTINUE_STATEMENT -> {
                append(stmt, List.of());
                jump(JumpKind.CONTINUE, stmt);
            }
            case FUNCTION_DECLARATION -> append(stmt, List.of());
            case EXPORT_NAMED_DECLARATION, EXPORT_DEFAULT_DECLARATION -> {
                AstNode decl = stmt.child("declaration");
                if (decl != null && decl.kind.isStatement()) {
                    visit(decl);
                } else {
                    append(stmt, List.of(stmt));
                }
            }
            // 普通语句和不认识的语句：单个不透明的语句项
            default -> append(stmt, List.of(stmt));
        }
    }

    private void visitIf(AstNode stmt) {
        append(stmt, nonNull(stmt.child("test")));
        BasicBlock cond = current;

        BasicBlock thenBlock = newBlock();
        cfg.addEdge(cond, thenBlock, EdgeKind.TRUE_BRANCH);
        current = thenBlock;
        visit(stmt.child("consequent"));
        BasicBlock thenEnd = current;

        BasicBlock elseEnd = null;
        boolean fallsThrough = true;
        AstNode alternate = stmt.child("alternate");
        if (alternate != null) {
            BasicBlock elseBlock = newBlock();
            cfg.addEdge(cond, elseBlock, EdgeKind.FALSE_BRANCH);
            current = elseBlock;
            visit(alternate);
            elseEnd = current;
            fallsThrough = false;
        }

        if (thenEnd == null && elseEnd == null && !fallsThrough) {
            current = null;
            return;
        }
        BasicBlock merge = newBlock();
        if (thenEnd != null) {
            cfg.addEdge(thenEnd, merge, EdgeKind.UNCONDITIONAL);
        }
        if (elseEnd != null) {
            cfg.addEdge(elseEnd, merge, EdgeKind.UNCONDITIONAL);
        }
        if (fallsThrough) {
            cfg.addEdge(cond, merge, EdgeKind.FALSE_BRANCH);
        }
        current = merge;
    }

    private void visitWhile(AstNode stmt) {
        Set<String> labels = takeLabels();
        BasicBlock header = newBlock();
        flowTo(header, EdgeKind.UNCONDITIONAL);
        current = header;
        append(stmt, nonNull(stmt.child("test")));
        BasicBlock test = current;

        BasicBlock body = newBlock();
        BasicBlock after = newBlock();
        cfg.addEdge(test, body, EdgeKind.TRUE_BRANCH);
        cfg.addEdge(test, after, EdgeKind.FALSE_BRANCH);

        frames.add(new LoopFrame(labels, header, EdgeKind.LOOP_BACK, after));
        current = body;
        visit(stmt.child("body"));
        flowTo(header, EdgeKind.LOOP_BACK);
        popFrame();
        current = after;
    }

    private void visitDoWhile(AstNode stmt) {
        Set<String> labels = takeLabels();
        BasicBlock body = newBlock();
        flowTo(body, EdgeKind.UNCONDITIONAL);
        BasicBlock test = newBlock();
        BasicBlock after = newBlock();

        frames.add(new LoopFrame(labels, test, EdgeKind.UNCONDITIONAL, after));
        current = body;
        visit(stmt.child("body"));
        flowTo(test, EdgeKind.UNCONDITIONAL);
        popFrame();

        current = test;
        append(stmt, nonNull(stmt.child("test")));
        cfg.addEdge(current, body, EdgeKind.LOOP_BACK);
        cfg.addEdge(current, after, EdgeKind.FALSE_BRANCH);
        current = after;
    }

    private void visitFor(AstNode stmt) {
        Set<String> labels = takeLabels();
        AstNode init = stmt.child("init");
        if (init != null) {
            append(init, List.of(init));
        }

        BasicBlock header = newBlock();
        flowTo(header, EdgeKind.UNCONDITIONAL);
        current = header;
        // 条件缺省时仍保留 FALSE 边：条件从不求值，出口按构造可达
        append(stmt, nonNull(stmt.child("test")));
        BasicBlock test = current;

        BasicBlock body = newBlock();
        BasicBlock after = newBlock();
        cfg.addEdge(test, body, EdgeKind.TRUE_BRANCH);
        cfg.addEdge(test, after, EdgeKind.FALSE_BRANCH);

        AstNode update = stmt.child("update");
        BasicBlock updateBlock = update != null ? newBlock() : null;
        LoopFrame frame = updateBlock != null
                ? new LoopFrame(labels, updateBlock, EdgeKind.UNCONDITIONAL, after)
                : new LoopFrame(labels, header, EdgeKind.LOOP_BACK, after);

        frames.add(frame);
        current = body;
        visit(stmt.child("body"));
        flowTo(frame.continueTarget, frame.continueKind);
        popFrame();

        if (updateBlock != null) {
            current = updateBlock;
            append(update, List.of(update));
            cfg.addEdge(current, header, EdgeKind.LOOP_BACK);
        }
        current = after;
    }

    private void visitForIn(AstNode stmt) {
        Set<String> labels = takeLabels();
        BasicBlock header = newBlock();
        flowTo(header, EdgeKind.UNCONDITIONAL);
        current = header;
        List<AstNode> parts = new ArrayList<>();
        parts.addAll(nonNull(stmt.child("left")));
        parts.addAll(nonNull(stmt.child("right")));
        append(stmt, parts);
        BasicBlock next = current;

        BasicBlock body = newBlock();
        BasicBlock after = newBlock();
        cfg.addEdge(next, body, EdgeKind.TRUE_BRANCH);
        cfg.addEdge(next, after, EdgeKind.FALSE_BRANCH);

        frames.add(new LoopFrame(labels, header, EdgeKind.LOOP_BACK, after));
        current = body;
        visit(stmt.child("body"));
        flowTo(header, EdgeKind.LOOP_BACK);
        popFrame();
        current = after;
    }

    /**
     * case 测试串成链：TRUE 进入该 case 体，FALSE 到下一个测试，最后一个 FALSE 到 default 或出口；
     * case 体之间按顺序贯穿
     */
    private void visitSwitch(AstNode stmt) {
        Set<String> labels = takeLabels();
        append(stmt, nonNull(stmt.child("discriminant")));
        BasicBlock dispatch = current;

        List<AstNode> cases = stmt.children("cases");
        BasicBlock after = newBlock();
        List<BasicBlock> bodies = new ArrayList<>();
        for (int i = 0; i < cases.size(); i++) {
            bodies.add(newBlock());
        }

        BasicBlock prevTest = dispatch;
        EdgeKind nextKind = EdgeKind.UNCONDITIONAL;
        int defaultIndex = -1;
        for (int i = 0; i < cases.size(); i++) {
            AstNode c = cases.get(i);
            AstNode test = c.child("test");
            if (test == null) {
                defaultIndex = i;
                continue;
            }
            BasicBlock testBlock = newBlock();
            cfg.addEdge(prevTest, testBlock, nextKind);
            current = testBlock;
            append(c, List.of(test));
            cfg.addEdge(current, bodies.get(i), EdgeKind.TRUE_BRANCH);
            prevTest = current;
            nextKind = EdgeKind.FALSE_BRANCH;
        }
        cfg.addEdge(prevTest, defaultIndex >= 0 ? bodies.get(defaultIndex) : after, nextKind);

        frames.add(new SwitchFrame(labels, after));
        BasicBlock fallthrough = null;
        for (int i = 0; i < cases.size(); i++) {
            current = bodies.get(i);
            if (fallthrough != null) {
                cfg.addEdge(fallthrough, current, EdgeKind.UNCONDITIONAL);
            }
            visitAll(cases.get(i).children("consequent"));
            fallthrough = current;
        }
        popFrame();
        if (fallthrough != null) {
            cfg.addEdge(fallthrough, after, EdgeKind.UNCONDITIONAL);
        }
        current = after;
    }

    /**
     * try 块中每个可能抛异常的语句项都从它之前的块连 EXCEPTION 边到 catch；finally 是唯一的汇合区域，
     * 所有经过它的路径（正常结束、异常、return、break、continue）记下来，在 finally 结束处重新分派
     */
    private void visitTry(AstNode stmt) {
        append(stmt, List.of());
        BasicBlock tryBlock = newBlock();
        flowTo(tryBlock, EdgeKind.UNCONDITIONAL);

        AstNode handler = stmt.child("handler");
        AstNode finalizer = stmt.child("finalizer");
        BasicBlock catchBlock = handler != null ? newBlock() : null;
        BasicBlock finallyBlock = finalizer != null ? newBlock() : null;
        TryFrame frame = new TryFrame(catchBlock, finallyBlock);
        frames.add(frame);

        List<BasicBlock> normalEnds = new ArrayList<>();
        boolean normalIntoFinally = false;

        current = tryBlock;
        visit(stmt.child("block"));
        closeProtectedRegion(frame, catchBlock != null ? catchBlock : finallyBlock);
        if (current != null) {
            if (finallyBlock != null) {
                cfg.addEdge(current, finallyBlock, EdgeKind.UNCONDITIONAL);
                normalIntoFinally = true;
            } else {
                normalEnds.add(current);
            }
        }

        if (handler != null) {
            frame.inTry = false;
            if (finallyBlock == null) {
                popFrame();
            }
            current = catchBlock;
            append(handler, nonNull(handler.child("param")));
            visit(handler.child("body"));
            if (finallyBlock != null) {
                closeProtectedRegion(frame, finallyBlock);
            }
            if (current != null) {
                if (finallyBlock != null) {
                    cfg.addEdge(current, finallyBlock, EdgeKind.UNCONDITIONAL);
                    normalIntoFinally = true;
                } else {
                    normalEnds.add(current);
                }
            }
        }

        if (finallyBlock != null) {
            popFrame();
            current = finallyBlock;
            visit(finalizer);
            BasicBlock finallyEnd = current;
            if (finallyEnd != null && normalIntoFinally) {
                normalEnds.add(finallyEnd);
            }
            for (PendingJump p : frame.pending) {
                resolveJump(p.kind(), p.label(), finallyEnd, p.offset());
            }
        }

        if (normalEnds.isEmpty()) {
            current = null;
            return;
        }
        BasicBlock merge = newBlock();
        for (BasicBlock end : normalEnds) {
            cfg.addEdge(end, merge, EdgeKind.UNCONDITIONAL);
        }
        current = merge;
    }

    private void closeProtectedRegion(TryFrame frame, BasicBlock target) {
        for (BasicBlock b : frame.throwing) {
            cfg.addEdge(b, target, EdgeKind.EXCEPTION);
        }
        if (target == frame.finallyEntry && !frame.throwing.isEmpty()) {
            // 未捕获的异常穿过 finally 后继续向外抛
            frame.pending.add(new PendingJump(JumpKind.THROW, null, -1));
        }
        frame.throwing.clear();
    }

    private void visitLabeled(AstNode stmt) {
        AstNode label = stmt.child("label");
        if (label != null && label.name() != null) {
            pendingLabels.add(label.name());
        }
        AstNode body = stmt.child("body");
        if (body != null && (body.kind.isLoop() || body.is(NodeKind.SWITCH_STATEMENT)
                || body.is(NodeKind.LABELED_STATEMENT))) {
            visit(body);
            return;
        }
        Set<String> labels = takeLabels();
        BasicBlock after = newBlock();
        frames.add(new LabelFrame(labels, after));
        visit(body);
        flowTo(after, EdgeKind.UNCONDITIONAL);
        popFrame();
        current = after;
    }

    // ---------------------------------------------------------------- 跳转

    private void jump(JumpKind kind, AstNode stmt) {
        AstNode label = stmt.child("label");
        resolveJump(kind, label != null ? label.name() : null, current, stmt.range.start());
        current = null;
    }

    /**
     * 从栈顶向下找跳转目标。经过带 finally 的 try 时先进入 finally，并把跳转记为待分派；
     * from 为 null 时只校验目标是否存在。
     */
    private void resolveJump(JumpKind kind, String label, BasicBlock from, int offset) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            Frame f = frames.get(i);
            if (f instanceof TryFrame t) {
                if (kind == JumpKind.THROW && t.inTry && t.handler != null) {
                    edge(from, t.handler, EdgeKind.EXCEPTION);
                    return;
                }
                if (t.finallyEntry != null) {
                    edge(from, t.finallyEntry, kind == JumpKind.THROW ? EdgeKind.EXCEPTION : EdgeKind.UNCONDITIONAL);
                    t.pending.add(new PendingJump(kind, label, offset));
                    return;
                }
            } else if (f instanceof LoopFrame loop) {
                boolean matches = label == null || loop.labels.contains(label);
                if (kind == JumpKind.BREAK && matches) {
                    edge(from, loop.breakTarget, EdgeKind.UNCONDITIONAL);
                    return;
                }
                if (kind == JumpKind.CONTINUE && matches) {
                    edge(from, loop.continueTarget, loop.continueKind);
                    return;
                }
            } else if (f instanceof SwitchFrame sw) {
                if (kind == JumpKind.BREAK && (label == null || sw.labels.contains(label))) {
                    edge(from, sw.breakTarget, EdgeKind.UNCONDITIONAL);
                    return;
                }
            } else if (f instanceof LabelFrame lf) {
                if (kind == JumpKind.BREAK && label != null && lf.labels.contains(label)) {
                    edge(from, lf.breakTarget, EdgeKind.UNCONDITIONAL);
                    return;
                }
            }
        }

        switch (kind) {
            case RETURN -> edge(from, cfg.exit, EdgeKind.UNCONDITIONAL);
            case THROW -> edge(from, cfg.exit, EdgeKind.EXCEPTION);
            case BREAK -> throw new MalformedControlFlowException(
                    label != null ? "break to unknown label '" + label + "'" : "break outside loop or switch", offset);
            case CONTINUE -> throw new MalformedControlFlowException(
                    label != null ? "continue to unknown loop label '" + label + "'" : "continue outside loop", offset);
        }
    }

    // ---------------------------------------------------------------- 工具

    private StmtNode append(AstNode anchor, List<AstNode> parts) {
        if (current == null) {
            // 跳转之后的死代码：没有前驱的新块
            current = newBlock();
        }
        if (graph.items.size() >= maxItems) {
            throw new GraphSizeExceededException("graph nodes", graph.items.size() + 1L, maxItems);
        }
        TryFrame t = innermostTry();
        if (t != null && canThrow(anchor, parts)) {
            // 在受保护区域中，抛异常的语句项单独起一个块：异常边从前一个块出发，
            // catch 收到的是该项执行之前到达的定义
            BasicBlock before = current;
            current = newBlock();
            cfg.addEdge(before, current, EdgeKind.UNCONDITIONAL);
            t.throwing.add(before);
        }
        StmtNode item = graph.newItem(anchor, parts, current, false);
        DefUseCollector.collect(item, scopes);
        return item;
    }

    private TryFrame innermostTry() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i) instanceof TryFrame t) {
                return t;
            }
        }
        return null;
    }

    /**
     * 保守判断语句项能否抛出异常
     */
    static boolean canThrow(AstNode anchor, List<AstNode> parts) {
        switch (anchor.kind) {
            case EXPRESSION_STATEMENT, THROW_STATEMENT, IF_STATEMENT, WHILE_STATEMENT, DO_WHILE_STATEMENT,
                    SWITCH_STATEMENT, SWITCH_CASE, FOR_IN_STATEMENT, FOR_OF_STATEMENT, WITH_STATEMENT,
                    CLASS_DECLARATION, EXPORT_DEFAULT_DECLARATION:
                return true;
            case VARIABLE_DECLARATION:
                for (AstNode d : anchor.children("declarations")) {
                    if (d.child("init") != null) {
                        return true;
                    }
                }
                return false;
            case RETURN_STATEMENT:
                return anchor.child("argument") != null;
            case FOR_STATEMENT:
                return anchor.child("test") != null;
            default:
                break;
        }
        if (anchor.kind.category() == NodeKind.Category.EXPRESSION) {
            return true;
        }
        for (AstNode part : parts) {
            if (containsCall(part)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsCall(AstNode root) {
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode n = stack.pop();
            if (n.is(NodeKind.CALL_EXPRESSION) || n.is(NodeKind.NEW_EXPRESSION)) {
                return true;
            }
            if (n.kind.isFunction()) {
                continue;
            }
            for (AstNode c : n.children) {
                stack.push(c);
            }
        }
        return false;
    }

    private BasicBlock newBlock() {
        return graph.newBlock(cfg);
    }

    private void flowTo(BasicBlock target, EdgeKind kind) {
        if (current != null) {
            cfg.addEdge(current, target, kind);
        }
    }

    private void edge(BasicBlock from, BasicBlock to, EdgeKind kind) {
        if (from != null) {
            cfg.addEdge(from, to, kind);
        }
    }

    private void popFrame() {
        frames.remove(frames.size() - 1);
    }

    private Set<String> takeLabels() {
        Set<String> labels = new LinkedHashSet<>(pendingLabels);
        pendingLabels.clear();
        return labels;
    }

    private static List<AstNode> nonNull(AstNode node) {
        return node == null ? List.of() : List.of(node);
    }
}
