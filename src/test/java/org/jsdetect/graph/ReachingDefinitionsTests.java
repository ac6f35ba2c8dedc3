package org.jsdetect.graph;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jsdetect.Js;
import org.jsdetect.ast.ParsedScript;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.*;

/**
 * 数据边与按语法结构求值的参照分析对照。参照分析不看构建出的 CFG：
 * 直接在 ESTree 上按语句的执行顺序传播“变量 -> 到达的定义”，循环迭代到不动点，
 * break / continue / return / throw 作为突然结束向外传递，由对应的语句接收。
 * 可能抛异常的语句在执行之前的状态交给最近的 catch（或 finally）。
 */
class ReachingDefinitionsTests {

	private static final String[] VARS = {"a", "b", "c"};

	@Test
	void testDataEdgesMatchStructuralAnalysis() {
		Random random = new Random(20240917L);
		for (int round = 0; round < 400; round++) {
			JsonObject program = new ProgramGenerator(random).program();
			ParsedScript script = Js.parse(program);
			ProgramGraph graph = new ScriptAnalyzer().analyze(script);
			Set<String> expected = new StructuralAnalysis().run(program);
			Assertions.assertEquals(expected, edges(graph), "round " + round + ": " + program);
		}
	}

	@Test
	void testLoopCarriedDefinition() {
		// var i = 0; while (i) { i = i + 1; }
		ProgramGraph graph = new ScriptAnalyzer().analyze(Js.script(
				Js.var("i", Js.num(0)),
				Js.whileStmt(Js.id("i"), Js.block(Js.assign("i", Js.binary("+", Js.id("i"), Js.num(1)))))));
		StmtNode init = CfgBuilderTests.item(graph, "VariableDeclaration");
		StmtNode test = CfgBuilderTests.item(graph, "WhileStatement");
		StmtNode step = CfgBuilderTests.item(graph, "ExpressionStatement");
		Set<DataEdge> expected = new TreeSet<>(List.of(
				new DataEdge(init.id, test.id, "i"),
				new DataEdge(init.id, step.id, "i"),
				new DataEdge(step.id, test.id, "i"),
				new DataEdge(step.id, step.id, "i")));
		Assertions.assertEquals(expected, graph.dataEdges);
	}

	@Test
	void testParametersAreDefinedAtEntry() {
		// function f(p) { return p; }
		ProgramGraph graph = new ScriptAnalyzer().analyze(Js.script(
				Js.function("f", Js.params("p"), Js.ret(Js.id("p")))));
		ControlFlowGraph cfg = graph.functions.get(1);
		StmtNode ret = CfgBuilderTests.item(graph, "ReturnStatement");
		Assertions.assertTrue(graph.dataEdges.contains(new DataEdge(cfg.entryItem.id, ret.id, "p")));
	}

	// ------------------------------------------------------------------
	// try / catch
	// ------------------------------------------------------------------

	@Test
	void testCatchSeesDefinitionsBeforeThrowingCall() {
		// var x = 0; try { x = 1; f(); x = 2; } catch (e) { use(x); }
		ProgramGraph graph = new ScriptAnalyzer().analyze(Js.script(
				Js.var("x", Js.num(0)),
				Js.tryStmt(Js.block(Js.assign("x", Js.num(1)), Js.expr(Js.call(Js.id("f"))), Js.assign("x", Js.num(2))),
						"e", Js.block(Js.expr(Js.call(Js.id("use"), Js.id("x")))), null)));
		StmtNode init = CfgBuilderTests.item(graph, "VariableDeclaration");
		List<StmtNode> statements = graph.items.stream().filter(i -> i.label.equals("ExpressionStatement")).toList();
		StmtNode first = statements.get(0);
		StmtNode use = statements.get(3);
		// x = 0 在 x = 1 抛出时到达，x = 1 在 f() 或 x = 2 抛出时到达；x = 2 之后没有会抛出的语句
		Assertions.assertEquals(Set.of(new DataEdge(init.id, use.id, "x"), new DataEdge(first.id, use.id, "x")),
				incoming(graph, use));
	}

	@Test
	void testCatchSeesDefinitionBeforeThrowingAssignment() {
		// var x = 0; try { x = f(); } catch (e) { use(x); }
		ProgramGraph graph = new ScriptAnalyzer().analyze(Js.script(
				Js.var("x", Js.num(0)),
				Js.tryStmt(Js.block(Js.assign("x", Js.call(Js.id("f")))),
						"e", Js.block(Js.expr(Js.call(Js.id("use"), Js.id("x")))), null)));
		StmtNode init = CfgBuilderTests.item(graph, "VariableDeclaration");
		StmtNode use = graph.items.stream().filter(i -> i.label.equals("ExpressionStatement")).toList().get(1);
		Assertions.assertEquals(Set.of(new DataEdge(init.id, use.id, "x")), incoming(graph, use));
	}

	@Test
	void testFinallySeesDefinitionsFromEveryExit() {
		// var x = 0; try { x = 1; g(); } finally { use(x); }
		ProgramGraph graph = new ScriptAnalyzer().analyze(Js.script(
				Js.var("x", Js.num(0)),
				Js.tryStmt(Js.block(Js.assign("x", Js.num(1)), Js.expr(Js.call(Js.id("g")))),
						null, null, Js.block(Js.expr(Js.call(Js.id("use"), Js.id("x")))))));
		StmtNode init = CfgBuilderTests.item(graph, "VariableDeclaration");
		List<StmtNode> statements = graph.items.stream().filter(i -> i.label.equals("ExpressionStatement")).toList();
		StmtNode assign = statements.get(0);
		StmtNode use = statements.get(2);
		Assertions.assertEquals(Set.of(new DataEdge(init.id, use.id, "x"), new DataEdge(assign.id, use.id, "x")),
				incoming(graph, use));
	}

	private static Set<DataEdge> incoming(ProgramGraph graph, StmtNode item) {
		Set<DataEdge> result = new HashSet<>();
		for (DataEdge e : graph.dataEdges) {
			if (e.to() == item.id) {
				result.add(e);
			}
		}
		return result;
	}

	/**
	 * 以锚点的 range 起点标识语句项，和参照分析使用同一套编号
	 */
	private static Set<String> edges(ProgramGraph graph) {
		Set<String> result = new TreeSet<>();
		for (DataEdge e : graph.dataEdges) {
			StmtNode from = graph.item(e.from());
			StmtNode to = graph.item(e.to());
			result.add((from.entry ? "entry" : String.valueOf(from.astNode.range.start()))
					+ "->" + to.astNode.range.start() + ":" + e.variable());
		}
		return result;
	}

	// ------------------------------------------------------------------
	// 随机程序
	// ------------------------------------------------------------------

	/**
	 * 生成可以被正确构建 CFG 的随机程序：break / continue 只出现在能接收它们的语句中，
	 * return 只出现在函数中。函数只声明在顶层，函数体内不声明 var，catch 参数和标签各不相同，
	 * 所以同名变量总是同一个绑定。
	 */
	private static final class ProgramGenerator {

		private final Random random;
		private int names;

		ProgramGenerator(Random random) {
			this.random = random;
		}

		JsonObject program() {
			Context top = new Context(false, false, false, List.of(), List.of(), List.of());
			int count = 1 + random.nextInt(6);
			JsonObject[] body = new JsonObject[count];
			for (int i = 0; i < count; i++) {
				body[i] = random.nextInt(6) == 0 ? function() : statement(3, top);
			}
			return Js.program(body);
		}

		private JsonObject function() {
			Context inside = new Context(true, false, false, List.of(), List.of(), List.of());
			return Js.function("g" + names++, Js.params(), statements(2, inside, 1 + random.nextInt(3)));
		}

		private JsonObject[] statements(int depth, Context ctx, int count) {
			JsonObject[] result = new JsonObject[count];
			for (int i = 0; i < count; i++) {
				result[i] = statement(depth, ctx);
			}
			return result;
		}

		private JsonObject statement(int depth, Context ctx) {
			switch (random.nextInt(depth > 0 ? 12 : 4)) {
				case 0:
					return Js.assign(pick(), expression(ctx));
				case 1:
					return ctx.inFunction ? Js.assign(pick(), expression(ctx)) : Js.var(pick(), expression(ctx));
				case 2:
					return Js.expr(Js.call(Js.id("use"), Js.id(pickUse(ctx))));
				case 3:
					return random.nextInt(3) == 0 ? jump(ctx) : Js.expr(Js.update(pick()));
				case 4:
					return Js.ifStmt(Js.id(pickUse(ctx)), block(depth, ctx),
							random.nextBoolean() ? block(depth, ctx) : null);
				case 5:
					return loop(depth, ctx, null);
				case 6:
					return block(depth, ctx);
				case 7:
				case 8:
					return tryStatement(depth, ctx);
				case 9:
					return switchStatement(depth, ctx, null);
				case 10:
					return labeled(depth, ctx);
				default:
					return Js.throwStmt(Js.id(pickUse(ctx)));
			}
		}

		private JsonObject block(int depth, Context ctx) {
			return Js.block(statements(depth - 1, ctx, 1 + random.nextInt(3)));
		}

		private JsonObject jump(Context ctx) {
			List<JsonObject> options = new ArrayList<>();
			if (ctx.inBreakable) {
				options.add(Js.brk());
			}
			if (ctx.inLoop) {
				options.add(Js.cont());
			}
			for (String label : ctx.breakLabels) {
				options.add(Js.brk(label));
			}
			for (String label : ctx.loopLabels) {
				options.add(Js.node("ContinueStatement", "label", Js.id(label)));
			}
			if (ctx.inFunction) {
				options.add(Js.ret(random.nextBoolean() ? Js.id(pickUse(ctx)) : null));
			}
			options.add(Js.throwStmt(Js.id(pickUse(ctx))));
			return options.get(random.nextInt(options.size()));
		}

		private JsonObject loop(int depth, Context ctx, String label) {
			Context body = ctx.loop(label);
			switch (random.nextInt(3)) {
				case 0:
					return Js.whileStmt(Js.id(pickUse(ctx)), block(depth, body));
				case 1:
					return Js.node("DoWhileStatement", "body", block(depth, body), "test", Js.id(pickUse(ctx)));
				default:
					JsonObject init = null;
					switch (random.nextInt(3)) {
						case 0 -> init = ctx.inFunction ? assignment(ctx) : Js.var(pick(), expression(ctx));
						case 1 -> init = assignment(ctx);
						default -> {
						}
					}
					JsonObject test = random.nextInt(4) == 0 ? null : Js.id(pickUse(ctx));
					JsonObject update = random.nextBoolean() ? Js.update(pick()) : null;
					return Js.forStmt(init, test, update, block(depth, body));
			}
		}

		private JsonObject switchStatement(int depth, Context ctx, String label) {
			Context inside = ctx.breakable(label);
			int count = 1 + random.nextInt(3);
			int defaultIndex = random.nextBoolean() ? random.nextInt(count) : -1;
			List<JsonObject> cases = new ArrayList<>();
			for (int i = 0; i < count; i++) {
				JsonObject test = i == defaultIndex ? null
						: random.nextBoolean() ? Js.num(i) : Js.id(pickUse(ctx));
				cases.add(Js.node("SwitchCase", "test", test,
						"consequent", List.of(statements(depth - 1, inside, random.nextInt(3)))));
			}
			return Js.node("SwitchStatement", "discriminant", Js.id(pickUse(ctx)), "cases", cases);
		}

		private JsonObject tryStatement(int depth, Context ctx) {
			int shape = random.nextInt(3);
			JsonObject block = block(depth, ctx);
			String param = null;
			JsonObject handler = null;
			if (shape != 1) {
				param = "e" + names++;
				handler = block(depth, ctx.withCatchParam(param));
			}
			JsonObject finalizer = shape != 0 ? block(depth, ctx) : null;
			return Js.tryStmt(block, param, handler, finalizer);
		}

		private JsonObject labeled(int depth, Context ctx) {
			String label = "L" + names++;
			switch (random.nextInt(3)) {
				case 0:
					return Js.labeled(label, loop(depth, ctx, label));
				case 1:
					return Js.labeled(label, switchStatement(depth, ctx, label));
				default:
					return Js.labeled(label, block(depth, ctx.label(label)));
			}
		}

		private JsonObject assignment(Context ctx) {
			return Js.node("AssignmentExpression", "operator", "=", "left", Js.id(pick()), "right", expression(ctx));
		}

		private JsonObject expression(Context ctx) {
			if (random.nextBoolean()) {
				return Js.num(random.nextInt(10));
			}
			return Js.binary("+", Js.id(pickUse(ctx)), Js.id(pickUse(ctx)));
		}

		private String pick() {
			return VARS[random.nextInt(VARS.length)];
		}

		private String pickUse(Context ctx) {
			if (!ctx.catchParams.isEmpty() && random.nextInt(4) == 0) {
				return ctx.catchParams.get(random.nextInt(ctx.catchParams.size()));
			}
			return pick();
		}
	}

	private record Context(boolean inFunction, boolean inLoop, boolean inBreakable,
						   List<String> breakLabels, List<String> loopLabels, List<String> catchParams) {

		Context loop(String label) {
			return new Context(inFunction, true, true, plus(breakLabels, label), plus(loopLabels, label), catchParams);
		}

		Context breakable(String label) {
			return new Context(inFunction, inLoop, true, plus(breakLabels, label), loopLabels, catchParams);
		}

		Context label(String label) {
			return new Context(inFunction, inLoop, inBreakable, plus(breakLabels, label), loopLabels, catchParams);
		}

		Context withCatchParam(String param) {
			return new Context(inFunction, inLoop, inBreakable, breakLabels, loopLabels, plus(catchParams, param));
		}

		private static List<String> plus(List<String> list, String value) {
			if (value == null) {
				return list;
			}
			List<String> result = new ArrayList<>(list);
			result.add(value);
			return result;
		}
	}

	// ------------------------------------------------------------------
	// 参照分析
	// ------------------------------------------------------------------

	/**
	 * 变量名 -> 到达的定义（定义语句锚点的 range 起点）。live 表示这一点可以从函数入口到达；
	 * 不可达的死代码从空状态开始，照样向后传播。
	 */
	private static final class State {
		final Map<String, Set<Integer>> defs = new TreeMap<>();
		final boolean live;

		State(boolean live) {
			this.live = live;
		}

		static State dead() {
			return new State(false);
		}

		static State orDead(State s) {
			return s != null ? s : dead();
		}

		static State join(State a, State b) {
			if (a == null) {
				return b;
			}
			if (b == null) {
				return a;
			}
			State s = new State(a.live || b.live);
			s.addAll(a);
			s.addAll(b);
			return s;
		}

		void addAll(State other) {
			for (Map.Entry<String, Set<Integer>> e : other.defs.entrySet()) {
				defs.computeIfAbsent(e.getKey(), k -> new TreeSet<>()).addAll(e.getValue());
			}
		}

		State define(String name, int site) {
			State s = new State(live);
			s.addAll(this);
			s.defs.put(name, new TreeSet<>(Set.of(site)));
			return s;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof State s && s.live == live && s.defs.equals(defs);
		}

		@Override
		public int hashCode() {
			return Objects.hash(live, defs);
		}
	}

	/**
	 * 突然结束：kind 为 break / continue / return / throw
	 */
	private record Jump(String kind, String label, State state) {
	}

	/**
	 * 语句的执行结果。normal 为 null 表示语句之后控制流断开
	 */
	private static final class Flow {
		State normal;
		final List<Jump> jumps = new ArrayList<>();
	}

	private static final class StructuralAnalysis {

		private final Set<String> edges = new TreeSet<>();
		private final List<JsonObject> functions = new ArrayList<>();
		// 顶层所有可达语句项之前的状态之并，也就是函数声明可以捕获的定义
		private State captured = State.dead();
		private boolean topLevel;

		Set<String> run(JsonObject program) {
			topLevel = true;
			execList(list(program, "body"), new State(true));
			topLevel = false;
			for (JsonObject fn : functions) {
				State entry = new State(true);
				entry.addAll(captured);
				execList(list(fn.getAsJsonObject("body"), "body"), entry);
			}
			return edges;
		}

		private Flow execList(List<JsonObject> statements, State in) {
			Flow flow = new Flow();
			State state = in;
			for (JsonObject s : statements) {
				Flow r = exec(s, state, Set.of());
				flow.jumps.addAll(r.jumps);
				state = r.normal;
			}
			flow.normal = state;
			return flow;
		}

		private Flow exec(JsonObject s, State in, Set<String> labels) {
			Flow flow = new Flow();
			switch (type(s)) {
				case "BlockStatement" -> {
					return execList(list(s, "body"), in);
				}
				case "ExpressionStatement", "VariableDeclaration" -> flow.normal = effect(s, s, in, flow);
				case "FunctionDeclaration" -> {
					if (topLevel) {
						functions.add(s);
					}
					flow.normal = item(s, in, List.of(), null, false, flow);
				}
				case "BreakStatement", "ContinueStatement" -> {
					State st = item(s, in, List.of(), null, false, flow);
					String kind = type(s).equals("BreakStatement") ? "break" : "continue";
					flow.jumps.add(new Jump(kind, labelOf(s), st));
				}
				case "ReturnStatement" -> {
					JsonObject arg = child(s, "argument");
					State st = item(s, in, names(arg), null, arg != null, flow);
					flow.jumps.add(new Jump("return", null, st));
				}
				case "ThrowStatement" -> {
					State st = item(s, in, names(child(s, "argument")), null, true, flow);
					flow.jumps.add(new Jump("throw", null, st));
				}
				case "IfStatement" -> {
					State cond = item(s, in, names(child(s, "test")), null, true, flow);
					Flow then = exec(child(s, "consequent"), cond, Set.of());
					flow.jumps.addAll(then.jumps);
					JsonObject alternate = child(s, "alternate");
					if (alternate != null) {
						Flow other = exec(alternate, cond, Set.of());
						flow.jumps.addAll(other.jumps);
						flow.normal = State.join(then.normal, other.normal);
					} else {
						flow.normal = State.join(then.normal, cond);
					}
				}
				case "WhileStatement" -> {
					return whileLoop(s, in, labels);
				}
				case "DoWhileStatement" -> {
					return doWhileLoop(s, in, labels);
				}
				case "ForStatement" -> {
					return forLoop(s, in, labels);
				}
				case "SwitchStatement" -> {
					return switchStatement(s, in, labels);
				}
				case "TryStatement" -> {
					return tryStatement(s, in);
				}
				case "LabeledStatement" -> {
					String label = child(s, "label").get("name").getAsString();
					JsonObject body = child(s, "body");
					if (!type(body).equals("BlockStatement")) {
						Set<String> more = new HashSet<>(labels);
						more.add(label);
						return exec(body, in, more);
					}
					Flow inner = exec(body, in, Set.of());
					State after = inner.normal;
					for (Jump j : inner.jumps) {
						if (j.kind().equals("break") && label.equals(j.label())) {
							after = State.join(after, j.state());
						} else {
							flow.jumps.add(j);
						}
					}
					flow.normal = State.orDead(after);
				}
				default -> throw new IllegalStateException(type(s));
			}
			return flow;
		}

		private Flow whileLoop(JsonObject s, State in, Set<String> labels) {
			State back = null;
			while (true) {
				Flow flow = new Flow();
				State header = State.orDead(State.join(in, back));
				State test = item(s, header, names(child(s, "test")), null, true, flow);
				Flow body = exec(child(s, "body"), test, Set.of());
				State[] targets = consume(body, flow, labels);
				State next = State.join(body.normal, targets[0]);
				if (Objects.equals(next, back)) {
					flow.normal = State.join(test, targets[1]);
					return flow;
				}
				back = next;
			}
		}

		private Flow doWhileLoop(JsonObject s, State in, Set<String> labels) {
			State back = null;
			while (true) {
				Flow flow = new Flow();
				Flow body = exec(child(s, "body"), State.orDead(State.join(in, back)), Set.of());
				State[] targets = consume(body, flow, labels);
				State testIn = State.orDead(State.join(body.normal, targets[0]));
				State test = item(s, testIn, names(child(s, "test")), null, true, flow);
				if (test.equals(back)) {
					flow.normal = State.join(test, targets[1]);
					return flow;
				}
				back = test;
			}
		}

		private Flow forLoop(JsonObject s, State in, Set<String> labels) {
			Flow initFlow = new Flow();
			State start = in;
			JsonObject init = child(s, "init");
			if (init != null) {
				start = effect(init, init, in, initFlow);
			}
			JsonObject testExpr = child(s, "test");
			JsonObject update = child(s, "update");
			State back = null;
			while (true) {
				Flow flow = new Flow();
				flow.jumps.addAll(initFlow.jumps);
				State header = State.orDead(State.join(start, back));
				State test = item(s, header, names(testExpr), null, testExpr != null, flow);
				Flow body = exec(child(s, "body"), test, Set.of());
				State[] targets = consume(body, flow, labels);
				State next = State.join(body.normal, targets[0]);
				if (update != null) {
					next = effect(update, update, State.orDead(next), flow);
				}
				if (Objects.equals(next, back)) {
					flow.normal = State.join(test, targets[1]);
					return flow;
				}
				back = next;
			}
		}

		/**
		 * 循环接收属于它的 continue 和 break，其余的突然结束交给外层
		 *
		 * @return [continue 的状态之并, break 的状态之并]
		 */
		private State[] consume(Flow body, Flow outer, Set<String> labels) {
			State continued = null;
			State broken = null;
			for (Jump j : body.jumps) {
				boolean mine = j.label() == null || labels.contains(j.label());
				if (j.kind().equals("continue") && mine) {
					continued = State.join(continued, j.state());
				} else if (j.kind().equals("break") && mine) {
					broken = State.join(broken, j.state());
				} else {
					outer.jumps.add(j);
				}
			}
			return new State[]{continued, broken};
		}

		private Flow switchStatement(JsonObject s, State in, Set<String> labels) {
			Flow flow = new Flow();
			State dispatch = item(s, in, names(child(s, "discriminant")), null, true, flow);
			List<JsonObject> cases = list(s, "cases");
			State[] entries = new State[cases.size()];
			State previous = dispatch;
			int defaultIndex = -1;
			for (int i = 0; i < cases.size(); i++) {
				JsonObject test = child(cases.get(i), "test");
				if (test == null) {
					defaultIndex = i;
					continue;
				}
				previous = item(cases.get(i), previous, names(test), null, true, flow);
				entries[i] = previous;
			}
			State after = null;
			if (defaultIndex >= 0) {
				entries[defaultIndex] = previous;
			} else {
				after = previous;
			}
			State fallthrough = null;
			for (int i = 0; i < cases.size(); i++) {
				Flow body = execList(list(cases.get(i), "consequent"), State.orDead(State.join(entries[i], fallthrough)));
				for (Jump j : body.jumps) {
					if (j.kind().equals("break") && (j.label() == null || labels.contains(j.label()))) {
						after = State.join(after, j.state());
					} else {
						flow.jumps.add(j);
					}
				}
				fallthrough = body.normal;
			}
			flow.normal = State.orDead(State.join(after, fallthrough));
			return flow;
		}

		/**
		 * try 部分抛出的异常进入 catch；其余出口（以及没有 catch 时的异常）都进入 finally，
		 * finally 结束之后按原来的种类继续
		 */
		private Flow tryStatement(JsonObject s, State in) {
			Flow flow = new Flow();
			State start = item(s, in, List.of(), null, false, flow);
			Flow block = exec(child(s, "block"), start, Set.of());
			JsonObject handler = child(s, "handler");
			JsonObject finalizer = child(s, "finalizer");

			List<Jump> entering = new ArrayList<>();
			Flow caught = null;
			if (handler != null) {
				State catchIn = null;
				for (Jump j : block.jumps) {
					if (j.kind().equals("throw")) {
						catchIn = State.join(catchIn, j.state());
					} else {
						entering.add(j);
					}
				}
				String param = child(handler, "param").get("name").getAsString();
				State bound = item(handler, catchIn, List.of(), param, false, flow);
				caught = exec(child(handler, "body"), bound, Set.of());
				entering.addAll(caught.jumps);
			} else {
				entering.addAll(block.jumps);
			}

			State normal = State.join(block.normal, caught != null ? caught.normal : null);
			if (finalizer == null) {
				flow.jumps.addAll(entering);
				flow.normal = normal;
				return flow;
			}

			State finallyIn = normal;
			Set<List<String>> pending = new LinkedHashSet<>();
			for (Jump j : entering) {
				finallyIn = State.join(finallyIn, j.state());
				pending.add(Arrays.asList(j.kind(), j.label()));
			}
			Flow fin = exec(finalizer, State.orDead(finallyIn), Set.of());
			flow.jumps.addAll(fin.jumps);
			if (fin.normal != null) {
				for (List<String> p : pending) {
					flow.jumps.add(new Jump(p.get(0), p.get(1), fin.normal));
				}
				if (normal != null) {
					flow.normal = fin.normal;
				}
			}
			return flow;
		}

		/**
		 * 赋值、变量声明、自增和调用的使用与定义
		 */
		private State effect(JsonObject anchor, JsonObject node, State in, Flow flow) {
			switch (type(node)) {
				case "ExpressionStatement":
					return effect(anchor, child(node, "expression"), in, flow);
				case "VariableDeclaration": {
					JsonObject d = list(node, "declarations").get(0);
					return item(anchor, in, names(child(d, "init")), child(d, "id").get("name").getAsString(), true, flow);
				}
				case "AssignmentExpression":
					return item(anchor, in, names(child(node, "right")), child(node, "left").get("name").getAsString(),
							true, flow);
				case "UpdateExpression": {
					String name = child(node, "argument").get("name").getAsString();
					return item(anchor, in, List.of(name), name, true, flow);
				}
				default:
					return item(anchor, in, names(node), null, true, flow);
			}
		}

		/**
		 * 一个语句项：记录到达它的使用的数据边，可能抛出时把执行之前的状态作为异常交出去
		 */
		private State item(JsonObject anchor, State in, List<String> uses, String def, boolean canThrow, Flow flow) {
			State state = State.orDead(in);
			int site = start(anchor);
			if (topLevel && state.live) {
				captured = State.join(captured, state);
			}
			for (String use : uses) {
				for (int from : state.defs.getOrDefault(use, Set.of())) {
					edges.add(from + "->" + site + ":" + use);
				}
			}
			if (canThrow) {
				flow.jumps.add(new Jump("throw", null, state));
			}
			return def != null ? state.define(def, site) : state;
		}

		/**
		 * 表达式中作为值读取的变量名，被调用的函数名除外
		 */
		private static List<String> names(JsonObject node) {
			List<String> result = new ArrayList<>();
			if (node == null) {
				return result;
			}
			switch (type(node)) {
				case "Identifier" -> result.add(node.get("name").getAsString());
				case "BinaryExpression" -> {
					result.addAll(names(child(node, "left")));
					result.addAll(names(child(node, "right")));
				}
				case "CallExpression" -> {
					for (JsonObject arg : list(node, "arguments")) {
						result.addAll(names(arg));
					}
				}
				default -> {
				}
			}
			return result;
		}

		private static String labelOf(JsonObject s) {
			JsonObject label = child(s, "label");
			return label != null ? label.get("name").getAsString() : null;
		}
	}

	private static String type(JsonObject node) {
		return node.get("type").getAsString();
	}

	private static JsonObject child(JsonObject node, String key) {
		JsonElement e = node.get(key);
		return e != null && e.isJsonObject() ? e.getAsJsonObject() : null;
	}

	private static List<JsonObject> list(JsonObject node, String key) {
		List<JsonObject> result = new ArrayList<>();
		for (JsonElement e : node.getAsJsonArray(key)) {
			result.add(e.getAsJsonObject());
		}
		return result;
	}

	private static int start(JsonObject node) {
		return node.getAsJsonArray("range").get(0).getAsInt();
	}
}
