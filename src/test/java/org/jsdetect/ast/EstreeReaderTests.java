package org.jsdetect.ast;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.jsdetect.Js;
import org.jsdetect.error.FileStatus;
import org.jsdetect.error.GraphSizeExceededException;
import org.jsdetect.error.ParseFailureException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

class EstreeReaderTests {

	// ------------------------------------------------------------------
	// 树结构
	// ------------------------------------------------------------------

	@Test
	void testIdsArePreorderArenaIndexes() throws Exception {
		ParsedScript script = Js.readFixture("scenario_a.json");
		List<Integer> ids = new ArrayList<>();
		script.root.walk(n -> ids.add(n.id));
		for (int i = 0; i < ids.size(); i++) {
			Assertions.assertEquals(i, ids.get(i));
			Assertions.assertSame(script.node(i), script.nodes.get(i));
		}
		Assertions.assertEquals(script.size(), ids.size());
	}

	@Test
	void testRolesParentsAndRanges() throws Exception {
		ParsedScript script = Js.readFixture("scenario_a.json");
		AstNode ifStmt = script.root.children("body").get(1);
		Assertions.assertEquals(NodeKind.IF_STATEMENT, ifStmt.kind);
		Assertions.assertEquals("body", ifStmt.role);
		Assertions.assertSame(script.root, ifStmt.parent);
		Assertions.assertEquals(new SourceRange(11, 48), ifStmt.range);

		AstNode test = ifStmt.child("test");
		Assertions.assertEquals("x", test.name());
		Assertions.assertEquals(ifStmt, test.parent);
		Assertions.assertNotNull(ifStmt.child("consequent"));
		Assertions.assertNotNull(ifStmt.child("alternate"));
	}

	@Test
	void testLiteralTypes() {
		ParsedScript script = Js.script(
				Js.expr(Js.num(42)),
				Js.expr(Js.str("abc")),
				Js.expr(Js.node("Literal", "value", 1.5, "raw", "1.5")),
				Js.expr(Js.node("Literal", "value", 255, "raw", "0xff")),
				Js.expr(Js.node("Literal", "value", true, "raw", "true")),
				Js.expr(Js.node("Literal", "value", null, "raw", "null")));
		List<String> types = new ArrayList<>();
		script.root.walk(n -> {
			if (n.is(NodeKind.LITERAL)) {
				types.add(n.attr("literalType"));
			}
		});
		Assertions.assertEquals(List.of("Int", "String", "Numeric", "Int", "Bool", "Null"), types);
	}

	@Test
	void testRegexLiteral() {
		ParsedScript script = Js.script(Js.expr(Js.node("Literal", "value", new JsonObject(), "raw", "/ab+c/g",
				"regex", regex("ab+c", "g"))));
		AstNode literal = script.root.children.get(0).child("expression");
		Assertions.assertEquals("RegExp", literal.attr("literalType"));
		Assertions.assertEquals("ab+c", literal.attr("pattern"));
		Assertions.assertEquals("g", literal.attr("flags"));
	}

	@Test
	void testUnknownTypeFallsBackToUnsupported() {
		ParsedScript script = Js.script(Js.node("FancyNewStatement", "argument", Js.id("a")));
		AstNode stmt = script.root.children.get(0);
		Assertions.assertEquals(NodeKind.UNSUPPORTED, stmt.kind);
		Assertions.assertEquals("FancyNewStatement", stmt.type);
		Assertions.assertEquals(NodeKind.IDENTIFIER, stmt.child("argument").kind);
	}

	@Test
	void testTokensAndComments() throws Exception {
		ParsedScript script = Js.readFixture("scenario_b.json");
		Assertions.assertEquals(18, script.tokens.size());
		Assertions.assertEquals(new Token("Keyword", "function", new SourceRange(0, 8)), script.tokens.get(0));
		Assertions.assertTrue(script.comments.isEmpty());
		Assertions.assertEquals("script", script.sourceType);
	}

	@Test
	void testAttachedComments() {
		JsonObject stmt = Js.expr(Js.id("a"));
		JsonArray leading = new JsonArray();
		JsonObject comment = new JsonObject();
		comment.addProperty("type", "Line");
		comment.addProperty("value", " hello");
		leading.add(comment);
		stmt.add("leadingComments", leading);

		ParsedScript script = Js.script(stmt);
		AstNode node = script.root.children.get(0);
		Assertions.assertEquals(1, node.comments.size());
		Assertions.assertEquals(" hello", node.comments.get(0).value());
		// 注释不是子节点
		Assertions.assertEquals(1, node.children.size());
	}

	// ------------------------------------------------------------------
	// 失败
	// ------------------------------------------------------------------

	@Test
	void testMalformedJsonIsParseFailure() {
		ParseFailureException e = Assertions.assertThrows(ParseFailureException.class,
				() -> Js.readFixture("malformed.json"));
		Assertions.assertEquals(FileStatus.PARSE_FAILURE, e.status());
	}

	@Test
	void testRootMustBeProgram() {
		Assertions.assertThrows(ParseFailureException.class,
				() -> new EstreeReader().read("{\"type\": \"ExpressionStatement\"}"));
		Assertions.assertThrows(ParseFailureException.class, () -> new EstreeReader().read("[1, 2]"));
	}

	@Test
	void testNodeWithoutTypeIsParseFailure() {
		Assertions.assertThrows(ParseFailureException.class,
				() -> new EstreeReader().read("{\"type\": \"Program\", \"body\": [{\"name\": \"x\"}]}"));
	}

	@Test
	void testNodeLimit() {
		String json = Js.program(Js.expr(Js.binary("+", Js.id("a"), Js.id("b")))).toString();
		GraphSizeExceededException e = Assertions.assertThrows(GraphSizeExceededException.class,
				() -> new EstreeReader(3).read(json));
		Assertions.assertEquals(3, e.limit());
		Assertions.assertEquals(FileStatus.GRAPH_SIZE_EXCEEDED, e.status());
		Assertions.assertEquals(5, new EstreeReader(5).read(json).size());
	}

	private static JsonObject regex(String pattern, String flags) {
		JsonObject o = new JsonObject();
		o.addProperty("pattern", pattern);
		o.addProperty("flags", flags);
		return o;
	}
}
