package com.linetrace.instrument.rewrite;

import com.linetrace.instrument.UnsupportedConstructPolicy;
import com.linetrace.instrument.source.OwnerMembers;
import org.eclipse.jdt.core.dom.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstrumenterTest {

    private final DefinitionParser parser = new DefinitionParser();
    private final Instrumenter instrumenter = new Instrumenter();

    private ParsedDefinition instrument(String... lines) {
        return instrumenter.instrument(parser.parse(String.join("\n", lines)));
    }

    /** Emissions in source order of the rewritten tree, as "position:name,name". */
    private static List<String> emissions(ASTNode root) {
        List<String> found = new ArrayList<>();
        root.accept(new ASTVisitor() {
            @Override
            public boolean visit(MethodInvocation node) {
                if (node.getName().getIdentifier().equals("$emit")) {
                    List<?> args = node.arguments();
                    StringBuilder sb = new StringBuilder(args.get(0).toString()).append(':');
                    for (int i = 1; i < args.size(); i += 2) {
                        if (i > 1) sb.append(',');
                        sb.append(((StringLiteral) args.get(i)).getLiteralValue());
                    }
                    found.add(sb.toString());
                }
                return true;
            }
        });
        return found;
    }

    /** Members of the single top-level type declared by {@code lines}, in package {@code p}. */
    private static OwnerMembers owner(String... lines) {
        CompilationUnit cu = DefinitionParser.parseUnit("package p;\n" + String.join("\n", lines));
        return OwnerMembers.of("p", List.of((AbstractTypeDeclaration) cu.types().get(0)));
    }

    private ParsedDefinition instrument(OwnerMembers owner, String... lines) {
        return instrumenter.instrument(parser.parse(String.join("\n", lines)), owner);
    }

    private static int count(ASTNode root, String invocation) {
        int[] n = {0};
        root.accept(new ASTVisitor() {
            @Override
            public boolean visit(MethodInvocation node) {
                if (node.getName().getIdentifier().equals(invocation)) n[0]++;
                return true;
            }
        });
        return n[0];
    }

    private static Statement last(Block block, int fromEnd) {
        List<?> statements = block.statements();
        return (Statement) statements.get(statements.size() - 1 - fromEnd);
    }

    // --- straight-line code ---

    @Test
    void emitsAfterEachStatementWithVisibleLocals() {
        ParsedDefinition def = instrument(
            "static void f(int a) {",
            "    int x = a;",
            "    int y = x + 1;",
            "}");
        assertEquals(List.of("2:a,x", "3:a,x,y"), emissions(def.method()));
    }

    @Test
    void voidMethodGetsTrailingFlush() {
        ParsedDefinition def = instrument(
            "static void f() {",
            "    int x = 1;",
            "}");
        Statement tail = last(def.method().getBody(), 0);
        assertTrue(tail.toString().startsWith("$flush()"), tail.toString());
        assertEquals(1, count(def.method(), "$flush"));
    }

    @Test
    void returnValueIsCapturedBeforeFlush() {
        ParsedDefinition def = instrument(
            "static int f() {",
            "    int x = 1;",
            "    return x + 2;",
            "}");
        Block body = def.method().getBody();
        assertInstanceOf(VariableDeclarationStatement.class, last(body, 3));
        assertTrue(last(body, 3).toString().contains("$retval=x + 2"), last(body, 3).toString());
        assertTrue(last(body, 1).toString().startsWith("$flush()"));
        ReturnStatement ret = (ReturnStatement) last(body, 0);
        assertEquals("$retval", ret.getExpression().toString());
        assertEquals(List.of("2:x", "3:x,$retval"), emissions(def.method()));
    }

    @Test
    void bareReturnFlushesBeforeLeaving() {
        ParsedDefinition def = instrument(
            "static void f(boolean stop) {",
            "    if (stop) {",
            "        return;",
            "    }",
            "}");
        // one flush before the return, one at the end of the body
        assertEquals(2, count(def.method(), "$flush"));
    }

    @Test
    void methodEndingInReturnHasNoTrailingFlush() {
        ParsedDefinition def = instrument(
            "static void f() {",
            "    int x = 1;",
            "    return;",
            "}");
        assertInstanceOf(ReturnStatement.class, last(def.method().getBody(), 0));
        assertEquals(1, count(def.method(), "$flush"));
    }

    @Test
    void throwRecordsNothing() {
        ParsedDefinition def = instrument(
            "static int f(int n) {",
            "    throw new IllegalStateException();",
            "}");
        Block body = def.method().getBody();
        assertEquals(1, body.statements().size());
        assertInstanceOf(ThrowStatement.class, last(body, 0));
        assertEquals(List.of(), emissions(def.method()));
        assertEquals(0, count(def.method(), "$flush"));
    }

    @Test
    void continueRecordsNothing() {
        ParsedDefinition def = instrument(
            "static int f(int[] values) {",
            "    int odd = 0;",
            "    for (int v : values) {",
            "        if (v % 2 == 0) {",
            "            continue;",
            "        }",
            "        odd++;",
            "    }",
            "    return odd;",
            "}");
        EnhancedForStatement loop = (EnhancedForStatement) def.method().getBody().statements().get(1);
        IfStatement check = (IfStatement) ((Block) loop.getBody()).statements().get(1);
        Block then = (Block) check.getThenStatement();
        assertEquals(2, then.statements().size());
        assertInstanceOf(ContinueStatement.class, last(then, 0));
        assertEquals(List.of("4:values,odd,v"), emissions(then));
    }

    // --- pending declarations ---

    @Test
    void declarationWithoutValueIsHiddenUntilAssigned() {
        ParsedDefinition def = instrument(
            "static int f(int n) {",
            "    int y;",
            "    int z = n;",
            "    y = n * 2;",
            "    return y + z;",
            "}");
        assertEquals(List.of("2:n", "3:n,z", "4:n,y,z", "5:n,y,z,$retval"), emissions(def.method()));
    }

    @Test
    void assignmentInClosedBlockIsForgotten() {
        ParsedDefinition def = instrument(
            "static int f(String s) {",
            "    int r;",
            "    try {",
            "        r = Integer.parseInt(s);",
            "    } catch (NumberFormatException e) {",
            "        r = 0;",
            "    }",
            "    return r;",
            "}");
        assertEquals(List.of("2:s", "3:s", "4:s,r", "5:s,e", "6:s,r,e", "8:s,$retval"),
            emissions(def.method()));
    }

    // --- branches ---

    @Test
    void missingElseIsSynthesizedAtIfLine() {
        ParsedDefinition def = instrument(
            "static void f(int x) {",
            "    if (x > 0) {",
            "        x = 0;",
            "    }",
            "}");
        IfStatement stmt = (IfStatement) def.method().getBody().statements().get(0);
        assertNotNull(stmt.getElseStatement());
        assertEquals(List.of("2:x"), emissions(stmt.getElseStatement()));
        assertEquals(List.of("2:x", "3:x"), emissions(stmt.getThenStatement()));
    }

    @Test
    void explicitElseStartsWithIfLine() {
        ParsedDefinition def = instrument(
            "static void f(int x) {",
            "    if (x > 0) {",
            "        x = 0;",
            "    } else {",
            "        x = 1;",
            "    }",
            "}");
        IfStatement stmt = (IfStatement) def.method().getBody().statements().get(0);
        assertEquals(List.of("2:x", "5:x"), emissions(stmt.getElseStatement()));
    }

    @Test
    void singleStatementBranchBecomesBlock() {
        ParsedDefinition def = instrument(
            "static int f(int x) {",
            "    if (x > 0) return 1;",
            "    return 0;",
            "}");
        IfStatement stmt = (IfStatement) def.method().getBody().statements().get(0);
        assertInstanceOf(Block.class, stmt.getThenStatement());
    }

    // --- loops ---

    @Test
    void loopBodyStartsWithLoopLineAndExitIsRecorded() {
        ParsedDefinition def = instrument(
            "static void f() {",
            "    int x = 0;",
            "    while (x < 3) {",
            "        x++;",
            "    }",
            "}");
        assertEquals(List.of("2:x", "3:x", "4:x", "3:x"), emissions(def.method()));
    }

    @Test
    void infiniteLoopHasNoExitEmission() {
        ParsedDefinition def = instrument(
            "static int f(int n) {",
            "    while (true) {",
            "        if (n == 0) {",
            "            break;",
            "        }",
            "        n--;",
            "    }",
            "    return n;",
            "}");
        assertInstanceOf(WhileStatement.class, def.method().getBody().statements().get(0));
        WhileStatement loop = (WhileStatement) def.method().getBody().statements().get(0);
        assertEquals(List.of("2:n", "3:n", "3:n", "6:n"), emissions(loop));
    }

    @Test
    void constantExpressionConditionHasNoExitEmission() {
        ParsedDefinition def = instrument(
            "static void f(int n) {",
            "    while (1 > 0) {",
            "        if (n == 0) {",
            "            return;",
            "        }",
            "        n--;",
            "    }",
            "}");
        Block body = def.method().getBody();
        assertEquals(1, body.statements().size());
        assertInstanceOf(WhileStatement.class, body.statements().get(0));
        assertEquals(1, count(def.method(), "$flush"));
    }

    @Test
    void ownerConstantConditionHasNoExitEmission() {
        OwnerMembers owner = owner(
            "class Worker {",
            "    static final boolean ALWAYS = true;",
            "    static final int LIMIT = 4;",
            "}");
        ParsedDefinition whileDef = instrument(owner,
            "static int f(int n) {",
            "    while (ALWAYS) {",
            "        if (n == 0) {",
            "            return n;",
            "        }",
            "        n--;",
            "    }",
            "}");
        assertEquals(1, whileDef.method().getBody().statements().size());

        ParsedDefinition forDef = instrument(owner,
            "static void g(int n) {",
            "    for (int i = 0; Worker.LIMIT > 3; i++) {",
            "        if (i == n) {",
            "            return;",
            "        }",
            "    }",
            "}");
        Block body = forDef.method().getBody();
        assertEquals(1, body.statements().size());
        assertInstanceOf(ForStatement.class, last(body, 0));
    }

    @Test
    void parameterHidesOwnerConstant() {
        OwnerMembers owner = owner("class Worker {", "    static final boolean ALWAYS = true;", "}");
        ParsedDefinition def = instrument(owner,
            "static void f(boolean ALWAYS) {",
            "    while (ALWAYS) {",
            "        ALWAYS = false;",
            "    }",
            "}");
        Block body = def.method().getBody();
        assertEquals(List.of("2:ALWAYS", "3:ALWAYS", "2:ALWAYS"), emissions(body));
        assertEquals("$flush", ((MethodInvocation) ((ExpressionStatement) last(body, 0)).getExpression())
            .getName().getIdentifier());
    }

    @Test
    void breakSetsFlagThatGuardsExitEmission() {
        ParsedDefinition def = instrument(
            "static int f(int[] values) {",
            "    int found = -1;",
            "    for (int i = 0; i < values.length; i++) {",
            "        if (values[i] < 0) {",
            "            found = i;",
            "            break;",
            "        }",
            "    }",
            "    return found;",
            "}");
        String body = def.method().getBody().toString();
        assertTrue(body.contains("boolean $broke1=false;"), body);
        assertTrue(body.contains("$broke1=true;"), body);
        assertTrue(body.contains("if (!$broke1)"), body);
        assertFalse(emissions(def.method().getBody()).contains("6:values,found,i"));
    }

    @Test
    void labeledBreakFlagsTheOuterLoop() {
        ParsedDefinition def = instrument(
            "static int f(int[][] grid) {",
            "    outer:",
            "    for (int[] row : grid) {",
            "        for (int cell : row) {",
            "            break outer;",
            "        }",
            "    }",
            "    return 0;",
            "}");
        List<?> statements = def.method().getBody().statements();
        assertTrue(statements.get(0).toString().contains("$broke"), statements.get(0).toString());
        assertInstanceOf(LabeledStatement.class, statements.get(1));
        assertInstanceOf(IfStatement.class, statements.get(2));
        assertEquals(List.of("3:grid"), emissions((ASTNode) statements.get(2)));
    }

    @Test
    void doLoopRecordsExitAtDoLine() {
        ParsedDefinition def = instrument(
            "static int f(int n) {",
            "    do {",
            "        n /= 10;",
            "    } while (n != 0);",
            "    return n;",
            "}");
        assertEquals(List.of("2:n", "3:n", "2:n", "5:n,$retval"), emissions(def.method()));
    }

    @Test
    void lambdaBodiesAreLeftAlone() {
        ParsedDefinition def = instrument(
            "static int f(java.util.List<Integer> values) {",
            "    int total = values.stream().mapToInt(v -> {",
            "        int shifted = v + 1;",
            "        return shifted;",
            "    }).sum();",
            "    return total;",
            "}");
        assertEquals(List.of("2:values,total", "6:values,total,$retval"), emissions(def.method()));
        assertEquals(1, count(def.method(), "$flush"));
    }

    // --- unsupported constructs ---

    @Test
    void instanceMethodIsRejected() {
        Instrumenter.UnsupportedConstructException ex = assertThrows(
            Instrumenter.UnsupportedConstructException.class,
            () -> instrument("int f() {", "    return 1;", "}"));
        assertTrue(ex.construct().contains("instance method"));
    }

    @Test
    void privateOwnerMembersAreRejectedBeforeRewriting() {
        OwnerMembers owner = owner(
            "class Worker {",
            "    private static int secret = 1;",
            "    private static int hidden(int x) { return x; }",
            "    private static class Box {}",
            "    static int shared(int x) { return x; }",
            "}");

        ParsedDefinition parsed = parser.parse(String.join("\n",
            "static int f(int x) {",
            "    int y = shared(x);",
            "    return Worker.hidden(y);",
            "}"));
        String before = parsed.method().toString();
        Instrumenter.UnsupportedConstructException ex = assertThrows(
            Instrumenter.UnsupportedConstructException.class, () -> instrumenter.instrument(parsed, owner));
        assertEquals("reference to private method hidden", ex.construct());
        assertEquals(3, ex.position());
        assertEquals(before, parsed.method().toString());

        ex = assertThrows(Instrumenter.UnsupportedConstructException.class, () -> instrument(owner,
            "static Object f() {",
            "    return new Box();",
            "}"));
        assertEquals("reference to private type Box", ex.construct());

        ex = assertThrows(Instrumenter.UnsupportedConstructException.class, () -> instrument(owner,
            "static int f() {",
            "    return Worker.secret;",
            "}"));
        assertEquals("reference to private field secret", ex.construct());
    }

    @Test
    void localNamedLikePrivateFieldIsAccepted() {
        OwnerMembers owner = owner(
            "class Worker {",
            "    private static int secret = 1;",
            "    private static int hidden(int x) { return x; }",
            "    static int hidden(String s) { return 0; }",
            "}");
        ParsedDefinition def = instrument(owner,
            "static int f(int x) {",
            "    int secret = hidden(\"a\") + x;",
            "    return secret;",
            "}");
        assertTrue(Instrumenter.isInstrumented(def.method()));
    }

    @Test
    void methodOfPrivateClassIsRejected() {
        CompilationUnit cu = DefinitionParser.parseUnit(String.join("\n",
            "package p;",
            "class Outer {",
            "    private static class Hidden {",
            "        static int f() { return 1; }",
            "    }",
            "}"));
        AbstractTypeDeclaration outer = (AbstractTypeDeclaration) cu.types().get(0);
        AbstractTypeDeclaration hidden = (AbstractTypeDeclaration) outer.bodyDeclarations().get(0);
        OwnerMembers owner = OwnerMembers.of("p", List.of(outer, hidden));

        Instrumenter.UnsupportedConstructException ex = assertThrows(Instrumenter.UnsupportedConstructException.class,
            () -> instrument(owner, "static int f() {", "    return 1;", "}"));
        assertEquals("method of private class Hidden", ex.construct());
    }

    @Test
    void switchFailsWithItsPosition() {
        ParsedDefinition parsed = parser.parse(String.join("\n",
            "static int f(int n) {",
            "    int r = 0;",
            "    switch (n) {",
            "        case 1: r = 1; break;",
            "        default: r = 2;",
            "    }",
            "    return r;",
            "}"));
        String before = parsed.method().toString();
        Instrumenter.UnsupportedConstructException ex = assertThrows(
            Instrumenter.UnsupportedConstructException.class, () -> instrumenter.instrument(parsed));
        assertEquals(3, ex.position());
        assertEquals("switch statement", ex.construct());
        assertEquals(before, parsed.method().toString());
    }

    @Test
    void switchPassesThroughAsOneStatement() {
        ParsedDefinition def = new Instrumenter(UnsupportedConstructPolicy.PASS_THROUGH).instrument(parser.parse(
            String.join("\n",
                "static int f(int n) {",
                "    int r = 0;",
                "    switch (n) {",
                "        case 1: r = 1; break;",
                "        default: r = 2;",
                "    }",
                "    return r;",
                "}")));
        assertEquals(List.of("2:n,r", "3:n,r", "7:n,r,$retval"), emissions(def.method()));
    }

    // --- marker ---

    @Test
    void instrumentedMethodCarriesMarker() {
        ParsedDefinition def = instrument("static void f() {", "    int x = 1;", "}");
        assertTrue(Instrumenter.isInstrumented(def.method()));
        assertTrue(def.method().modifiers().get(0).toString().contains("Instrumented"));
    }

    @Test
    void alreadyInstrumentedMethodIsUnchanged() {
        ParsedDefinition parsed = parser.parse(String.join("\n",
            "@Instrumented",
            "static void f() {",
            "    int x = 1;",
            "}"));
        String before = parsed.method().toString();
        ParsedDefinition result = instrumenter.instrument(parsed);
        assertSame(parsed, result);
        assertEquals(before, result.method().toString());
        assertTrue(emissions(result.method()).isEmpty());
    }

    @Test
    void instrumentingTwiceDoesNotDoubleEmissions() {
        ParsedDefinition def = instrument("static void f() {", "    int x = 1;", "}");
        int once = emissions(def.method()).size();
        instrumenter.instrument(def);
        assertEquals(once, emissions(def.method()).size());
    }
}
