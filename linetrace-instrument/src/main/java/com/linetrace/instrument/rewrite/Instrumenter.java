package com.linetrace.instrument.rewrite;

import com.linetrace.instrument.UnsupportedConstructPolicy;
import com.linetrace.instrument.source.OwnerMembers;
import org.eclipse.jdt.core.dom.*;

import java.util.*;
import java.util.function.Consumer;

/**
 * Rewrites a static method so that it reports its locals after every statement.
 *
 * Rules, applied depth-first to every block of the body:
 * - plain statement: followed by {@code $emit(line, locals...)}
 * - break, continue, throw: no emission; a break leaving a loop sets that loop's flag
 * - return: the value is stored in {@code $retval}, emitted with the locals, then {@code $flush()} runs
 * - if, loops, try, synchronized, labeled and bare blocks: every nested block starts with an
 *   emission at the owning statement's line; an if without else gets an else holding only that emission
 * - a loop that ends because its condition failed records one more entry at its line
 *
 * The rewrite is all-or-nothing: the body is checked for unsupported constructs before any node changes.
 */
public class Instrumenter {

    public static final String MARKER = "com.linetrace.runtime.Instrumented";

    public static class UnsupportedConstructException extends RuntimeException {
        private final String construct;
        private final int position;

        public UnsupportedConstructException(String construct, int position) {
            super(construct + " at position " + position + " cannot be instrumented");
            this.construct = construct;
            this.position = position;
        }

        public String construct() { return construct; }
        public int position() { return position; }
    }

    private final UnsupportedConstructPolicy policy;

    public Instrumenter() {
        this(UnsupportedConstructPolicy.FAIL);
    }

    public Instrumenter(UnsupportedConstructPolicy policy) {
        this.policy = policy;
    }

    public ParsedDefinition instrument(ParsedDefinition definition) {
        return instrument(definition, OwnerMembers.none());
    }

    /**
     * Rewrites {@code definition} in place and returns it.
     * A method that already carries {@code @Instrumented} is returned untouched.
     * {@code owner} supplies the constants and private members of the enclosing types.
     *
     * @throws UnsupportedConstructException for instance methods, for methods that reach private members
     *         of their enclosing types, and for switch statements under {@link UnsupportedConstructPolicy#FAIL}
     */
    @SuppressWarnings("unchecked")
    public ParsedDefinition instrument(ParsedDefinition definition, OwnerMembers owner) {
        MethodDeclaration method = definition.method();
        if (isInstrumented(method)) {
            return definition;
        }
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new UnsupportedConstructException("instance method " + definition.methodName(), 1);
        }
        if (owner.privateOwner() != null) {
            throw new UnsupportedConstructException("method of private class " + owner.privateOwner(), 1);
        }
        PrivateReferences.first(method, owner).ifPresent(ref -> {
            throw new UnsupportedConstructException(ref.describe(), definition.lineOf(ref.node()));
        });

        Block body = method.getBody();
        List<Statement> unsupported = new ArrayList<>();
        collectUnsupported(body, unsupported);
        for (Statement s : unsupported) {
            int line = definition.lineOf(s);
            if (policy == UnsupportedConstructPolicy.FAIL) {
                throw new UnsupportedConstructException("switch statement", line);
            }
            System.err.println("[linetrace] Warning: switch statement at position " + line + " of "
                + definition.methodName() + " is recorded as a single statement");
        }

        BreakTargets targets = BreakTargets.of(body);
        Reachability reachability = new Reachability(targets, ConstantFolder.forMethod(method, owner.constants()));
        boolean trailingFlush = isVoid(method) && reachability.canCompleteNormally(body);

        EmissionFactory factory = new EmissionFactory(method.getAST());
        new Pass(definition, factory, targets, reachability).run(trailingFlush);
        method.modifiers().add(0, factory.instrumentedMarker());
        return definition;
    }

    public static boolean isInstrumented(MethodDeclaration method) {
        for (Object modifier : method.modifiers()) {
            if (modifier instanceof Annotation annotation) {
                String name = annotation.getTypeName().getFullyQualifiedName();
                if (name.equals(MARKER) || name.equals("Instrumented")) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isVoid(MethodDeclaration method) {
        return method.getReturnType2() instanceof PrimitiveType p && p.getPrimitiveTypeCode() == PrimitiveType.VOID;
    }

    /** Walks the same statement structure the rewrite walks. */
    private static void collectUnsupported(Statement s, List<Statement> found) {
        if (s instanceof SwitchStatement) {
            found.add(s);
        } else if (s instanceof Block block) {
            for (Object o : block.statements()) collectUnsupported((Statement) o, found);
        } else if (s instanceof IfStatement ifs) {
            collectUnsupported(ifs.getThenStatement(), found);
            if (ifs.getElseStatement() != null) collectUnsupported(ifs.getElseStatement(), found);
        } else if (s instanceof WhileStatement ws) {
            collectUnsupported(ws.getBody(), found);
        } else if (s instanceof DoStatement ds) {
            collectUnsupported(ds.getBody(), found);
        } else if (s instanceof ForStatement fs) {
            collectUnsupported(fs.getBody(), found);
        } else if (s instanceof EnhancedForStatement efs) {
            collectUnsupported(efs.getBody(), found);
        } else if (s instanceof LabeledStatement ls) {
            collectUnsupported(ls.getBody(), found);
        } else if (s instanceof SynchronizedStatement ss) {
            collectUnsupported(ss.getBody(), found);
        } else if (s instanceof TryStatement ts) {
            collectUnsupported(ts.getBody(), found);
            for (Object c : ts.catchClauses()) collectUnsupported(((CatchClause) c).getBody(), found);
            if (ts.getFinally() != null) collectUnsupported(ts.getFinally(), found);
        }
    }

    // -----------------------------------------------------------------------
    // Rewrite pass
    // -----------------------------------------------------------------------

    private static final class Pass {

        private static final int NO_OWNER = 0;

        private final ParsedDefinition definition;
        private final EmissionFactory emit;
        private final BreakTargets targets;
        private final Reachability reachability;
        private final ScopeTracker scope = new ScopeTracker();

        // loop -> flag set by every break that leaves it
        private final Map<Statement, String> brokeFlags = new IdentityHashMap<>();
        private int flagCount;

        Pass(ParsedDefinition definition, EmissionFactory emit, BreakTargets targets, Reachability reachability) {
            this.definition = definition;
            this.emit = emit;
            this.targets = targets;
            this.reachability = reachability;
        }

        @SuppressWarnings("unchecked")
        void run(boolean trailingFlush) {
            MethodDeclaration method = definition.method();
            for (Object p : method.parameters()) {
                scope.declareAssigned(((SingleVariableDeclaration) p).getName().getIdentifier());
            }
            Block body = method.getBody();
            rewriteBlock(body, NO_OWNER);
            if (trailingFlush) {
                body.statements().add(emit.flush());
            }
        }

        @SuppressWarnings("unchecked")
        private void rewriteBlock(Block block, int ownerLine) {
            List<Statement> original = new ArrayList<>(block.statements());
            block.statements().clear();
            List<Statement> out = block.statements();

            scope.enter();
            if (ownerLine != NO_OWNER) {
                out.add(emitHere(ownerLine));
            }
            for (Statement s : original) {
                rewriteStatement(s, out);
            }
            scope.exit();
        }

        private void rewriteStatement(Statement s, List<Statement> out) {
            int line = definition.lineOf(s);

            if (s instanceof ReturnStatement ret) {
                rewriteReturn(ret, line, out);
            } else if (s instanceof BreakStatement br) {
                String flag = brokeFlags.get(targets.targetOf(br));
                if (flag != null) {
                    out.add(emit.flagSet(flag));
                }
                out.add(br);
            } else if (s instanceof ContinueStatement || s instanceof ThrowStatement) {
                // jumps record no entry
                out.add(s);
            } else if (s instanceof IfStatement ifs) {
                rewriteIf(ifs, line);
                out.add(ifs);
            } else if (BreakTargets.isLoop(s)) {
                rewriteLoop(s, s, line, out);
            } else if (s instanceof LabeledStatement labeled) {
                if (BreakTargets.isLoop(labeled.getBody())) {
                    rewriteLoop(labeled.getBody(), labeled, definition.lineOf(labeled.getBody()), out);
                } else {
                    rewriteBlock(toBlock(labeled.getBody(), labeled::setBody), line);
                    out.add(labeled);
                }
            } else if (s instanceof Block block) {
                rewriteBlock(block, line);
                out.add(block);
            } else if (s instanceof SynchronizedStatement sync) {
                rewriteBlock(sync.getBody(), line);
                out.add(sync);
            } else if (s instanceof TryStatement tryStatement) {
                rewriteTry(tryStatement, line);
                out.add(tryStatement);
            } else if (s instanceof SwitchStatement) {
                // only reached when unsupported constructs pass through
                out.add(s);
                if (reachability.canCompleteNormally(s)) {
                    out.add(emitHere(line));
                }
            } else {
                out.add(s);
                track(s);
                out.add(emitHere(line));
            }
        }

        private void rewriteReturn(ReturnStatement ret, int line, List<Statement> out) {
            Expression value = ret.getExpression();
            if (value == null) {
                out.add(emitHere(line));
                out.add(emit.flush());
                out.add(ret);
                return;
            }
            ret.setExpression(null);

            List<String> names = new ArrayList<>(scope.visible());
            names.add(EmissionFactory.RETVAL);
            out.add(emit.retval(returnType(), value));
            out.add(emit.emit(line, names));
            out.add(emit.flush());
            out.add(emit.returnRetval());
        }

        private Type returnType() {
            MethodDeclaration method = definition.method();
            AST ast = method.getAST();
            Type type = (Type) ASTNode.copySubtree(ast, method.getReturnType2());
            int dims = method.getExtraDimensions();
            return dims > 0 ? ast.newArrayType(type, dims) : type;
        }

        private void rewriteIf(IfStatement ifs, int line) {
            rewriteBlock(toBlock(ifs.getThenStatement(), ifs::setThenStatement), line);

            Statement otherwise = ifs.getElseStatement();
            Block elseBlock;
            if (otherwise == null) {
                elseBlock = emit.newBlock();
                ifs.setElseStatement(elseBlock);
            } else {
                elseBlock = toBlock(otherwise, ifs::setElseStatement);
            }
            rewriteBlock(elseBlock, line);
        }

        private void rewriteLoop(Statement loop, Statement outer, int line, List<Statement> out) {
            boolean recordsExit = canExitThroughCondition(loop);
            String flag = null;
            if (recordsExit && targets.hasBreakTo(loop)) {
                flag = EmissionFactory.BROKE_PREFIX + (++flagCount);
                brokeFlags.put(loop, flag);
                out.add(emit.flagDeclaration(flag));
            }

            if (loop instanceof WhileStatement ws) {
                rewriteBlock(toBlock(ws.getBody(), ws::setBody), line);
            } else if (loop instanceof DoStatement ds) {
                rewriteBlock(toBlock(ds.getBody(), ds::setBody), line);
            } else if (loop instanceof ForStatement fs) {
                scope.enter();
                for (Object init : fs.initializers()) {
                    trackExpression((Expression) init);
                }
                rewriteBlock(toBlock(fs.getBody(), fs::setBody), line);
                scope.exit();
            } else if (loop instanceof EnhancedForStatement efs) {
                scope.enter();
                scope.declareAssigned(efs.getParameter().getName().getIdentifier());
                rewriteBlock(toBlock(efs.getBody(), efs::setBody), line);
                scope.exit();
            }
            out.add(outer);

            if (recordsExit) {
                ExpressionStatement exit = emitHere(line);
                out.add(flag == null ? exit : emit.unlessFlag(flag, exit));
            }
        }

        private boolean canExitThroughCondition(Statement loop) {
            if (loop instanceof WhileStatement ws) {
                return !reachability.isConstantTrue(ws.getExpression());
            }
            if (loop instanceof ForStatement fs) {
                return !reachability.isConstantTrue(fs.getExpression());
            }
            if (loop instanceof DoStatement ds) {
                return !reachability.isConstantTrue(ds.getExpression())
                    && (reachability.canCompleteNormally(ds.getBody()) || targets.hasContinueTo(ds));
            }
            return true;
        }

        private void rewriteTry(TryStatement tryStatement, int line) {
            scope.enter();
            for (Object resource : tryStatement.resources()) {
                if (resource instanceof VariableDeclarationExpression vde) {
                    trackExpression(vde);
                }
            }
            rewriteBlock(tryStatement.getBody(), line);
            scope.exit();

            for (Object c : tryStatement.catchClauses()) {
                CatchClause clause = (CatchClause) c;
                scope.enter();
                scope.declareAssigned(clause.getException().getName().getIdentifier());
                rewriteBlock(clause.getBody(), definition.lineOf(clause));
                scope.exit();
            }
            if (tryStatement.getFinally() != null) {
                rewriteBlock(tryStatement.getFinally(), definition.lineOf(tryStatement.getFinally()));
            }
        }

        // -----------------------------------------------------------------------
        // Scope bookkeeping
        // -----------------------------------------------------------------------

        private void track(Statement s) {
            if (s instanceof VariableDeclarationStatement vds) {
                for (Object f : vds.fragments()) {
                    declareFragment((VariableDeclarationFragment) f);
                }
            } else if (s instanceof ExpressionStatement es) {
                trackExpression(es.getExpression());
            }
        }

        private void trackExpression(Expression e) {
            if (e instanceof VariableDeclarationExpression vde) {
                for (Object f : vde.fragments()) {
                    declareFragment((VariableDeclarationFragment) f);
                }
            } else if (e instanceof Assignment assignment) {
                Expression target = assignment.getLeftHandSide();
                while (target instanceof ParenthesizedExpression p) {
                    target = p.getExpression();
                }
                if (target instanceof SimpleName name) {
                    scope.assign(name.getIdentifier());
                }
            }
        }

        private void declareFragment(VariableDeclarationFragment fragment) {
            String name = fragment.getName().getIdentifier();
            if (fragment.getInitializer() != null) {
                scope.declareAssigned(name);
            } else {
                scope.declare(name);
            }
        }

        private ExpressionStatement emitHere(int line) {
            return emit.emit(line, scope.visible());
        }

        @SuppressWarnings("unchecked")
        private Block toBlock(Statement body, Consumer<Statement> setter) {
            if (body instanceof Block block) {
                return block;
            }
            Block block = emit.newBlock();
            setter.accept(block);
            block.statements().add(body);
            return block;
        }
    }
}
