package com.linetrace.instrument.rewrite;

import org.eclipse.jdt.core.dom.*;

/**
 * Approximates the "can complete normally" rules of the Java language for statements.
 *
 * A loop condition counts as constant when {@link ConstantFolder} can evaluate it.
 */
final class Reachability {

    private final BreakTargets targets;
    private final ConstantFolder constants;

    Reachability(BreakTargets targets, ConstantFolder constants) {
        this.targets = targets;
        this.constants = constants;
    }

    boolean canCompleteNormally(Statement s) {
        if (s instanceof Block block) {
            for (Object o : block.statements()) {
                if (!canCompleteNormally((Statement) o)) return false;
            }
            return true;
        }
        if (s instanceof ReturnStatement || s instanceof ThrowStatement
                || s instanceof BreakStatement || s instanceof ContinueStatement
                || s instanceof YieldStatement) {
            return false;
        }
        if (s instanceof IfStatement ifs) {
            return ifs.getElseStatement() == null
                || canCompleteNormally(ifs.getThenStatement())
                || canCompleteNormally(ifs.getElseStatement());
        }
        if (s instanceof WhileStatement ws) {
            return !isConstantTrue(ws.getExpression()) || targets.hasBreakTo(ws);
        }
        if (s instanceof DoStatement ds) {
            boolean bodyFallsThrough = canCompleteNormally(ds.getBody()) || targets.hasContinueTo(ds);
            return (bodyFallsThrough && !isConstantTrue(ds.getExpression())) || targets.hasBreakTo(ds);
        }
        if (s instanceof ForStatement fs) {
            return !isConstantTrue(fs.getExpression()) || targets.hasBreakTo(fs);
        }
        if (s instanceof LabeledStatement ls) {
            return canCompleteNormally(ls.getBody()) || targets.hasBreakTo(ls);
        }
        if (s instanceof SynchronizedStatement ss) {
            return canCompleteNormally(ss.getBody());
        }
        if (s instanceof TryStatement ts) {
            boolean tryOrCatch = canCompleteNormally(ts.getBody());
            for (Object c : ts.catchClauses()) {
                tryOrCatch |= canCompleteNormally(((CatchClause) c).getBody());
            }
            return tryOrCatch && (ts.getFinally() == null || canCompleteNormally(ts.getFinally()));
        }
        if (s instanceof SwitchStatement sw) {
            return switchCanCompleteNormally(sw);
        }
        return true;
    }

    private boolean switchCanCompleteNormally(SwitchStatement sw) {
        boolean hasDefault = false;
        boolean arrowForm = false;
        for (Object o : sw.statements()) {
            if (o instanceof SwitchCase sc) {
                hasDefault |= sc.isDefault();
                arrowForm |= sc.isSwitchLabeledRule();
            }
        }
        if (!hasDefault || targets.hasBreakTo(sw) || sw.statements().isEmpty()) {
            return true;
        }
        if (arrowForm) {
            for (Object o : sw.statements()) {
                if (!(o instanceof SwitchCase) && canCompleteNormally((Statement) o)) return true;
            }
            return false;
        }
        Object last = sw.statements().get(sw.statements().size() - 1);
        return last instanceof SwitchCase || canCompleteNormally((Statement) last);
    }

    boolean isConstantTrue(Expression condition) {
        return constants.isConstantTrue(condition);
    }
}
