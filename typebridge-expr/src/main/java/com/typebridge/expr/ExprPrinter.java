package com.typebridge.expr;

import com.typebridge.expr.node.*;
import com.typebridge.model.MemberDescriptor;

import java.util.List;

/**
 * 表达式的确定性文本形式，用于 toString 和诊断信息。
 * <pre>
 * Let(x, Value(5), Call(demo.Util.Twice, [x]))
 * </pre>
 */
public final class ExprPrinter implements ExprVisitor<Void, StringBuilder> {

    private static final ExprPrinter INSTANCE = new ExprPrinter();

    private ExprPrinter() {
    }

    public static String print(Expr expr) {
        StringBuilder sb = new StringBuilder();
        INSTANCE.append(expr, sb);
        return sb.toString();
    }

    private void append(Expr expr, StringBuilder sb) {
        if (expr == null) {
            sb.append("null");
        } else {
            expr.accept(this, sb);
        }
    }

    private void appendList(List<Expr> exprs, StringBuilder sb) {
        sb.append('[');
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) sb.append(", ");
            append(exprs.get(i), sb);
        }
        sb.append(']');
    }

    private static String member(MemberDescriptor m) {
        return m.getDeclaringType() + "." + m.getName();
    }

    /** 实例成员先打印 target，静态成员省略。 */
    private void appendTarget(Expr target, StringBuilder sb) {
        if (target != null) {
            append(target, sb);
            sb.append(", ");
        }
    }

    @Override
    public Void visitCall(CallExpr node, StringBuilder sb) {
        sb.append("Call(");
        appendTarget(node.getTarget(), sb);
        sb.append(member(node.getMethod()));
        if (node.getMethod().isGenericMethod()) {
            sb.append(node.getMethod().getGenericArguments());
        }
        sb.append(", ");
        appendList(node.getArgs(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitPropertyGet(PropertyGetExpr node, StringBuilder sb) {
        sb.append("PropertyGet(");
        appendTarget(node.getTarget(), sb);
        sb.append(member(node.getProperty())).append(", ");
        appendList(node.getIndexArgs(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitPropertySet(PropertySetExpr node, StringBuilder sb) {
        sb.append("PropertySet(");
        appendTarget(node.getTarget(), sb);
        sb.append(member(node.getProperty())).append(", ");
        appendList(node.getIndexArgs(), sb);
        sb.append(", ");
        append(node.getValue(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitFieldGet(FieldGetExpr node, StringBuilder sb) {
        sb.append("FieldGet(");
        appendTarget(node.getTarget(), sb);
        sb.append(member(node.getField())).append(')');
        return null;
    }

    @Override
    public Void visitFieldSet(FieldSetExpr node, StringBuilder sb) {
        sb.append("FieldSet(");
        appendTarget(node.getTarget(), sb);
        sb.append(member(node.getField())).append(", ");
        append(node.getValue(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitNewObject(NewObjectExpr node, StringBuilder sb) {
        sb.append("NewObject(").append(node.getType()).append(", ");
        appendList(node.getArgs(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitCoerce(CoerceExpr node, StringBuilder sb) {
        sb.append("Coerce(");
        append(node.getOperand(), sb);
        sb.append(", ").append(node.getType()).append(')');
        return null;
    }

    @Override
    public Void visitNewArray(NewArrayExpr node, StringBuilder sb) {
        sb.append("NewArray(").append(node.getElementType()).append(", ");
        appendList(node.getElements(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitNewTuple(NewTupleExpr node, StringBuilder sb) {
        sb.append("NewTuple");
        appendList(node.getElements(), sb);
        return null;
    }

    @Override
    public Void visitTupleGet(TupleGetExpr node, StringBuilder sb) {
        sb.append("TupleGet(");
        append(node.getTuple(), sb);
        sb.append(", ").append(node.getIndex()).append(')');
        return null;
    }

    @Override
    public Void visitNewDelegate(NewDelegateExpr node, StringBuilder sb) {
        sb.append("NewDelegate(").append(node.getType()).append(", ").append(node.getParameters()).append(", ");
        append(node.getBody(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitLet(LetExpr node, StringBuilder sb) {
        sb.append("Let(").append(node.getVar().getName()).append(", ");
        append(node.getValue(), sb);
        sb.append(", ");
        append(node.getBody(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitVar(VarExpr node, StringBuilder sb) {
        sb.append(node.getVar().getName());
        return null;
    }

    @Override
    public Void visitLambda(LambdaExpr node, StringBuilder sb) {
        sb.append("Lambda(").append(node.getParameter().getName()).append(", ");
        append(node.getBody(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitApplication(ApplicationExpr node, StringBuilder sb) {
        sb.append("Application(");
        append(node.getFunction(), sb);
        sb.append(", ");
        append(node.getArgument(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitNewUnionCase(NewUnionCaseExpr node, StringBuilder sb) {
        sb.append("NewUnionCase(").append(node.getUnionCase()).append(", ");
        appendList(node.getArgs(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitNewRecord(NewRecordExpr node, StringBuilder sb) {
        sb.append("NewRecord(").append(node.getType()).append(", ");
        appendList(node.getArgs(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitUnionCaseTest(UnionCaseTestExpr node, StringBuilder sb) {
        sb.append("UnionCaseTest(");
        append(node.getTarget(), sb);
        sb.append(", ").append(node.getUnionCase()).append(')');
        return null;
    }

    @Override
    public Void visitValue(ValueExpr node, StringBuilder sb) {
        Object value = node.getValue();
        sb.append("Value(");
        if (value instanceof String) {
            sb.append('"').append(value).append('"');
        } else {
            sb.append(value);
        }
        sb.append(')');
        return null;
    }

    @Override
    public Void visitOperation(OperationExpr node, StringBuilder sb) {
        List<Expr> operands = node.getOperands();
        sb.append('(');
        if (operands.size() == 1) {
            sb.append(node.getOperator().getSymbol()).append(' ');
            append(operands.get(0), sb);
        } else {
            append(operands.get(0), sb);
            sb.append(' ').append(node.getOperator().getSymbol()).append(' ');
            append(operands.get(1), sb);
        }
        sb.append(')');
        return null;
    }

    @Override
    public Void visitIfThenElse(IfThenElseExpr node, StringBuilder sb) {
        sb.append("IfThenElse(");
        append(node.getCondition(), sb);
        sb.append(", ");
        append(node.getThenExpr(), sb);
        sb.append(", ");
        append(node.getElseExpr(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitSequential(SequentialExpr node, StringBuilder sb) {
        sb.append("Sequential(");
        append(node.getFirst(), sb);
        sb.append(", ");
        append(node.getSecond(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitVarSet(VarSetExpr node, StringBuilder sb) {
        sb.append("VarSet(").append(node.getVar().getName()).append(", ");
        append(node.getValue(), sb);
        sb.append(')');
        return null;
    }

    @Override
    public Void visitWhileLoop(WhileLoopExpr node, StringBuilder sb) {
        sb.append("WhileLoop(");
        append(node.getCondition(), sb);
        sb.append(", ");
        append(node.getBody(), sb);
        sb.append(')');
        return null;
    }
}
