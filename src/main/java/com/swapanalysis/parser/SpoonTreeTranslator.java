package com.swapanalysis.parser;

import com.swapanalysis.syntax.*;
import spoon.reflect.code.*;
import spoon.reflect.cu.SourcePosition;
import spoon.reflect.cu.position.DeclarationSourcePosition;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtType;
import spoon.reflect.reference.CtFieldReference;
import spoon.reflect.reference.CtTypeReference;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates Spoon statement lists into the analysis tree.
 * <p>
 * Java objects and arrays are only reachable through references, so field and array accesses
 * with an explicit or implicit receiver are modelled as projections through an implicit
 * {@link Dereference}. Locals, parameters and {@code this} become single-segment paths, static
 * fields become {@code Type.FIELD} paths.
 */
public class SpoonTreeTranslator {

    static final SyntaxContext SOURCE = new SyntaxContext("source");
    static final SyntaxContext IMPLICIT = new SyntaxContext("implicit");

    /** Model node to the Spoon expression whose static type describes it. */
    private final Map<Expression, CtExpression<?>> typedNodes = new IdentityHashMap<>();

    public Map<Expression, CtExpression<?>> getTypedNodes() {
        return typedNodes;
    }

    public Block translateBlock(CtStatementList list) {
        List<Statement> statements = new ArrayList<>();
        for (CtStatement statement : list.getStatements()) {
            statements.add(translateStatement(statement));
        }
        return new Block(statements, span(list), originOf(list));
    }

    Statement translateStatement(CtStatement statement) {
        Span span = span(statement);
        if (statement instanceof CtLocalVariable<?> local) {
            Identifier identifier = new Identifier(local.getSimpleName(), nameSpan(local));
            CtExpression<?> init = local.getDefaultExpression();
            return new LocalDeclaration(
                    new BindingPattern(identifier, null, identifier.span()),
                    init == null ? null : translate(init),
                    span);
        }
        if (statement instanceof CtOperatorAssignment<?, ?> opAssign) {
            BinaryOperator operator = binaryOperator(opAssign.getKind());
            if (operator == null) {
                return new OtherStatement(statement.getClass().getSimpleName(), span);
            }
            return new CompoundAssignment(operator, translate(opAssign.getAssigned()),
                    translate(opAssign.getAssignment()), withoutTerminator(opAssign, span));
        }
        if (statement instanceof CtExpression<?> expression) {
            return new ExpressionStatement(translate(expression), span);
        }
        return new OtherStatement(statement.getClass().getSimpleName(), span);
    }

    Expression translate(CtExpression<?> expression) {
        Expression result = translateUncast(expression);
        for (CtTypeReference<?> cast : expression.getTypeCasts()) {
            result = new Cast(cast.getSimpleName(), result, span(expression));
        }
        return result;
    }

    private Expression translateUncast(CtExpression<?> e) {
        Span span = span(e);
        if (e instanceof CtOperatorAssignment<?, ?>) {
            return new OpaqueExpression("compound assignment", span);
        }
        if (e instanceof CtAssignment<?, ?> assignment) {
            return new Assign(translate(assignment.getAssigned()), translate(assignment.getAssignment()),
                    withoutTerminator(assignment, span));
        }
        if (e instanceof CtFieldAccess<?> fieldAccess) {
            return translateField(fieldAccess, span);
        }
        if (e instanceof CtVariableAccess<?> variableAccess) {
            if (variableAccess.getVariable() == null) {
                return new OpaqueExpression(e.getClass().getSimpleName(), span);
            }
            return typed(PathReference.local(variableAccess.getVariable().getSimpleName(), span), e);
        }
        if (e instanceof CtThisAccess<?>) {
            return typed(PathReference.local("this", span), e);
        }
        if (e instanceof CtArrayAccess<?, ?> arrayAccess) {
            Dereference array = dereference(translate(arrayAccess.getTarget()), arrayAccess.getTarget());
            return typed(new IndexAccess(array, translate(arrayAccess.getIndexExpression()), span), e);
        }
        if (e instanceof CtLiteral<?> literal) {
            return new Literal(String.valueOf(literal), span);
        }
        if (e instanceof CtUnaryOperator<?> unary) {
            UnaryOperator operator = unaryOperator(unary.getKind());
            if (operator == null) {
                return new OpaqueExpression("unary " + unary.getKind(), span);
            }
            return new Unary(operator, translate(unary.getOperand()), span);
        }
        if (e instanceof CtBinaryOperator<?> binary) {
            BinaryOperator operator = binaryOperator(binary.getKind());
            if (operator == null) {
                return new OpaqueExpression("binary " + binary.getKind(), span);
            }
            return new Binary(operator, translate(binary.getLeftHandOperand()),
                    translate(binary.getRightHandOperand()), span);
        }
        if (e instanceof CtTypeAccess<?> typeAccess && typeAccess.getAccessedType() != null) {
            return new PathReference(List.of(typeAccess.getAccessedType().getSimpleName()), span);
        }
        if (e instanceof CtInvocation<?> invocation) {
            return translateInvocation(invocation, span);
        }
        return new OpaqueExpression(e.getClass().getSimpleName(), span);
    }

    private Expression translateField(CtFieldAccess<?> access, Span span) {
        CtFieldReference<?> field = access.getVariable();
        if (field.isStatic() && field.getDeclaringType() != null) {
            return typed(new PathReference(
                    List.of(field.getDeclaringType().getSimpleName(), field.getSimpleName()), span), access);
        }
        CtExpression<?> target = access.getTarget();
        Expression receiver = target == null
                ? PathReference.local("this", Span.NONE)
                : translate(target);
        return typed(new FieldAccess(dereference(receiver, target), field.getSimpleName(), span), access);
    }

    private Expression translateInvocation(CtInvocation<?> invocation, Span span) {
        List<Expression> arguments = new ArrayList<>();
        for (CtExpression<?> argument : invocation.getArguments()) {
            arguments.add(translate(argument));
        }
        String name = invocation.getExecutable().getSimpleName();
        CtExpression<?> target = invocation.getTarget();
        if (target == null || target.isImplicit()) {
            return new Call(PathReference.local(name, Span.NONE), arguments, false, span);
        }
        return new MethodCall(translate(target), name, arguments, false, span);
    }

    private Dereference dereference(Expression receiver, CtExpression<?> typedBy) {
        Dereference deref = Dereference.implicitOf(receiver);
        if (typedBy != null) {
            typedNodes.put(deref, typedBy);
        }
        return deref;
    }

    private Expression typed(Expression node, CtExpression<?> spoonNode) {
        typedNodes.put(node, spoonNode);
        return node;
    }

    static Span span(CtElement element) {
        SourcePosition position = element.getPosition();
        if (position == null || !position.isValidPosition() || element.isImplicit()) {
            return Span.NONE;
        }
        return new Span(position.getSourceStart(), position.getSourceEnd() + 1, SOURCE);
    }

    /**
     * Spoon positions an expression used as a statement up to and including its {@code ;}. The
     * expression itself ends before it, so that an edit over the expression keeps the terminator.
     */
    static Span withoutTerminator(CtElement element, Span span) {
        if (!span.isKnown() || element.getPosition().getCompilationUnit() == null) {
            return span;
        }
        String source = element.getPosition().getCompilationUnit().getOriginalSourceCode();
        if (source == null || span.end() > source.length()) {
            return span;
        }
        int end = span.end();
        while (end > span.start()
                && (source.charAt(end - 1) == ';' || Character.isWhitespace(source.charAt(end - 1)))) {
            end--;
        }
        return new Span(span.start(), end, span.context());
    }

    static SyntaxContext contextOf(CtElement element) {
        return element.isImplicit() ? IMPLICIT : SOURCE;
    }

    private static Span nameSpan(CtLocalVariable<?> local) {
        if (local.getPosition() instanceof DeclarationSourcePosition declaration && declaration.isValidPosition()) {
            return new Span(declaration.getNameStart(), declaration.getNameEnd() + 1, contextOf(local));
        }
        return Span.NONE;
    }

    private static String originOf(CtElement element) {
        CtExecutable<?> executable = element.getParent(CtExecutable.class);
        CtType<?> type = element.getParent(CtType.class);
        String typeName = type != null ? type.getQualifiedName() : "<unknown>";
        if (executable == null) {
            return typeName;
        }
        return typeName + "#" + executable.getSimpleName();
    }

    static BinaryOperator binaryOperator(BinaryOperatorKind kind) {
        return switch (kind) {
            case PLUS -> BinaryOperator.ADD;
            case MINUS -> BinaryOperator.SUB;
            case MUL -> BinaryOperator.MUL;
            case DIV -> BinaryOperator.DIV;
            case MOD -> BinaryOperator.REM;
            case AND -> BinaryOperator.AND;
            case OR -> BinaryOperator.OR;
            case BITAND -> BinaryOperator.BIT_AND;
            case BITOR -> BinaryOperator.BIT_OR;
            case BITXOR -> BinaryOperator.BIT_XOR;
            case SL -> BinaryOperator.SHL;
            case SR -> BinaryOperator.SHR;
            case USR -> BinaryOperator.USHR;
            case EQ -> BinaryOperator.EQ;
            case NE -> BinaryOperator.NE;
            case LT -> BinaryOperator.LT;
            case LE -> BinaryOperator.LE;
            case GT -> BinaryOperator.GT;
            case GE -> BinaryOperator.GE;
            case INSTANCEOF -> BinaryOperator.INSTANCE_OF;
            default -> null;
        };
    }

    static UnaryOperator unaryOperator(UnaryOperatorKind kind) {
        return switch (kind) {
            case NEG -> UnaryOperator.NEG;
            case POS -> UnaryOperator.POS;
            case NOT -> UnaryOperator.NOT;
            case COMPL -> UnaryOperator.COMPL;
            case PREINC -> UnaryOperator.PRE_INC;
            case PREDEC -> UnaryOperator.PRE_DEC;
            case POSTINC -> UnaryOperator.POST_INC;
            case POSTDEC -> UnaryOperator.POST_DEC;
            default -> null;
        };
    }
}
