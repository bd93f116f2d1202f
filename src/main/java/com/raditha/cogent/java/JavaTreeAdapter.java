package com.raditha.cogent.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseProblemException;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.type.*;
import com.raditha.cogent.tree.BindingKind;
import com.raditha.cogent.tree.Location;
import com.raditha.cogent.tree.NodeFlag;
import com.raditha.cogent.tree.NodeKind;
import com.raditha.cogent.tree.Role;
import com.raditha.cogent.tree.SyntaxNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses Java source with JavaParser and converts it into a {@link SyntaxNode} tree.
 * <p>
 * Methods and constructors become function declarations, lambdas become arrow
 * functions (they see the enclosing {@code this}), {@code &&} and {@code ||} become
 * logical expressions and Java locals are block scoped. Constructs with no special
 * meaning for scoring become {@link NodeKind#OTHER} nodes that keep their children.
 * <p>
 * Not thread safe: the underlying parser keeps state between calls.
 */
public class JavaTreeAdapter {

    private static final Logger logger = LoggerFactory.getLogger(JavaTreeAdapter.class);

    private final JavaParser parser;

    public JavaTreeAdapter() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(configuration);
    }

    /**
     * Parse and convert a compilation unit.
     *
     * @throws ParseProblemException if the source does not parse
     */
    public SyntaxNode parse(String source) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new ParseProblemException(result.getProblems());
        }
        return convert(result.getResult().get());
    }

    public SyntaxNode parse(Path file) throws IOException {
        logger.debug("Parsing {}", file);
        return parse(Files.readString(file));
    }

    public SyntaxNode convert(CompilationUnit unit) {
        SyntaxNode.Builder program = SyntaxNode.builder(NodeKind.PROGRAM).at(location(unit));
        for (ImportDeclaration declaration : unit.getImports()) {
            program.child(Role.BODY, importDeclaration(declaration));
        }
        for (TypeDeclaration<?> type : unit.getTypes()) {
            program.child(Role.BODY, typeDeclaration(type));
        }
        return program.build();
    }

    // Declarations

    private SyntaxNode importDeclaration(ImportDeclaration declaration) {
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.IMPORT_DECLARATION)
                .at(location(declaration))
                .name(declaration.getNameAsString());
        // only static member imports introduce names usable as values
        if (declaration.isStatic() && !declaration.isAsterisk()) {
            builder.child(Role.SPECIFIERS, SyntaxNode.builder(NodeKind.IDENTIFIER)
                    .at(location(declaration.getName()))
                    .name(declaration.getName().getIdentifier())
                    .build());
        }
        return builder.build();
    }

    private SyntaxNode typeDeclaration(TypeDeclaration<?> type) {
        SyntaxNode.Builder body = SyntaxNode.builder(NodeKind.CLASS_BODY).at(location(type));
        if (type instanceof EnumDeclaration enumDeclaration) {
            for (EnumConstantDeclaration constant : enumDeclaration.getEntries()) {
                body.child(Role.BODY, enumConstant(constant));
            }
        }
        for (BodyDeclaration<?> member : type.getMembers()) {
            body.children(Role.BODY, member(member));
        }
        return SyntaxNode.builder(NodeKind.CLASS_DECLARATION)
                .at(location(type))
                .name(type.getNameAsString())
                .child(Role.ID, identifier(type.getName()))
                .child(Role.BODY, body.build())
                .build();
    }

    private List<SyntaxNode> member(BodyDeclaration<?> member) {
        if (member instanceof MethodDeclaration method) {
            return List.of(function(method, method.getName(), method.getParameters(),
                    method.getBody().orElse(null), false));
        }
        if (member instanceof ConstructorDeclaration constructor) {
            return List.of(function(constructor, constructor.getName(), constructor.getParameters(),
                    constructor.getBody(), true));
        }
        if (member instanceof CompactConstructorDeclaration constructor) {
            return List.of(function(constructor, constructor.getName(), new NodeList<>(),
                    constructor.getBody(), true));
        }
        if (member instanceof FieldDeclaration field) {
            List<SyntaxNode> properties = new ArrayList<>();
            for (VariableDeclarator variable : field.getVariables()) {
                properties.add(SyntaxNode.builder(NodeKind.PROPERTY_DEFINITION)
                        .at(location(variable))
                        .child(Role.KEY, memberName(variable.getName()))
                        .child(Role.VALUE, variable.getInitializer().map(this::expression).orElse(null))
                        .build());
            }
            return properties;
        }
        if (member instanceof InitializerDeclaration initializer) {
            return List.of(statement(initializer.getBody()));
        }
        if (member instanceof TypeDeclaration<?> nested) {
            return List.of(typeDeclaration(nested));
        }
        return List.of();
    }

    private SyntaxNode enumConstant(EnumConstantDeclaration constant) {
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.OTHER)
                .at(location(constant))
                .name(constant.getNameAsString())
                .children(Role.ARGUMENTS, expressions(constant.getArguments()));
        if (constant.getClassBody().isNonEmpty()) {
            builder.child(Role.BODY, classBody(constant, constant.getClassBody()));
        }
        return builder.build();
    }

    private SyntaxNode classBody(Node owner, NodeList<BodyDeclaration<?>> members) {
        SyntaxNode.Builder body = SyntaxNode.builder(NodeKind.CLASS_BODY).at(location(owner));
        for (BodyDeclaration<?> member : members) {
            body.children(Role.BODY, member(member));
        }
        return body.build();
    }

    private SyntaxNode function(Node node, SimpleName name, NodeList<Parameter> parameters,
                                @Nullable BlockStmt body, boolean constructor) {
        return SyntaxNode.builder(NodeKind.FUNCTION_DECLARATION)
                .at(location(node))
                .name(name.getIdentifier())
                .flagIf(constructor, NodeFlag.CONSTRUCTOR)
                .child(Role.ID, identifier(name))
                .children(Role.PARAMS, parameters.stream().map(this::parameter).toList())
                .child(Role.BODY, body == null ? null : statement(body))
                .build();
    }

    private SyntaxNode parameter(Parameter parameter) {
        SyntaxNode type = type(parameter.getType());
        if (type != null && parameter.isVarArgs()) {
            type = SyntaxNode.builder(NodeKind.TYPE_ARRAY)
                    .at(location(parameter.getType()))
                    .child(Role.ELEMENT_TYPE, type)
                    .build();
        }
        return SyntaxNode.builder(NodeKind.IDENTIFIER)
                .at(location(parameter.getName()))
                .name(parameter.getNameAsString())
                .child(Role.TYPE_ANNOTATION, type)
                .build();
    }

    // Statements

    private SyntaxNode statement(Statement statement) {
        if (statement instanceof BlockStmt block) {
            return SyntaxNode.builder(NodeKind.BLOCK)
                    .at(location(block))
                    .children(Role.BODY, statements(block.getStatements()))
                    .build();
        }
        if (statement instanceof ExpressionStmt expressionStmt) {
            Expression expression = expressionStmt.getExpression();
            if (expression instanceof VariableDeclarationExpr declaration) {
                return variableDeclaration(declaration);
            }
            return SyntaxNode.builder(NodeKind.EXPRESSION_STATEMENT)
                    .at(location(expressionStmt))
                    .child(Role.EXPRESSION, expression(expression))
                    .build();
        }
        if (statement instanceof IfStmt ifStmt) {
            return SyntaxNode.builder(NodeKind.IF)
                    .at(location(ifStmt))
                    .child(Role.TEST, expression(ifStmt.getCondition()))
                    .child(Role.CONSEQUENT, statement(ifStmt.getThenStmt()))
                    .child(Role.ALTERNATE, ifStmt.getElseStmt().map(this::statement).orElse(null))
                    .build();
        }
        if (statement instanceof ForStmt forStmt) {
            return SyntaxNode.builder(NodeKind.FOR)
                    .at(location(forStmt))
                    .children(Role.INIT, expressions(forStmt.getInitialization()))
                    .child(Role.TEST, forStmt.getCompare().map(this::expression).orElse(null))
                    .children(Role.UPDATE, expressions(forStmt.getUpdate()))
                    .child(Role.BODY, statement(forStmt.getBody()))
                    .build();
        }
        if (statement instanceof ForEachStmt forEach) {
            return SyntaxNode.builder(NodeKind.FOR_OF)
                    .at(location(forEach))
                    .child(Role.LEFT, variableDeclaration(forEach.getVariable()))
                    .child(Role.RIGHT, expression(forEach.getIterable()))
                    .child(Role.BODY, statement(forEach.getBody()))
                    .build();
        }
        if (statement instanceof WhileStmt whileStmt) {
            return SyntaxNode.builder(NodeKind.WHILE)
                    .at(location(whileStmt))
                    .child(Role.TEST, expression(whileStmt.getCondition()))
                    .child(Role.BODY, statement(whileStmt.getBody()))
                    .build();
        }
        if (statement instanceof DoStmt doStmt) {
            return SyntaxNode.builder(NodeKind.DO_WHILE)
                    .at(location(doStmt))
                    .child(Role.BODY, statement(doStmt.getBody()))
                    .child(Role.TEST, expression(doStmt.getCondition()))
                    .build();
        }
        if (statement instanceof SwitchStmt switchStmt) {
            return switchNode(switchStmt, switchStmt.getSelector(), switchStmt.getEntries());
        }
        if (statement instanceof TryStmt tryStmt) {
            return SyntaxNode.builder(NodeKind.TRY)
                    .at(location(tryStmt))
                    .children(Role.INIT, expressions(tryStmt.getResources()))
                    .child(Role.BLOCK, statement(tryStmt.getTryBlock()))
                    .children(Role.HANDLER, tryStmt.getCatchClauses().stream().map(this::catchClause).toList())
                    .child(Role.FINALIZER, tryStmt.getFinallyBlock().map(this::statement).orElse(null))
                    .build();
        }
        if (statement instanceof ReturnStmt returnStmt) {
            return SyntaxNode.builder(NodeKind.RETURN)
                    .at(location(returnStmt))
                    .child(Role.ARGUMENT, returnStmt.getExpression().map(this::expression).orElse(null))
                    .build();
        }
        if (statement instanceof ThrowStmt throwStmt) {
            return SyntaxNode.builder(NodeKind.THROW)
                    .at(location(throwStmt))
                    .child(Role.ARGUMENT, expression(throwStmt.getExpression()))
                    .build();
        }
        if (statement instanceof BreakStmt breakStmt) {
            return SyntaxNode.builder(NodeKind.BREAK)
                    .at(location(breakStmt))
                    .name(breakStmt.getLabel().map(SimpleName::getIdentifier).orElse(null))
                    .build();
        }
        if (statement instanceof ContinueStmt continueStmt) {
            return SyntaxNode.builder(NodeKind.CONTINUE)
                    .at(location(continueStmt))
                    .name(continueStmt.getLabel().map(SimpleName::getIdentifier).orElse(null))
                    .build();
        }
        if (statement instanceof LabeledStmt labeled) {
            return SyntaxNode.builder(NodeKind.LABELED)
                    .at(location(labeled))
                    .name(labeled.getLabel().getIdentifier())
                    .child(Role.BODY, statement(labeled.getStatement()))
                    .build();
        }
        if (statement instanceof LocalClassDeclarationStmt local) {
            return typeDeclaration(local.getClassDeclaration());
        }
        if (statement instanceof LocalRecordDeclarationStmt local) {
            return typeDeclaration(local.getRecordDeclaration());
        }
        return other(statement);
    }

    private List<SyntaxNode> statements(NodeList<Statement> statements) {
        return statements.stream().map(this::statement).toList();
    }

    private SyntaxNode switchNode(Node node, Expression selector, NodeList<SwitchEntry> entries) {
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.SWITCH)
                .at(location(node))
                .child(Role.DISCRIMINANT, expression(selector));
        for (SwitchEntry entry : entries) {
            // an entry without labels is the default branch
            builder.child(Role.CASES, SyntaxNode.builder(NodeKind.SWITCH_CASE)
                    .at(location(entry))
                    .children(Role.TEST, expressions(entry.getLabels()))
                    .children(Role.CONSEQUENT, statements(entry.getStatements()))
                    .build());
        }
        return builder.build();
    }

    private SyntaxNode catchClause(CatchClause clause) {
        return SyntaxNode.builder(NodeKind.CATCH)
                .at(location(clause))
                .child(Role.PARAM, parameter(clause.getParameter()))
                .child(Role.BODY, statement(clause.getBody()))
                .build();
    }

    private SyntaxNode variableDeclaration(VariableDeclarationExpr declaration) {
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.VARIABLE_DECLARATION)
                .at(location(declaration))
                .binding(declaration.isFinal() ? BindingKind.CONST : BindingKind.LET);
        for (VariableDeclarator variable : declaration.getVariables()) {
            SyntaxNode id = SyntaxNode.builder(NodeKind.IDENTIFIER)
                    .at(location(variable.getName()))
                    .name(variable.getNameAsString())
                    .child(Role.TYPE_ANNOTATION, type(variable.getType()))
                    .build();
            builder.child(Role.DECLARATIONS, SyntaxNode.builder(NodeKind.VARIABLE_DECLARATOR)
                    .at(location(variable))
                    .child(Role.ID, id)
                    .child(Role.INIT, variable.getInitializer().map(this::expression).orElse(null))
                    .build());
        }
        return builder.build();
    }

    // Expressions

    private SyntaxNode expression(Expression expression) {
        if (expression instanceof EnclosedExpr enclosed) {
            return expression(enclosed.getInner());
        }
        if (expression instanceof NameExpr name) {
            return identifier(name.getName());
        }
        if (expression instanceof ThisExpr thisExpr) {
            return SyntaxNode.builder(NodeKind.THIS).at(location(thisExpr)).build();
        }
        if (expression instanceof LiteralExpr literal) {
            return literal(literal);
        }
        if (expression instanceof FieldAccessExpr fieldAccess) {
            return SyntaxNode.builder(NodeKind.MEMBER)
                    .at(location(fieldAccess))
                    .child(Role.OBJECT, expression(fieldAccess.getScope()))
                    .child(Role.PROPERTY, identifier(fieldAccess.getName()))
                    .build();
        }
        if (expression instanceof ArrayAccessExpr arrayAccess) {
            return SyntaxNode.builder(NodeKind.MEMBER)
                    .at(location(arrayAccess))
                    .flag(NodeFlag.COMPUTED)
                    .child(Role.OBJECT, expression(arrayAccess.getName()))
                    .child(Role.PROPERTY, expression(arrayAccess.getIndex()))
                    .build();
        }
        if (expression instanceof MethodCallExpr call) {
            return methodCall(call);
        }
        if (expression instanceof BinaryExpr binary) {
            return binary(binary);
        }
        if (expression instanceof AssignExpr assign) {
            return SyntaxNode.builder(NodeKind.ASSIGNMENT)
                    .at(location(assign))
                    .operator(assign.getOperator().asString())
                    .child(Role.LEFT, expression(assign.getTarget()))
                    .child(Role.RIGHT, expression(assign.getValue()))
                    .build();
        }
        if (expression instanceof UnaryExpr unary) {
            return unary(unary);
        }
        if (expression instanceof ConditionalExpr conditional) {
            return SyntaxNode.builder(NodeKind.CONDITIONAL)
                    .at(location(conditional))
                    .child(Role.TEST, expression(conditional.getCondition()))
                    .child(Role.CONSEQUENT, expression(conditional.getThenExpr()))
                    .child(Role.ALTERNATE, expression(conditional.getElseExpr()))
                    .build();
        }
        if (expression instanceof LambdaExpr lambda) {
            return lambda(lambda);
        }
        if (expression instanceof SwitchExpr switchExpr) {
            return switchNode(switchExpr, switchExpr.getSelector(), switchExpr.getEntries());
        }
        if (expression instanceof VariableDeclarationExpr declaration) {
            return variableDeclaration(declaration);
        }
        if (expression instanceof ObjectCreationExpr creation) {
            return objectCreation(creation);
        }
        if (expression instanceof ArrayCreationExpr creation) {
            List<SyntaxNode> dimensions = new ArrayList<>();
            creation.getLevels().forEach(level -> level.getDimension().ifPresent(d -> dimensions.add(expression(d))));
            return SyntaxNode.builder(NodeKind.ARRAY_LITERAL)
                    .at(location(creation))
                    .children(Role.ARGUMENTS, dimensions)
                    .children(Role.ELEMENTS, creation.getInitializer()
                            .map(init -> expressions(init.getValues()))
                            .orElse(List.of()))
                    .build();
        }
        if (expression instanceof ArrayInitializerExpr initializer) {
            return SyntaxNode.builder(NodeKind.ARRAY_LITERAL)
                    .at(location(initializer))
                    .children(Role.ELEMENTS, expressions(initializer.getValues()))
                    .build();
        }
        if (expression instanceof InstanceOfExpr instanceOf) {
            return SyntaxNode.builder(NodeKind.BINARY)
                    .at(location(instanceOf))
                    .operator("instanceof")
                    .child(Role.LEFT, expression(instanceOf.getExpression()))
                    .child(Role.RIGHT, type(instanceOf.getType()))
                    .build();
        }
        if (expression instanceof CastExpr cast) {
            return SyntaxNode.builder(NodeKind.OTHER)
                    .at(location(cast))
                    .child(Role.TYPE_ANNOTATION, type(cast.getType()))
                    .child(Role.EXPRESSION, expression(cast.getExpression()))
                    .build();
        }
        return other(expression);
    }

    private List<SyntaxNode> expressions(NodeList<Expression> expressions) {
        return expressions.stream().map(this::expression).toList();
    }

    private SyntaxNode methodCall(MethodCallExpr call) {
        SyntaxNode callee;
        if (call.getScope().isPresent()) {
            Expression scope = call.getScope().get();
            callee = SyntaxNode.builder(NodeKind.MEMBER)
                    .at(span(scope, call.getName()))
                    .child(Role.OBJECT, expression(scope))
                    .child(Role.PROPERTY, identifier(call.getName()))
                    .build();
        } else {
            callee = memberName(call.getName());
        }
        return SyntaxNode.builder(NodeKind.CALL)
                .at(location(call))
                .child(Role.CALLEE, callee)
                .children(Role.ARGUMENTS, expressions(call.getArguments()))
                .build();
    }

    private SyntaxNode binary(BinaryExpr binary) {
        BinaryExpr.Operator operator = binary.getOperator();
        boolean logical = operator == BinaryExpr.Operator.AND || operator == BinaryExpr.Operator.OR;
        return SyntaxNode.builder(logical ? NodeKind.LOGICAL : NodeKind.BINARY)
                .at(location(binary))
                .operator(operator.asString())
                .child(Role.LEFT, expression(binary.getLeft()))
                .child(Role.RIGHT, expression(binary.getRight()))
                .build();
    }

    private SyntaxNode unary(UnaryExpr unary) {
        UnaryExpr.Operator operator = unary.getOperator();
        boolean update = operator == UnaryExpr.Operator.PREFIX_INCREMENT
                || operator == UnaryExpr.Operator.PREFIX_DECREMENT
                || operator == UnaryExpr.Operator.POSTFIX_INCREMENT
                || operator == UnaryExpr.Operator.POSTFIX_DECREMENT;
        return SyntaxNode.builder(update ? NodeKind.UPDATE : NodeKind.UNARY)
                .at(location(unary))
                .operator(operator.asString())
                .flagIf(operator.isPrefix(), NodeFlag.PREFIX)
                .child(Role.ARGUMENT, expression(unary.getExpression()))
                .build();
    }

    private SyntaxNode lambda(LambdaExpr lambda) {
        Statement body = lambda.getBody();
        SyntaxNode convertedBody = body instanceof ExpressionStmt expressionBody
                ? expression(expressionBody.getExpression())
                : statement(body);
        return SyntaxNode.builder(NodeKind.ARROW_FUNCTION)
                .at(location(lambda))
                .children(Role.PARAMS, lambda.getParameters().stream().map(this::parameter).toList())
                .child(Role.BODY, convertedBody)
                .build();
    }

    private SyntaxNode objectCreation(ObjectCreationExpr creation) {
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.NEW)
                .at(location(creation))
                .child(Role.OBJECT, creation.getScope().map(this::expression).orElse(null))
                .child(Role.CALLEE, type(creation.getType()))
                .children(Role.ARGUMENTS, expressions(creation.getArguments()));
        creation.getAnonymousClassBody().ifPresent(body -> builder.child(Role.BODY, classBody(creation, body)));
        return builder.build();
    }

    private SyntaxNode literal(LiteralExpr literal) {
        Object value;
        if (literal instanceof StringLiteralExpr string) {
            value = string.asString();
        } else if (literal instanceof TextBlockLiteralExpr textBlock) {
            value = textBlock.asString();
        } else if (literal instanceof CharLiteralExpr character) {
            value = character.asChar();
        } else if (literal instanceof BooleanLiteralExpr bool) {
            value = bool.getValue();
        } else if (literal instanceof IntegerLiteralExpr integer) {
            value = integer.asNumber();
        } else if (literal instanceof LongLiteralExpr longLiteral) {
            value = longLiteral.asNumber();
        } else if (literal instanceof DoubleLiteralExpr doubleLiteral) {
            value = doubleLiteral.asDouble();
        } else {
            value = null;
        }
        return SyntaxNode.builder(NodeKind.LITERAL).at(location(literal)).value(value).build();
    }

    private SyntaxNode identifier(SimpleName name) {
        return SyntaxNode.builder(NodeKind.IDENTIFIER)
                .at(location(name))
                .name(name.getIdentifier())
                .build();
    }

    /**
     * An identifier that names a method or field rather than a variable.
     */
    private SyntaxNode memberName(SimpleName name) {
        return SyntaxNode.builder(NodeKind.IDENTIFIER)
                .at(location(name))
                .name(name.getIdentifier())
                .flag(NodeFlag.MEMBER_NAME)
                .build();
    }

    // Types

    private @Nullable SyntaxNode type(Type type) {
        if (type instanceof VarType || type instanceof UnknownType) {
            return null;
        }
        if (type instanceof PrimitiveType || type instanceof VoidType) {
            return SyntaxNode.builder(NodeKind.TYPE_KEYWORD).at(location(type)).name(type.asString()).build();
        }
        if (type instanceof ArrayType array) {
            return SyntaxNode.builder(NodeKind.TYPE_ARRAY)
                    .at(location(array))
                    .child(Role.ELEMENT_TYPE, type(array.getComponentType()))
                    .build();
        }
        if (type instanceof ClassOrInterfaceType reference) {
            return SyntaxNode.builder(NodeKind.TYPE_REFERENCE)
                    .at(location(reference))
                    .name(reference.getNameAsString())
                    .build();
        }
        if (type instanceof UnionType union) {
            return SyntaxNode.builder(NodeKind.TYPE_UNION)
                    .at(location(union))
                    .children(Role.TYPES, types(union.getElements()))
                    .build();
        }
        if (type instanceof IntersectionType intersection) {
            return SyntaxNode.builder(NodeKind.TYPE_INTERSECTION)
                    .at(location(intersection))
                    .children(Role.TYPES, types(intersection.getElements()))
                    .build();
        }
        return SyntaxNode.builder(NodeKind.TYPE_OTHER).at(location(type)).build();
    }

    private List<SyntaxNode> types(NodeList<? extends Type> types) {
        List<SyntaxNode> converted = new ArrayList<>();
        for (Type type : types) {
            SyntaxNode node = type(type);
            if (node != null) {
                converted.add(node);
            }
        }
        return converted;
    }

    // Fallback

    private SyntaxNode other(Node node) {
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.OTHER).at(location(node));
        for (Node child : node.getChildNodes()) {
            if (child instanceof Expression expression) {
                builder.child(Role.CHILD, expression(expression));
            } else if (child instanceof Statement statement) {
                builder.child(Role.CHILD, statement(statement));
            } else if (child instanceof TypeDeclaration<?> type) {
                builder.child(Role.CHILD, typeDeclaration(type));
            }
        }
        return builder.build();
    }

    static Location location(Node node) {
        return node.getRange()
                .map(range -> new Location(range.begin.line, range.begin.column, range.end.line, range.end.column))
                .orElse(Location.ZERO);
    }

    private static Location span(Node from, Node to) {
        Location start = location(from);
        Location end = location(to);
        return new Location(start.startLine(), start.startColumn(), end.endLine(), end.endColumn());
    }
}
