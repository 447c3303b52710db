package com.architecture.memory.flowgraph.support;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.List;

/**
 * Builds Babel-shaped AST JSON for tests.
 *
 * Every node gets a distinct start position: the line set with {@link #line(int)} and an
 * increasing column. Use {@link #at(ObjectNode, int, int)} to force a position.
 */
public class AstBuilder {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private int line = 1;
    private int column = 0;

    public AstBuilder line(int line) {
        this.line = line;
        this.column = 0;
        return this;
    }

    public static AstNode toAst(ObjectNode json) {
        return AstNode.of(json);
    }

    public static ObjectNode at(ObjectNode node, int line, int column) {
        ObjectNode start = JSON.objectNode().put("line", line).put("column", column);
        node.set("loc", JSON.objectNode().set("start", start));
        return node;
    }

    // ---------- program and statements ----------

    public ObjectNode program(ObjectNode... statements) {
        ObjectNode node = node("Program");
        node.put("sourceType", "module");
        node.set("body", array(statements));
        return node;
    }

    public ObjectNode file(ObjectNode program) {
        ObjectNode node = node("File");
        node.set("program", program);
        return node;
    }

    public ObjectNode constDecl(String name, ObjectNode init) {
        return declaration("const", id(name), init);
    }

    public ObjectNode letDecl(String name, ObjectNode init) {
        return declaration("let", id(name), init);
    }

    public ObjectNode varDecl(String name, ObjectNode init) {
        return declaration("var", id(name), init);
    }

    public ObjectNode declaration(String kind, ObjectNode target, ObjectNode init) {
        ObjectNode declarator = node("VariableDeclarator");
        declarator.set("id", target);
        declarator.set("init", init);
        ObjectNode node = node("VariableDeclaration");
        node.put("kind", kind);
        node.set("declarations", array(declarator));
        return node;
    }

    public ObjectNode exprStmt(ObjectNode expression) {
        ObjectNode node = node("ExpressionStatement");
        node.set("expression", expression);
        return node;
    }

    public ObjectNode ret(ObjectNode argument) {
        ObjectNode node = node("ReturnStatement");
        node.set("argument", argument);
        return node;
    }

    public ObjectNode block(ObjectNode... statements) {
        ObjectNode node = node("BlockStatement");
        node.set("body", array(statements));
        return node;
    }

    public ObjectNode ifStmt(ObjectNode test, ObjectNode consequent, ObjectNode alternate) {
        ObjectNode node = node("IfStatement");
        node.set("test", test);
        node.set("consequent", consequent);
        node.set("alternate", alternate);
        return node;
    }

    public ObjectNode forOf(String kind, ObjectNode target, ObjectNode iterable, ObjectNode body) {
        ObjectNode node = node("ForOfStatement");
        node.set("left", declarationWithoutInit(kind, target));
        node.set("right", iterable);
        node.set("body", body);
        node.put("await", false);
        return node;
    }

    public ObjectNode forIn(String kind, ObjectNode target, ObjectNode object, ObjectNode body) {
        ObjectNode node = node("ForInStatement");
        node.set("left", declarationWithoutInit(kind, target));
        node.set("right", object);
        node.set("body", body);
        return node;
    }

    public ObjectNode forStmt(ObjectNode init, ObjectNode test, ObjectNode update, ObjectNode body) {
        ObjectNode node = node("ForStatement");
        node.set("init", init);
        node.set("test", test);
        node.set("update", update);
        node.set("body", body);
        return node;
    }

    public ObjectNode whileStmt(ObjectNode test, ObjectNode body) {
        ObjectNode node = node("WhileStatement");
        node.set("test", test);
        node.set("body", body);
        return node;
    }

    public ObjectNode switchStmt(ObjectNode discriminant, ObjectNode... cases) {
        ObjectNode node = node("SwitchStatement");
        node.set("discriminant", discriminant);
        node.set("cases", array(cases));
        return node;
    }

    public ObjectNode switchCase(ObjectNode test, ObjectNode... consequent) {
        ObjectNode node = node("SwitchCase");
        node.set("test", test);
        node.set("consequent", array(consequent));
        return node;
    }

    public ObjectNode tryStmt(ObjectNode block, ObjectNode param, ObjectNode handlerBody, ObjectNode finalizer) {
        ObjectNode node = node("TryStatement");
        node.set("block", block);
        if (handlerBody != null) {
            ObjectNode handler = node("CatchClause");
            handler.set("param", param);
            handler.set("body", handlerBody);
            node.set("handler", handler);
        } else {
            node.putNull("handler");
        }
        node.set("finalizer", finalizer);
        return node;
    }

    public ObjectNode throwStmt(ObjectNode argument) {
        ObjectNode node = node("ThrowStatement");
        node.set("argument", argument);
        return node;
    }

    public ObjectNode importDecl(String source, ObjectNode... specifiers) {
        ObjectNode node = node("ImportDeclaration");
        node.set("specifiers", array(specifiers));
        node.set("source", str(source));
        return node;
    }

    public ObjectNode importSpecifier(String imported, String local) {
        ObjectNode node = node("ImportSpecifier");
        node.set("imported", id(imported));
        node.set("local", id(local));
        return node;
    }

    public ObjectNode importDefault(String local) {
        ObjectNode node = node("ImportDefaultSpecifier");
        node.set("local", id(local));
        return node;
    }

    // ---------- functions and classes ----------

    public ObjectNode functionDecl(String name, List<ObjectNode> params, ObjectNode... body) {
        ObjectNode node = node("FunctionDeclaration");
        node.set("id", name != null ? id(name) : null);
        node.set("params", array(params.toArray(new ObjectNode[0])));
        node.set("body", block(body));
        node.put("async", false);
        node.put("generator", false);
        return node;
    }

    public ObjectNode functionExpr(List<ObjectNode> params, ObjectNode... body) {
        ObjectNode node = node("FunctionExpression");
        node.putNull("id");
        node.set("params", array(params.toArray(new ObjectNode[0])));
        node.set("body", block(body));
        return node;
    }

    public ObjectNode arrow(List<ObjectNode> params, ObjectNode body) {
        ObjectNode node = node("ArrowFunctionExpression");
        node.set("params", array(params.toArray(new ObjectNode[0])));
        node.set("body", body);
        node.put("expression", !"BlockStatement".equals(body.path("type").asText()));
        return node;
    }

    public ObjectNode classDecl(String name, ObjectNode superClass, ObjectNode... members) {
        ObjectNode node = node("ClassDeclaration");
        node.set("id", id(name));
        node.set("superClass", superClass);
        ObjectNode body = node("ClassBody");
        body.set("body", array(members));
        node.set("body", body);
        return node;
    }

    public ObjectNode classMethod(String name, List<ObjectNode> params, ObjectNode... body) {
        ObjectNode node = node("ClassMethod");
        node.put("kind", "method");
        node.set("key", id(name));
        node.put("computed", false);
        node.put("static", false);
        node.set("params", array(params.toArray(new ObjectNode[0])));
        node.set("body", block(body));
        return node;
    }

    public ObjectNode classExpr(ObjectNode... members) {
        ObjectNode node = node("ClassExpression");
        node.putNull("id");
        node.putNull("superClass");
        ObjectNode body = node("ClassBody");
        body.set("body", array(members));
        node.set("body", body);
        return node;
    }

    // ---------- expressions ----------

    public ObjectNode id(String name) {
        ObjectNode node = node("Identifier");
        node.put("name", name);
        return node;
    }

    public ObjectNode num(long value) {
        ObjectNode node = node("NumericLiteral");
        node.put("value", value);
        return node;
    }

    public ObjectNode num(double value) {
        ObjectNode node = node("NumericLiteral");
        node.put("value", value);
        return node;
    }

    public ObjectNode str(String value) {
        ObjectNode node = node("StringLiteral");
        node.put("value", value);
        return node;
    }

    public ObjectNode bool(boolean value) {
        ObjectNode node = node("BooleanLiteral");
        node.put("value", value);
        return node;
    }

    public ObjectNode nul() {
        return node("NullLiteral");
    }

    public ObjectNode binary(String operator, ObjectNode left, ObjectNode right) {
        return operatorNode("BinaryExpression", operator, left, right);
    }

    public ObjectNode logical(String operator, ObjectNode left, ObjectNode right) {
        return operatorNode("LogicalExpression", operator, left, right);
    }

    public ObjectNode assign(String operator, ObjectNode left, ObjectNode right) {
        return operatorNode("AssignmentExpression", operator, left, right);
    }

    public ObjectNode cond(ObjectNode test, ObjectNode consequent, ObjectNode alternate) {
        ObjectNode node = node("ConditionalExpression");
        node.set("test", test);
        node.set("consequent", consequent);
        node.set("alternate", alternate);
        return node;
    }

    public ObjectNode member(ObjectNode object, String property) {
        ObjectNode node = node("MemberExpression");
        node.set("object", object);
        node.set("property", id(property));
        node.put("computed", false);
        return node;
    }

    public ObjectNode computed(ObjectNode object, ObjectNode property) {
        ObjectNode node = node("MemberExpression");
        node.set("object", object);
        node.set("property", property);
        node.put("computed", true);
        return node;
    }

    public ObjectNode optionalMember(ObjectNode object, String property) {
        ObjectNode node = node("OptionalMemberExpression");
        node.set("object", object);
        node.set("property", id(property));
        node.put("computed", false);
        node.put("optional", true);
        return node;
    }

    public ObjectNode unary(String operator, ObjectNode argument) {
        ObjectNode node = node("UnaryExpression");
        node.put("operator", operator);
        node.put("prefix", true);
        node.set("argument", argument);
        return node;
    }

    public ObjectNode update(String operator, ObjectNode argument) {
        ObjectNode node = node("UpdateExpression");
        node.put("operator", operator);
        node.put("prefix", false);
        node.set("argument", argument);
        return node;
    }

    public ObjectNode template(List<String> quasis, ObjectNode... expressions) {
        ObjectNode node = node("TemplateLiteral");
        ArrayNode elements = JSON.arrayNode();
        for (int i = 0; i < quasis.size(); i++) {
            ObjectNode quasi = node("TemplateElement");
            quasi.set("value", JSON.objectNode().put("raw", quasis.get(i)).put("cooked", quasis.get(i)));
            quasi.put("tail", i == quasis.size() - 1);
            elements.add(quasi);
        }
        node.set("quasis", elements);
        node.set("expressions", array(expressions));
        return node;
    }

    public ObjectNode tagged(ObjectNode tag, ObjectNode quasi) {
        ObjectNode node = node("TaggedTemplateExpression");
        node.set("tag", tag);
        node.set("quasi", quasi);
        return node;
    }

    public ObjectNode call(ObjectNode callee, ObjectNode... arguments) {
        ObjectNode node = node("CallExpression");
        node.set("callee", callee);
        node.set("arguments", array(arguments));
        return node;
    }

    public ObjectNode newExpr(ObjectNode callee, ObjectNode... arguments) {
        ObjectNode node = node("NewExpression");
        node.set("callee", callee);
        node.set("arguments", array(arguments));
        return node;
    }

    public ObjectNode await(ObjectNode argument) {
        ObjectNode node = node("AwaitExpression");
        node.set("argument", argument);
        return node;
    }

    public ObjectNode paren(ObjectNode expression) {
        ObjectNode node = node("ParenthesizedExpression");
        node.set("expression", expression);
        return node;
    }

    public ObjectNode tsAs(ObjectNode expression) {
        ObjectNode node = node("TSAsExpression");
        node.set("expression", expression);
        node.set("typeAnnotation", node("TSAnyKeyword"));
        return node;
    }

    public ObjectNode sequence(ObjectNode... expressions) {
        ObjectNode node = node("SequenceExpression");
        node.set("expressions", array(expressions));
        return node;
    }

    public ObjectNode thisExpr() {
        return node("ThisExpression");
    }

    public ObjectNode obj(ObjectNode... properties) {
        ObjectNode node = node("ObjectExpression");
        node.set("properties", array(properties));
        return node;
    }

    public ObjectNode prop(String key, ObjectNode value) {
        ObjectNode node = node("ObjectProperty");
        node.set("key", id(key));
        node.set("value", value);
        node.put("computed", false);
        node.put("shorthand", false);
        return node;
    }

    public ObjectNode objectMethod(String key, ObjectNode... body) {
        ObjectNode node = node("ObjectMethod");
        node.put("kind", "method");
        node.set("key", id(key));
        node.put("computed", false);
        node.set("params", JSON.arrayNode());
        node.set("body", block(body));
        return node;
    }

    public ObjectNode arr(ObjectNode... elements) {
        ObjectNode node = node("ArrayExpression");
        node.set("elements", array(elements));
        return node;
    }

    public ObjectNode spread(ObjectNode argument) {
        ObjectNode node = node("SpreadElement");
        node.set("argument", argument);
        return node;
    }

    // ---------- patterns ----------

    public ObjectNode objPattern(ObjectNode... properties) {
        ObjectNode node = node("ObjectPattern");
        node.set("properties", array(properties));
        return node;
    }

    public ObjectNode patternProp(String key, ObjectNode value) {
        ObjectNode node = node("ObjectProperty");
        node.set("key", id(key));
        node.set("value", value);
        node.put("computed", false);
        node.put("shorthand", false);
        return node;
    }

    public ObjectNode shorthand(String name) {
        ObjectNode node = node("ObjectProperty");
        node.set("key", id(name));
        node.set("value", id(name));
        node.put("computed", false);
        node.put("shorthand", true);
        return node;
    }

    public ObjectNode arrPattern(ObjectNode... elements) {
        ObjectNode node = node("ArrayPattern");
        node.set("elements", array(elements));
        return node;
    }

    public ObjectNode withDefault(ObjectNode left, ObjectNode right) {
        ObjectNode node = node("AssignmentPattern");
        node.set("left", left);
        node.set("right", right);
        return node;
    }

    public ObjectNode rest(ObjectNode argument) {
        ObjectNode node = node("RestElement");
        node.set("argument", argument);
        return node;
    }

    // ---------- helpers ----------

    public ObjectNode node(String type) {
        ObjectNode node = JSON.objectNode();
        node.put("type", type);
        return at(node, line, column++);
    }

    private ObjectNode operatorNode(String type, String operator, ObjectNode left, ObjectNode right) {
        ObjectNode node = node(type);
        node.put("operator", operator);
        node.set("left", left);
        node.set("right", right);
        return node;
    }

    private ObjectNode declarationWithoutInit(String kind, ObjectNode target) {
        ObjectNode declarator = node("VariableDeclarator");
        declarator.set("id", target);
        declarator.putNull("init");
        ObjectNode declaration = node("VariableDeclaration");
        declaration.put("kind", kind);
        declaration.set("declarations", array(declarator));
        return declaration;
    }

    // Null entries become array holes
    private static ArrayNode array(ObjectNode... items) {
        ArrayNode array = JSON.arrayNode();
        for (ObjectNode item : items) {
            if (item != null) {
                array.add(item);
            } else {
                array.addNull();
            }
        }
        return array;
    }

    public static List<ObjectNode> params(ObjectNode... params) {
        return Arrays.asList(params);
    }
}
