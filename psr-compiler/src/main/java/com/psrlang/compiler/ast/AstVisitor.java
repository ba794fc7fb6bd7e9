package com.psrlang.compiler.ast;

import com.psrlang.compiler.ast.decl.*;
import com.psrlang.compiler.ast.expr.*;
import com.psrlang.compiler.ast.jsx.*;
import com.psrlang.compiler.ast.stmt.*;
import com.psrlang.compiler.ast.type.*;

/**
 * AST 访问者接口
 *
 * <p>所有方法提供默认实现（返回 null），实现类只需覆盖感兴趣的节点类型。
 * 类型注解统一走 {@link #visitTypeNode}，具体形态用 instanceof 区分。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 声明 ============

    default R visitProgram(Program node, C ctx) { return null; }

    default R visitImportDecl(ImportDecl node, C ctx) { return null; }

    default R visitImportSpecifier(ImportSpecifier node, C ctx) { return null; }

    default R visitExportDecl(ExportDecl node, C ctx) { return null; }

    default R visitExportSpecifier(ExportSpecifier node, C ctx) { return null; }

    default R visitVariableDecl(VariableDecl node, C ctx) { return null; }

    default R visitVariableDeclarator(VariableDeclarator node, C ctx) { return null; }

    default R visitFunctionDecl(FunctionDecl node, C ctx) { return null; }

    default R visitComponentDecl(ComponentDecl node, C ctx) { return null; }

    default R visitClassDecl(ClassDecl node, C ctx) { return null; }

    default R visitPropertyMember(PropertyMember node, C ctx) { return null; }

    default R visitMethodMember(MethodMember node, C ctx) { return null; }

    default R visitIndexSignatureMember(IndexSignatureMember node, C ctx) { return null; }

    default R visitStaticBlockMember(StaticBlockMember node, C ctx) { return null; }

    default R visitInterfaceDecl(InterfaceDecl node, C ctx) { return null; }

    default R visitTypeAliasDecl(TypeAliasDecl node, C ctx) { return null; }

    default R visitEnumDecl(EnumDecl node, C ctx) { return null; }

    default R visitEnumMember(EnumMember node, C ctx) { return null; }

    default R visitNamespaceDecl(NamespaceDecl node, C ctx) { return null; }

    default R visitParameter(Parameter node, C ctx) { return null; }

    default R visitDecorator(Decorator node, C ctx) { return null; }

    // ============ 语句 ============

    default R visitBlock(Block node, C ctx) { return null; }

    default R visitExpressionStmt(ExpressionStmt node, C ctx) { return null; }

    default R visitIfStmt(IfStmt node, C ctx) { return null; }

    default R visitForStmt(ForStmt node, C ctx) { return null; }

    default R visitForInStmt(ForInStmt node, C ctx) { return null; }

    default R visitWhileStmt(WhileStmt node, C ctx) { return null; }

    default R visitDoWhileStmt(DoWhileStmt node, C ctx) { return null; }

    default R visitReturnStmt(ReturnStmt node, C ctx) { return null; }

    default R visitBreakStmt(BreakStmt node, C ctx) { return null; }

    default R visitContinueStmt(ContinueStmt node, C ctx) { return null; }

    default R visitThrowStmt(ThrowStmt node, C ctx) { return null; }

    default R visitTryStmt(TryStmt node, C ctx) { return null; }

    default R visitCatchClause(CatchClause node, C ctx) { return null; }

    default R visitSwitchStmt(SwitchStmt node, C ctx) { return null; }

    default R visitSwitchCase(SwitchCase node, C ctx) { return null; }

    default R visitLabeledStmt(LabeledStmt node, C ctx) { return null; }

    default R visitEmptyStmt(EmptyStmt node, C ctx) { return null; }

    default R visitDebuggerStmt(DebuggerStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitIdentifier(Identifier node, C ctx) { return null; }

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitTemplateLiteral(TemplateLiteral node, C ctx) { return null; }

    default R visitTaggedTemplateExpr(TaggedTemplateExpr node, C ctx) { return null; }

    default R visitArrayLiteral(ArrayLiteral node, C ctx) { return null; }

    default R visitObjectLiteral(ObjectLiteral node, C ctx) { return null; }

    default R visitObjectProperty(ObjectProperty node, C ctx) { return null; }

    default R visitFunctionExpr(FunctionExpr node, C ctx) { return null; }

    default R visitArrowFunction(ArrowFunction node, C ctx) { return null; }

    default R visitClassExpr(ClassExpr node, C ctx) { return null; }

    default R visitUnaryExpr(UnaryExpr node, C ctx) { return null; }

    default R visitUpdateExpr(UpdateExpr node, C ctx) { return null; }

    default R visitBinaryExpr(BinaryExpr node, C ctx) { return null; }

    default R visitAssignExpr(AssignExpr node, C ctx) { return null; }

    default R visitConditionalExpr(ConditionalExpr node, C ctx) { return null; }

    default R visitCallExpr(CallExpr node, C ctx) { return null; }

    default R visitNewExpr(NewExpr node, C ctx) { return null; }

    default R visitMemberExpr(MemberExpr node, C ctx) { return null; }

    default R visitIndexExpr(IndexExpr node, C ctx) { return null; }

    default R visitNonNullExpr(NonNullExpr node, C ctx) { return null; }

    default R visitTypeAssertionExpr(TypeAssertionExpr node, C ctx) { return null; }

    default R visitSequenceExpr(SequenceExpr node, C ctx) { return null; }

    default R visitSpreadElement(SpreadElement node, C ctx) { return null; }

    default R visitAwaitExpr(AwaitExpr node, C ctx) { return null; }

    default R visitYieldExpr(YieldExpr node, C ctx) { return null; }

    default R visitParenExpr(ParenExpr node, C ctx) { return null; }

    default R visitThisExpr(ThisExpr node, C ctx) { return null; }

    default R visitSuperExpr(SuperExpr node, C ctx) { return null; }

    default R visitMetaProperty(MetaProperty node, C ctx) { return null; }

    // ============ JSX ============

    default R visitJsxElement(JsxElement node, C ctx) { return null; }

    default R visitJsxFragment(JsxFragment node, C ctx) { return null; }

    default R visitJsxText(JsxText node, C ctx) { return null; }

    default R visitJsxExpressionContainer(JsxExpressionContainer node, C ctx) { return null; }

    default R visitJsxAttribute(JsxAttribute node, C ctx) { return null; }

    default R visitJsxSpreadAttribute(JsxSpreadAttribute node, C ctx) { return null; }

    // ============ 类型 ============

    default R visitTypeNode(TypeNode node, C ctx) { return null; }

    default R visitTypeParams(TypeParams node, C ctx) { return null; }

    default R visitTypeParameter(TypeParameter node, C ctx) { return null; }
}
