package com.psrlang.compiler.ir.builder;

import com.psrlang.compiler.analysis.AstWalker;
import com.psrlang.compiler.analysis.Symbol;
import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.ast.FunctionLike;
import com.psrlang.compiler.ast.decl.VariableDeclarator;
import com.psrlang.compiler.ast.expr.Expression;
import com.psrlang.compiler.ast.expr.MemberExpr;
import com.psrlang.compiler.ast.expr.SpreadElement;
import com.psrlang.compiler.ast.jsx.*;
import com.psrlang.compiler.classifier.Category;
import com.psrlang.compiler.classifier.Classification;
import com.psrlang.compiler.classifier.ReactivityClassifier;
import com.psrlang.compiler.ir.expr.IdentifierIR;
import com.psrlang.compiler.ir.jsx.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * JSX 元素和片段降级为 IR
 *
 * <p>属性和子表达式按源码 AST 分类，再用 {@link IrBuilder} 构建其值。</p>
 */
final class JsxLowering {

    private static final Logger LOG = Logger.getLogger(JsxLowering.class.getName());

    private static final String PROVIDER = "Provider";

    private final IrBuilder builder;
    private final ReactivityClassifier classifier = new ReactivityClassifier();

    JsxLowering(IrBuilder builder) {
        this.builder = builder;
    }

    Expression lowerElement(JsxElement node, BuildContext ctx) {
        ctx.markJsx();
        String tag = node.getTagName();
        if (tag == null || tag.isEmpty()) {
            throw new IrBuildException("JSX element has an empty tag name", node.getLocation());
        }
        if (node.isComponentTag()) {
            return lowerComponentCall(node, ctx);
        }

        List<AttributeIR> attributes = new ArrayList<AttributeIR>();
        List<EventHandlerIR> events = new ArrayList<EventHandlerIR>();
        List<SignalBindingIR> bindings = new ArrayList<SignalBindingIR>();
        Expression ref = null;

        for (AstNode attr : node.getAttributes()) {
            if (attr instanceof JsxSpreadAttribute) {
                Expression argument = ((JsxSpreadAttribute) attr).getArgument();
                Classification c = classifier.classify(argument, ctx.getClassificationContext());
                attributes.add(AttributeIR.spread(attr.getLocation(), builder.buildExpr(argument, ctx), c));
                continue;
            }
            JsxAttribute attribute = (JsxAttribute) attr;
            String name = attribute.getName();
            Expression value = attributeValue(attribute);

            if (JsxNames.REF.equals(name) && value != null) {
                ref = builder.buildExpr(value, ctx);
                continue;
            }
            Classification c = classifier.classifyAttribute(name, value, ctx.getClassificationContext());
            Expression built = builder.buildExpr(value, ctx);
            if (c.is(Category.EVENT)) {
                if (built == null) {
                    throw new IrBuildException("Event attribute '" + name + "' requires a handler",
                            attribute.getLocation());
                }
                events.add(new EventHandlerIR(attribute.getLocation(), name, built));
                ctx.markEventHandler();
            } else if (c.isReactive()) {
                bindings.add(new SignalBindingIR(attribute.getLocation(), name, JsxNames.domProperty(name),
                        built, c.getDependencies()));
                ctx.addDependencies(c.getDependencies());
            } else {
                attributes.add(new AttributeIR(attribute.getLocation(), name, built, c, false));
            }
        }

        List<Expression> children = lowerChildren(node.getJsxChildren(), ctx);
        boolean isStatic = events.isEmpty() && bindings.isEmpty() && ref == null && allStatic(children);
        return new ElementIR(node.getLocation(), tag, attributes, events, bindings, ref, children, isStatic);
    }

    Expression lowerFragment(JsxFragment node, BuildContext ctx) {
        ctx.markJsx();
        return new FragmentIR(node.getLocation(), lowerChildren(node.getJsxChildren(), ctx));
    }

    // ========== 组件调用 ==========

    /**
     * 标签的根名称在本文件中没有声明时按全局名称处理，由运行时环境提供
     */
    private Expression lowerComponentCall(JsxElement node, BuildContext ctx) {
        String tag = node.getTagName();
        String[] segments = tag.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IrBuildException("Invalid component tag '" + tag + "'", node.getLocation());
            }
        }
        Symbol root = ctx.lookup(segments[0]);
        if (root == null) {
            LOG.fine("Component '" + tag + "' is not declared in " + ctx.getFileName() + "; treating it as global");
        }
        Expression callee = new IdentifierIR(node.getLocation(), segments[0], ctx.resolveScope(segments[0]), false);
        for (int i = 1; i < segments.length; i++) {
            callee = new MemberExpr(node.getLocation(), callee, segments[i], false);
        }

        List<AttributeIR> props = new ArrayList<AttributeIR>();
        for (AstNode attr : node.getAttributes()) {
            if (attr instanceof JsxSpreadAttribute) {
                Expression argument = ((JsxSpreadAttribute) attr).getArgument();
                Classification c = classifier.classify(argument, ctx.getClassificationContext());
                props.add(AttributeIR.spread(attr.getLocation(), builder.buildExpr(argument, ctx), c));
                continue;
            }
            JsxAttribute attribute = (JsxAttribute) attr;
            Expression value = attributeValue(attribute);
            Classification c = classifier.classifyAttribute(attribute.getName(), value,
                    ctx.getClassificationContext());
            props.add(new AttributeIR(attribute.getLocation(), attribute.getName(),
                    builder.buildExpr(value, ctx), c, false));
        }
        List<Expression> children = lowerChildren(node.getJsxChildren(), ctx);
        return new ComponentCallIR(node.getLocation(), tag, callee, props, children,
                defersChildren(segments, root));
    }

    /**
     * Provider 需要在子节点求值之前建立上下文，因此子节点以函数传入。
     * &lt;X.Provider&gt; 总是延迟；名称以 Provider 结尾的组件在本文件中有函数体时，
     * 只有函数体渲染了 .Provider 才延迟，否则一律延迟
     */
    static boolean defersChildren(String[] segments, Symbol root) {
        String last = segments[segments.length - 1];
        if (segments.length > 1) {
            return PROVIDER.equals(last);
        }
        if (!last.endsWith(PROVIDER)) {
            return false;
        }
        AstNode body = root != null ? functionBody(root.getDeclaration()) : null;
        return body == null || rendersProvider(body);
    }

    private static AstNode functionBody(AstNode declaration) {
        if (declaration instanceof VariableDeclarator) {
            Expression init = ((VariableDeclarator) declaration).getInit();
            return init instanceof FunctionLike ? ((FunctionLike) init).getBody() : null;
        }
        if (declaration instanceof FunctionLike) {
            return ((FunctionLike) declaration).getBody();
        }
        return null;
    }

    private static boolean rendersProvider(AstNode body) {
        final boolean[] found = new boolean[1];
        AstWalker.walk(body, new AstWalker.NodeFilter() {
            @Override
            public boolean enter(AstNode node) {
                if (node instanceof JsxElement && ((JsxElement) node).getTagName().endsWith("." + PROVIDER)) {
                    found[0] = true;
                }
                return !found[0];
            }
        });
        return found[0];
    }

    // ========== 子节点 ==========

    private List<Expression> lowerChildren(List<Expression> children, BuildContext ctx) {
        List<Expression> result = new ArrayList<Expression>(children.size());
        for (Expression child : children) {
            if (child instanceof JsxText) {
                result.add(new TextIR(child.getLocation(), ((JsxText) child).getValue()));
            } else if (child instanceof JsxElement || child instanceof JsxFragment) {
                result.add(builder.buildExpr(child, ctx));
            } else if (child instanceof JsxExpressionContainer) {
                Expression lowered = lowerContainer((JsxExpressionContainer) child, ctx);
                if (lowered != null) result.add(lowered);
            } else {
                throw new IrBuildException("Unsupported JSX child", child.getLocation());
            }
        }
        return result;
    }

    private Expression lowerContainer(JsxExpressionContainer container, BuildContext ctx) {
        Expression expr = container.getExpression();
        if (expr == null) return null;
        if (expr instanceof SpreadElement) {
            Expression argument = ((SpreadElement) expr).getArgument();
            Classification c = classifier.classify(argument, ctx.getClassificationContext());
            ctx.addDependencies(c.getDependencies());
            return new ExpressionChildIR(container.getLocation(), builder.buildExpr(argument, ctx), c, true);
        }
        if (expr instanceof JsxElement || expr instanceof JsxFragment) {
            return builder.buildExpr(expr, ctx);
        }
        Classification c = classifier.classify(expr, ctx.getClassificationContext());
        if (c.isReactive()) {
            ctx.addDependencies(c.getDependencies());
        }
        return new ExpressionChildIR(container.getLocation(), builder.buildExpr(expr, ctx), c, false);
    }

    /**
     * 属性值：null 为布尔属性；字符串、{expr} 或元素
     */
    private static Expression attributeValue(JsxAttribute attribute) {
        AstNode value = attribute.getValue();
        if (value == null) return null;
        if (value instanceof JsxExpressionContainer) {
            return ((JsxExpressionContainer) value).getExpression();
        }
        if (value instanceof Expression) {
            return (Expression) value;
        }
        throw new IrBuildException("Unsupported value for attribute '" + attribute.getName() + "'",
                attribute.getLocation());
    }

    static boolean allStatic(List<Expression> children) {
        for (Expression child : children) {
            if (!isStaticChild(child)) return false;
        }
        return true;
    }

    private static boolean isStaticChild(Expression child) {
        if (child instanceof TextIR || child instanceof ComponentCallIR) return true;
        if (child instanceof ElementIR) return ((ElementIR) child).isStatic();
        if (child instanceof FragmentIR) return allStatic(((FragmentIR) child).getJsxChildren());
        if (child instanceof ExpressionChildIR) return ((ExpressionChildIR) child).isStatic();
        return false;
    }
}
