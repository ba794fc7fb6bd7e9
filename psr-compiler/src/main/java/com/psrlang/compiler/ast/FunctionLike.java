package com.psrlang.compiler.ast;

import com.psrlang.compiler.ast.decl.Parameter;
import com.psrlang.compiler.ast.type.TypeNode;
import com.psrlang.compiler.ast.type.TypeParams;

import java.util.List;

/**
 * 函数形态节点的公共视图（函数声明、函数表达式、箭头函数、组件声明）
 */
public interface FunctionLike {

    /** 名称，匿名时为 null */
    String getName();

    TypeParams getTypeParams();

    List<Parameter> getParams();

    TypeNode getReturnType();

    /** 检测阶段可能补写返回类型注解 */
    void setReturnType(TypeNode returnType);

    /** 函数体：Block，箭头函数可能是表达式；重载签名为 null */
    AstNode getBody();

    boolean isAsync();

    SourceLocation getLocation();
}
