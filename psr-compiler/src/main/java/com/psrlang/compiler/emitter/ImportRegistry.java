package com.psrlang.compiler.emitter;

import com.psrlang.compiler.ast.decl.ImportDecl;
import com.psrlang.compiler.ast.decl.ImportSpecifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 导入注册表：按模块合并、去重并排序导入
 *
 * <p>每个模块通常生成一条值导入和一条 {@code import type}；同一模块以不同本地名多次默认导入或命名空间导入时，
 * 第一个绑定并入主导入语句，其余各自单独成行。仅有副作用的导入排在最前，
 * 其余模块按路径字母序输出，花括号内的说明符按字典序排列。
 * {@link #generateImportStatements(ModuleFormat)} 不修改注册表状态。</p>
 */
public final class ImportRegistry {

    /**
     * 单个模块的导入
     */
    private static final class ModuleImports {
        final Set<String> defaults = new LinkedHashSet<String>();
        final Set<String> namespaces = new LinkedHashSet<String>();
        final Set<String> named = new TreeSet<String>();      // "a"、"a as b"
        final Set<String> typeDefaults = new LinkedHashSet<String>();
        final Set<String> typeNamespaces = new LinkedHashSet<String>();
        final Set<String> typeNamed = new TreeSet<String>();
        boolean sideEffect;

        boolean hasBindings() {
            return !defaults.isEmpty() || !namespaces.isEmpty() || !named.isEmpty()
                    || !typeDefaults.isEmpty() || !typeNamespaces.isEmpty() || !typeNamed.isEmpty();
        }
    }

    private final Map<String, ModuleImports> modules = new TreeMap<String, ModuleImports>();
    private final Set<String> sideEffectOrder = new LinkedHashSet<String>();
    private final Map<String, String> localNames = new LinkedHashMap<String, String>();  // 本地名 -> 模块

    private ModuleImports module(String source) {
        ModuleImports imports = modules.get(source);
        if (imports == null) {
            imports = new ModuleImports();
            modules.put(source, imports);
        }
        return imports;
    }

    // ============ 登记 ============

    public void addNamed(String source, String imported) {
        addNamed(source, imported, imported, false);
    }

    /**
     * 登记具名导入；同一模块中相同的说明符只保留一份
     */
    public void addNamed(String source, String imported, String local, boolean typeOnly) {
        String spec = imported.equals(local) ? imported : imported + " as " + local;
        ModuleImports imports = module(source);
        if (typeOnly) {
            // 已作为值导入时，类型导入是多余的
            if (!imports.named.contains(spec)) imports.typeNamed.add(spec);
        } else {
            imports.named.add(spec);
            imports.typeNamed.remove(spec);
        }
        localNames.put(local, source);
    }

    /**
     * 登记默认导入；同一模块的每个不同本地名都会保留
     */
    public void addDefault(String source, String local, boolean typeOnly) {
        ModuleImports imports = module(source);
        addBinding(imports.defaults, imports.typeDefaults, local, typeOnly);
        localNames.put(local, source);
    }

    /**
     * 登记命名空间导入；同一模块的每个不同本地名都会保留
     */
    public void addNamespace(String source, String local, boolean typeOnly) {
        ModuleImports imports = module(source);
        addBinding(imports.namespaces, imports.typeNamespaces, local, typeOnly);
        localNames.put(local, source);
    }

    private static void addBinding(Set<String> values, Set<String> types, String local, boolean typeOnly) {
        if (typeOnly) {
            if (!values.contains(local)) types.add(local);
        } else {
            values.add(local);
            types.remove(local);
        }
    }

    public void addSideEffect(String source) {
        module(source).sideEffect = true;
        sideEffectOrder.add(source);
    }

    /**
     * 合并源码中的一条 import 声明
     */
    public void addImportDecl(ImportDecl decl) {
        String source = decl.getSource();
        if (decl.isSideEffectOnly()) {
            addSideEffect(source);
            return;
        }
        boolean typeOnly = decl.isTypeOnly();
        if (decl.getDefaultBinding() != null) {
            addDefault(source, decl.getDefaultBinding(), typeOnly);
        }
        if (decl.getNamespaceBinding() != null) {
            addNamespace(source, decl.getNamespaceBinding(), typeOnly);
        }
        for (ImportSpecifier specifier : decl.getSpecifiers()) {
            addNamed(source, specifier.getImported(), specifier.getLocal(), typeOnly || specifier.isTypeOnly());
        }
    }

    // ============ 查询 ============

    /** 本地名是否已被某个导入绑定 */
    public boolean isBound(String local) {
        return localNames.containsKey(local);
    }

    public boolean isEmpty() {
        return modules.isEmpty();
    }

    public int getModuleCount() {
        return modules.size();
    }

    // ============ 生成 ============

    /**
     * 按确定顺序生成导入语句，每条一行
     */
    public List<String> generateImportStatements(ModuleFormat format) {
        List<String> lines = new ArrayList<String>();
        // 只有副作用的模块保持源码顺序，排在最前
        for (String source : sideEffectOrder) {
            ModuleImports imports = modules.get(source);
            if (!imports.hasBindings()) {
                lines.add(format == ModuleFormat.CJS
                        ? "require(" + quote(source) + ");"
                        : "import " + quote(source) + ";");
            }
        }
        for (Map.Entry<String, ModuleImports> entry : modules.entrySet()) {
            ModuleImports imports = entry.getValue();
            if (!imports.hasBindings()) continue;
            if (format == ModuleFormat.CJS) {
                valueRequires(entry.getKey(), imports, lines);
            } else {
                valueImports(entry.getKey(), imports, lines);
            }
            typeImports(entry.getKey(), imports, lines);
        }
        return lines;
    }

    public List<String> generateImportStatements() {
        return generateImportStatements(ModuleFormat.ESM);
    }

    private static void valueImports(String source, ModuleImports imports, List<String> lines) {
        String from = " from " + quote(source) + ";";
        String defaultBinding = first(imports.defaults);
        String namespaceBinding = first(imports.namespaces);
        List<String> clauses = new ArrayList<String>();
        if (defaultBinding != null) clauses.add(defaultBinding);
        if (namespaceBinding != null) {
            clauses.add("* as " + namespaceBinding);
            // import * as ns 不能与 { ... } 写在同一条语句中
            if (!imports.named.isEmpty()) {
                lines.add("import " + join(clauses) + from);
                clauses.clear();
            }
        }
        if (!imports.named.isEmpty()) clauses.add(braces(imports.named));
        if (!clauses.isEmpty()) {
            lines.add("import " + join(clauses) + from);
        }
        for (String local : imports.defaults) {
            if (!local.equals(defaultBinding)) lines.add("import " + local + from);
        }
        for (String local : imports.namespaces) {
            if (!local.equals(namespaceBinding)) lines.add("import * as " + local + from);
        }
    }

    private static void valueRequires(String source, ModuleImports imports, List<String> lines) {
        String require = "require(" + quote(source) + ")";
        for (String local : imports.namespaces) {
            lines.add("const " + local + " = " + require + ";");
        }
        for (String local : imports.defaults) {
            lines.add("const " + local + " = " + require + ".default;");
        }
        if (!imports.named.isEmpty()) {
            List<String> parts = new ArrayList<String>();
            for (String spec : imports.named) {
                parts.add(spec.replace(" as ", ": "));
            }
            lines.add("const { " + String.join(", ", parts) + " } = " + require + ";");
        }
    }

    private static void typeImports(String source, ModuleImports imports, List<String> lines) {
        String from = " from " + quote(source) + ";";
        // import type 只能有默认导入或具名导入之一
        for (String local : imports.typeDefaults) {
            lines.add("import type " + local + from);
        }
        for (String local : imports.typeNamespaces) {
            lines.add("import type * as " + local + from);
        }
        if (!imports.typeNamed.isEmpty()) {
            lines.add("import type " + braces(imports.typeNamed) + from);
        }
    }

    private static String first(Set<String> bindings) {
        return bindings.isEmpty() ? null : bindings.iterator().next();
    }

    private static String braces(Set<String> specs) {
        return "{ " + String.join(", ", specs) + " }";
    }

    private static String join(List<String> clauses) {
        return String.join(", ", clauses);
    }

    private static String quote(String source) {
        return StringEscapes.singleQuoted(source);
    }
}
