package com.psrlang.compiler.detector;

import com.psrlang.compiler.ast.AstNode;
import com.psrlang.compiler.diagnostic.Diagnostic;
import com.psrlang.compiler.diagnostic.DiagnosticType;
import com.psrlang.compiler.diagnostic.Phase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一个编译单元中所有被检测为组件的函数
 */
public final class DetectionReport {

    /**
     * 报告条目
     */
    public static final class Entry {
        private final String name;
        private final int line;
        private final int column;
        private final DetectionResult result;
        private final AstNode function;

        Entry(String name, int line, int column, DetectionResult result, AstNode function) {
            this.name = name;
            this.line = line;
            this.column = column;
            this.result = result;
            this.function = function;
        }

        public String getName() { return name; }
        public int getLine() { return line; }
        public int getColumn() { return column; }
        public DetectionResult getResult() { return result; }
        /** 被检测的函数声明、函数表达式或箭头函数 */
        public AstNode getFunction() { return function; }
    }

    private final List<Entry> entries = new ArrayList<Entry>();

    void add(String name, AstNode function, DetectionResult result) {
        entries.add(new Entry(name, function.getLocation().getLine(), function.getLocation().getColumn(),
                result, function));
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    /** 指定名称的条目，不存在时为 null */
    public Entry find(String name) {
        for (Entry entry : entries) {
            if (name.equals(entry.getName())) {
                return entry;
            }
        }
        return null;
    }

    /** 函数节点对应的条目，未被检测为组件时为 null */
    public Entry entryFor(AstNode function) {
        for (Entry entry : entries) {
            if (entry.getFunction() == function) {
                return entry;
            }
        }
        return null;
    }

    /** 每个条目一条 info 诊断（调试模式使用） */
    public List<Diagnostic> toDiagnostics() {
        List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
        for (Entry entry : entries) {
            DetectionResult r = entry.getResult();
            diagnostics.add(new Diagnostic(DiagnosticType.INFO,
                    "Detected component '" + (entry.getName() != null ? entry.getName() : "<anonymous>")
                            + "' via " + r.getStrategyName() + " (" + r.getConfidence() + "): " + r.getRationale(),
                    Phase.DETECTOR, entry.getLine(), entry.getColumn()));
        }
        return diagnostics;
    }
}
