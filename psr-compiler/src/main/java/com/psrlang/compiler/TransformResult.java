package com.psrlang.compiler;

import com.psrlang.compiler.diagnostic.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 转换结果：生成的代码、诊断和可选的耗时统计
 *
 * <p>失败时 code 为空串，诊断中至少有一条错误说明原因。</p>
 */
public final class TransformResult {

    private final String code;
    private final List<Diagnostic> diagnostics;
    private final TransformMetrics metrics;

    public TransformResult(String code, List<Diagnostic> diagnostics, TransformMetrics metrics) {
        this.code = code != null ? code : "";
        this.diagnostics = Collections.unmodifiableList(new ArrayList<Diagnostic>(diagnostics));
        this.metrics = metrics;
    }

    public String getCode() {
        return code;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** 非调试模式下为 null */
    public TransformMetrics getMetrics() {
        return metrics;
    }

    public boolean hasErrors() {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    public List<Diagnostic> getErrors() {
        List<Diagnostic> errors = new ArrayList<Diagnostic>();
        for (Diagnostic d : diagnostics) {
            if (d.isError()) errors.add(d);
        }
        return errors;
    }

    public boolean isSuccess() {
        return !hasErrors();
    }
}
