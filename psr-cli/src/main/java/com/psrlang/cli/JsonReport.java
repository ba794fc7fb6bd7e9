package com.psrlang.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.psrlang.compiler.TransformResult;
import com.psrlang.compiler.diagnostic.Diagnostic;

import java.util.Map;

/**
 * 转换结果的 JSON 报告
 */
final class JsonReport {

    private final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();
    private final JsonArray files = new JsonArray();

    /**
     * 记录一个文件的结果
     *
     * @param includeCode 代码不写入文件时放进报告
     */
    void add(String file, String output, TransformResult result, boolean includeCode) {
        JsonObject entry = new JsonObject();
        entry.addProperty("file", file);
        entry.addProperty("output", output);
        entry.addProperty("success", result.isSuccess());
        if (includeCode) {
            entry.addProperty("code", result.getCode());
        }
        JsonArray diagnostics = new JsonArray();
        for (Diagnostic d : result.getDiagnostics()) {
            diagnostics.add(toJson(d));
        }
        entry.add("diagnostics", diagnostics);
        if (result.getMetrics() != null) {
            JsonObject metrics = new JsonObject();
            for (Map.Entry<String, Long> metric : result.getMetrics().toMap().entrySet()) {
                metrics.addProperty(metric.getKey(), metric.getValue());
            }
            entry.add("metrics", metrics);
        } else {
            entry.add("metrics", null);
        }
        files.add(entry);
    }

    static JsonObject toJson(Diagnostic d) {
        JsonObject json = new JsonObject();
        json.addProperty("type", d.getType().getId());
        json.addProperty("phase", d.getPhase().getId());
        json.addProperty("message", d.getMessage());
        if (d.hasLocation()) {
            json.addProperty("line", d.getLine());
            json.addProperty("column", d.getColumn());
        }
        return json;
    }

    String toJson() {
        JsonObject root = new JsonObject();
        root.add("files", files);
        int failed = 0;
        for (int i = 0; i < files.size(); i++) {
            if (!files.get(i).getAsJsonObject().get("success").getAsBoolean()) failed++;
        }
        root.addProperty("failed", failed);
        return gson.toJson(root);
    }
}
