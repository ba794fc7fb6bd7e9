package com.psrlang.compiler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 各阶段耗时（毫秒），仅在调试模式下记录
 */
public final class TransformMetrics {

    private long lexerTime;
    private long parserTime;
    private long detectorTime;
    private long analyzerTime;
    private long emitterTime;
    private long totalTime;

    public long getLexerTime() { return lexerTime; }
    public long getParserTime() { return parserTime; }
    public long getDetectorTime() { return detectorTime; }
    public long getAnalyzerTime() { return analyzerTime; }
    public long getEmitterTime() { return emitterTime; }
    public long getTotalTime() { return totalTime; }

    void setLexerTime(long lexerTime) { this.lexerTime = lexerTime; }
    void setParserTime(long parserTime) { this.parserTime = parserTime; }
    void setDetectorTime(long detectorTime) { this.detectorTime = detectorTime; }
    void setAnalyzerTime(long analyzerTime) { this.analyzerTime = analyzerTime; }
    void setEmitterTime(long emitterTime) { this.emitterTime = emitterTime; }
    void setTotalTime(long totalTime) { this.totalTime = totalTime; }

    /** 按阶段顺序的名称 → 耗时 */
    public Map<String, Long> toMap() {
        Map<String, Long> map = new LinkedHashMap<String, Long>();
        map.put("lexerTime", lexerTime);
        map.put("parserTime", parserTime);
        map.put("detectorTime", detectorTime);
        map.put("analyzerTime", analyzerTime);
        map.put("emitterTime", emitterTime);
        map.put("totalTime", totalTime);
        return map;
    }

    @Override
    public String toString() {
        return "TransformMetrics" + toMap();
    }
}
