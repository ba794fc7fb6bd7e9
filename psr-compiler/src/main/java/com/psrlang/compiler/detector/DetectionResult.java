package com.psrlang.compiler.detector;

/**
 * 单次组件检测结果（不可变）
 */
public final class DetectionResult {

    /** 没有任何策略命中时的策略名 */
    public static final String NONE = "none";

    private final boolean component;
    private final Confidence confidence;
    private final String strategyName;
    private final String rationale;
    private final String componentName;

    public DetectionResult(boolean component, Confidence confidence, String strategyName,
                           String rationale, String componentName) {
        this.component = component;
        this.confidence = confidence;
        this.strategyName = strategyName;
        this.rationale = rationale;
        this.componentName = componentName;
    }

    public static DetectionResult positive(String strategy, Confidence confidence, String rationale, String name) {
        return new DetectionResult(true, confidence, strategy, rationale, name);
    }

    public static DetectionResult negative(String strategy, String rationale) {
        return new DetectionResult(false, Confidence.LOW, strategy, rationale, null);
    }

    public static DetectionResult none(String name) {
        return new DetectionResult(false, Confidence.LOW, NONE, "No strategy matched", name);
    }

    public boolean isComponent() { return component; }
    public Confidence getConfidence() { return confidence; }
    public String getStrategyName() { return strategyName; }
    public String getRationale() { return rationale; }
    public String getComponentName() { return componentName; }

    @Override
    public String toString() {
        return (component ? "component" : "not-component") + " via " + strategyName
                + " (" + confidence + "): " + rationale;
    }
}
