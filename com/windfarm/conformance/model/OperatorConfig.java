package com.windfarm.conformance.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 算子管道中的一步：算子标识、执行顺序（小者先执行）和该步的参数。
 */
public final class OperatorConfig {

    private final String functionId;
    private final int order;
    private final Map<String, Object> parameters;

    public OperatorConfig(String functionId, int order, Map<String, Object> parameters) {
        this.functionId = functionId;
        this.order = order;
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public String getFunctionId() { return functionId; }
    public int getOrder() { return order; }
    public Map<String, Object> getParameters() { return parameters; }

    @Override
    public String toString() {
        return functionId + "#" + order + parameters;
    }
}
