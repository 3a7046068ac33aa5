package com.windfarm.conformance.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个算子配置的校验结果。
 * 错误与警告都以 "算子标识: " 开头，便于在聚合后的异常中定位。
 */
public class ValidationResult {

    private final String functionId;
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public ValidationResult(String functionId) {
        this.functionId = functionId;
    }

    public ValidationResult error(String message) {
        errors.add(functionId + ": " + message);
        return this;
    }

    public ValidationResult warning(String message) {
        warnings.add(functionId + ": " + message);
        return this;
    }

    public String getFunctionId() { return functionId; }
    public boolean isValid() { return errors.isEmpty(); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
}
