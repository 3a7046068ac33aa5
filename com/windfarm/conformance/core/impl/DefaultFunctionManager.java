package com.windfarm.conformance.core.impl;

import com.windfarm.conformance.core.FunctionManager;
import com.windfarm.conformance.core.UFunction;
import com.windfarm.conformance.model.FunctionMetadata;
import com.windfarm.conformance.model.ParameterDefinition;
import com.windfarm.conformance.model.SourceType;
import com.windfarm.conformance.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 算子注册表默认实现，基于ConcurrentHashMap，可在多个流水线实例间共享。
 */
public class DefaultFunctionManager implements FunctionManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultFunctionManager.class);

    private final ConcurrentHashMap<String, UFunction> registry = new ConcurrentHashMap<>();

    @Override
    public void registerFunction(UFunction function) {
        FunctionMetadata metadata = function.getMetadata();
        String functionId = metadata != null ? metadata.getFunctionId() : null;
        if (functionId == null || functionId.isBlank()) {
            throw new IllegalArgumentException("Operator " + function.getClass().getName() + " declares no function id");
        }
        if (registry.putIfAbsent(functionId, function) != null) {
            throw new IllegalArgumentException("Operator '" + functionId + "' is already registered");
        }
        log.debug("Operator '{}' registered, version {}", functionId, metadata.getVersion());
    }

    @Override
    public boolean unregisterFunction(String functionId) {
        UFunction removed = functionId != null ? registry.remove(functionId) : null;
        if (removed == null) {
            log.warn("Operator '{}' not registered, nothing to unregister", functionId);
            return false;
        }
        removed.cleanup();
        log.info("Operator '{}' unregistered", functionId);
        return true;
    }

    @Override
    public UFunction getFunction(String functionId) {
        return registry.get(functionId);
    }

    @Override
    public Set<String> getFunctionIds() {
        return Collections.unmodifiableSet(new TreeSet<>(registry.keySet()));
    }

    @Override
    public ValidationResult validateFunction(String functionId, Map<String, Object> parameters, SourceType sourceType) {
        ValidationResult result = new ValidationResult(functionId);

        UFunction function = registry.get(functionId);
        if (function == null) {
            return result.error("operator is not registered");
        }
        FunctionMetadata metadata = function.getMetadata();
        if (metadata == null) {
            return result;
        }
        if (sourceType != null && !metadata.isApplicableTo(sourceType)) {
            result.error("operator is not applicable to " + sourceType + " sources");
        }

        Map<String, Object> params = parameters != null ? parameters : Collections.emptyMap();
        Set<String> declared = new HashSet<>();
        for (ParameterDefinition definition : metadata.getParameterDefinitions()) {
            declared.add(definition.getName());
            Object value = params.get(definition.getName());
            if (value == null) {
                if (definition.isRequired()) {
                    result.error("required parameter '" + definition.getName() + "' is missing");
                }
                continue;
            }
            definition.check(value, result);
        }

        for (String key : params.keySet()) {
            if (!declared.contains(key)) {
                result.warning("parameter '" + key + "' is not declared and will be ignored");
            }
        }
        return result;
    }
}
