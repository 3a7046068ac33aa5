package com.windfarm.conformance.core;

import com.windfarm.conformance.model.SourceType;
import com.windfarm.conformance.model.ValidationResult;

import java.util.Map;
import java.util.Set;

/**
 * 算子注册表。算子以其元数据中的functionId注册。
 */
public interface FunctionManager {

    /**
     * @throws IllegalArgumentException 元数据缺少functionId或该标识已注册
     */
    void registerFunction(UFunction function);

    /**
     * 卸载算子并调用其cleanup。
     *
     * @return 算子存在并已卸载时返回true
     */
    boolean unregisterFunction(String functionId);

    /** 未注册时返回null */
    UFunction getFunction(String functionId);

    /** 已注册的算子标识，按字典序 */
    Set<String> getFunctionIds();

    /**
     * 校验一份算子配置：算子是否已注册、是否适用于该类数据源、参数是否满足定义。
     * 未在元数据中声明的参数只产生警告。
     */
    ValidationResult validateFunction(String functionId, Map<String, Object> parameters, SourceType sourceType);
}
