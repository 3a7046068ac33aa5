package com.windfarm.conformance.exception;

/**
 * 资产标识在各数据源之间无法对应：被引用的资产不在资产表中，或资产表内重复声明。
 */
public class EntityReconciliationException extends ConformanceException {

    private final String assetId;

    public EntityReconciliationException(String sourceName, String assetId, String detail) {
        super(sourceName, "Entity reconciliation failed for asset '" + assetId + "'"
                + (sourceName != null ? " in source '" + sourceName + "'" : "") + ": " + detail);
        this.assetId = assetId;
    }

    public String getAssetId() { return assetId; }
}
