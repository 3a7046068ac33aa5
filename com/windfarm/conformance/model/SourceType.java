package com.windfarm.conformance.model;

/**
 * 数据源类型
 */
public enum SourceType {
    /** 风机SCADA，按(风机, 时间)组织 */
    SCADA(true),
    /** 关口电表，按电站时间组织 */
    METER(false),
    /** 限电/可利用率记录，按电站时间组织 */
    CURTAILMENT(false),
    /** 再分析气象产品，按时间组织 */
    REANALYSIS(false);

    private final boolean entityKeyed;

    SourceType(boolean entityKeyed) {
        this.entityKeyed = entityKeyed;
    }

    /** 该类型的数据是否按资产标识区分 */
    public boolean isEntityKeyed() { return entityKeyed; }
}
