package com.windfarm.conformance.contract;

/**
 * 字段取值非法时的处理策略
 */
public enum InvalidValuePolicy {
    /** 置空单元格，保留该行 */
    NULL_CELL,
    /** 删除整行 */
    DROP_ROW
}
