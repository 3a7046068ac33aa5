package com.windfarm.conformance.alignment;

import java.util.Locale;
import java.util.Objects;

/**
 * 同名列冲突的处理策略。
 *
 * KEEP_FIRST 保留第一次出现的列；KEEP_LAST 保留最后一次出现的列；
 * FAIL 视为结构错误；RENAME:&lt;name&gt; 保留第一列，其余重命名。
 */
public final class ColumnCollisionPolicy {

    public enum Action { KEEP_FIRST, KEEP_LAST, FAIL, RENAME }

    public static final ColumnCollisionPolicy KEEP_FIRST = new ColumnCollisionPolicy(Action.KEEP_FIRST, null);
    public static final ColumnCollisionPolicy KEEP_LAST = new ColumnCollisionPolicy(Action.KEEP_LAST, null);
    public static final ColumnCollisionPolicy FAIL = new ColumnCollisionPolicy(Action.FAIL, null);

    private final Action action;
    /** 仅RENAME使用 */
    private final String renameTo;

    private ColumnCollisionPolicy(Action action, String renameTo) {
        this.action = action;
        this.renameTo = renameTo;
    }

    public static ColumnCollisionPolicy rename(String newName) {
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("RENAME policy requires a target column name");
        }
        return new ColumnCollisionPolicy(Action.RENAME, newName.trim());
    }

    /** 解析 KEEP_FIRST / KEEP_LAST / FAIL / RENAME:name */
    public static ColumnCollisionPolicy parse(String text) {
        String value = Objects.requireNonNull(text, "policy").trim();
        String upper = value.toUpperCase(Locale.ROOT);
        if (upper.startsWith("RENAME:")) {
            return rename(value.substring("RENAME:".length()));
        }
        switch (upper) {
            case "KEEP_FIRST": return KEEP_FIRST;
            case "KEEP_LAST": return KEEP_LAST;
            case "FAIL": return FAIL;
            default: throw new IllegalArgumentException("Unknown column collision policy: " + text);
        }
    }

    public Action getAction() { return action; }
    public String getRenameTo() { return renameTo; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnCollisionPolicy)) return false;
        ColumnCollisionPolicy other = (ColumnCollisionPolicy) o;
        return action == other.action && Objects.equals(renameTo, other.renameTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, renameTo);
    }

    @Override
    public String toString() {
        return action == Action.RENAME ? "RENAME:" + renameTo : action.name();
    }
}
