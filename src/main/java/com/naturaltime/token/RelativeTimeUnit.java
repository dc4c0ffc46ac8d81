package com.naturaltime.token;

/**
 * 相对时间单位。
 */
public enum RelativeTimeUnit {
    SECONDS("Seconds"),
    MINUTES("Minutes"),
    HOURS("Hours"),
    DAYS("Days"),
    WEEKS("Weeks"),
    FORTNIGHTS("Fortnights"),
    MONTHS("Months"),
    YEARS("Years"),
    /** 无效单位，分词成功时永远不会产生，仅用于构造非法 token */
    UNKNOWN("Unknown");

    private final String displayName;

    RelativeTimeUnit(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * 按名称解析单位，同时接受枚举名与展示名，大小写不敏感。
     */
    public static RelativeTimeUnit fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("时间单位名称不能为空");
        }
        String trimmed = name.trim();
        for (RelativeTimeUnit unit : values()) {
            if (unit.name().equalsIgnoreCase(trimmed) || unit.displayName.equalsIgnoreCase(trimmed)) {
                return unit;
            }
        }
        throw new IllegalArgumentException("未知时间单位: " + name);
    }
}
