package com.naturaltime.config;

/**
 * 全局常量定义
 * 
 * 包含插件标识、语法关键字、日历换算参数和CLI参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 插件标识 ====================
    /** 算术时间插件的来源标识 */
    public static final String ARITHMETIC_PLUGIN_KEY = "arithmetic";

    // ==================== 语法参数 ====================
    /** 取反关键字，大小写不敏感 */
    public static final String AGO_KEYWORD = "ago";
    /** 省略数值时的默认倍数 */
    public static final long DEFAULT_MAGNITUDE = 1L;
    /** 单位别名允许的复数后缀 */
    public static final char PLURAL_SUFFIX = 's';

    // ==================== 日历参数 ====================
    /** 每周天数 */
    public static final int DAYS_PER_WEEK = 7;
    /** 每两周天数 */
    public static final int DAYS_PER_FORTNIGHT = 14;
    /** 每年月数 */
    public static final int MONTHS_PER_YEAR = 12;

    // ==================== CLI参数 ====================
    /** 默认时间戳输出格式 */
    public static final String DEFAULT_TIMESTAMP_PATTERN = "yyyy-MM-dd'T'HH:mm:ss";
    /** 表达式最大长度 */
    public static final int MAX_EXPRESSION_LENGTH = 1024;
}
