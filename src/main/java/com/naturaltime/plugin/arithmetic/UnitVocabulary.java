package com.naturaltime.plugin.arithmetic;

import com.naturaltime.token.RelativeTimeUnit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 单位别名词表，别名大小写不敏感。
 * 
 * 每个插件实例独占一份，可在分词前追加本地化别名；实例本身不做同步。
 */
public class UnitVocabulary {

    private final Map<String, RelativeTimeUnit> aliases = new LinkedHashMap<>();

    /**
     * 创建预置 GNU 英文别名的词表。
     */
    public UnitVocabulary() {
        putDefaults();
    }

    /**
     * 创建空词表。
     */
    public static UnitVocabulary empty() {
        UnitVocabulary vocabulary = new UnitVocabulary();
        vocabulary.clear();
        return vocabulary;
    }

    /**
     * 查找别名对应的单位。
     */
    public Optional<RelativeTimeUnit> lookup(String alias) {
        if (alias == null || alias.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(aliases.get(normalize(alias)));
    }

    /**
     * 新增或覆盖别名。
     */
    public void put(String alias, RelativeTimeUnit unit) {
        if (unit == null || unit == RelativeTimeUnit.UNKNOWN) {
            throw new IllegalArgumentException("别名必须映射到有效时间单位: " + alias);
        }
        validateAlias(alias);
        aliases.put(normalize(alias), unit);
    }

    public void putAll(Map<String, RelativeTimeUnit> entries) {
        entries.forEach(this::put);
    }

    public boolean contains(String alias) {
        return lookup(alias).isPresent();
    }

    public int size() {
        return aliases.size();
    }

    public void clear() {
        aliases.clear();
    }

    /**
     * 返回已登记别名（小写）的只读视图。
     */
    public Set<String> aliases() {
        return Collections.unmodifiableSet(aliases.keySet());
    }

    private void putDefaults() {
        put("sec", RelativeTimeUnit.SECONDS);
        put("secs", RelativeTimeUnit.SECONDS);
        put("second", RelativeTimeUnit.SECONDS);
        put("seconds", RelativeTimeUnit.SECONDS);
        put("min", RelativeTimeUnit.MINUTES);
        put("mins", RelativeTimeUnit.MINUTES);
        put("minute", RelativeTimeUnit.MINUTES);
        put("minutes", RelativeTimeUnit.MINUTES);
        put("hour", RelativeTimeUnit.HOURS);
        put("hours", RelativeTimeUnit.HOURS);
        put("day", RelativeTimeUnit.DAYS);
        put("days", RelativeTimeUnit.DAYS);
        put("week", RelativeTimeUnit.WEEKS);
        put("weeks", RelativeTimeUnit.WEEKS);
        put("fortnight", RelativeTimeUnit.FORTNIGHTS);
        put("fortnights", RelativeTimeUnit.FORTNIGHTS);
        put("month", RelativeTimeUnit.MONTHS);
        put("months", RelativeTimeUnit.MONTHS);
        put("year", RelativeTimeUnit.YEARS);
        put("years", RelativeTimeUnit.YEARS);
    }

    /**
     * 别名必须能被词法分析器整体切分为一个单词。
     */
    private void validateAlias(String alias) {
        if (alias == null || alias.isBlank()) {
            throw new IllegalArgumentException("别名不能为空");
        }
        for (int i = 0; i < alias.length(); i++) {
            char ch = alias.charAt(i);
            if (!ExpressionLexer.isWordChar(ch)) {
                throw new IllegalArgumentException("别名包含无法识别的字符 '" + ch + "': " + alias);
            }
        }
    }

    private static String normalize(String alias) {
        return alias.toLowerCase(Locale.ROOT);
    }
}
