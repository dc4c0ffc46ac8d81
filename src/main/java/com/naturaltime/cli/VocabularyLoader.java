package com.naturaltime.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.naturaltime.plugin.arithmetic.UnitVocabulary;
import com.naturaltime.token.RelativeTimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * 从 JSON 文件加载本地化单位别名，格式为 {"heure": "Hours", "jour": "DAYS"}。
 */
public class VocabularyLoader {
    private static final Logger logger = LoggerFactory.getLogger(VocabularyLoader.class);

    private static final TypeReference<Map<String, String>> ALIAS_MAP = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public VocabularyLoader() {
        this(new ObjectMapper());
    }

    public VocabularyLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 读取别名文件并写入词表，返回新增或覆盖的别名数量。
     */
    public int load(Path file, UnitVocabulary vocabulary) throws IOException {
        try (InputStream input = Files.newInputStream(file)) {
            int count = load(input, vocabulary);
            logger.info("已从 {} 加载 {} 个单位别名", file, count);
            return count;
        }
    }

    public int load(InputStream input, UnitVocabulary vocabulary) throws IOException {
        Map<String, String> aliases = mapper.readValue(input, ALIAS_MAP);
        return apply(aliases, vocabulary);
    }

    /**
     * 将别名到单位名称的映射写入词表；单位名称无效时抛出 IllegalArgumentException。
     */
    public static int apply(Map<String, String> aliases, UnitVocabulary vocabulary) {
        if (aliases == null) {
            return 0;
        }
        for (Map.Entry<String, String> entry : aliases.entrySet()) {
            vocabulary.put(entry.getKey(), RelativeTimeUnit.fromName(entry.getValue()));
        }
        return aliases.size();
    }
}
