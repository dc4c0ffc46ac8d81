package com.naturaltime.plugin;

import com.naturaltime.token.TimeToken;

import java.time.LocalDateTime;
import java.util.List;

public interface TimePlugin {

    /**
     * 返回插件来源标识，宿主据此区分 token 的归属。
     */
    String key();

    /**
     * 将原始文本切分为时间 token；无法完整识别时返回空列表。
     */
    List<TimeToken> tokenize(String text);

    /**
     * 将单个 token 应用到基准时间，返回偏移后的时间。
     */
    LocalDateTime apply(TimeToken token, LocalDateTime base);
}
