package com.wangbin.scheduler.common.utils;

import com.alibaba.fastjson2.JSON;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串
     */
    public static String toJsonString(Object object) {
        try {
            return JSON.toJSONString(object);
        } catch (Exception e) {
            log.error("对象转JSON字符串失败", e);
            return null;
        }
    }
}
