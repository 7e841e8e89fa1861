package com.miniformula.error;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Messages - 本地化错误信息
 *
 * 从资源包 com/miniformula/messages.properties 读取模板,
 * 用MessageFormat填充参数。找不到的key原样返回,不影响异常抛出。
 */
public final class Messages {

    private static final String BUNDLE_NAME = "com.miniformula.messages";

    private Messages() {
    }

    /**
     * 获取格式化后的本地化信息
     *
     * @param key 资源key
     * @param args 模板参数
     * @return 本地化信息
     */
    public static String get(String key, Object... args) {
        String pattern;
        try {
            pattern = ResourceBundle.getBundle(BUNDLE_NAME).getString(key);
        } catch (MissingResourceException e) {
            return key;
        }
        return MessageFormat.format(pattern, args);
    }
}
