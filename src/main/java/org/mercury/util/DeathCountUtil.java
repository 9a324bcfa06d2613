package org.mercury.util;

import org.springframework.amqp.core.MessageProperties;

import java.util.List;
import java.util.Map;

/**
 * x-death 死信记录工具类
 * - broker 每次死信路由都会累加 x-death 记录中的 count
 * - 只取首条记录，与已部署服务的计数口径一致
 */
public final class DeathCountUtil {

    public static final String X_DEATH_HEADER = "x-death";

    private static final String COUNT_KEY = "count";

    private DeathCountUtil() {
    }

    /**
     * 读取已发生的死信次数
     *
     * @param properties 消息属性
     * @return 死信次数，无记录返回 0
     */
    public static long deathCount(MessageProperties properties) {
        if (properties == null) {
            return 0L;
        }
        Object header = properties.getHeaders().get(X_DEATH_HEADER);
        if (!(header instanceof List) || ((List<?>) header).isEmpty()) {
            return 0L;
        }
        Object first = ((List<?>) header).get(0);
        if (!(first instanceof Map)) {
            return 0L;
        }
        Object count = ((Map<?, ?>) first).get(COUNT_KEY);
        return count instanceof Number ? ((Number) count).longValue() : 0L;
    }
}
