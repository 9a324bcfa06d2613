package org.mercury.event;

/**
 * 处理结果信号
 *
 * @see ProcessSuccessSignal
 * @see ProcessErrorSignal
 * @see BroadcastSuccessSignal
 */
public interface OutcomeSignal {
}
