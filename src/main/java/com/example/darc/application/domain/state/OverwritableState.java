package com.example.darc.application.domain.state;

/**
 * 非事件溯源狀態的整體覆寫能力 (降級路徑)
 *
 * <p>
 * 未繼承 {@link EventSourcedState} 的舊式狀態，會以單一 {@link StateChangedEvent} 整份寫入。
 * 重播時由狀態自行從該事件承載的新狀態複製所有可寫欄位。
 * </p>
 *
 * @param <S> 狀態本身的型別
 */
public interface OverwritableState<S> {

	void overwriteFrom(S source);
}
