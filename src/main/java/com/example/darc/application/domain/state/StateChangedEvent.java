package com.example.darc.application.domain.state;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 「整份狀態已變更」事件
 *
 * <p>
 * 僅用於非事件溯源的狀態，事件類型為 {@code "{StateName}Changed"}，會失去逐欄位的事件語意。
 * </p>
 *
 * @param <S> 狀態型別
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class StateChangedEvent<S> extends Event {

	/**
	 * 變更後的完整狀態
	 */
	private S newState;
}
