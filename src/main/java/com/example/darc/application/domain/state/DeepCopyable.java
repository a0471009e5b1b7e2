package com.example.darc.application.domain.state;

/**
 * 可獨立複製的狀態
 *
 * <p>
 * 儲存引擎在已提交狀態與工作副本之間傳遞狀態時一律透過 {@link #deepCopy()}，兩者之間不得共用可變物件。
 * </p>
 *
 * @param <S> 狀態本身的型別
 */
public interface DeepCopyable<S> {

	/**
	 * @return 與原物件完全獨立的結構複本
	 */
	S deepCopy();
}
