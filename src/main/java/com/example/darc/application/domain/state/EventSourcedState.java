package com.example.darc.application.domain.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 事件溯源狀態的基底類別
 *
 * <p>
 * 狀態只能透過事件改變：業務邏輯呼叫 {@link #append(Event)}，事件會立即套用並記錄在待提交清單中；
 * 交易準備時儲存引擎會原封不動地取出並清空這份清單。
 * </p>
 *
 * <p>
 * 子類別必須實作 {@link #apply(Event)} (依事件子類別分派) 與 {@link #deepCopy()}。
 * </p>
 *
 * @param <S> 子類別本身的型別
 */
public abstract class EventSourcedState<S extends EventSourcedState<S>> implements DeepCopyable<S> {

	/**
	 * 尚未寫入事件日誌的事件
	 */
	private final List<Event> pendingEvents = new ArrayList<>();

	/**
	 * 將事件套用到目前狀態。重建狀態與業務邏輯追加事件時都會呼叫。
	 *
	 * @param event 領域事件
	 */
	public abstract void apply(Event event);

	/**
	 * 套用事件並加入待提交清單。套用失敗時事件不會留在清單中。
	 */
	public void append(Event event) {
		apply(event);
		pendingEvents.add(event);
	}

	public List<Event> getPendingEvents() {
		return Collections.unmodifiableList(pendingEvents);
	}

	public void clearPendingEvents() {
		pendingEvents.clear();
	}

	/**
	 * 取出並清空待提交事件。之後以此狀態為基礎的交易只會帶出自己新增的事件。
	 */
	public List<Event> drainPendingEvents() {
		List<Event> drained = new ArrayList<>(pendingEvents);
		pendingEvents.clear();
		return drained;
	}

	/**
	 * 供子類別的 {@link #deepCopy()} 使用，事件本身不可變所以只複製清單。
	 */
	protected void copyPendingEventsTo(S target) {
		((EventSourcedState<S>) target).pendingEvents.addAll(pendingEvents);
	}
}
