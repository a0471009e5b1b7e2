package com.example.darc.application.service;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.example.darc.application.domain.state.DeepCopyable;
import com.example.darc.application.domain.state.DomainEvent;
import com.example.darc.application.domain.state.Event;
import com.example.darc.application.domain.state.EventSourcedState;
import com.example.darc.application.domain.state.OverwritableState;
import com.example.darc.application.domain.state.StateChangedEvent;
import com.example.darc.application.domain.state.StateType;
import com.example.darc.application.domain.stream.LogEvent;
import com.example.darc.application.domain.transaction.ReplayFailurePolicy;
import com.example.darc.application.shared.exception.EventReplayException;
import com.example.darc.infra.event.codec.EventJsonCodec;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 事件溯源轉接器 (Event-Sourcing Adapter)
 *
 * <p>
 * 兩個方向的轉換：
 * <ul>
 * <li>寫入：把提議狀態中業務邏輯累積的待提交事件原封不動地取出並清空，轉成可寫入事件日誌的 {@link LogEvent}</li>
 * <li>讀取：把事件日誌中的歷史事件依事件類型反序列化，套用回狀態</li>
 * </ul>
 * </p>
 *
 * <p>
 * 非事件溯源的狀態走降級路徑：整份狀態包成單一 {@link StateChangedEvent}，重播時以
 * {@link OverwritableState#overwriteFrom(Object)} 覆寫。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class EventSourcingAdapter {

	/**
	 * 降級事件中承載新狀態的欄位名稱
	 */
	static final String NEW_STATE_FIELD = "newState";

	private final EventJsonCodec codec;

	@Getter
	private final ReplayFailurePolicy replayFailurePolicy;

	/**
	 * 計算提議狀態相對於已提交狀態要寫入的領域事件
	 *
	 * @param stateType 狀態型別描述
	 * @param committed 目前已提交的狀態
	 * @param proposed  交易提出的新狀態
	 * @return 依發生順序排列的領域事件，可能為空
	 */
	public <S extends DeepCopyable<S>> List<DomainEvent> computeDomainEvents(StateType<S> stateType, S committed,
			S proposed) {
		if (proposed instanceof EventSourcedState) {
			// 取出即清空，管線化的下一筆交易複製此狀態時不會重複帶出這些事件
			return ((EventSourcedState<?>) proposed).drainPendingEvents().stream().map(DomainEvent::of)
					.collect(Collectors.toList());
		}

		if (Objects.equals(committed, proposed)) {
			log.debug(">>> [EventSourcing] {} 狀態未變更，不產生事件", stateType.getName());
			return Collections.emptyList();
		}

		log.debug(">>> [EventSourcing] {} 非事件溯源狀態，改以 {} 整份寫入", stateType.getName(),
				stateType.getStateChangedEventType());
		StateChangedEvent<S> changed = new StateChangedEvent<>(proposed.deepCopy());
		return List.of(DomainEvent.builder().eventType(stateType.getStateChangedEventType()).data(changed)
				.occurredAt(changed.getOccurredAt()).build());
	}

	/**
	 * 將領域事件序列化為事件日誌紀錄
	 *
	 * @param metadata 使用者中繼資料，寫入主串流時必須為空
	 */
	public LogEvent toLogEvent(DomainEvent domainEvent, byte[] metadata) {
		return LogEvent.builder().eventType(domainEvent.getEventType()).data(codec.serialize(domainEvent.getData()))
				.metadata(metadata == null ? new byte[0] : metadata).build();
	}

	public List<LogEvent> toLogEvents(List<DomainEvent> domainEvents) {
		return domainEvents.stream().map(e -> toLogEvent(e, null)).collect(Collectors.toList());
	}

	/**
	 * 將一筆歷史事件套用到狀態上
	 *
	 * <p>
	 * 失敗時依 {@link ReplayFailurePolicy} 處理：SKIP 記錄警告後略過，FAIL 拋出
	 * {@link EventReplayException}。
	 * </p>
	 *
	 * @return 事件是否成功套用
	 */
	public <S extends DeepCopyable<S>> boolean apply(StateType<S> stateType, S state, LogEvent event) {
		try {
			applyOrThrow(stateType, state, event);
			return true;
		} catch (EventReplayException e) {
			if (replayFailurePolicy == ReplayFailurePolicy.FAIL) {
				throw e;
			}
			log.warn(">>> [EventSourcing] 略過無法重播的事件 {} (revision={}): {}", event.getEventType(),
					event.getRevision(), e.getMessage());
			return false;
		}
	}

	/**
	 * 依序套用多筆事件
	 */
	public <S extends DeepCopyable<S>> S replay(StateType<S> stateType, S state, List<LogEvent> events) {
		for (LogEvent event : events) {
			apply(stateType, state, event);
		}
		return state;
	}

	/**
	 * 清除狀態上的待提交事件 (事件已寫入事件日誌後呼叫)
	 */
	public void resetPendingEvents(Object state) {
		if (state instanceof EventSourcedState) {
			((EventSourcedState<?>) state).clearPendingEvents();
		}
	}

	private <S extends DeepCopyable<S>> void applyOrThrow(StateType<S> stateType, S state, LogEvent event) {
		String eventType = event.getEventType();

		if (stateType.getStateChangedEventType().equals(eventType)) {
			if (!stateType.isOverwritable()) {
				throw new EventReplayException(eventType, stateType.getName() + " 不支援整份覆寫，無法重播 " + eventType);
			}
			S newState = decode(eventType,
					() -> codec.deserializeField(event.getData(), NEW_STATE_FIELD, stateType.getStateClass()));
			stateType.overwrite(state, newState);
			return;
		}

		if (!(state instanceof EventSourcedState)) {
			throw new EventReplayException(eventType, stateType.getName() + " 不是事件溯源狀態，無法套用 " + eventType);
		}
		Class<? extends Event> eventClass = stateType.resolveEventClass(eventType)
				.orElseThrow(() -> new EventReplayException(eventType, "未註冊的事件類型: " + eventType));
		Event domainEvent = decode(eventType, () -> codec.deserialize(event.getData(), eventClass));
		try {
			((EventSourcedState<?>) state).apply(domainEvent);
		} catch (RuntimeException e) {
			throw new EventReplayException(eventType, "事件套用失敗: " + eventType, e);
		}
	}

	private static <T> T decode(String eventType, Supplier<T> decoder) {
		try {
			return decoder.get();
		} catch (IllegalStateException e) {
			throw new EventReplayException(eventType, "事件內容無法反序列化: " + eventType, e);
		}
	}
}
