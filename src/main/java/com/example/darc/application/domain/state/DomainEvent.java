package com.example.darc.application.domain.state;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 待持久化的領域事件包裝
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DomainEvent {

	/**
	 * 事件類型，例如 "MoneyDepositedEvent"
	 */
	private String eventType;

	/**
	 * 事件本體
	 */
	private Event data;

	/**
	 * 事件發生時間 (取自 {@link Event#getOccurredAt()})
	 */
	private Instant occurredAt;

	/**
	 * 以事件的實際類別名稱作為事件類型進行包裝
	 */
	public static DomainEvent of(Event event) {
		return new DomainEvent(event.getClass().getSimpleName(), event, event.getOccurredAt());
	}
}
