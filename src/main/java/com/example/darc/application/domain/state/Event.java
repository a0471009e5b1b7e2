package com.example.darc.application.domain.state;

import java.time.Instant;

import lombok.Data;

/**
 * 所有領域事件的基底類別
 *
 * <p>
 * 事件是不可變的事實，建立後不應再修改。子類別的簡單類別名稱即為事件類型 (重播時的分派鍵)。
 * </p>
 */
@Data
public abstract class Event {

	/**
	 * 事件發生時間
	 */
	private Instant occurredAt = Instant.now();
}
