package com.example.darc.application.shared.exception;

import lombok.Getter;

/**
 * 歷史事件無法重播 (未知事件類型、內容損毀或狀態不支援降級路徑)
 */
@Getter
public class EventReplayException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String eventType;

	public EventReplayException(String eventType, String message) {
		super(message);
		this.eventType = eventType;
	}

	public EventReplayException(String eventType, String message, Throwable cause) {
		super(message, cause);
		this.eventType = eventType;
	}
}
