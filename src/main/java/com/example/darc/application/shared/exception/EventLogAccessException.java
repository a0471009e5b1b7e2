package com.example.darc.application.shared.exception;

/**
 * 事件日誌存取失敗 (連線、逾時、中斷或其他客戶端錯誤)，不重試直接往上拋
 */
public class EventLogAccessException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public EventLogAccessException(String message, Throwable cause) {
		super(message, cause);
	}
}
