package com.example.darc.application.shared.exception;

import lombok.Getter;

/**
 * 事件日誌中找不到指定的串流
 */
@Getter
public class LogStreamNotFoundException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String streamName;

	public LogStreamNotFoundException(String streamName) {
		super("串流不存在: " + streamName);
		this.streamName = streamName;
	}

	public LogStreamNotFoundException(String streamName, Throwable cause) {
		super("串流不存在: " + streamName, cause);
		this.streamName = streamName;
	}
}
