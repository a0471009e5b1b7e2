package com.example.darc.application.shared.exception;

import com.example.darc.application.domain.stream.ExpectedVersion;

import lombok.Getter;

/**
 * 追加事件時版本前置條件不成立 (有其他寫入者搶先)
 */
@Getter
public class LogVersionConflictException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String streamName;

	private final transient ExpectedVersion expectedVersion;

	public LogVersionConflictException(String streamName, ExpectedVersion expectedVersion, Throwable cause) {
		super("串流版本衝突: " + streamName + " (expected " + expectedVersion + ")", cause);
		this.streamName = streamName;
		this.expectedVersion = expectedVersion;
	}
}
