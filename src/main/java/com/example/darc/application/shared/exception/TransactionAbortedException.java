package com.example.darc.application.shared.exception;

/**
 * 提交時主串流版本衝突，交易被中止
 *
 * <p>
 * 協調者收到後應重新 {@code load} 並重試交易。
 * </p>
 */
public class TransactionAbortedException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public TransactionAbortedException(String message, Throwable cause) {
		super(message, cause);
	}
}
