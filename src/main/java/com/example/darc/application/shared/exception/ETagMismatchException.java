package com.example.darc.application.shared.exception;

import lombok.Getter;

/**
 * 呼叫端帶入的 ETag 與儲存體目前的 ETag 不一致 (呼叫端程式錯誤)
 */
@Getter
public class ETagMismatchException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final String expectedETag;

	private final String currentETag;

	public ETagMismatchException(String expectedETag, String currentETag) {
		super("ETag 不一致: expected=" + expectedETag + ", current=" + currentETag);
		this.expectedETag = expectedETag;
		this.currentETag = currentETag;
	}
}
