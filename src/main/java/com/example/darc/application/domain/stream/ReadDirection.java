package com.example.darc.application.domain.stream;

/**
 * 串流讀取方向
 */
public enum ReadDirection {
	FORWARDS, // 由舊至新
	BACKWARDS // 由新至舊
}
