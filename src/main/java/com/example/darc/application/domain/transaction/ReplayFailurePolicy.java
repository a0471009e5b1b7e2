package com.example.darc.application.domain.transaction;

/**
 * 重播歷史事件失敗時的處理策略
 */
public enum ReplayFailurePolicy {
	SKIP, // 記錄警告並略過該事件
	FAIL // 中止載入並拋出例外
}
