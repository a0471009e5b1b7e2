package com.example.darc.application.domain.transaction;

/**
 * 交易儲存策略 (每個部署固定一種)
 */
public enum StorageMode {
	OPTIMISTIC, // 準備階段只在記憶體，提交時以版本檢查做單次原子追加
	PESSIMISTIC // 準備階段寫入共用 pending 串流 (write-ahead)，提交時搬移到主串流
}
