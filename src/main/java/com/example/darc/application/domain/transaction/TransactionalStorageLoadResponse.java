package com.example.darc.application.domain.transaction;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * {@code load} 的回傳結果
 *
 * @param <S> 狀態型別
 */
@Getter
@ToString
@AllArgsConstructor
public class TransactionalStorageLoadResponse<S> {

	/**
	 * 下一次 {@code store} 必須帶回的 ETag
	 */
	private final String eTag;

	private final S committedState;

	private final long committedSequenceId;

	private final TransactionalStateMetaData metadata;

	/**
	 * 回復的進行中交易 (樂觀策略永遠為空)
	 */
	private final List<PendingTransactionState<S>> pendingStates;
}
