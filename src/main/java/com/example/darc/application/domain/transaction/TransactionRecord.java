package com.example.darc.application.domain.transaction;

import java.time.Instant;
import java.util.List;

import com.example.darc.application.domain.state.DomainEvent;

import lombok.Builder;
import lombok.Getter;

/**
 * 樂觀策略的記憶體內交易紀錄，只存在於 prepare 與 commit/abort 之間
 *
 * @param <S> 狀態型別
 */
@Getter
@Builder
public class TransactionRecord<S> {

	private final String transactionId;

	private final long sequenceId;

	private final List<DomainEvent> events;

	/**
	 * 準備時的狀態複本，提交後成為新的已提交狀態
	 */
	private final S workingState;

	private final Instant timestamp;
}
