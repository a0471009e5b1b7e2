package com.example.darc.application.domain.transaction;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 準備中 (尚未提交) 的交易狀態
 *
 * <p>
 * 作為 {@code store} 的準備輸入，也作為悲觀策略在 {@code load} 時回復的進行中交易。
 * </p>
 *
 * @param <S> 狀態型別
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingTransactionState<S> {

	/**
	 * 交易唯一識別碼
	 */
	private String transactionId;

	/**
	 * 協調者指派的提交順序序號
	 */
	private long sequenceId;

	/**
	 * 交易提出的新狀態
	 */
	private S state;

	/**
	 * 交易時間戳
	 */
	private Instant timeStamp;

	/**
	 * 交易管理者 (協調者) 識別
	 */
	private String transactionManager;
}
