package com.example.darc.application.port;

import java.util.List;

import com.example.darc.application.domain.transaction.PendingTransactionState;
import com.example.darc.application.domain.transaction.TransactionalStateMetaData;
import com.example.darc.application.domain.transaction.TransactionalStorageLoadResponse;

/**
 * 交易參與者的持久化狀態儲存介面 (由協調者呼叫)
 *
 * <p>
 * 協調者保證同一個實例的呼叫嚴格循序，實作不做內部鎖定。
 * </p>
 *
 * @param <S> 狀態型別
 */
public interface TransactionalStateStorage<S> {

	/**
	 * 啟用時載入已提交狀態與尚未解決的準備中交易
	 */
	TransactionalStorageLoadResponse<S> load();

	/**
	 * 依序處理 prepare → commit → abort，三個階段皆可省略
	 *
	 * @param expectedETag    最近一次 load / store 回傳的 ETag
	 * @param metadata        協調者中繼資料，提交時一併保存
	 * @param statesToPrepare 要準備的交易，可為空
	 * @param commitUpTo      提交序號小於等於此值的交易，{@code null} 表示不提交
	 * @param abortAfter      中止序號大於此值的交易，{@code null} 表示不中止
	 * @return 新的 ETag
	 */
	String store(String expectedETag, TransactionalStateMetaData metadata,
			List<PendingTransactionState<S>> statesToPrepare, Long commitUpTo, Long abortAfter);
}
