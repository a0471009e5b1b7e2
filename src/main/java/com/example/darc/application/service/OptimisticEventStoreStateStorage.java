package com.example.darc.application.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.example.darc.application.domain.state.DeepCopyable;
import com.example.darc.application.domain.state.DomainEvent;
import com.example.darc.application.domain.state.StateType;
import com.example.darc.application.domain.stream.LogEvent;
import com.example.darc.application.domain.stream.StreamLayout;
import com.example.darc.application.domain.transaction.PendingTransactionState;
import com.example.darc.application.domain.transaction.TransactionRecord;
import com.example.darc.application.domain.transaction.TransactionalStateMetaData;
import com.example.darc.application.port.EventLogPort;

import lombok.extern.slf4j.Slf4j;

/**
 * 樂觀策略 (Optimistic)
 *
 * <p>
 * 準備階段只在記憶體中保存交易紀錄，不做任何 I/O；提交時把所有符合序號的交易事件攤平，以主串流目前版本為前置條件做一次原子追加。
 * 版本衝突代表有其他實例搶先提交，所有記憶體中的準備中交易都已失效，全部丟棄。
 * </p>
 *
 * <p>
 * 實例崩潰後準備中交易不會回復，{@link #load()} 永遠回傳空的準備中清單，由協調者逾時中止。
 * </p>
 *
 * @param <S> 狀態型別
 */
@Slf4j
public class OptimisticEventStoreStateStorage<S extends DeepCopyable<S>> extends AbstractEventStoreStateStorage<S> {

	/**
	 * 準備中交易 (transactionId → 紀錄)，保持準備順序
	 */
	private final Map<String, TransactionRecord<S>> pendingTransactions = new LinkedHashMap<>();

	public OptimisticEventStoreStateStorage(StreamLayout layout, StateType<S> stateType, EventLogPort eventLog,
			EventSourcingAdapter eventSourcingAdapter, MetadataStore metadataStore) {
		super(layout, stateType, eventLog, eventSourcingAdapter, metadataStore);
	}

	/**
	 * 目前記憶體中的準備中交易 (唯讀)
	 */
	public Map<String, TransactionRecord<S>> getPendingTransactions() {
		return Collections.unmodifiableMap(pendingTransactions);
	}

	@Override
	protected List<PendingTransactionState<S>> recoverPendingStates() {
		if (!pendingTransactions.isEmpty()) {
			log.info(">>> [Load] 捨棄 {} 筆記憶體中的準備中交易", pendingTransactions.size());
		}
		pendingTransactions.clear();
		return Collections.emptyList();
	}

	@Override
	protected void prepare(List<PendingTransactionState<S>> statesToPrepare) {
		for (PendingTransactionState<S> pending : statesToPrepare) {
			List<DomainEvent> events = eventSourcingAdapter.computeDomainEvents(stateType, committedState,
					pending.getState());
			TransactionRecord<S> record = TransactionRecord.<S>builder()
					.transactionId(pending.getTransactionId())
					.sequenceId(pending.getSequenceId())
					.events(events)
					.workingState(pending.getState().deepCopy())
					.timestamp(pending.getTimeStamp() == null ? Instant.now() : pending.getTimeStamp())
					.build();
			pendingTransactions.put(pending.getTransactionId(), record);
			log.debug(">>> [Prepare] 交易 {} (seq={}) 暫存 {} 筆事件", pending.getTransactionId(),
					pending.getSequenceId(), events.size());
		}
	}

	@Override
	protected void commit(TransactionalStateMetaData metadata, long commitUpTo) {
		List<TransactionRecord<S>> toCommit = pendingTransactions.values().stream()
				.filter(r -> r.getSequenceId() <= commitUpTo)
				.sorted(Comparator.comparingLong(TransactionRecord::getSequenceId))
				.collect(Collectors.toList());
		if (toCommit.isEmpty()) {
			log.warn(">>> [Commit] {} 沒有序號 <= {} 的準備中交易", layout.getMainStreamName(), commitUpTo);
			return;
		}

		List<LogEvent> batch = new ArrayList<>();
		for (TransactionRecord<S> record : toCommit) {
			batch.addAll(eventSourcingAdapter.toLogEvents(record.getEvents()));
		}

		long newRevision = committedRevision;
		if (!batch.isEmpty()) {
			newRevision = appendToMainStream(batch);
		}

		S newCommittedState = toCommit.get(toCommit.size() - 1).getWorkingState().deepCopy();
		toCommit.forEach(r -> pendingTransactions.remove(r.getTransactionId()));
		finishCommit(newCommittedState, newRevision, commitUpTo, metadata);

		log.info(">>> [Commit] {} 提交 {} 筆交易、{} 筆事件 (seq={}, revision={})", layout.getMainStreamName(),
				toCommit.size(), batch.size(), committedSequenceId, committedRevision);
	}

	@Override
	protected void abort(long abortAfter) {
		List<String> aborted = pendingTransactions.values().stream().filter(r -> r.getSequenceId() > abortAfter)
				.map(TransactionRecord::getTransactionId).collect(Collectors.toList());
		aborted.forEach(pendingTransactions::remove);
		if (!aborted.isEmpty()) {
			log.info(">>> [Abort] {} 中止 {} 筆交易 (seq > {})", layout.getMainStreamName(), aborted.size(), abortAfter);
		}
	}

	@Override
	protected void onCommitConflict() {
		log.warn(">>> [Commit] 丟棄全部 {} 筆準備中交易", pendingTransactions.size());
		pendingTransactions.clear();
	}
}
