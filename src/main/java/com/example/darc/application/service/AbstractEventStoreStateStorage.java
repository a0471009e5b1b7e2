package com.example.darc.application.service;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.example.darc.application.domain.state.DeepCopyable;
import com.example.darc.application.domain.state.StateType;
import com.example.darc.application.domain.stream.ExpectedVersion;
import com.example.darc.application.domain.stream.LogEvent;
import com.example.darc.application.domain.stream.StreamLayout;
import com.example.darc.application.domain.transaction.MetadataSnapshot;
import com.example.darc.application.domain.transaction.PendingTransactionState;
import com.example.darc.application.domain.transaction.TransactionalStateMetaData;
import com.example.darc.application.domain.transaction.TransactionalStorageLoadResponse;
import com.example.darc.application.port.EventLogPort;
import com.example.darc.application.port.TransactionalStateStorage;
import com.example.darc.application.shared.exception.ETagMismatchException;
import com.example.darc.application.shared.exception.LogStreamNotFoundException;
import com.example.darc.application.shared.exception.LogVersionConflictException;
import com.example.darc.application.shared.exception.TransactionAbortedException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * EventStoreDB 交易狀態儲存的共用骨架
 *
 * <p>
 * 樂觀與悲觀策略共用相同的載入流程與 {@code store} 階段順序，只在準備中交易的保存方式上不同：
 * </p>
 *
 * <pre>
 * load()  : 重播主串流 → 讀取 metadata 快照 → 回復準備中交易 (由子類別決定) → 產生新 ETag
 * store() : ETag 檢查 → prepare → commit → abort (三個階段皆可省略)
 * </pre>
 *
 * <p>
 * 協調者保證呼叫嚴格循序，所以這裡不做任何鎖定。
 * </p>
 *
 * @param <S> 狀態型別
 */
@Slf4j
@Getter
public abstract class AbstractEventStoreStateStorage<S extends DeepCopyable<S>> implements TransactionalStateStorage<S> {

	protected final StreamLayout layout;
	protected final StateType<S> stateType;
	protected final EventLogPort eventLog;
	protected final EventSourcingAdapter eventSourcingAdapter;
	protected final MetadataStore metadataStore;

	protected S committedState;

	/**
	 * 主串流最後一筆事件的版本，尚無事件時為 {@link ExpectedVersion#NO_STREAM_REVISION}
	 */
	protected long committedRevision = ExpectedVersion.NO_STREAM_REVISION;

	protected long committedSequenceId;

	protected TransactionalStateMetaData metadata = new TransactionalStateMetaData();

	protected String currentETag;

	protected AbstractEventStoreStateStorage(StreamLayout layout, StateType<S> stateType, EventLogPort eventLog,
			EventSourcingAdapter eventSourcingAdapter, MetadataStore metadataStore) {
		this.layout = layout;
		this.stateType = stateType;
		this.eventLog = eventLog;
		this.eventSourcingAdapter = eventSourcingAdapter;
		this.metadataStore = metadataStore;
		this.committedState = stateType.newInstance();
	}

	@Override
	public final TransactionalStorageLoadResponse<S> load() {
		S state = stateType.newInstance();
		long revision = ExpectedVersion.NO_STREAM_REVISION;
		try {
			List<LogEvent> events = eventLog.readAll(layout.getMainStreamName());
			for (LogEvent event : events) {
				eventSourcingAdapter.apply(stateType, state, event);
				revision = event.getRevision();
			}
			log.info(">>> [Load] {} 重播 {} 筆已提交事件 (revision={})", layout.getMainStreamName(), events.size(),
					revision);
		} catch (LogStreamNotFoundException e) {
			log.info(">>> [Load] {} 尚無已提交事件，以空白狀態開始", layout.getMainStreamName());
		} catch (RuntimeException e) {
			log.error(">>> [Load] {} 載入失敗: {}", layout.getMainStreamName(), e.getMessage(), e);
			throw e;
		}

		MetadataSnapshot snapshot = metadataStore.loadMetadata(layout.getMetadataStreamName());
		this.committedState = state;
		this.committedRevision = revision;
		this.committedSequenceId = snapshot.getSequenceId();
		this.metadata = snapshot.getMetadata();

		List<PendingTransactionState<S>> pendingStates = recoverPendingStates();
		this.currentETag = newETag();

		log.info(">>> [Load] {} 載入完成 (sequenceId={}, 準備中交易={})", layout.getMainStreamName(), committedSequenceId,
				pendingStates.size());
		return new TransactionalStorageLoadResponse<>(currentETag, committedState.deepCopy(), committedSequenceId,
				metadata.copy(), pendingStates);
	}

	@Override
	public final String store(String expectedETag, TransactionalStateMetaData metadata,
			List<PendingTransactionState<S>> statesToPrepare, Long commitUpTo, Long abortAfter) {
		if (currentETag == null) {
			throw new IllegalStateException("尚未載入狀態，請先呼叫 load(): " + layout.getMainStreamName());
		}
		if (!Objects.equals(currentETag, expectedETag)) {
			throw new ETagMismatchException(expectedETag, currentETag);
		}

		if (statesToPrepare != null && !statesToPrepare.isEmpty()) {
			prepare(statesToPrepare);
		}
		if (commitUpTo != null) {
			commit(metadata, commitUpTo);
		}
		if (abortAfter != null) {
			abort(abortAfter);
		}
		return currentETag;
	}

	/**
	 * 載入時回復尚未解決的準備中交易，此時已提交狀態與序號已就緒
	 */
	protected abstract List<PendingTransactionState<S>> recoverPendingStates();

	protected abstract void prepare(List<PendingTransactionState<S>> statesToPrepare);

	protected abstract void commit(TransactionalStateMetaData metadata, long commitUpTo);

	protected abstract void abort(long abortAfter);

	/**
	 * 衝突時在拋出 {@link TransactionAbortedException} 之前呼叫，用來丟棄已失效的準備中交易
	 */
	protected abstract void onCommitConflict();

	/**
	 * 以目前已提交版本為前置條件，將事件原子性地追加到主串流
	 *
	 * @return 追加後主串流最後一筆事件的版本 (前置條件成立時必為 committedRevision + 事件數)
	 * @throws TransactionAbortedException 有其他寫入者搶先提交
	 */
	protected long appendToMainStream(List<LogEvent> events) {
		ExpectedVersion expected = ExpectedVersion.fromCommittedRevision(committedRevision);
		try {
			eventLog.append(layout.getMainStreamName(), expected, events);
			return committedRevision + events.size();
		} catch (LogVersionConflictException e) {
			log.warn(">>> [Commit] {} 版本衝突 (expected {})，交易中止", layout.getMainStreamName(), expected);
			onCommitConflict();
			throw new TransactionAbortedException("提交失敗，主串流已被其他寫入者更新: " + layout.getMainStreamName(), e);
		}
	}

	/**
	 * 提交成功後的共用收尾：更新已提交狀態與序號、保存中繼資料、產生新 ETag
	 */
	protected void finishCommit(S newCommittedState, long newRevision, long commitUpTo,
			TransactionalStateMetaData metadata) {
		eventSourcingAdapter.resetPendingEvents(newCommittedState);
		this.committedState = newCommittedState;
		this.committedRevision = newRevision;
		this.committedSequenceId = Math.max(committedSequenceId, commitUpTo);
		if (metadata != null) {
			this.metadata = metadata.copy();
		}
		metadataStore.saveMetadata(layout.getMetadataStreamName(), committedSequenceId, this.metadata);
		this.currentETag = newETag();
	}

	private static String newETag() {
		return UUID.randomUUID().toString();
	}
}
