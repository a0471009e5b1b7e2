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
import com.example.darc.application.domain.stream.ExpectedVersion;
import com.example.darc.application.domain.stream.LogEvent;
import com.example.darc.application.domain.stream.StreamLayout;
import com.example.darc.application.domain.transaction.PendingEntryTag;
import com.example.darc.application.domain.transaction.PendingTransactionState;
import com.example.darc.application.domain.transaction.TransactionalStateMetaData;
import com.example.darc.application.port.EventLogPort;
import com.example.darc.application.shared.exception.EventLogAccessException;
import com.example.darc.application.shared.exception.LogStreamNotFoundException;
import com.example.darc.infra.event.codec.EventJsonCodec;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 悲觀策略 (Pessimistic, write-ahead)
 *
 * <p>
 * 準備階段就把交易事件寫入共用的 pending 串流，每筆事件的使用者中繼資料帶有 {@link PendingEntryTag}。
 * 實例崩潰後可從 pending 串流回復準備中交易；提交時把符合序號的事件去除標記後搬到主串流，再刪除 pending 串流。
 * </p>
 *
 * <pre>
 * prepare : pending 串流追加 (ExpectedVersion.any)
 * commit  : 讀 pending → 篩選 committedSeq &lt; seq &lt;= commitUpTo → 依序號穩定排序 → 去標記寫入主串流 (無事件則略過)
 *           → 推進序號、保存 metadata → 刪除 pending → 新 ETag
 * abort   : 刪除整條 pending 串流
 * </pre>
 *
 * @param <S> 狀態型別
 */
@Slf4j
public class PessimisticEventStoreStateStorage<S extends DeepCopyable<S>> extends AbstractEventStoreStateStorage<S> {

	private final EventJsonCodec codec;

	public PessimisticEventStoreStateStorage(StreamLayout layout, StateType<S> stateType, EventLogPort eventLog,
			EventSourcingAdapter eventSourcingAdapter, MetadataStore metadataStore, EventJsonCodec codec) {
		super(layout, stateType, eventLog, eventSourcingAdapter, metadataStore);
		this.codec = codec;
	}

	@Override
	protected List<PendingTransactionState<S>> recoverPendingStates() {
		List<TaggedEntry> entries = readPendingEntries();

		// 依交易分組，保持第一次出現的順序
		Map<String, List<TaggedEntry>> byTransaction = new LinkedHashMap<>();
		for (TaggedEntry entry : entries) {
			byTransaction.computeIfAbsent(entry.getTag().getTransactionId(), k -> new ArrayList<>()).add(entry);
		}

		// 依序號累加：每筆回復狀態等於提交到該序號時的狀態
		List<List<TaggedEntry>> groups = byTransaction.values().stream()
				.filter(group -> group.get(0).getTag().getSequenceId() > committedSequenceId)
				.sorted(Comparator.comparingLong(group -> group.get(0).getTag().getSequenceId()))
				.collect(Collectors.toList());
		S running = committedState.deepCopy();
		List<PendingTransactionState<S>> recovered = new ArrayList<>();
		for (List<TaggedEntry> group : groups) {
			PendingEntryTag tag = group.get(0).getTag();
			for (TaggedEntry entry : group) {
				eventSourcingAdapter.apply(stateType, running, entry.getEvent());
			}
			recovered.add(PendingTransactionState.<S>builder()
					.transactionId(tag.getTransactionId())
					.sequenceId(tag.getSequenceId())
					.state(running.deepCopy())
					.timeStamp(tag.getTimestamp())
					.transactionManager(tag.getTransactionManager())
					.build());
		}
		if (groups.size() < byTransaction.size()) {
			log.debug(">>> [Recovery] 略過 {} 筆已提交的殘留交易", byTransaction.size() - groups.size());
		}

		if (!recovered.isEmpty()) {
			log.info(">>> [Recovery] {} 回復 {} 筆準備中交易", layout.getPendingStreamName(), recovered.size());
		}
		return recovered;
	}

	@Override
	protected void prepare(List<PendingTransactionState<S>> statesToPrepare) {
		for (PendingTransactionState<S> pending : statesToPrepare) {
			List<DomainEvent> events = eventSourcingAdapter.computeDomainEvents(stateType, committedState,
					pending.getState());
			if (events.isEmpty()) {
				log.debug(">>> [Prepare] 交易 {} 沒有任何事件", pending.getTransactionId());
				continue;
			}

			PendingEntryTag tag = new PendingEntryTag(pending.getTransactionId(), pending.getSequenceId(),
					pending.getTransactionManager(),
					pending.getTimeStamp() == null ? Instant.now() : pending.getTimeStamp());
			byte[] tagBytes = codec.serialize(tag);
			List<LogEvent> logEvents = events.stream().map(e -> eventSourcingAdapter.toLogEvent(e, tagBytes))
					.collect(Collectors.toList());

			eventLog.append(layout.getPendingStreamName(), ExpectedVersion.any(), logEvents);
			log.debug(">>> [Prepare] 交易 {} (seq={}) 寫入 {} 筆事件到 {}", pending.getTransactionId(),
					pending.getSequenceId(), logEvents.size(), layout.getPendingStreamName());
		}
	}

	@Override
	protected void commit(TransactionalStateMetaData metadata, long commitUpTo) {
		// 有序串流的 sorted 為穩定排序，同一交易內的事件順序不變
		List<TaggedEntry> toCommit = readPendingEntries().stream()
				.filter(e -> e.getTag().getSequenceId() > committedSequenceId
						&& e.getTag().getSequenceId() <= commitUpTo)
				.sorted(Comparator.comparingLong(e -> e.getTag().getSequenceId()))
				.collect(Collectors.toList());
		if (toCommit.isEmpty()) {
			// 沒有事件的交易 prepare 時不寫入 pending 串流，序號與 metadata 仍要推進
			log.info(">>> [Commit] {} 沒有序號介於 ({}, {}] 的準備中事件", layout.getPendingStreamName(),
					committedSequenceId, commitUpTo);
		}

		List<LogEvent> cleanEvents = toCommit.stream().map(e -> e.getEvent().withoutMetadata())
				.collect(Collectors.toList());
		long newRevision = cleanEvents.isEmpty() ? committedRevision : appendToMainStream(cleanEvents);

		S newCommittedState = committedState.deepCopy();
		for (LogEvent event : cleanEvents) {
			eventSourcingAdapter.apply(stateType, newCommittedState, event);
		}
		finishCommit(newCommittedState, newRevision, commitUpTo, metadata);
		// 協調者循序呼叫，剛讀到的內容就是全部的準備中工作
		deletePendingStreamAfterCommit();

		log.info(">>> [Commit] {} 提交 {} 筆事件 (seq={}, revision={})", layout.getMainStreamName(),
				cleanEvents.size(), committedSequenceId, committedRevision);
	}

	@Override
	protected void abort(long abortAfter) {
		deletePendingStream();
		log.info(">>> [Abort] {} 中止序號 > {} 的交易，已刪除 pending 串流", layout.getMainStreamName(), abortAfter);
	}

	@Override
	protected void onCommitConflict() {
		// pending 串流保留，下次 load 時由回復流程重新判斷
		log.warn(">>> [Commit] 保留 {} 供回復", layout.getPendingStreamName());
	}

	/**
	 * 讀取整條 pending 串流並解析交易標記，串流不存在時回傳空清單
	 */
	private List<TaggedEntry> readPendingEntries() {
		List<LogEvent> events;
		try {
			events = eventLog.readAll(layout.getPendingStreamName());
		} catch (LogStreamNotFoundException e) {
			return Collections.emptyList();
		}

		List<TaggedEntry> entries = new ArrayList<>(events.size());
		for (LogEvent event : events) {
			PendingEntryTag tag = readTag(event);
			if (tag == null) {
				log.warn(">>> [Pending] {} 的事件 {} (revision={}) 沒有可讀的交易標記，略過", layout.getPendingStreamName(),
						event.getEventType(), event.getRevision());
				continue;
			}
			entries.add(new TaggedEntry(event, tag));
		}
		return entries;
	}

	private PendingEntryTag readTag(LogEvent event) {
		if (!event.hasMetadata()) {
			return null;
		}
		try {
			PendingEntryTag tag = codec.deserialize(event.getMetadata(), PendingEntryTag.class);
			return tag.getTransactionId() == null ? null : tag;
		} catch (IllegalStateException e) {
			log.debug(">>> [Pending] 交易標記解析失敗: {}", e.getMessage());
			return null;
		}
	}

	private void deletePendingStream() {
		try {
			eventLog.delete(layout.getPendingStreamName());
		} catch (LogStreamNotFoundException e) {
			log.debug(">>> [Pending] {} 不存在，無需刪除", layout.getPendingStreamName());
		}
	}

	/**
	 * 提交已經持久化，刪除失敗只記錄警告；殘留事件的序號已不大於已提交序號，之後會被略過
	 */
	private void deletePendingStreamAfterCommit() {
		try {
			deletePendingStream();
		} catch (EventLogAccessException e) {
			log.warn(">>> [Commit] 提交完成但刪除 {} 失敗: {}", layout.getPendingStreamName(), e.getMessage());
		}
	}

	@Getter
	@AllArgsConstructor
	private static class TaggedEntry {
		private final LogEvent event;
		private final PendingEntryTag tag;
	}
}
