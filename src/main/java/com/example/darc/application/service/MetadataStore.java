package com.example.darc.application.service;

import java.util.List;
import java.util.Optional;

import com.example.darc.application.domain.stream.ExpectedVersion;
import com.example.darc.application.domain.stream.LogEvent;
import com.example.darc.application.domain.transaction.MetadataSnapshot;
import com.example.darc.application.domain.transaction.TransactionalStateMetaData;
import com.example.darc.application.port.EventLogPort;
import com.example.darc.application.shared.exception.LogStreamNotFoundException;
import com.example.darc.infra.event.codec.EventJsonCodec;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 已提交序號與協調者中繼資料的存取 (metadata 串流)
 *
 * <p>
 * 每次提交追加一筆 {@link MetadataSnapshot}，以最後一筆為準，歷史不截斷。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class MetadataStore {

	public static final String EVENT_TYPE = "MetadataSnapshot";

	private final EventLogPort eventLog;
	private final EventJsonCodec codec;

	/**
	 * 讀取最新快照，串流不存在或為空時回傳序號 0 與空白中繼資料
	 */
	public MetadataSnapshot loadMetadata(String metadataStreamName) {
		Optional<LogEvent> last;
		try {
			last = eventLog.readLast(metadataStreamName);
		} catch (LogStreamNotFoundException e) {
			log.debug(">>> [Metadata] {} 尚無紀錄，使用初始值", metadataStreamName);
			return MetadataSnapshot.empty();
		}
		if (last.isEmpty()) {
			return MetadataSnapshot.empty();
		}

		MetadataSnapshot snapshot = codec.deserialize(last.get().getData(), MetadataSnapshot.class);
		if (snapshot.getMetadata() == null) {
			snapshot.setMetadata(new TransactionalStateMetaData());
		}
		return snapshot;
	}

	public void saveMetadata(String metadataStreamName, long sequenceId, TransactionalStateMetaData metadata) {
		MetadataSnapshot snapshot = new MetadataSnapshot(sequenceId,
				metadata == null ? new TransactionalStateMetaData() : metadata);
		LogEvent event = LogEvent.builder().eventType(EVENT_TYPE).data(codec.serialize(snapshot)).build();
		eventLog.append(metadataStreamName, ExpectedVersion.any(), List.of(event));
		log.debug(">>> [Metadata] {} 已記錄提交序號 {}", metadataStreamName, sequenceId);
	}
}
