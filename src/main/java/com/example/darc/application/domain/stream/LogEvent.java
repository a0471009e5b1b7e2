package com.example.darc.application.domain.stream;

import java.time.Instant;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 事件日誌中的單筆紀錄
 *
 * <p>
 * 與 EventStoreDB 的 EventData / RecordedEvent 對應，但不依賴客戶端型別。寫入時 {@code revision} 無意義
 * (固定為 -1)，讀取時為該事件在串流中的版本號。
 * </p>
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = { "data", "metadata" })
@AllArgsConstructor
public class LogEvent {

	private static final byte[] EMPTY = new byte[0];

	@Builder.Default
	private final UUID eventId = UUID.randomUUID();

	private final String eventType;

	@Builder.Default
	private final byte[] data = EMPTY;

	/**
	 * 使用者中繼資料 (悲觀策略用來標記交易身分)，主串流中永遠為空
	 */
	@Builder.Default
	private final byte[] metadata = EMPTY;

	@Builder.Default
	private final long revision = -1L;

	private final Instant created;

	public boolean hasMetadata() {
		return metadata != null && metadata.length > 0;
	}

	/**
	 * 產生一份去除交易中繼資料的新事件，用於從 pending 串流複製到主串流。
	 */
	public LogEvent withoutMetadata() {
		return LogEvent.builder().eventType(eventType).data(data).build();
	}
}
