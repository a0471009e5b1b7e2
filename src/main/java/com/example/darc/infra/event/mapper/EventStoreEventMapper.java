package com.example.darc.infra.event.mapper;

import java.util.List;
import java.util.stream.Collectors;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.EventDataBuilder;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.example.darc.application.domain.stream.LogEvent;

/**
 * EventStoreDB 專用的事件映射器 (Event Mapper)
 *
 * <p>
 * 負責 {@link LogEvent} 與 EventStoreDB 資料格式之間的轉換，屬於 Infrastructure 層，封裝 EventStoreDB
 * 專屬結構，讓儲存引擎不直接依賴客戶端型別。
 * </p>
 *
 * <p>
 * 設計重點：
 * <ul>
 * <li>事件 ID、類型與內容原樣保留，不做任何序列化</li>
 * <li>使用者中繼資料只在非空時寫入，主串流事件因此不帶任何中繼資料</li>
 * </ul>
 * </p>
 */
public class EventStoreEventMapper {

	/**
	 * 將 {@link LogEvent} 封裝為 EventStoreDB 可寫入的 {@link EventData}
	 */
	public EventData toEventData(LogEvent event) {
		EventDataBuilder builder = EventData.builderAsJson(event.getEventId(), event.getEventType(), event.getData());
		if (event.hasMetadata()) {
			builder.metadataAsBytes(event.getMetadata());
		}
		return builder.build();
	}

	public List<EventData> toEventData(List<LogEvent> events) {
		return events.stream().map(this::toEventData).collect(Collectors.toList());
	}

	/**
	 * 將 EventStoreDB {@link ResolvedEvent} 還原為 {@link LogEvent}
	 *
	 * <p>
	 * 讀取時帶回事件在串流中的版本與建立時間，重播與提交版本推進都依賴此版本號。
	 * </p>
	 */
	public LogEvent toLogEvent(ResolvedEvent resolvedEvent) {
		RecordedEvent recorded = resolvedEvent.getEvent();
		return LogEvent.builder()
				.eventId(recorded.getEventId())
				.eventType(recorded.getEventType())
				.data(recorded.getEventData())
				.metadata(recorded.getUserMetadata() == null ? new byte[0] : recorded.getUserMetadata())
				.revision(recorded.getRevision())
				.created(recorded.getCreated())
				.build();
	}
}
