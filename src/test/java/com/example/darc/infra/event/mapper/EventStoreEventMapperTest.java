package com.example.darc.infra.event.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.eventstore.dbclient.EventData;
import com.eventstore.dbclient.RecordedEvent;
import com.eventstore.dbclient.ResolvedEvent;
import com.example.darc.application.domain.stream.LogEvent;

class EventStoreEventMapperTest {

	private final EventStoreEventMapper mapper = new EventStoreEventMapper();

	@Test
	@DisplayName("寫入時保留事件 ID、類型、內容與中繼資料")
	void mapsLogEventToEventData() {
		UUID eventId = UUID.randomUUID();
		LogEvent event = LogEvent.builder().eventId(eventId).eventType("MoneyDepositedEvent")
				.data("{\"amount\":10}".getBytes()).metadata("{\"transactionId\":\"tx\"}".getBytes()).build();

		EventData data = mapper.toEventData(event);

		assertThat(data.getEventId()).isEqualTo(eventId);
		assertThat(data.getEventType()).isEqualTo("MoneyDepositedEvent");
		assertThat(data.getEventData()).isEqualTo(event.getData());
		assertThat(data.getUserMetadata()).isEqualTo(event.getMetadata());
	}

	@Test
	void leavesMetadataEmptyForCleanEvents() {
		EventData data = mapper.toEventData(LogEvent.builder().eventType("MoneyWithdrawnEvent").build());

		assertThat(data.getUserMetadata()).isNullOrEmpty();
	}

	@Test
	@DisplayName("讀取時帶回版本與建立時間")
	void mapsResolvedEventToLogEvent() {
		UUID eventId = UUID.randomUUID();
		Instant created = Instant.parse("2024-03-01T10:00:00Z");
		RecordedEvent recorded = mock(RecordedEvent.class);
		when(recorded.getEventId()).thenReturn(eventId);
		when(recorded.getEventType()).thenReturn("MetadataSnapshot");
		when(recorded.getEventData()).thenReturn(new byte[] { 1 });
		when(recorded.getUserMetadata()).thenReturn(null);
		when(recorded.getRevision()).thenReturn(5L);
		when(recorded.getCreated()).thenReturn(created);
		ResolvedEvent resolved = mock(ResolvedEvent.class);
		when(resolved.getEvent()).thenReturn(recorded);

		LogEvent event = mapper.toLogEvent(resolved);

		assertThat(event.getEventId()).isEqualTo(eventId);
		assertThat(event.getEventType()).isEqualTo("MetadataSnapshot");
		assertThat(event.getRevision()).isEqualTo(5L);
		assertThat(event.getCreated()).isEqualTo(created);
		assertThat(event.hasMetadata()).isFalse();
	}
}
