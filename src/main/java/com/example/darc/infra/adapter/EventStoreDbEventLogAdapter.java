package com.example.darc.infra.adapter;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import com.eventstore.dbclient.AppendToStreamOptions;
import com.eventstore.dbclient.DeleteStreamOptions;
import com.eventstore.dbclient.EventStoreDBClient;
import com.eventstore.dbclient.ExpectedRevision;
import com.eventstore.dbclient.ReadResult;
import com.eventstore.dbclient.ReadStreamOptions;
import com.eventstore.dbclient.StreamNotFoundException;
import com.eventstore.dbclient.WriteResult;
import com.eventstore.dbclient.WrongExpectedVersionException;
import com.example.darc.application.domain.stream.ExpectedVersion;
import com.example.darc.application.domain.stream.LogEvent;
import com.example.darc.application.domain.stream.ReadDirection;
import com.example.darc.application.port.EventLogPort;
import com.example.darc.application.shared.exception.EventLogAccessException;
import com.example.darc.application.shared.exception.LogStreamNotFoundException;
import com.example.darc.application.shared.exception.LogVersionConflictException;
import com.example.darc.infra.event.mapper.EventStoreEventMapper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * EventStoreDB 事件日誌轉接器 (Infrastructure Adapter)
 *
 * <p>
 * 實作 {@link EventLogPort}。所有遠端呼叫都以逾時等待客戶端的 Future，避免網路問題讓協調者無限期卡住；
 * 客戶端例外會轉換為儲存引擎的例外類型。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class EventStoreDbEventLogAdapter implements EventLogPort {

	private final EventStoreDBClient client;
	private final EventStoreEventMapper mapper;
	private final long timeoutSeconds;

	@Override
	public List<LogEvent> read(String streamName, ReadDirection direction, long fromRevision, long maxCount) {
		ReadStreamOptions options = direction == ReadDirection.BACKWARDS ? ReadStreamOptions.get().backwards()
				: ReadStreamOptions.get().forwards();
		options = fromRevision == END ? options.fromEnd() : options.fromRevision(fromRevision);
		if (maxCount > 0) {
			options = options.maxCount(maxCount);
		}

		ReadResult result = await(streamName, client.readStream(streamName, options), null);
		List<LogEvent> events = result.getEvents().stream().map(mapper::toLogEvent).collect(Collectors.toList());
		log.debug(">>> [EventStore] 讀取 {} 筆事件 (Stream={}, Direction={})", events.size(), streamName, direction);
		return events;
	}

	@Override
	public void append(String streamName, ExpectedVersion expectedVersion, List<LogEvent> events) {
		AppendToStreamOptions options = AppendToStreamOptions.get().expectedRevision(toExpectedRevision(expectedVersion));
		WriteResult result = await(streamName,
				client.appendToStream(streamName, options, mapper.toEventData(events).iterator()), expectedVersion);
		log.debug(">>> [EventStore] 寫入成功: Stream={}, Events={}, Version={}", streamName, events.size(),
				result.getNextExpectedRevision());
	}

	@Override
	public void delete(String streamName) {
		await(streamName, client.deleteStream(streamName, DeleteStreamOptions.get()), null);
		log.debug(">>> [EventStore] 已刪除串流: {}", streamName);
	}

	private static ExpectedRevision toExpectedRevision(ExpectedVersion expectedVersion) {
		switch (expectedVersion.getKind()) {
		case NO_STREAM:
			return ExpectedRevision.noStream();
		case EXACT:
			return ExpectedRevision.expectedRevision(expectedVersion.getRevision());
		default:
			return ExpectedRevision.any();
		}
	}

	/**
	 * 等待客戶端 Future 完成並轉換例外
	 *
	 * @param expectedVersion 只有追加時才有值，用於版本衝突的錯誤訊息
	 */
	private <T> T await(String streamName, CompletableFuture<T> future, ExpectedVersion expectedVersion) {
		try {
			return future.get(timeoutSeconds, TimeUnit.SECONDS);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof StreamNotFoundException) {
				throw new LogStreamNotFoundException(streamName, cause);
			}
			if (cause instanceof WrongExpectedVersionException) {
				throw new LogVersionConflictException(streamName, expectedVersion, cause);
			}
			throw new EventLogAccessException("EventStore 存取失敗: " + streamName, cause);
		} catch (TimeoutException e) {
			throw new EventLogAccessException("EventStore 存取逾時 (" + timeoutSeconds + "s): " + streamName, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EventLogAccessException("EventStore 存取被中斷: " + streamName, e);
		}
	}
}
