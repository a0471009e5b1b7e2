package com.example.darc.application.port;

import java.util.List;
import java.util.Optional;

import com.example.darc.application.domain.stream.ExpectedVersion;
import com.example.darc.application.domain.stream.LogEvent;
import com.example.darc.application.domain.stream.ReadDirection;
import com.example.darc.application.shared.exception.EventLogAccessException;
import com.example.darc.application.shared.exception.LogStreamNotFoundException;
import com.example.darc.application.shared.exception.LogVersionConflictException;

/**
 * 遠端事件日誌 Port
 *
 * <p>
 * 儲存引擎只透過此介面存取事件日誌，實作負責把客戶端例外轉換為
 * {@link LogStreamNotFoundException}、{@link LogVersionConflictException} 與
 * {@link EventLogAccessException}。
 * </p>
 */
public interface EventLogPort {

	/**
	 * 從串流開頭讀取
	 */
	long START = 0L;

	/**
	 * 從串流結尾讀取 (搭配 {@link ReadDirection#BACKWARDS})
	 */
	long END = -1L;

	/**
	 * 讀取串流事件
	 *
	 * @param streamName   串流名稱
	 * @param direction    讀取方向
	 * @param fromRevision 起始版本，{@link #START} 或 {@link #END}
	 * @param maxCount     最多讀取筆數，小於等於 0 表示不限
	 * @return 依讀取方向排列的事件
	 * @throws LogStreamNotFoundException 串流不存在或已刪除
	 */
	List<LogEvent> read(String streamName, ReadDirection direction, long fromRevision, long maxCount);

	/**
	 * 由前往後讀取整條串流
	 */
	default List<LogEvent> readAll(String streamName) {
		return read(streamName, ReadDirection.FORWARDS, START, 0);
	}

	/**
	 * 讀取串流最後一筆事件，串流存在但沒有事件時回傳空值
	 */
	default Optional<LogEvent> readLast(String streamName) {
		List<LogEvent> events = read(streamName, ReadDirection.BACKWARDS, END, 1);
		return events.isEmpty() ? Optional.empty() : Optional.of(events.get(0));
	}

	/**
	 * 以單次原子操作追加多筆事件，全部成功或全部失敗
	 *
	 * @throws LogVersionConflictException 版本前置條件不成立
	 */
	void append(String streamName, ExpectedVersion expectedVersion, List<LogEvent> events);

	/**
	 * 刪除整條串流
	 *
	 * @throws LogStreamNotFoundException 串流不存在
	 */
	void delete(String streamName);
}
