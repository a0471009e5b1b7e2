package com.example.darc.application.domain.transaction;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * pending 串流事件的交易標記，存放於事件的使用者中繼資料 (user metadata)
 *
 * <p>
 * 提交時會被剝除，主串流中的事件永遠不帶此標記。
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingEntryTag {

	private String transactionId;

	private long sequenceId;

	private String transactionManager;

	private Instant timestamp;
}
