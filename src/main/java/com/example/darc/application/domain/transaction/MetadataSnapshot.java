package com.example.darc.application.domain.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * metadata 串流中的單筆快照：最後提交的序號與協調者中繼資料
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetadataSnapshot {

	private long sequenceId;

	private TransactionalStateMetaData metadata = new TransactionalStateMetaData();

	public static MetadataSnapshot empty() {
		return new MetadataSnapshot(0L, new TransactionalStateMetaData());
	}
}
