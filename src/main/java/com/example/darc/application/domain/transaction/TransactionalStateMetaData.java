package com.example.darc.application.domain.transaction;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 協調者提供的交易中繼資料
 *
 * <p>
 * 對儲存引擎而言是不透明的資料，只負責在提交時隨序號一併保存，並在載入時原樣交還。
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransactionalStateMetaData {

	/**
	 * 協調者的邏輯時間戳
	 */
	private Instant timeStamp = Instant.EPOCH;

	/**
	 * 協調者自行維護的提交紀錄
	 */
	private Map<String, String> commitRecords = new LinkedHashMap<>();

	public TransactionalStateMetaData copy() {
		return new TransactionalStateMetaData(timeStamp,
				commitRecords == null ? new LinkedHashMap<>() : new LinkedHashMap<>(commitRecords));
	}
}
