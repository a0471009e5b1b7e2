package com.example.darc.infra.event.codec;

import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * 事件與中繼資料的 JSON 編解碼器
 *
 * <p>
 * 負責將領域事件、交易標記與 metadata 快照和 JSON byte[] 之間互相轉換，不依賴 EventStoreDB。
 * 序列化/反序列化失敗均視為系統錯誤，以 {@link IllegalStateException} 往上拋。
 * </p>
 */
public class EventJsonCodec {

	private final ObjectMapper objectMapper;

	/**
	 * @param objectMapper Jackson ObjectMapper
	 */
	public EventJsonCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * 將物件序列化為 JSON byte[]
	 *
	 * @param value 事件或中繼資料
	 * @return JSON byte[] 表現
	 */
	public byte[] serialize(Object value) {
		try {
			return objectMapper.writeValueAsBytes(value);
		} catch (Exception e) {
			throw new IllegalStateException(value.getClass().getSimpleName() + " JSON 序列化失敗", e);
		}
	}

	/**
	 * 將 JSON byte[] 反序列化為指定類型
	 *
	 * @param data JSON byte[]
	 * @param type 目標類型
	 */
	public <T> T deserialize(byte[] data, Class<T> type) {
		try {
			return objectMapper.readValue(data, type);
		} catch (Exception e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 反序列化失敗", e);
		}
	}

	/**
	 * 只反序列化 JSON 物件中的單一欄位
	 *
	 * <p>
	 * 用於 {@code StateChangedEvent}：泛型欄位在執行期無法推導，需由呼叫端指定狀態類別。
	 * </p>
	 *
	 * @param data      JSON byte[]
	 * @param fieldName 欄位名稱
	 * @param type      欄位的目標類型
	 */
	public <T> T deserializeField(byte[] data, String fieldName, Class<T> type) {
		JsonNode field;
		try {
			field = objectMapper.readTree(data).get(fieldName);
		} catch (Exception e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 解析失敗", e);
		}
		if (field == null || field.isNull()) {
			throw new IllegalStateException("JSON 缺少欄位: " + fieldName);
		}
		try {
			return objectMapper.treeToValue(field, type);
		} catch (Exception e) {
			throw new IllegalStateException(type.getSimpleName() + " JSON 反序列化失敗", e);
		}
	}
}
