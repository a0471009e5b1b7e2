package com.example.darc.application.domain.stream;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 交易參與者識別 (Participant Identity)
 *
 * <p>
 * 由協調者在啟用參與者時提供，例如 {@code ("bankaccount", "account-001")}。
 * 參與者類型會統一轉為小寫，與串流命名規則保持一致。
 * </p>
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ParticipantContext {

	/**
	 * 參與者類型 (例如 grain type)
	 */
	private final String participantType;

	/**
	 * 參與者唯一鍵
	 */
	private final String participantKey;

	public static ParticipantContext of(String participantType, String participantKey) {
		if (participantType == null || participantType.isBlank()) {
			throw new IllegalArgumentException("參與者類型不可為空");
		}
		if (participantKey == null || participantKey.isBlank()) {
			throw new IllegalArgumentException("參與者唯一鍵不可為空");
		}
		return new ParticipantContext(participantType.toLowerCase(), participantKey);
	}
}
