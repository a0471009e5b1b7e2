package com.example.darc.application.domain.stream;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 串流佈局 (Stream Layout)
 *
 * <p>
 * 一個參與者的一份具名狀態對應三條串流：
 * </p>
 *
 * <pre>
 * main     = "{participantType}-{participantKey}-{stateName}"   僅含已提交的領域事件
 * pending  = "{main}-pending"                                   準備中的事件 (悲觀策略)
 * metadata = "{main}-metadata"                                  已提交序號與協調者中繼資料
 * </pre>
 *
 * <p>
 * 純函式，不做任何 I/O。呼叫端必須保證 (participantType, participantKey) 唯一。
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StreamLayout {

	private static final String PENDING_SUFFIX = "-pending";
	private static final String METADATA_SUFFIX = "-metadata";

	private final String mainStreamName;
	private final String pendingStreamName;
	private final String metadataStreamName;

	public static StreamLayout of(String participantType, String participantKey, String stateName) {
		return of(ParticipantContext.of(participantType, participantKey), stateName);
	}

	public static StreamLayout of(ParticipantContext participant, String stateName) {
		if (stateName == null || stateName.isBlank()) {
			throw new IllegalArgumentException("狀態名稱不可為空");
		}
		String main = participant.getParticipantType() + "-" + participant.getParticipantKey() + "-" + stateName;
		return new StreamLayout(main, main + PENDING_SUFFIX, main + METADATA_SUFFIX);
	}
}
