package com.example.darc.application.domain.stream;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 追加事件時的版本前置條件 (Expected Version)
 *
 * <ul>
 * <li>{@link #any()}：不檢查版本，pending / metadata 串流使用</li>
 * <li>{@link #noStream()}：串流必須尚不存在</li>
 * <li>{@link #exact(long)}：串流最後一筆事件的版本必須等於指定值，主串流提交使用</li>
 * </ul>
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExpectedVersion {

	/**
	 * 串流尚無任何事件時的版本哨兵值 (第一筆事件的版本為 0)
	 */
	public static final long NO_STREAM_REVISION = -1L;

	public enum Kind {
		ANY, NO_STREAM, EXACT
	}

	private final Kind kind;
	private final long revision;

	public static ExpectedVersion any() {
		return new ExpectedVersion(Kind.ANY, NO_STREAM_REVISION);
	}

	public static ExpectedVersion noStream() {
		return new ExpectedVersion(Kind.NO_STREAM, NO_STREAM_REVISION);
	}

	public static ExpectedVersion exact(long revision) {
		if (revision < 0) {
			throw new IllegalArgumentException("版本號不可小於 0: " + revision);
		}
		return new ExpectedVersion(Kind.EXACT, revision);
	}

	/**
	 * 依目前已提交的版本決定前置條件：尚無事件時要求串流不存在，否則要求精確版本。
	 */
	public static ExpectedVersion fromCommittedRevision(long committedRevision) {
		return committedRevision == NO_STREAM_REVISION ? noStream() : exact(committedRevision);
	}

	@Override
	public String toString() {
		return kind == Kind.EXACT ? "EXACT(" + revision + ")" : kind.name();
	}
}
