package com.example.darc.application.domain.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * 狀態型別描述 (State Type Descriptor)
 *
 * <p>
 * 提供儲存引擎無法從泛型取得的資訊：預設建構方式、類別 Token，以及事件類型名稱與事件類別的對照表
 * (重播時依事件類型反序列化)。
 * </p>
 *
 * <pre>
 * StateType&lt;BankAccountState&gt; type = StateType.of(BankAccountState.class, BankAccountState::new,
 * 		MoneyDepositedEvent.class, MoneyWithdrawnEvent.class);
 *
 * StateType&lt;LegacyCounterState&gt; legacy = StateType.overwritable(LegacyCounterState.class, LegacyCounterState::new);
 * </pre>
 *
 * <p>
 * 只有以 {@link #overwritable(Class, Supplier)} 建立的描述能重播 {@code {State}Changed} 降級事件。
 * </p>
 *
 * @param <S> 狀態型別
 */
@Getter
public final class StateType<S extends DeepCopyable<S>> {

	private final Class<S> stateClass;

	private final Supplier<S> factory;

	private final Map<String, Class<? extends Event>> eventTypes;

	/**
	 * 降級事件的整份覆寫 (target, source)，事件溯源狀態為 null
	 */
	@Getter(AccessLevel.NONE)
	private final BiConsumer<S, S> overwriter;

	private StateType(Class<S> stateClass, Supplier<S> factory, Map<String, Class<? extends Event>> eventTypes,
			BiConsumer<S, S> overwriter) {
		this.stateClass = stateClass;
		this.factory = factory;
		this.eventTypes = Collections.unmodifiableMap(eventTypes);
		this.overwriter = overwriter;
	}

	@SafeVarargs
	public static <S extends DeepCopyable<S>> StateType<S> of(Class<S> stateClass, Supplier<S> factory,
			Class<? extends Event>... eventClasses) {
		if (stateClass == null || factory == null) {
			throw new IllegalArgumentException("狀態類別與建構方式不可為空");
		}
		Map<String, Class<? extends Event>> eventTypes = new LinkedHashMap<>();
		for (Class<? extends Event> eventClass : eventClasses) {
			Class<? extends Event> previous = eventTypes.put(eventClass.getSimpleName(), eventClass);
			if (previous != null && previous != eventClass) {
				throw new IllegalArgumentException("事件類型名稱重複: " + eventClass.getSimpleName());
			}
		}
		return new StateType<>(stateClass, factory, eventTypes, null);
	}

	/**
	 * 非事件溯源狀態的描述，重播時以 {@link OverwritableState#overwriteFrom(Object)} 整份覆寫
	 */
	public static <S extends DeepCopyable<S> & OverwritableState<S>> StateType<S> overwritable(Class<S> stateClass,
			Supplier<S> factory) {
		if (stateClass == null || factory == null) {
			throw new IllegalArgumentException("狀態類別與建構方式不可為空");
		}
		BiConsumer<S, S> overwriter = OverwritableState::overwriteFrom;
		return new StateType<>(stateClass, factory, new LinkedHashMap<>(), overwriter);
	}

	public String getName() {
		return stateClass.getSimpleName();
	}

	/**
	 * 降級路徑使用的事件類型名稱
	 */
	public String getStateChangedEventType() {
		return getName() + "Changed";
	}

	/**
	 * 建立空白狀態
	 */
	public S newInstance() {
		return factory.get();
	}

	public boolean isOverwritable() {
		return overwriter != null;
	}

	/**
	 * 以 {@code source} 整份覆寫 {@code target}
	 *
	 * @throws IllegalStateException 此狀態型別不支援整份覆寫
	 */
	public void overwrite(S target, S source) {
		if (overwriter == null) {
			throw new IllegalStateException(getName() + " 不支援整份覆寫");
		}
		overwriter.accept(target, source);
	}

	public Optional<Class<? extends Event>> resolveEventClass(String eventType) {
		return Optional.ofNullable(eventTypes.get(eventType));
	}
}
