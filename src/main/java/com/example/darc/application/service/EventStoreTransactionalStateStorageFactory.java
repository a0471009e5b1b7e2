package com.example.darc.application.service;

import com.example.darc.application.domain.state.DeepCopyable;
import com.example.darc.application.domain.state.StateType;
import com.example.darc.application.domain.stream.ParticipantContext;
import com.example.darc.application.domain.stream.StreamLayout;
import com.example.darc.application.domain.transaction.ReplayFailurePolicy;
import com.example.darc.application.domain.transaction.StorageMode;
import com.example.darc.application.port.EventLogPort;
import com.example.darc.application.port.TransactionalStateStorage;
import com.example.darc.application.port.TransactionalStateStorageFactory;
import com.example.darc.infra.event.codec.EventJsonCodec;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 交易狀態儲存工廠
 *
 * <p>
 * 策略在部署時決定 ({@code darc.storage.mode})，同一部署中所有參與者使用相同策略。
 * </p>
 */
@Slf4j
public class EventStoreTransactionalStateStorageFactory implements TransactionalStateStorageFactory {

	private final EventLogPort eventLog;
	private final EventJsonCodec codec;
	private final EventSourcingAdapter eventSourcingAdapter;
	private final MetadataStore metadataStore;

	@Getter
	private final StorageMode mode;

	public EventStoreTransactionalStateStorageFactory(EventLogPort eventLog, EventJsonCodec codec, StorageMode mode,
			ReplayFailurePolicy replayFailurePolicy) {
		if (mode == null) {
			throw new IllegalArgumentException("儲存策略不可為空");
		}
		this.eventLog = eventLog;
		this.codec = codec;
		this.mode = mode;
		this.eventSourcingAdapter = new EventSourcingAdapter(codec,
				replayFailurePolicy == null ? ReplayFailurePolicy.SKIP : replayFailurePolicy);
		this.metadataStore = new MetadataStore(eventLog, codec);
	}

	@Override
	public <S extends DeepCopyable<S>> TransactionalStateStorage<S> create(String stateName,
			ParticipantContext participant, StateType<S> stateType) {
		StreamLayout layout = StreamLayout.of(participant, stateName);
		log.debug(">>> [Factory] 建立 {} 儲存體: {}", mode, layout.getMainStreamName());

		switch (mode) {
		case OPTIMISTIC:
			return new OptimisticEventStoreStateStorage<>(layout, stateType, eventLog, eventSourcingAdapter,
					metadataStore);
		case PESSIMISTIC:
		default:
			return new PessimisticEventStoreStateStorage<>(layout, stateType, eventLog, eventSourcingAdapter,
					metadataStore, codec);
		}
	}
}
