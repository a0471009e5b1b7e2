package com.example.darc.application.port;

import com.example.darc.application.domain.state.DeepCopyable;
import com.example.darc.application.domain.state.StateType;
import com.example.darc.application.domain.stream.ParticipantContext;

/**
 * 依部署設定的策略為參與者建立儲存體
 */
public interface TransactionalStateStorageFactory {

	<S extends DeepCopyable<S>> TransactionalStateStorage<S> create(String stateName, ParticipantContext participant,
			StateType<S> stateType);
}
