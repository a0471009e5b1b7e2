package com.example.darc.config.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.darc.application.domain.transaction.ReplayFailurePolicy;
import com.example.darc.application.domain.transaction.StorageMode;
import com.example.darc.application.port.EventLogPort;
import com.example.darc.application.port.TransactionalStateStorageFactory;
import com.example.darc.application.service.EventStoreTransactionalStateStorageFactory;
import com.example.darc.infra.event.codec.EventJsonCodec;

import lombok.extern.slf4j.Slf4j;

/**
 * 交易狀態儲存的配置類
 *
 * <pre>
 * darc.storage.mode                  : OPTIMISTIC | PESSIMISTIC (預設 PESSIMISTIC)
 * darc.storage.replay-failure-policy : SKIP | FAIL (預設 SKIP)
 * </pre>
 */
@Slf4j
@Configuration
public class TransactionalStorageConfiguration {

	@Bean
	public TransactionalStateStorageFactory transactionalStateStorageFactory(EventLogPort eventLogPort,
			EventJsonCodec eventJsonCodec, @Value("${darc.storage.mode:PESSIMISTIC}") StorageMode mode,
			@Value("${darc.storage.replay-failure-policy:SKIP}") ReplayFailurePolicy replayFailurePolicy) {
		log.info(">>> [Storage] 交易狀態儲存策略: {}, 重播失敗處理: {}", mode, replayFailurePolicy);
		return new EventStoreTransactionalStateStorageFactory(eventLogPort, eventJsonCodec, mode, replayFailurePolicy);
	}
}
