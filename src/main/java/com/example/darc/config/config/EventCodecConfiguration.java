package com.example.darc.config.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.darc.infra.event.codec.EventJsonCodec;

import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * EventCodec 的配置類
 * <p>
 * 優先使用 Spring 容器中的 ObjectMapper，沒有時建立預設的 JsonMapper。
 * </p>
 */
@Configuration
public class EventCodecConfiguration {

	@Bean
	public EventJsonCodec eventJsonCodec(ObjectProvider<ObjectMapper> objectMapper) {
		return new EventJsonCodec(objectMapper.getIfAvailable(() -> JsonMapper.builder().build()));
	}
}
