package com.example.darc.application.domain.account;

import java.math.BigDecimal;

import com.example.darc.application.domain.state.Event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 存款事件
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class MoneyDepositedEvent extends Event {

	private BigDecimal amount;
}
