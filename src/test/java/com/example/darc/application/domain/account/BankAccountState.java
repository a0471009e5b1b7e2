package com.example.darc.application.domain.account;

import java.math.BigDecimal;
import java.time.Instant;

import com.example.darc.application.domain.state.Event;
import com.example.darc.application.domain.state.EventSourcedState;
import com.example.darc.application.domain.state.StateType;

import lombok.Getter;

/**
 * 測試用的銀行帳戶狀態 (事件溯源)
 *
 * <p>
 * 業務規則在追加事件之前檢查，違反時直接拋出例外，不留下任何事件。
 * </p>
 */
@Getter
public class BankAccountState extends EventSourcedState<BankAccountState> {

	public static final StateType<BankAccountState> TYPE = StateType.of(BankAccountState.class,
			BankAccountState::new, AccountCreatedEvent.class, MoneyDepositedEvent.class, MoneyWithdrawnEvent.class);

	private String owner;

	private BigDecimal balance = BigDecimal.ZERO;

	private int transactionCount;

	private Instant lastUpdate;

	public void open(String owner) {
		if (this.owner != null) {
			throw new IllegalStateException("帳戶已開立: " + this.owner);
		}
		append(new AccountCreatedEvent(owner));
	}

	public void deposit(BigDecimal amount) {
		requirePositive(amount);
		append(new MoneyDepositedEvent(amount));
	}

	public void withdraw(BigDecimal amount) {
		requirePositive(amount);
		if (balance.compareTo(amount) < 0) {
			throw new IllegalStateException("餘額不足: balance=" + balance + ", amount=" + amount);
		}
		append(new MoneyWithdrawnEvent(amount));
	}

	@Override
	public void apply(Event event) {
		if (event instanceof AccountCreatedEvent) {
			this.owner = ((AccountCreatedEvent) event).getOwner();
		} else if (event instanceof MoneyDepositedEvent) {
			this.balance = balance.add(((MoneyDepositedEvent) event).getAmount());
			this.transactionCount++;
		} else if (event instanceof MoneyWithdrawnEvent) {
			this.balance = balance.subtract(((MoneyWithdrawnEvent) event).getAmount());
			this.transactionCount++;
		} else {
			throw new IllegalArgumentException("不支援的事件: " + event.getClass().getSimpleName());
		}
		this.lastUpdate = event.getOccurredAt();
	}

	@Override
	public BankAccountState deepCopy() {
		BankAccountState copy = new BankAccountState();
		copy.owner = owner;
		copy.balance = balance;
		copy.transactionCount = transactionCount;
		copy.lastUpdate = lastUpdate;
		copyPendingEventsTo(copy);
		return copy;
	}

	private static void requirePositive(BigDecimal amount) {
		if (amount == null || amount.signum() <= 0) {
			throw new IllegalArgumentException("金額必須大於 0: " + amount);
		}
	}
}
