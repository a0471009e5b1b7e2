package com.example.darc.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.example.darc.application.domain.account.BankAccountState;
import com.example.darc.application.domain.stream.LogEvent;
import com.example.darc.application.domain.stream.ParticipantContext;
import com.example.darc.application.domain.stream.StreamLayout;
import com.example.darc.application.domain.transaction.ReplayFailurePolicy;
import com.example.darc.application.domain.transaction.StorageMode;
import com.example.darc.application.port.TransactionalStateStorageFactory;
import com.example.darc.infra.event.codec.EventJsonCodec;
import com.example.darc.testkit.InMemoryEventLog;
import com.example.darc.testkit.TestTransactionCoordinator;

import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.json.JsonMapper;

/**
 * <h2>銀行帳戶帳本情境測試</h2>
 *
 * <pre>
 * <b>Feature:</b> 透過協調者驅動 load / store，兩種儲存策略都要得到相同的帳本結果
 * <b>Background:</b> 每個情境使用全新的記憶體事件日誌與測試協調者
 * </pre>
 */
@Slf4j
class BankAccountLedgerScenarioTest {

	private final InMemoryEventLog eventLog = new InMemoryEventLog();

	private TransactionalStateStorageFactory factory(StorageMode mode) {
		return new EventStoreTransactionalStateStorageFactory(eventLog,
				new EventJsonCodec(JsonMapper.builder().build()), mode, ReplayFailurePolicy.SKIP);
	}

	private TestTransactionCoordinator<BankAccountState> activate(StorageMode mode, String accountId) {
		TestTransactionCoordinator<BankAccountState> coordinator = new TestTransactionCoordinator<>(
				factory(mode).create("account", ParticipantContext.of("bankaccount", accountId), BankAccountState.TYPE));
		coordinator.activate();
		return coordinator;
	}

	/**
	 * <b>Scenario A:</b> Deposit(100) 之後查詢餘額為 100
	 */
	@ParameterizedTest
	@EnumSource(StorageMode.class)
	void depositThenReadBalance(StorageMode mode) {
		TestTransactionCoordinator<BankAccountState> account = activate(mode, "acc-a");

		account.runTransaction(s -> s.deposit(new BigDecimal("100")));

		assertThat(account.read().getBalance()).isEqualByComparingTo("100");
	}

	/**
	 * <b>Scenario B:</b> 連續三筆存款，餘額 100、交易筆數 3
	 */
	@ParameterizedTest
	@EnumSource(StorageMode.class)
	void threeDepositsAccumulate(StorageMode mode) {
		TestTransactionCoordinator<BankAccountState> account = activate(mode, "acc-b");

		account.runTransaction(s -> s.deposit(new BigDecimal("50")));
		account.runTransaction(s -> s.deposit(new BigDecimal("30")));
		account.runTransaction(s -> s.deposit(new BigDecimal("20")));

		BankAccountState reloaded = activate(mode, "acc-b").read();
		assertThat(reloaded.getBalance()).isEqualByComparingTo("100");
		assertThat(reloaded.getTransactionCount()).isEqualTo(3);
		assertThat(reloaded.getLastUpdate()).isNotNull();
	}

	/**
	 * <b>Scenario C:</b> Deposit(100) 再 Withdraw(30)，餘額 70
	 */
	@ParameterizedTest
	@EnumSource(StorageMode.class)
	void depositThenWithdraw(StorageMode mode) {
		TestTransactionCoordinator<BankAccountState> account = activate(mode, "acc-c");

		account.runTransaction(s -> s.deposit(new BigDecimal("100")));
		account.runTransaction(s -> s.withdraw(new BigDecimal("30")));

		assertThat(activate(mode, "acc-c").read().getBalance()).isEqualByComparingTo("70");
	}

	/**
	 * <pre>
	 * <b>Scenario D:</b> 餘額不足的提款被拒絕
	 * <b>Given</b> 帳戶餘額 50
	 * <b>When</b>  提款 80
	 * <b>Then</b>  業務規則拋出例外，任何串流都沒有新事件，餘額仍為 50
	 * </pre>
	 */
	@ParameterizedTest
	@EnumSource(StorageMode.class)
	void insufficientFundsIsRejected(StorageMode mode) {
		TestTransactionCoordinator<BankAccountState> account = activate(mode, "acc-d");
		account.runTransaction(s -> s.deposit(new BigDecimal("50")));
		int appendsBefore = eventLog.getAppendCalls();

		assertThatThrownBy(() -> account.runTransaction(s -> s.withdraw(new BigDecimal("80"))))
				.isInstanceOf(IllegalStateException.class);

		assertThat(eventLog.getAppendCalls()).isEqualTo(appendsBefore);
		assertThat(account.read().getBalance()).isEqualByComparingTo("50");
		assertThat(activate(mode, "acc-d").read().getBalance()).isEqualByComparingTo("50");
	}

	/**
	 * <pre>
	 * <b>Scenario E:</b> 跨參與者轉帳
	 * <b>Given</b> 帳戶 X 餘額 200、帳戶 Y 餘額 50
	 * <b>When</b>  兩階段提交：X 提款 75、Y 存款 75 都 prepare 後再各自 commit
	 * <b>Then</b>  兩個帳戶都是 125，重新啟用後仍是 125 / 125
	 * </pre>
	 */
	@ParameterizedTest
	@EnumSource(StorageMode.class)
	void transferAcrossParticipants(StorageMode mode) {
		TestTransactionCoordinator<BankAccountState> x = activate(mode, "acc-x");
		TestTransactionCoordinator<BankAccountState> y = activate(mode, "acc-y");
		x.runTransaction(s -> s.deposit(new BigDecimal("200")));
		y.runTransaction(s -> s.deposit(new BigDecimal("50")));

		transfer(x, y, new BigDecimal("75"));

		assertThat(x.read().getBalance()).isEqualByComparingTo("125");
		assertThat(y.read().getBalance()).isEqualByComparingTo("125");
		assertThat(activate(mode, "acc-x").read().getBalance()).isEqualByComparingTo("125");
		assertThat(activate(mode, "acc-y").read().getBalance()).isEqualByComparingTo("125");
	}

	/**
	 * <pre>
	 * <b>Scenario:</b> 管線化交易
	 * <b>Given</b> 帳戶餘額 0
	 * <b>When</b>  存款 10 prepare 後尚未提交，接著以其準備狀態存款 5 並 prepare，最後一次提交到第二筆
	 * <b>Then</b>  主串流只有兩筆事件，協調者看到的已提交狀態與重新載入的狀態都是 15
	 * </pre>
	 */
	@ParameterizedTest
	@EnumSource(StorageMode.class)
	void pipelinedPreparesCommitOnce(StorageMode mode) {
		TestTransactionCoordinator<BankAccountState> account = activate(mode, "acc-pipe");

		account.prepare(s -> s.deposit(new BigDecimal("10")));
		long second = account.prepare(s -> s.deposit(new BigDecimal("5")));
		account.commit(second);

		String main = StreamLayout.of("bankaccount", "acc-pipe", "account").getMainStreamName();
		BankAccountState reloaded = activate(mode, "acc-pipe").read();
		assertThat(eventLog.events(main)).hasSize(2);
		assertThat(account.read().getBalance()).isEqualByComparingTo("15");
		assertThat(reloaded.getBalance()).isEqualByComparingTo(account.read().getBalance());
		assertThat(reloaded.getTransactionCount()).isEqualTo(account.read().getTransactionCount()).isEqualTo(2);
	}

	/**
	 * <b>P1:</b> 任意提交序列之後，load 的結果等於從頭重播主串流的結果
	 */
	@ParameterizedTest
	@EnumSource(StorageMode.class)
	void loadEqualsReplayFromScratch(StorageMode mode) {
		TestTransactionCoordinator<BankAccountState> account = activate(mode, "acc-p1");
		Random random = new Random(42);
		for (int i = 0; i < 20; i++) {
			BigDecimal amount = BigDecimal.valueOf(1 + random.nextInt(50));
			if (random.nextBoolean() || account.read().getBalance().compareTo(amount) < 0) {
				account.runTransaction(s -> s.deposit(amount));
			} else {
				account.runTransaction(s -> s.withdraw(amount));
			}
		}

		String main = StreamLayout.of("bankaccount", "acc-p1", "account").getMainStreamName();
		EventSourcingAdapter adapter = new EventSourcingAdapter(new EventJsonCodec(JsonMapper.builder().build()),
				ReplayFailurePolicy.FAIL);
		BankAccountState replayed = adapter.replay(BankAccountState.TYPE, new BankAccountState(),
				eventLog.events(main));
		BankAccountState loaded = activate(mode, "acc-p1").read();

		assertThat(loaded.getBalance()).isEqualByComparingTo(replayed.getBalance());
		assertThat(loaded.getTransactionCount()).isEqualTo(replayed.getTransactionCount()).isEqualTo(20);
		assertThat(loaded.getBalance()).isEqualByComparingTo(account.read().getBalance());
		assertThat(eventLog.events(main)).noneMatch(LogEvent::hasMetadata);
	}

	/**
	 * <b>P5:</b> 任意成功轉帳序列之後，所有帳戶的總餘額不變
	 */
	@ParameterizedTest
	@EnumSource(StorageMode.class)
	void transfersConserveTotalBalance(StorageMode mode) {
		List<TestTransactionCoordinator<BankAccountState>> accounts = List.of(activate(mode, "acc-1"),
				activate(mode, "acc-2"), activate(mode, "acc-3"));
		accounts.forEach(a -> a.runTransaction(s -> s.deposit(new BigDecimal("100"))));

		Random random = new Random(7);
		for (int i = 0; i < 30; i++) {
			TestTransactionCoordinator<BankAccountState> from = accounts.get(random.nextInt(3));
			TestTransactionCoordinator<BankAccountState> to = accounts.get(random.nextInt(3));
			if (from == to) {
				continue;
			}
			BigDecimal amount = BigDecimal.valueOf(1 + random.nextInt(120));
			try {
				transfer(from, to, amount);
			} catch (IllegalStateException e) {
				log.debug(">>> [P5] 轉帳 {} 被拒絕: {}", amount, e.getMessage());
			}
		}

		BigDecimal total = BigDecimal.ZERO;
		for (String id : List.of("acc-1", "acc-2", "acc-3")) {
			total = total.add(activate(mode, id).read().getBalance());
		}
		assertThat(total).isEqualByComparingTo("300");
	}

	/**
	 * 兩階段提交：兩邊都 prepare 成功才提交，任一邊業務規則失敗時中止已 prepare 的一方
	 */
	private static void transfer(TestTransactionCoordinator<BankAccountState> from,
			TestTransactionCoordinator<BankAccountState> to, BigDecimal amount) {
		long withdrawSeq = from.prepare(s -> s.withdraw(amount));
		long depositSeq;
		try {
			depositSeq = to.prepare(s -> s.deposit(amount));
		} catch (RuntimeException e) {
			from.abort(withdrawSeq - 1);
			throw e;
		}
		from.commit(withdrawSeq);
		to.commit(depositSeq);
	}
}
