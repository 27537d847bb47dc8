package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.application.config.ExecutionEnvironment;
import com.ryuqq.fanout.application.config.OrgAccessConfig;
import com.ryuqq.fanout.application.identity.RootSessionResolver;
import com.ryuqq.fanout.application.identity.SessionCache;
import com.ryuqq.fanout.application.processor.AccountSetProcessor;
import com.ryuqq.fanout.application.processor.BatchResult;
import com.ryuqq.fanout.core.identity.IdentityResolutionException;
import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.outcome.UnitResult;
import com.ryuqq.fanout.core.spi.CredentialProvider;
import com.ryuqq.fanout.core.spi.RegionOperation;
import com.ryuqq.fanout.core.statemachine.AccountState;
import com.ryuqq.fanout.core.statemachine.AccountStateTransition;
import com.ryuqq.fanout.core.statemachine.RegionState;
import com.ryuqq.fanout.core.statemachine.RegionStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Fan-out Executor 구현체.
 *
 * <p>고정 크기 worker 풀에서 계정마다 하나의 task를 실행하고, 완료 순서대로 결과를 모아
 * {@link BatchResult}로 반환합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * runBatch(accounts, operation)
 *   ↓
 * rootSessionResolver.getRootSession() (한 번, 실패 시 호출자에게 전파)
 *   ↓
 * For each distinct account → submit(task)
 *   task (worker 스레드):
 *     PENDING
 *       ├─ worker SessionCache.resolveIdentity() 실패 → IDENTITY_FAILED → DONE (결과 없음)
 *       └─ 성공 → IDENTITY_RESOLVED
 *            For each region: RUNNING → SUCCEEDED | FAILED
 *          → DONE (region → UnitResult)
 *   ↓
 * completionService.take() × N (완료 순서)
 *   - ExecutionException → 계정 제외, 로그
 *   ↓
 * BatchResult
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>동시에 실행되는 task 수는 concurrency를 넘지 않음</li>
 *   <li>각 worker 스레드는 자신만의 SessionCache를 소유 (락 없음, worker 간 공유 없음)</li>
 *   <li>root 세션은 모든 worker가 읽기 전용으로 공유</li>
 *   <li>worker 풀은 shutdown 전까지 유지되며, 캐시도 배치 간에 재사용됨</li>
 * </ul>
 *
 * @param <S> 세션 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class FanOutExecutor<S extends IdentitySession> implements AccountSetProcessor<S> {

    private static final Logger log = LoggerFactory.getLogger(FanOutExecutor.class);

    private final RootSessionResolver<S> rootSessionResolver;
    private final OrgAccessConfig accessConfig;
    private final FanOutConfig config;
    private final FanOutWorkerFactory<S> workerFactory;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (시스템 환경, UTC 시계 사용).
     *
     * @param credentialProvider 자격 증명 Provider
     * @param accessConfig org 접근 설정
     * @param config fan-out 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FanOutExecutor(CredentialProvider<S> credentialProvider,
                          OrgAccessConfig accessConfig,
                          FanOutConfig config) {
        this(
            credentialProvider,
            new RootSessionResolver<>(credentialProvider, accessConfig, ExecutionEnvironment.fromSystem()),
            accessConfig,
            config,
            Clock.systemUTC()
        );
    }

    /**
     * 생성자 (커스텀 RootSessionResolver, Clock 주입).
     *
     * @param credentialProvider 자격 증명 Provider (worker 캐시가 사용)
     * @param rootSessionResolver root 세션 해석기
     * @param accessConfig org 접근 설정
     * @param config fan-out 설정
     * @param clock 세션 만료 판단 기준 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FanOutExecutor(CredentialProvider<S> credentialProvider,
                          RootSessionResolver<S> rootSessionResolver,
                          OrgAccessConfig accessConfig,
                          FanOutConfig config,
                          Clock clock) {
        if (credentialProvider == null) {
            throw new IllegalArgumentException("credentialProvider cannot be null");
        }
        if (rootSessionResolver == null) {
            throw new IllegalArgumentException("rootSessionResolver cannot be null");
        }
        if (accessConfig == null) {
            throw new IllegalArgumentException("accessConfig cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.rootSessionResolver = rootSessionResolver;
        this.accessConfig = accessConfig;
        this.config = config;

        Duration refreshWindow = Duration.ofMillis(config.sessionRefreshWindowMs());
        this.workerFactory = new FanOutWorkerFactory<>(
            () -> new SessionCache<>(credentialProvider, accessConfig, clock, refreshWindow)
        );
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency(), workerFactory);
    }

    @Override
    public <T> BatchResult<T> runBatch(Collection<Account> accounts, RegionOperation<S, T> operation) {
        if (accounts == null) {
            throw new IllegalArgumentException("accounts cannot be null");
        }
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("FanOutExecutor has been shut down");
        }

        // 1. root 세션 (실패 시 fan-out 전에 전파)
        S rootSession = rootSessionResolver.getRootSession();

        // 2. 계정 ID 기준 중복 제거
        Map<String, Account> distinct = new LinkedHashMap<>();
        for (Account account : accounts) {
            distinct.putIfAbsent(account.id(), account);
        }

        // 3. fan-out
        CompletionService<Optional<Map<String, UnitResult<T>>>> completionService =
            new ExecutorCompletionService<>(workerExecutor);
        Map<Future<Optional<Map<String, UnitResult<T>>>>, Account> futures = new HashMap<>();
        for (Account account : distinct.values()) {
            futures.put(completionService.submit(() -> processAccount(rootSession, account, operation)), account);
        }

        // 4. fan-in (완료 순서)
        Map<String, Map<String, UnitResult<T>>> results = new LinkedHashMap<>();
        for (int i = 0; i < futures.size(); i++) {
            Future<Optional<Map<String, UnitResult<T>>>> future = take(completionService);
            Account account = futures.get(future);
            try {
                future.get().ifPresent(regionResults -> results.put(account.id(), regionResults));
            } catch (ExecutionException e) {
                log.error("Error in account:{} id:{} error:{}",
                    account.name(), account.id(), e.getCause().toString(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Fan-out interrupted", e);
            }
        }

        return BatchResult.of(results);
    }

    /**
     * Executor 종료 (리소스 정리).
     *
     * <p>worker 풀을 graceful shutdown하여 진행 중인 task가 완료되도록 대기합니다.
     * worker가 소유한 세션 캐시도 함께 폐기됩니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    /**
     * 계정 하나 처리 (worker 스레드에서 실행).
     *
     * @return 리전별 결과, 계정 세션 해석 실패 시 empty
     */
    private <T> Optional<Map<String, UnitResult<T>>> processAccount(S rootSession,
                                                                   Account account,
                                                                   RegionOperation<S, T> operation) {
        String roleTemplate = accessConfig.orgAccountRole();
        AccountState state = AccountState.PENDING;

        S session;
        try {
            session = workerFactory.cacheFor(Thread.currentThread()).resolveIdentity(rootSession, account, roleTemplate);
        } catch (IdentityResolutionException e) {
            state = advance(account, state, AccountState.IDENTITY_FAILED);
            log.error("Error assuming role into account:{} id:{} using role:{} error:{}",
                account.name(), account.id(), roleTemplate, e.getMessage(), e);
            advance(account, state, AccountState.DONE);
            return Optional.empty();
        }
        state = advance(account, state, AccountState.IDENTITY_RESOLVED);

        log.info("Processing account:{} id:{}", account.name(), account.id());
        Map<String, UnitResult<T>> regionResults = new LinkedHashMap<>();
        for (String region : config.regions()) {
            regionResults.put(region, processRegion(account, region, session, operation));
        }

        advance(account, state, AccountState.DONE);
        return Optional.of(regionResults);
    }

    private <T> UnitResult<T> processRegion(Account account,
                                            String region,
                                            S session,
                                            RegionOperation<S, T> operation) {
        RegionState state = RegionState.RUNNING;
        log.debug("Account {} region {} {}", account.id(), region, state);
        try {
            T value = operation.process(account, region, session);
            advance(account, region, state, RegionState.SUCCEEDED);
            return UnitResult.succeeded(value);
        } catch (Exception e) {
            log.error("Account region error account:{} id:{} region:{} error:{}",
                account.name(), account.id(), region, e.getMessage(), e);
            advance(account, region, state, RegionState.FAILED);
            return UnitResult.failed(e);
        }
    }

    private void advance(Account account, String region, RegionState from, RegionState to) {
        RegionState next = RegionStateTransition.transition(from, to);
        log.debug("Account {} region {} {} -> {}", account.id(), region, from, next);
    }

    private AccountState advance(Account account, AccountState from, AccountState to) {
        AccountState next = AccountStateTransition.transition(from, to);
        log.debug("Account {} {} -> {}", account.id(), from, next);
        return next;
    }

    private static <V> Future<V> take(CompletionService<V> completionService) {
        try {
            return completionService.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Fan-out interrupted", e);
        }
    }
}
