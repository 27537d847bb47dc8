package com.ryuqq.fanout.application.processor;

import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.spi.RegionOperation;

import java.util.Collection;

/**
 * Account Set Processor.
 *
 * <p>This interface defines the synchronous fan-out/fan-in primitive over a set of
 * organization accounts.</p>
 *
 * <p><strong>Processing Flow:</strong></p>
 * <pre>
 * runBatch(accounts, operation)
 *   ↓
 * 1. Resolve root session once
 * 2. Submit one task per account (bounded worker pool)
 * 3. Each task:
 *    a. Resolve account session via the worker's SessionCache
 *       - failure → log, account excluded
 *    b. For each configured region:
 *       - operation.process(account, region, session)
 *       - exception → Failed marker, continue with next region
 * 4. Gather completions in arrival order
 * 5. Fold into BatchResult keyed by account id
 * </pre>
 *
 * <p><strong>Failure Isolation:</strong></p>
 * <ul>
 *   <li>Region failure → recorded as Failed for that region only</li>
 *   <li>Identity failure → account absent from the result</li>
 *   <li>Unexpected task failure → account absent from the result</li>
 *   <li>No failure aborts the batch, except invalid configuration before fan-out starts</li>
 * </ul>
 *
 * <p><strong>Blocking Behavior:</strong> the call returns only after every submitted task has
 * finished. There is no cancellation and no batch-wide timeout.</p>
 *
 * @param <S> session type issued by the credential provider
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public interface AccountSetProcessor<S extends IdentitySession> {

    /**
     * Runs the operation against every account and region.
     *
     * @param accounts target accounts (duplicate ids are processed once)
     * @param operation per account-region unit of work
     * @param <T> operation result type
     * @return aggregated result, at most one entry per distinct account id
     * @throws IllegalArgumentException if accounts or operation is null
     * @throws com.ryuqq.fanout.core.identity.IdentityResolutionException if the root session cannot be resolved
     */
    <T> BatchResult<T> runBatch(Collection<Account> accounts, RegionOperation<S, T> operation);
}
