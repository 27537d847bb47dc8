package com.ryuqq.fanout.adapter.inmemory.directory;

import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.model.ChildType;
import com.ryuqq.fanout.core.model.Policy;
import com.ryuqq.fanout.core.model.PolicyType;
import com.ryuqq.fanout.core.spi.OrganizationDirectory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link OrganizationDirectory} for testing and reference purposes.
 *
 * <p>The tree is built with {@link #addUnit(String, String)} and {@link #addAccount(String, Account)};
 * policies with {@link #addPolicy(Policy)}.
 * Children are returned in insertion order. Listing calls are counted so tests can verify that
 * traversal is breadth first and non-recursive where it should be.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryOrganizationDirectory directory = new InMemoryOrganizationDirectory()
 *     .addUnit("r-root", "ou-a")
 *     .addUnit("ou-a", "ou-c")
 *     .addAccount("ou-c", Account.of("111111111111", "dev"));
 * </pre>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public class InMemoryOrganizationDirectory implements OrganizationDirectory {

    private final Map<String, List<String>> units = new ConcurrentHashMap<>();
    private final Map<String, List<String>> accountChildren = new ConcurrentHashMap<>();
    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    private final List<String> accountOrder = new CopyOnWriteArrayList<>();
    private final List<Policy> policies = new CopyOnWriteArrayList<>();
    private final AtomicInteger listChildrenCalls = new AtomicInteger();

    /**
     * 부모 아래에 OU 추가.
     *
     * @param parentId 부모 ID (root 또는 OU)
     * @param unitId 추가할 OU ID
     * @return this
     */
    public InMemoryOrganizationDirectory addUnit(String parentId, String unitId) {
        units.computeIfAbsent(parentId, key -> new CopyOnWriteArrayList<>()).add(unitId);
        return this;
    }

    /**
     * 부모 아래에 계정 추가.
     *
     * @param parentId 부모 ID (root 또는 OU)
     * @param account 추가할 계정
     * @return this
     */
    public InMemoryOrganizationDirectory addAccount(String parentId, Account account) {
        accountChildren.computeIfAbsent(parentId, key -> new CopyOnWriteArrayList<>()).add(account.id());
        if (accounts.put(account.id(), account) == null) {
            accountOrder.add(account.id());
        }
        return this;
    }

    /**
     * 정책 추가.
     *
     * @param policy 추가할 정책
     * @return this
     */
    public InMemoryOrganizationDirectory addPolicy(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        policies.add(policy);
        return this;
    }

    @Override
    public List<String> listChildren(String parentId, ChildType childType) {
        if (parentId == null) {
            throw new IllegalArgumentException("parentId cannot be null");
        }
        if (childType == null) {
            throw new IllegalArgumentException("childType cannot be null");
        }
        listChildrenCalls.incrementAndGet();

        Map<String, List<String>> source = childType == ChildType.ACCOUNT ? accountChildren : units;
        return List.copyOf(source.getOrDefault(parentId, List.of()));
    }

    @Override
    public List<Account> listAccounts() {
        List<Account> result = new ArrayList<>(accountOrder.size());
        for (String id : accountOrder) {
            result.add(accounts.get(id));
        }
        return result;
    }

    @Override
    public List<Policy> listPolicies(PolicyType policyType) {
        if (policyType == null) {
            throw new IllegalArgumentException("policyType cannot be null");
        }
        return policies.stream()
            .filter(policy -> policy.type() == policyType)
            .collect(Collectors.toList());
    }

    /**
     * listChildren 호출 횟수.
     *
     * @return 누적 호출 횟수
     */
    public int getListChildrenCalls() {
        return listChildrenCalls.get();
    }

    /**
     * Clears all in-memory state (for testing).
     */
    public void clear() {
        units.clear();
        accountChildren.clear();
        accounts.clear();
        accountOrder.clear();
        policies.clear();
        listChildrenCalls.set(0);
    }
}
