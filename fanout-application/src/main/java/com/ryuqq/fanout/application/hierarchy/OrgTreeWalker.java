package com.ryuqq.fanout.application.hierarchy;

import com.ryuqq.fanout.core.model.ChildType;
import com.ryuqq.fanout.core.spi.OrganizationDirectory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Organizational Unit 트리 탐색기.
 *
 * <p>설정된 root OU들로부터 도달 가능한 OU와 계정 ID 집합을 해석합니다.</p>
 *
 * <p><strong>탐색 방식:</strong></p>
 * <ul>
 *   <li>명시적 큐 기반 BFS (재귀 없음, 트리 깊이와 무관하게 스택 사용량 고정)</li>
 *   <li>결과는 Set에 누적되므로 중복 발견은 무해함 (멱등)</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class OrgTreeWalker {

    private final OrganizationDirectory directory;

    /**
     * 생성자.
     *
     * @param directory Organization 조회 SPI
     * @throws IllegalArgumentException directory가 null인 경우
     */
    public OrgTreeWalker(OrganizationDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    /**
     * root OU들과 모든 하위 OU ID 해석.
     *
     * <pre>
     * queue = roots, found = roots
     * while queue not empty:
     *   unit = queue.poll()
     *   for child in listChildren(unit, ORGANIZATIONAL_UNIT):
     *     queue.add(child); found.add(child)
     * </pre>
     *
     * @param rootIds 시작 OU (또는 root) ID 목록
     * @return root와 하위 OU의 합집합 (발견 순서)
     * @throws IllegalArgumentException rootIds가 null인 경우
     */
    public Set<String> resolveUnits(Collection<String> rootIds) {
        if (rootIds == null) {
            throw new IllegalArgumentException("rootIds cannot be null");
        }

        Set<String> units = new LinkedHashSet<>(rootIds);
        Deque<String> frontier = new ArrayDeque<>(rootIds);

        while (!frontier.isEmpty()) {
            String unit = frontier.poll();
            List<String> children = directory.listChildren(unit, ChildType.ORGANIZATIONAL_UNIT);
            frontier.addAll(children);
            units.addAll(children);
        }
        return units;
    }

    /**
     * OU 집합의 직계 계정 ID 해석.
     *
     * <p>재귀하지 않습니다. 하위 OU 확장은 {@link #resolveUnits(Collection)}에서 이미 수행되었다고 가정합니다.</p>
     *
     * @param unitIds 평탄화된 OU ID 집합
     * @return 계정 ID 합집합
     * @throws IllegalArgumentException unitIds가 null인 경우
     */
    public Set<String> resolveAccounts(Collection<String> unitIds) {
        if (unitIds == null) {
            throw new IllegalArgumentException("unitIds cannot be null");
        }

        Set<String> accountIds = new LinkedHashSet<>();
        for (String unit : unitIds) {
            accountIds.addAll(directory.listChildren(unit, ChildType.ACCOUNT));
        }
        return accountIds;
    }
}
