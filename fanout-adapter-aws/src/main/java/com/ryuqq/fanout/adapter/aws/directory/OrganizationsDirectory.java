package com.ryuqq.fanout.adapter.aws.directory;

import com.ryuqq.fanout.adapter.aws.credential.AwsIdentitySession;
import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.model.ChildType;
import com.ryuqq.fanout.core.model.Policy;
import com.ryuqq.fanout.core.model.PolicyType;
import com.ryuqq.fanout.core.spi.OrganizationDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.Child;
import software.amazon.awssdk.services.organizations.model.ListAccountsRequest;
import software.amazon.awssdk.services.organizations.model.ListChildrenRequest;
import software.amazon.awssdk.services.organizations.model.ListPoliciesRequest;
import software.amazon.awssdk.services.organizations.model.ListTagsForResourceRequest;
import software.amazon.awssdk.services.organizations.model.PolicySummary;
import software.amazon.awssdk.services.organizations.model.Tag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * AWS Organizations 기반 OrganizationDirectory.
 *
 * <p>ListChildren, ListAccounts, ListPolicies, ListTagsForResource를 SDK paginator로 호출하여
 * 모든 페이지를 합친 결과를 반환합니다. AWS 관리형 정책은 태그를 가질 수 없으므로
 * 태그 조회에서 제외됩니다.</p>
 *
 * <p>SDK 예외는 그대로 전파됩니다. 디렉터리 조회 실패는 fan-out 시작 전에 발생하므로
 * 호출자가 처리합니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public class OrganizationsDirectory implements OrganizationDirectory {

    private static final Logger log = LoggerFactory.getLogger(OrganizationsDirectory.class);

    private final OrganizationsClient client;
    private final boolean includeTags;

    /**
     * 생성자 (계정 태그 포함).
     *
     * @param client Organizations 클라이언트
     */
    public OrganizationsDirectory(OrganizationsClient client) {
        this(client, true);
    }

    /**
     * 생성자.
     *
     * @param client Organizations 클라이언트
     * @param includeTags 계정/정책 태그 조회 여부 (리소스마다 ListTagsForResource 호출)
     * @throws IllegalArgumentException client가 null인 경우
     */
    public OrganizationsDirectory(OrganizationsClient client, boolean includeTags) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
        this.includeTags = includeTags;
    }

    /**
     * 세션의 자격 증명과 리전으로 클라이언트를 생성하여 디렉터리 생성.
     *
     * @param session Organizations API를 호출할 세션 (보통 root 세션)
     * @return 디렉터리
     */
    public static OrganizationsDirectory forSession(AwsIdentitySession session) {
        return new OrganizationsDirectory(
            session.configure(OrganizationsClient.builder(), session.getRegion()).build()
        );
    }

    @Override
    public List<String> listChildren(String parentId, ChildType childType) {
        ListChildrenRequest request = ListChildrenRequest.builder()
            .parentId(parentId)
            .childType(toSdkChildType(childType))
            .build();

        List<String> children = client.listChildrenPaginator(request).children().stream()
            .map(Child::id)
            .collect(Collectors.toList());
        log.debug("Listed {} {} children of {}", children.size(), childType, parentId);
        return children;
    }

    @Override
    public List<Account> listAccounts() {
        List<Account> accounts = new ArrayList<>();
        for (software.amazon.awssdk.services.organizations.model.Account account
            : client.listAccountsPaginator(ListAccountsRequest.builder().build()).accounts()) {
            Map<String, String> tags = includeTags ? listTags(account.id()) : Map.of();
            accounts.add(new Account(account.id(), account.name(), account.arn(), tags));
        }
        log.info("Listed {} organization accounts", accounts.size());
        return accounts;
    }

    @Override
    public List<Policy> listPolicies(PolicyType policyType) {
        if (policyType == null) {
            throw new IllegalArgumentException("policyType cannot be null");
        }
        ListPoliciesRequest request = ListPoliciesRequest.builder()
            .filter(toSdkPolicyType(policyType))
            .build();

        List<Policy> policies = new ArrayList<>();
        for (PolicySummary summary : client.listPoliciesPaginator(request).policies()) {
            boolean awsManaged = Boolean.TRUE.equals(summary.awsManaged());
            Map<String, String> tags = includeTags && !awsManaged ? listTags(summary.id()) : Map.of();
            policies.add(new Policy(
                summary.id(),
                summary.name(),
                summary.arn(),
                policyType,
                summary.description(),
                awsManaged,
                tags
            ));
        }
        log.info("Listed {} {} policies", policies.size(), policyType);
        return policies;
    }

    private Map<String, String> listTags(String resourceId) {
        ListTagsForResourceRequest request = ListTagsForResourceRequest.builder()
            .resourceId(resourceId)
            .build();

        Map<String, String> tags = new LinkedHashMap<>();
        for (Tag tag : client.listTagsForResourcePaginator(request).tags()) {
            tags.put(tag.key(), tag.value());
        }
        return tags;
    }

    private static software.amazon.awssdk.services.organizations.model.ChildType toSdkChildType(ChildType childType) {
        return switch (childType) {
            case ACCOUNT -> software.amazon.awssdk.services.organizations.model.ChildType.ACCOUNT;
            case ORGANIZATIONAL_UNIT -> software.amazon.awssdk.services.organizations.model.ChildType.ORGANIZATIONAL_UNIT;
        };
    }

    private static software.amazon.awssdk.services.organizations.model.PolicyType toSdkPolicyType(PolicyType policyType) {
        return switch (policyType) {
            case SERVICE_CONTROL_POLICY -> software.amazon.awssdk.services.organizations.model.PolicyType.SERVICE_CONTROL_POLICY;
            case TAG_POLICY -> software.amazon.awssdk.services.organizations.model.PolicyType.TAG_POLICY;
            case BACKUP_POLICY -> software.amazon.awssdk.services.organizations.model.PolicyType.BACKUP_POLICY;
            case AISERVICES_OPT_OUT_POLICY -> software.amazon.awssdk.services.organizations.model.PolicyType.AISERVICES_OPT_OUT_POLICY;
        };
    }
}
