package com.ryuqq.fanout.adapter.aws.directory;

import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.model.ChildType;
import com.ryuqq.fanout.core.model.Policy;
import com.ryuqq.fanout.core.model.PolicyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.Child;
import software.amazon.awssdk.services.organizations.model.ListAccountsRequest;
import software.amazon.awssdk.services.organizations.model.ListAccountsResponse;
import software.amazon.awssdk.services.organizations.model.ListChildrenRequest;
import software.amazon.awssdk.services.organizations.model.ListChildrenResponse;
import software.amazon.awssdk.services.organizations.model.ListPoliciesRequest;
import software.amazon.awssdk.services.organizations.model.ListPoliciesResponse;
import software.amazon.awssdk.services.organizations.model.PolicySummary;
import software.amazon.awssdk.services.organizations.model.ListTagsForResourceRequest;
import software.amazon.awssdk.services.organizations.model.ListTagsForResourceResponse;
import software.amazon.awssdk.services.organizations.model.Tag;
import software.amazon.awssdk.services.organizations.paginators.ListAccountsIterable;
import software.amazon.awssdk.services.organizations.paginators.ListChildrenIterable;
import software.amazon.awssdk.services.organizations.paginators.ListPoliciesIterable;
import software.amazon.awssdk.services.organizations.paginators.ListTagsForResourceIterable;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * OrganizationsDirectory 테스트.
 *
 * <p>SDK paginator는 실제 구현을 사용하고, 페이지 응답만 mock 클라이언트로 제공합니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class OrganizationsDirectoryTest {

    @Mock
    private OrganizationsClient client;

    private OrganizationsDirectory directory;

    @BeforeEach
    void setUp() {
        directory = new OrganizationsDirectory(client);
    }

    private static Child child(String id, software.amazon.awssdk.services.organizations.model.ChildType type) {
        return Child.builder().id(id).type(type).build();
    }

    private static software.amazon.awssdk.services.organizations.model.Account sdkAccount(String id, String name) {
        return software.amazon.awssdk.services.organizations.model.Account.builder()
            .id(id)
            .name(name)
            .arn("arn:aws:organizations::999999999999:account/o-example/" + id)
            .build();
    }

    @Test
    void listChildren_모든_페이지를_합쳐서_반환함() {
        // given
        when(client.listChildrenPaginator(any(ListChildrenRequest.class)))
            .thenAnswer(invocation -> new ListChildrenIterable(client, invocation.getArgument(0)));
        when(client.listChildren(any(ListChildrenRequest.class))).thenReturn(
            ListChildrenResponse.builder()
                .children(child("ou-a", software.amazon.awssdk.services.organizations.model.ChildType.ORGANIZATIONAL_UNIT))
                .nextToken("page-2")
                .build(),
            ListChildrenResponse.builder()
                .children(child("ou-b", software.amazon.awssdk.services.organizations.model.ChildType.ORGANIZATIONAL_UNIT))
                .build()
        );

        // when
        List<String> children = directory.listChildren("r-root", ChildType.ORGANIZATIONAL_UNIT);

        // then
        assertThat(children).containsExactly("ou-a", "ou-b");

        ArgumentCaptor<ListChildrenRequest> captor = ArgumentCaptor.forClass(ListChildrenRequest.class);
        verify(client).listChildrenPaginator(captor.capture());
        assertThat(captor.getValue().parentId()).isEqualTo("r-root");
        assertThat(captor.getValue().childType())
            .isEqualTo(software.amazon.awssdk.services.organizations.model.ChildType.ORGANIZATIONAL_UNIT);
    }

    @Test
    void listChildren_ACCOUNT_유형을_SDK_유형으로_변환함() {
        // given
        when(client.listChildrenPaginator(any(ListChildrenRequest.class)))
            .thenAnswer(invocation -> new ListChildrenIterable(client, invocation.getArgument(0)));
        when(client.listChildren(any(ListChildrenRequest.class))).thenReturn(
            ListChildrenResponse.builder()
                .children(child("111111111111", software.amazon.awssdk.services.organizations.model.ChildType.ACCOUNT))
                .build()
        );

        // when
        List<String> children = directory.listChildren("ou-a", ChildType.ACCOUNT);

        // then
        assertThat(children).containsExactly("111111111111");
        ArgumentCaptor<ListChildrenRequest> captor = ArgumentCaptor.forClass(ListChildrenRequest.class);
        verify(client).listChildrenPaginator(captor.capture());
        assertThat(captor.getValue().childType())
            .isEqualTo(software.amazon.awssdk.services.organizations.model.ChildType.ACCOUNT);
    }

    @Test
    void listChildren_자식이_없으면_빈_목록() {
        when(client.listChildrenPaginator(any(ListChildrenRequest.class)))
            .thenAnswer(invocation -> new ListChildrenIterable(client, invocation.getArgument(0)));
        when(client.listChildren(any(ListChildrenRequest.class)))
            .thenReturn(ListChildrenResponse.builder().build());

        assertThat(directory.listChildren("ou-empty", ChildType.ORGANIZATIONAL_UNIT)).isEmpty();
    }

    @Test
    void listAccounts_계정과_태그를_조회함() {
        // given
        when(client.listAccountsPaginator(any(ListAccountsRequest.class)))
            .thenAnswer(invocation -> new ListAccountsIterable(client, invocation.getArgument(0)));
        when(client.listAccounts(any(ListAccountsRequest.class))).thenReturn(
            ListAccountsResponse.builder().accounts(sdkAccount("111111111111", "dev")).nextToken("page-2").build(),
            ListAccountsResponse.builder().accounts(sdkAccount("222222222222", "prod")).build()
        );
        when(client.listTagsForResourcePaginator(any(ListTagsForResourceRequest.class)))
            .thenAnswer(invocation -> new ListTagsForResourceIterable(client, invocation.getArgument(0)));
        when(client.listTagsForResource(any(ListTagsForResourceRequest.class))).thenAnswer(invocation -> {
            ListTagsForResourceRequest request = invocation.getArgument(0);
            if (request.resourceId().equals("111111111111")) {
                return ListTagsForResourceResponse.builder()
                    .tags(Tag.builder().key("env").value("dev").build())
                    .build();
            }
            return ListTagsForResourceResponse.builder().build();
        });

        // when
        List<Account> accounts = directory.listAccounts();

        // then
        assertThat(accounts).extracting(Account::id).containsExactly("111111111111", "222222222222");
        assertThat(accounts.get(0).name()).isEqualTo("dev");
        assertThat(accounts.get(0).arn()).endsWith("/111111111111");
        assertThat(accounts.get(0).tags()).isEqualTo(Map.of("env", "dev"));
        assertThat(accounts.get(1).tags()).isEmpty();
    }

    @Test
    void listAccounts_태그_조회를_끌_수_있음() {
        // given
        OrganizationsDirectory withoutTags = new OrganizationsDirectory(client, false);
        when(client.listAccountsPaginator(any(ListAccountsRequest.class)))
            .thenAnswer(invocation -> new ListAccountsIterable(client, invocation.getArgument(0)));
        when(client.listAccounts(any(ListAccountsRequest.class))).thenReturn(
            ListAccountsResponse.builder().accounts(sdkAccount("111111111111", "dev")).build()
        );

        // when
        List<Account> accounts = withoutTags.listAccounts();

        // then
        assertThat(accounts).hasSize(1);
        assertThat(accounts.get(0).tags()).isEmpty();
        verify(client, never()).listTagsForResourcePaginator(any(ListTagsForResourceRequest.class));
    }

    @Test
    void listPolicies_유형_필터로_모든_페이지를_조회함() {
        // given
        when(client.listPoliciesPaginator(any(ListPoliciesRequest.class)))
            .thenAnswer(invocation -> new ListPoliciesIterable(client, invocation.getArgument(0)));
        when(client.listPolicies(any(ListPoliciesRequest.class))).thenReturn(
            ListPoliciesResponse.builder()
                .policies(PolicySummary.builder()
                    .id("p-FullAWSAccess")
                    .name("FullAWSAccess")
                    .arn("arn:aws:organizations::aws:policy/service_control_policy/p-FullAWSAccess")
                    .awsManaged(true)
                    .build())
                .nextToken("page-2")
                .build(),
            ListPoliciesResponse.builder()
                .policies(PolicySummary.builder()
                    .id("p-abc123")
                    .name("deny-root")
                    .description("Deny root user actions")
                    .awsManaged(false)
                    .build())
                .build()
        );
        when(client.listTagsForResourcePaginator(any(ListTagsForResourceRequest.class)))
            .thenAnswer(invocation -> new ListTagsForResourceIterable(client, invocation.getArgument(0)));
        when(client.listTagsForResource(any(ListTagsForResourceRequest.class))).thenReturn(
            ListTagsForResourceResponse.builder()
                .tags(Tag.builder().key("owner").value("security").build())
                .build()
        );

        // when
        List<Policy> policies = directory.listPolicies(PolicyType.SERVICE_CONTROL_POLICY);

        // then
        assertThat(policies).extracting(Policy::id).containsExactly("p-FullAWSAccess", "p-abc123");
        assertThat(policies).allSatisfy(policy -> assertThat(policy.type()).isEqualTo(PolicyType.SERVICE_CONTROL_POLICY));
        assertThat(policies.get(0).awsManaged()).isTrue();
        assertThat(policies.get(0).tags()).isEmpty();
        assertThat(policies.get(1).description()).isEqualTo("Deny root user actions");
        assertThat(policies.get(1).tags()).isEqualTo(Map.of("owner", "security"));

        ArgumentCaptor<ListPoliciesRequest> policyCaptor = ArgumentCaptor.forClass(ListPoliciesRequest.class);
        verify(client).listPoliciesPaginator(policyCaptor.capture());
        assertThat(policyCaptor.getValue().filter())
            .isEqualTo(software.amazon.awssdk.services.organizations.model.PolicyType.SERVICE_CONTROL_POLICY);

        ArgumentCaptor<ListTagsForResourceRequest> tagCaptor = ArgumentCaptor.forClass(ListTagsForResourceRequest.class);
        verify(client, times(1)).listTagsForResourcePaginator(tagCaptor.capture());
        assertThat(tagCaptor.getValue().resourceId()).isEqualTo("p-abc123");
    }

    @Test
    void listPolicies_각_유형을_SDK_필터로_변환함() {
        // given
        OrganizationsDirectory withoutTags = new OrganizationsDirectory(client, false);
        when(client.listPoliciesPaginator(any(ListPoliciesRequest.class)))
            .thenAnswer(invocation -> new ListPoliciesIterable(client, invocation.getArgument(0)));
        when(client.listPolicies(any(ListPoliciesRequest.class)))
            .thenReturn(ListPoliciesResponse.builder().build());

        // when
        for (PolicyType type : PolicyType.values()) {
            assertThat(withoutTags.listPolicies(type)).isEmpty();
        }

        // then
        ArgumentCaptor<ListPoliciesRequest> captor = ArgumentCaptor.forClass(ListPoliciesRequest.class);
        verify(client, times(PolicyType.values().length)).listPoliciesPaginator(captor.capture());
        assertThat(captor.getAllValues())
            .extracting(ListPoliciesRequest::filterAsString)
            .containsExactly("SERVICE_CONTROL_POLICY", "TAG_POLICY", "BACKUP_POLICY", "AISERVICES_OPT_OUT_POLICY");
        verify(client, never()).listTagsForResourcePaginator(any(ListTagsForResourceRequest.class));
    }

    @Test
    void listPolicies_null_유형은_예외() {
        assertThatThrownBy(() -> directory.listPolicies(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 생성자_client가_null이면_예외() {
        assertThatThrownBy(() -> new OrganizationsDirectory(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
