package com.ryuqq.fanout.application.hierarchy;

import com.ryuqq.fanout.adapter.inmemory.directory.InMemoryOrganizationDirectory;
import com.ryuqq.fanout.core.model.Account;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OrganizationUnitFilterTest {

    private final Account mgmt = Account.of("100000000000", "mgmt");
    private final Account dev = Account.of("200000000000", "dev");
    private final Account prod = Account.of("300000000000", "prod");
    private final Account sandbox = Account.of("400000000000", "sandbox");

    private final InMemoryOrganizationDirectory directory = new InMemoryOrganizationDirectory()
        .addAccount("r-root", mgmt)
        .addUnit("r-root", "ou-workloads")
        .addUnit("r-root", "ou-sandbox")
        .addUnit("ou-workloads", "ou-dev")
        .addAccount("ou-dev", dev)
        .addAccount("ou-workloads", prod)
        .addAccount("ou-sandbox", sandbox);

    private final OrganizationUnitFilter filter = new OrganizationUnitFilter(new OrgTreeWalker(directory));

    @Test
    void filter_하위_OU를_포함한_계정만_남김() {
        // when
        List<Account> selected = filter.filter(List.of(mgmt, dev, prod, sandbox), List.of("ou-workloads"));

        // then
        assertThat(selected).containsExactly(dev, prod);
    }

    @Test
    void filter_후보_순서를_유지함() {
        List<Account> selected = filter.filter(List.of(sandbox, prod, dev), List.of("r-root"));

        assertThat(selected).containsExactly(sandbox, prod, dev);
    }

    @Test
    void filter_후보에_없는_계정은_추가하지_않음() {
        List<Account> selected = filter.filter(List.of(dev), List.of("r-root"));

        assertThat(selected).containsExactly(dev);
    }

    @Test
    void filter_알수없는_OU면_빈_결과() {
        assertThat(filter.filter(List.of(mgmt, dev), List.of("ou-missing"))).isEmpty();
    }
}
