package com.ryuqq.fanout.application.config;

import java.util.List;
import java.util.Map;

/**
 * Organization 접근 설정 (불변 record).
 *
 * <p>Role chain을 구성하는 설정값을 담고 있습니다.</p>
 *
 * <pre>
 * 실행 identity → (orgAccessRole) → orgAccountRole (계정별)
 * </pre>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>orgAccessRole: org 접근용 Role ARN (선택, null이면 실행 identity 사용)</li>
 *   <li>orgAccountRole: 계정별 Role 이름 또는 ARN 템플릿 (기본 {@value #DEFAULT_ACCOUNT_ROLE})</li>
 *   <li>memberRoleBound: 실행 모드에 member-role이 지정되어 있는지 여부</li>
 *   <li>partition: ARN partition (기본 aws)</li>
 *   <li>region: 자격 증명 엔드포인트 리전 (기본 us-east-1)</li>
 * </ul>
 *
 * @param orgAccessRole org 접근 Role ARN (null 허용, 지정 시 arn으로 시작해야 함)
 * @param orgAccountRole 계정 Role 이름 또는 ARN 템플릿 (blank 불가)
 * @param memberRoleBound member-role 지정 여부
 * @param partition ARN partition (blank 불가)
 * @param region 자격 증명 엔드포인트 리전 (blank 불가)
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public record OrgAccessConfig(
    String orgAccessRole,
    String orgAccountRole,
    boolean memberRoleBound,
    String partition,
    String region
) {

    public static final String ORG_ACCESS_ROLE_KEY = "org-access-role";

    public static final String ORG_ACCOUNT_ROLE_KEY = "org-account-role";

    public static final String MEMBER_ROLE_KEY = "member-role";

    /**
     * Organizations 기본 계정 Role.
     */
    public static final String DEFAULT_ACCOUNT_ROLE = "OrganizationAccountAccessRole";

    /**
     * Control Tower 환경의 기본 계정 Role.
     */
    public static final String CONTROL_TOWER_ACCOUNT_ROLE = "AWSControlTowerExecution";

    private static final String DEFAULT_PARTITION = "aws";

    private static final String DEFAULT_REGION = "us-east-1";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: orgAccessRole=null, orgAccountRole=OrganizationAccountAccessRole,
     * memberRoleBound=false, partition=aws, region=us-east-1</p>
     */
    public OrgAccessConfig() {
        this(null, DEFAULT_ACCOUNT_ROLE, false, DEFAULT_PARTITION, DEFAULT_REGION);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public OrgAccessConfig {
        if (orgAccessRole != null && !orgAccessRole.startsWith("arn")) {
            throw new IllegalArgumentException(
                ORG_ACCESS_ROLE_KEY + " must be a role arn (current: " + orgAccessRole + ")"
            );
        }
        if (orgAccountRole == null || orgAccountRole.isBlank()) {
            throw new IllegalArgumentException(ORG_ACCOUNT_ROLE_KEY + " cannot be null or blank");
        }
        if (partition == null || partition.isBlank()) {
            throw new IllegalArgumentException("partition cannot be null or blank");
        }
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region cannot be null or blank");
        }
    }

    /**
     * 정책의 query/mode 블록으로부터 설정 생성.
     *
     * <p>query는 여러 Map의 목록이며 순서대로 병합됩니다 (뒤의 값이 우선).
     * org-account-role이 없으면 환경에 따라 기본 Role을 선택합니다.</p>
     *
     * @param query 정책 query 블록 (null이면 빈 목록)
     * @param mode 정책 실행 mode 블록 (null 허용)
     * @param environment 실행 환경
     * @return OrgAccessConfig
     * @throws IllegalArgumentException 값의 타입이나 형식이 잘못된 경우
     */
    public static OrgAccessConfig fromQuery(List<Map<String, Object>> query,
                                            Map<String, Object> mode,
                                            ExecutionEnvironment environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }

        Map<String, Object> params = QueryParams.merge(query);

        String accessRole = QueryParams.stringParam(params, ORG_ACCESS_ROLE_KEY);
        String accountRole = QueryParams.stringParam(params, ORG_ACCOUNT_ROLE_KEY);
        if (accountRole == null) {
            accountRole = environment.controlTowerOrg() ? CONTROL_TOWER_ACCOUNT_ROLE : DEFAULT_ACCOUNT_ROLE;
        }

        Object memberRole = mode == null ? null : mode.get(MEMBER_ROLE_KEY);
        boolean memberRoleBound = memberRole != null && !memberRole.toString().isEmpty();

        return new OrgAccessConfig(accessRole, accountRole, memberRoleBound, DEFAULT_PARTITION, DEFAULT_REGION);
    }

    /**
     * orgAccessRole만 변경한 새 인스턴스 생성.
     */
    public OrgAccessConfig withOrgAccessRole(String orgAccessRole) {
        return new OrgAccessConfig(orgAccessRole, orgAccountRole, memberRoleBound, partition, region);
    }

    /**
     * orgAccountRole만 변경한 새 인스턴스 생성.
     */
    public OrgAccessConfig withOrgAccountRole(String orgAccountRole) {
        return new OrgAccessConfig(orgAccessRole, orgAccountRole, memberRoleBound, partition, region);
    }

    /**
     * memberRoleBound만 변경한 새 인스턴스 생성.
     */
    public OrgAccessConfig withMemberRoleBound(boolean memberRoleBound) {
        return new OrgAccessConfig(orgAccessRole, orgAccountRole, memberRoleBound, partition, region);
    }

    /**
     * partition만 변경한 새 인스턴스 생성.
     */
    public OrgAccessConfig withPartition(String partition) {
        return new OrgAccessConfig(orgAccessRole, orgAccountRole, memberRoleBound, partition, region);
    }

    /**
     * region만 변경한 새 인스턴스 생성.
     */
    public OrgAccessConfig withRegion(String region) {
        return new OrgAccessConfig(orgAccessRole, orgAccountRole, memberRoleBound, partition, region);
    }
}
