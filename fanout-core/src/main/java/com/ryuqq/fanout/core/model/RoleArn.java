package com.ryuqq.fanout.core.model;

/**
 * Assume 대상 IAM Role의 완전한 식별자.
 *
 * <p>두 가지 형태의 role 설정을 계정별 ARN으로 해석합니다:</p>
 * <ul>
 *   <li>ARN 템플릿 ({@code arn:aws:iam::{org_account_id}:role/Audit}):
 *       {@value #ACCOUNT_ID_PLACEHOLDER}를 계정 ID로 치환</li>
 *   <li>Role 이름 ({@code OrganizationAccountAccessRole}):
 *       {@code arn:<partition>:iam::<accountId>:role/<name>} 형태로 합성</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. equals/hashCode는 값 기준이므로
 * 세션 캐시 키로 사용됩니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class RoleArn {

    /**
     * ARN 템플릿에서 계정 ID로 치환되는 placeholder.
     */
    public static final String ACCOUNT_ID_PLACEHOLDER = "{org_account_id}";

    /**
     * 기본 partition.
     */
    public static final String DEFAULT_PARTITION = "aws";

    private static final String ARN_PREFIX = "arn";

    private final String value;

    private RoleArn(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RoleArn cannot be null or blank");
        }
        if (!value.startsWith(ARN_PREFIX)) {
            throw new IllegalArgumentException("RoleArn must start with 'arn' (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * RoleArn 생성.
     *
     * @param value 완전한 ARN 문자열
     * @return RoleArn 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RoleArn of(String value) {
        return new RoleArn(value);
    }

    /**
     * 계정별 Role ARN 해석.
     *
     * @param roleTemplate ARN 템플릿 또는 role 이름
     * @param accountId 대상 계정 ID
     * @param partition ARN partition (예: aws, aws-cn, aws-us-gov)
     * @return 해석된 RoleArn
     * @throws IllegalArgumentException 인자가 null/blank인 경우
     */
    public static RoleArn forAccount(String roleTemplate, String accountId, String partition) {
        if (roleTemplate == null || roleTemplate.isBlank()) {
            throw new IllegalArgumentException("roleTemplate cannot be null or blank");
        }
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId cannot be null or blank");
        }
        if (partition == null || partition.isBlank()) {
            throw new IllegalArgumentException("partition cannot be null or blank");
        }

        if (roleTemplate.startsWith(ARN_PREFIX)) {
            return new RoleArn(roleTemplate.replace(ACCOUNT_ID_PLACEHOLDER, accountId));
        }
        return new RoleArn(ARN_PREFIX + ":" + partition + ":iam::" + accountId + ":role/" + roleTemplate);
    }

    /**
     * ARN 값 조회.
     *
     * @return ARN 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RoleArn roleArn = (RoleArn) o;
        return value.equals(roleArn.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
