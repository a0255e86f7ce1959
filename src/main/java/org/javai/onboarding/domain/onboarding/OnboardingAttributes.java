package org.javai.onboarding.domain.onboarding;

/**
 * Attribute ids of the onboarding dictionary that generated DSL refers to.
 * The comment on each id is its dictionary name.
 */
public final class OnboardingAttributes {

	public static final String CBU_ID = "123e4567-e89b-12d3-a456-426614174001"; // onboard.cbu_id
	public static final String NATURE_PURPOSE = "123e4567-e89b-12d3-a456-426614174002"; // onboard.nature_purpose
	public static final String STATUS = "123e4567-e89b-12d3-a456-426614174003"; // onboard.status

	public static final String ENTITY_TYPE = "987fcdeb-51a2-43f7-8765-ba9876543202"; // entity.type
	public static final String ENTITY_INCORPORATION_DATE = "987fcdeb-51a2-43f7-8765-ba9876543204"; // entity.incorporation_date
	public static final String ENTITY_REGISTRATION_NUMBER = "987fcdeb-51a2-43f7-8765-ba9876543205"; // entity.registration_number

	public static final String CUSTODY_ACCOUNT_NUMBER = "456789ab-cdef-1234-5678-9abcdef01301"; // custody.account_number
	public static final String CUSTODY_CUSTODIAN_NAME = "456789ab-cdef-1234-5678-9abcdef01302"; // custody.custodian_name
	public static final String CUSTODY_ACCOUNT_TYPE = "456789ab-cdef-1234-5678-9abcdef01303"; // custody.account_type

	public static final String ACCOUNTING_FUND_CODE = "456789ab-cdef-1234-5678-9abcdef01401"; // accounting.fund_code
	public static final String ACCOUNTING_NAV_VALUE = "456789ab-cdef-1234-5678-9abcdef01402"; // accounting.nav_value

	public static final String TA_FUND_IDENTIFIER = "13579bdf-2468-ace0-1357-9bdf2468abc1"; // transfer_agency.fund_identifier
	public static final String TA_SHARE_CLASS = "13579bdf-2468-ace0-1357-9bdf2468abc2"; // transfer_agency.share_class

	public static final String FUND_NAME = "fedcba98-7654-3210-fedc-ba9876543201"; // fund.name
	public static final String FUND_STRATEGY = "fedcba98-7654-3210-fedc-ba9876543202"; // fund.strategy
	public static final String FUND_BASE_CURRENCY = "fedcba98-7654-3210-fedc-ba9876543203"; // fund.base_currency
	public static final String FUND_MINIMUM_INVESTMENT = "fedcba98-7654-3210-fedc-ba9876543204"; // fund.minimum_investment

	private OnboardingAttributes() {
	}
}
