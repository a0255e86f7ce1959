package org.javai.onboarding.domain.onboarding;

import static org.javai.onboarding.domain.onboarding.OnboardingAttributes.ACCOUNTING_FUND_CODE;
import static org.javai.onboarding.domain.onboarding.OnboardingAttributes.CUSTODY_ACCOUNT_NUMBER;
import static org.javai.onboarding.domain.onboarding.OnboardingAttributes.CUSTODY_ACCOUNT_TYPE;
import static org.javai.onboarding.domain.onboarding.OnboardingAttributes.FUND_BASE_CURRENCY;
import static org.javai.onboarding.domain.onboarding.OnboardingAttributes.TA_FUND_IDENTIFIER;
import static org.javai.onboarding.domain.onboarding.OnboardingAttributes.TA_SHARE_CLASS;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.javai.onboarding.generate.InstructionTemplate;

/**
 * Instruction templates of the onboarding domain, one per workflow step.
 */
public final class OnboardingTemplates {

	static final String DEFAULT_NATURE_PURPOSE = "Standard client onboarding";
	static final String FUND_NATURE_PURPOSE = "Investment fund setup";
	static final List<String> DEFAULT_PRODUCTS = List.of("CUSTODY", "FUND_ACCOUNTING");

	private static final Pattern CBU_ID = Pattern.compile("CBU-[A-Z0-9]+");
	private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

	private OnboardingTemplates() {
	}

	/**
	 * @param clock source for generated case ids when the instruction names none
	 */
	public static List<InstructionTemplate> all(Clock clock) {
		Objects.requireNonNull(clock, "clock must not be null");
		return List.of(
				new InstructionTemplate("onboarding_create_case", "case.create", List.of("create case"),
						"(case.create (cbu.id \"{cbu_id}\") (nature-purpose \"{nature_purpose}\"))",
						request -> Map.of(
								"cbu_id", cbuId(request.instruction(), clock),
								"nature_purpose", naturePurpose(request.instruction()))),
				new InstructionTemplate("onboarding_add_products", "products.add", List.of("add products"),
						"(products.add {products})",
						request -> Map.of("products", quoted(products(request.instruction())))),
				InstructionTemplate.fixed("onboarding_start_kyc", "kyc.start", List.of("start kyc"),
						"(kyc.start (requirements (document \"CertificateOfIncorporation\") (jurisdiction \"US\")))"),
				InstructionTemplate.fixed("onboarding_discover_services", "services.discover", List.of("discover services"),
						"(services.discover (for.product \"CUSTODY\" (service \"AccountOpening\") (service \"TradeSettlement\")))"),
				InstructionTemplate.fixed("onboarding_plan_resources", "resources.plan", List.of("plan resources"),
						"(resources.plan\n"
								+ "  (resource.create \"CustodyAccount\"\n"
								+ "    (owner \"CustodyTech\")\n"
								+ "    {attr:" + CUSTODY_ACCOUNT_NUMBER + "}\n"
								+ "    {attr:" + CUSTODY_ACCOUNT_TYPE + "})\n"
								+ "  (resource.create \"FundAccountingSystem\"\n"
								+ "    (owner \"AccountingTech\")\n"
								+ "    {attr:" + ACCOUNTING_FUND_CODE + "}\n"
								+ "    {attr:" + FUND_BASE_CURRENCY + "})\n"
								+ "  (resource.create \"TransferAgencySystem\"\n"
								+ "    (owner \"TransferTech\")\n"
								+ "    {attr:" + TA_FUND_IDENTIFIER + "}\n"
								+ "    {attr:" + TA_SHARE_CLASS + "}))"),
				InstructionTemplate.fixed("onboarding_bind_attributes", "values.bind", List.of("bind attributes"),
						"(values.bind\n"
								+ "  {attr:" + CUSTODY_ACCOUNT_NUMBER + "} \"CUST-EGOF-001\"\n"
								+ "  {attr:" + ACCOUNTING_FUND_CODE + "} \"FA-EGOF-LU-001\"\n"
								+ "  {attr:" + TA_FUND_IDENTIFIER + "} \"TA-EGOF-LU\"\n"
								+ "  {attr:" + FUND_BASE_CURRENCY + "} \"EUR\")"),
				new InstructionTemplate("onboarding_workflow_transition", "workflow.transition", List.of("workflow transition"),
						"(workflow.transition (from \"{from_state}\") (to \"{to_state}\"))",
						request -> Map.of(
								"from_state", literal(request.contextValue("from_state").orElse("CREATE")),
								"to_state", literal(request.contextValue("to_state").orElse("PRODUCTS_ADDED")))),
				new InstructionTemplate("onboarding_close_case", "case.close", List.of("close case"),
						"(case.close (reason \"{reason}\") (final-state \"ACTIVE\"))",
						request -> Map.of("reason", literal(
								request.contextValue("reason").orElse("Onboarding completed successfully")))));
	}

	static String cbuId(String instruction, Clock clock) {
		Matcher matcher = CBU_ID.matcher(instruction);
		if (matcher.find()) {
			return matcher.group();
		}
		return "CBU-" + clock.instant().getEpochSecond() % 10000;
	}

	static String naturePurpose(String instruction) {
		Matcher matcher = QUOTED.matcher(instruction);
		if (matcher.find()) {
			return literal(matcher.group(1));
		}
		if (instruction.toLowerCase(Locale.ROOT).contains("fund")) {
			return FUND_NATURE_PURPOSE;
		}
		return DEFAULT_NATURE_PURPOSE;
	}

	static List<String> products(String instruction) {
		String lower = instruction.toLowerCase(Locale.ROOT);
		List<String> products = new ArrayList<>();
		if (lower.contains("custody")) {
			products.add("CUSTODY");
		}
		if (lower.contains("fund accounting")) {
			products.add("FUND_ACCOUNTING");
		}
		if (lower.contains("transfer agent")) {
			products.add("TRANSFER_AGENT");
		}
		return products.isEmpty() ? DEFAULT_PRODUCTS : products;
	}

	private static String quoted(List<String> values) {
		return values.stream().map(v -> "\"" + v + "\"").collect(Collectors.joining(" "));
	}

	// Values end up between double quotes in the DSL.
	private static String literal(String value) {
		return StringUtils.remove(StringUtils.remove(value, '"'), '\\');
	}
}
