package com.address.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Simplifies an address before lookup by applying {@link NormalizationRule}s in priority order.
 *
 * <p>The default rule set strips a trailing floor, unit, shop, basement or podium segment
 * (e.g. {@code 12樓}, {@code G/F 3號舖}, {@code 地下}, {@code 平台}) together with everything
 * after it, since the lookup service matches buildings rather than units. The original
 * address is untouched and is still used for scoring and output.</p>
 */
public class AddressNormalizer {
    private static final Logger log = LoggerFactory.getLogger(AddressNormalizer.class);

    /**
     * Floor ({@code 樓}/{@code 層}), shop ({@code 舖}/{@code 鋪}), ground floor / basement
     * ({@code 地下}/{@code 地庫}) or podium ({@code 平台}), and everything that follows.
     */
    public static final String FLOOR_UNIT_SUFFIX =
            "([0-9A-z\\s\\-]+[樓層]|[0-9A-z號\\s\\-]+[舖鋪]|地[下庫]|平台).*";

    private final List<NormalizationRule> rules;

    public AddressNormalizer() {
        this.rules = new ArrayList<>();
    }

    public AddressNormalizer(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Creates a normalizer with the floor/unit suffix rule.
     */
    public static AddressNormalizer createDefault() {
        return new AddressNormalizer(defaultRules());
    }

    public static List<NormalizationRule> defaultRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("floor-unit-suffix")
                        .pattern(FLOOR_UNIT_SUFFIX)
                        .replacement("")
                        .priority(10)
                        .build()
        );
    }

    /**
     * Adds a rule to the normalizer.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes an address for lookup. Returns the input unchanged when no rule matches.
     */
    public String normalize(String address) {
        if (address == null) {
            return "";
        }

        String result = address;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }
        return result;
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
