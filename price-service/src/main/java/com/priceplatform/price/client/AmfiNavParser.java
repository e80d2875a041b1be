package com.priceplatform.price.client;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the AMFI {@code NAVAll.txt} feed.
 *
 * <pre>
 *   Scheme Code;ISIN Div Payout/ ISIN Growth;ISIN Div Reinvestment;Scheme Name;Net Asset Value;Date
 *   119551;INF209KA12Z1;INF209KA13Z9;Aditya Birla Sun Life Banking &amp; PSU Debt Fund;320.1235;14-Mar-2024
 * </pre>
 *
 * Category banners, fund-house names and blank lines carry no {@code ;} and are skipped.
 */
public final class AmfiNavParser {

    private static final List<String> HEADER_MARKERS = List.of(
        "Scheme Code", "ISIN", "Open Ended Schemes", "Close Ended Schemes", "Interval Fund Schemes");

    private static final int FIELD_COUNT = 6;

    private AmfiNavParser() {}

    /**
     * @param identifiers scheme codes or ISINs to look up
     * @return NAV row per requested identifier; identifiers with no valid row are absent
     */
    public static Map<String, FundNav> parse(String body, Collection<String> identifiers) {
        Map<String, String> wanted = new HashMap<>();
        for (String id : identifiers) {
            wanted.putIfAbsent(id.trim().toUpperCase(Locale.ROOT), id);
        }

        Map<String, FundNav> found = new LinkedHashMap<>();
        if (body == null || wanted.isEmpty()) return found;

        for (String raw : body.split("\\r?\\n")) {
            String line = raw.trim();
            if (line.isEmpty() || line.indexOf(';') < 0 || isHeader(line)) continue;

            String[] f = line.split(";", -1);
            if (f.length < FIELD_COUNT) continue;

            BigDecimal nav = parseNav(f[4]);
            if (nav == null) continue;

            FundNav row = new FundNav(f[0].trim(), f[1].trim(), f[2].trim(), f[3].trim(), nav, f[5].trim());
            match(wanted, found, row.schemeCode(), row);
            match(wanted, found, row.isinGrowth(), row);
            match(wanted, found, row.isinReinvestment(), row);

            if (found.size() == wanted.size()) break;
        }
        return found;
    }

    private static void match(Map<String, String> wanted, Map<String, FundNav> found, String key, FundNav row) {
        if (key.isEmpty() || "-".equals(key)) return;
        String requested = wanted.get(key.toUpperCase(Locale.ROOT));
        if (requested != null) found.putIfAbsent(requested, row);
    }

    private static boolean isHeader(String line) {
        for (String marker : HEADER_MARKERS) {
            if (line.contains(marker)) return true;
        }
        return false;
    }

    private static BigDecimal parseNav(String field) {
        try {
            BigDecimal nav = new BigDecimal(field.trim());
            return nav.signum() > 0 ? nav : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
