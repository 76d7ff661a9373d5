package com.chainguru.ingestion.adapter.page;

import com.chainguru.common.NumberParsing;
import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.MeasurementResult;
import com.chainguru.ingestion.adapter.SampleException;
import com.chainguru.ingestion.fetch.SafeFetchGate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort estimate read from a block explorer's HTML when every protocol endpoint failed. Patterns are tried
 * in order and the first match wins; results are marked as page-derived.
 */
@Component
@RequiredArgsConstructor
public class PageInspectionSampler {

    public static final String NO_MATCHES = "no_matches";

    static final List<Pattern> TPS_PATTERNS = List.of(
            Pattern.compile("TPS:?\\s*([\\d,]+\\.?\\d*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Transactions per second:?\\s*([\\d,]+\\.?\\d*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+\\.?\\d*)\\s*TPS", Pattern.CASE_INSENSITIVE));

    static final List<Pattern> TOTAL_PATTERNS = List.of(
            Pattern.compile("Total Transactions:?\\s*([\\d,]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Transactions:?\\s*([\\d,]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Total Txs:?\\s*([\\d,]+)", Pattern.CASE_INSENSITIVE));

    private final SafeFetchGate safeFetchGate;

    public boolean supports(ChainTarget target) {
        return target.hasExplorerUrl();
    }

    /**
     * Fetches the explorer page through the gate and extracts TPS and total transactions.
     *
     * @throws SampleException {@code no_matches} when neither value is found (or both are zero)
     */
    public MeasurementResult inspect(ChainTarget target) {
        String html = safeFetchGate.getText(pageUrl(target.explorerUrl()));
        double tps = firstMatch(TPS_PATTERNS, html);
        double total = firstMatch(TOTAL_PATTERNS, html);
        if (tps <= 0 && total <= 0) {
            throw new SampleException(NO_MATCHES);
        }
        return MeasurementResult.pageInspection(target, Math.max(tps, 0.0), total > 0 ? total : null);
    }

    static String pageUrl(String explorerUrl) {
        String url = explorerUrl.trim();
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return url;
        }
        return "https://" + url;
    }

    private static double firstMatch(List<Pattern> patterns, String html) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(html);
            if (m.find()) {
                return NumberParsing.cleanNumber(m.group(1));
            }
        }
        return 0.0;
    }
}
