package com.pstrata.server.ai.prior;

import java.math.BigDecimal;
import java.util.List;

/**
 * Renders priors as Stan sampling statements.
 */
public final class PriorSerializer {

    private PriorSerializer() {
    }

    /**
     * The distribution call, e.g. {@code normal(0, 1)}, or null for a flat prior.
     */
    public static String call(PriorSpec prior) {
        if (prior.isFlat()) {
            return null;
        }
        StringBuilder sb = new StringBuilder(prior.getName()).append('(');
        List<Double> args = prior.getCallArguments();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(formatNumber(args.get(i)));
        }
        return sb.append(')').toString();
    }

    /**
     * A complete statement {@code target ~ call;}, or null when the prior is flat and the
     * statement is to be omitted.
     */
    public static String statement(PriorSpec prior, String target) {
        String call = call(prior);
        if (call == null) {
            return null;
        }
        return target + " ~ " + call + ";";
    }

    public static String formatNumber(double v) {
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }
}
