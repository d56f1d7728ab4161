package com.quotefeed.common.normalize;

import java.math.BigDecimal;

/**
 * Indian-locale money formatting: the last three integer digits form one group and the
 * rest are grouped in pairs, e.g. {@code 112450} → {@code ₹1,12,450.00}.
 */
public final class InrFormat {

    private static final String RUPEE = "₹";

    private InrFormat() {}

    public static String format(Object value) {
        return format(value, true);
    }

    public static String format(Object value, boolean includeSymbol) {
        BigDecimal rounded = QuoteNormalizer.roundToScale(value);
        String sign = rounded.signum() < 0 ? "-" : "";
        String plain = rounded.abs().toPlainString();

        int dot = plain.indexOf('.');
        String intPart = plain.substring(0, dot);
        String decPart = plain.substring(dot + 1);

        StringBuilder grouped = new StringBuilder();
        if (intPart.length() > 3) {
            String head = intPart.substring(0, intPart.length() - 3);
            String tail = intPart.substring(intPart.length() - 3);
            int firstGroup = head.length() % 2 == 0 ? 2 : 1;
            grouped.append(head, 0, firstGroup);
            for (int i = firstGroup; i < head.length(); i += 2) {
                grouped.append(',').append(head, i, i + 2);
            }
            grouped.append(',').append(tail);
        } else {
            grouped.append(intPart);
        }

        return sign + (includeSymbol ? RUPEE : "") + grouped + "." + decPart;
    }
}
