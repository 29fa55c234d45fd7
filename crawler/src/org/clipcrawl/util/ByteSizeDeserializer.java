package org.clipcrawl.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Reads attachment size limits: a plain number of bytes, or a number followed by a binary unit
 * such as {@code 512K}, {@code 200 MB} or {@code 1.5G}.
 */
public class ByteSizeDeserializer extends StdDeserializer<Long> {
    private static final String UNITS = "KMGT";

    public ByteSizeDeserializer() {
        super(Long.class);
    }

    @Override
    public Long deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) return parser.getLongValue();
        String text = parser.getText();
        try {
            return parse(text);
        } catch (IllegalArgumentException | ArithmeticException e) {
            return (Long) context.handleWeirdStringValue(Long.class, text, e.getMessage());
        }
    }

    static long parse(String text) {
        String rest = text.strip().toUpperCase(Locale.ROOT);
        if (rest.endsWith("B")) rest = rest.substring(0, rest.length() - 1).strip();
        int shift = 0;
        if (!rest.isEmpty()) {
            int unit = UNITS.indexOf(rest.charAt(rest.length() - 1));
            if (unit >= 0) {
                shift = 10 * (unit + 1);
                rest = rest.substring(0, rest.length() - 1).strip();
            }
        }
        BigDecimal number;
        try {
            number = new BigDecimal(rest);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a byte size: " + text);
        }
        if (number.signum() < 0) throw new IllegalArgumentException("Negative byte size: " + text);
        return number.multiply(BigDecimal.valueOf(1L << shift)).setScale(0, RoundingMode.DOWN).longValueExact();
    }
}
