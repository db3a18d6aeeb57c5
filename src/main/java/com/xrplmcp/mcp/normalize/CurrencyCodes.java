package com.xrplmcp.mcp.normalize;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * Ledger currency code rules: standard three-character codes and the native code pass through,
 * anything else up to {@code width / 2} bytes is hex-encoded and right-padded with zeros.
 */
public final class CurrencyCodes {
    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final String nativeCode;
    private final int width;

    public CurrencyCodes(final String nativeCode, final int width) {
        this.nativeCode = nativeCode;
        this.width = width;
    }

    public String normalize(final String code) {
        if (code == null || code.isEmpty()) return code;
        if (code.length() == 3 || code.equals(nativeCode) || isEncoded(code)) {
            return code;
        }
        final byte[] bytes = code.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > width / 2) {
            return code;
        }
        final StringBuilder sb = new StringBuilder(width).append(HEX.formatHex(bytes));
        while (sb.length() < width) {
            sb.append('0');
        }
        return sb.toString();
    }

    static boolean isAsciiHexDigit(final char c) {
        return (c >= '0' && c <= '9') || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f');
    }

    /** True for a code that already has the encoded width and only ASCII hex digits. */
    public boolean isEncoded(final String code) {
        if (code.length() != width) return false;
        for (int i = 0; i < code.length(); i++) {
            if (!isAsciiHexDigit(code.charAt(i))) return false;
        }
        return true;
    }
}
