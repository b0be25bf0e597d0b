package de.caluga.bson;

import java.nio.charset.StandardCharsets;

/**
 * hex dumps of encoded documents for logging and tests
 **/
public final class BsonUtils {
    private static final char[] hexChars = {'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'};

    private BsonUtils() {
    }

    public static String getHex(byte[] b) {
        return getHex(b, -1);
    }

    /**
     * dump with 16 bytes per line: offset, hex values and a printable rendering
     * where 0 is shown as '-' and other control bytes as '.'
     *
     * @param sz maximum number of bytes to dump, -1 for all
     */
    public static String getHex(byte[] b, int sz) {
        StringBuilder sb = new StringBuilder();
        int mainIdx = 0;
        int end = b.length;

        if (sz > 0 && sz < b.length) {
            end = sz;
        }

        while (mainIdx < end) {
            sb.append(getHex((byte) (mainIdx >> 24 & 0xff)));
            sb.append(getHex((byte) (mainIdx >> 16 & 0xff)));
            sb.append(getHex((byte) (mainIdx >> 8 & 0xff)));
            sb.append(getHex((byte) (mainIdx & 0xff)));
            sb.append(":  ");
            int l = Math.min(16, end - mainIdx);

            for (int i = mainIdx; i < mainIdx + l; i++) {
                sb.append(getHex(b[i]));
                sb.append(" ");
            }

            for (int i = l; i < 16; i++) {
                sb.append("   ");
            }

            byte[] sr = new byte[l];

            for (int j = 0; j < l; j++) {
                byte by = b[mainIdx + j];

                if (by > 63) {
                    sr[j] = by;
                } else if (by == 0) {
                    sr[j] = '-';
                } else {
                    sr[j] = '.';
                }
            }

            sb.append("    ");
            sb.append(new String(sr, 0, l, StandardCharsets.UTF_8));
            sb.append("\n");
            mainIdx += 16;
        }

        return sb.toString();
    }

    public static String getHex(byte by) {
        return "" + hexChars[(by >>> 4) & 0x0f] + hexChars[by & 0x0f];
    }
}
