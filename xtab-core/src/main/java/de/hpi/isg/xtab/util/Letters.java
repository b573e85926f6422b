package de.hpi.isg.xtab.util;

import org.apache.commons.lang3.Validate;

/**
 * Generates spreadsheet-style column letters: A, B, ..., Z, AA, AB, ...
 */
public class Letters {

    private Letters() {
    }

    /**
     * @param index zero-based index
     * @return the letter code for the index
     */
    public static String of(int index) {
        Validate.isTrue(index >= 0, "Negative letter index %d.", index);
        StringBuilder sb = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            int remainder = (n - 1) % 26;
            sb.append((char) ('A' + remainder));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }
}
