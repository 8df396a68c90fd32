package org.pragmatica.cliffs.call;

/**
 * String similarity in {@code [0, 1]}, used to recognize mistyped literals.
 */
@FunctionalInterface
public interface Similarity {

    double ratio(String expected, String actual);

    /**
     * Jaro-Winkler similarity. Rewards common prefixes, which suits abbreviated or truncated words.
     */
    static Similarity jaroWinkler() {
        return Similarity::jaroWinklerRatio;
    }

    /**
     * Longest-common-subsequence ratio: {@code 2 * lcs / (|a| + |b|)}.
     */
    static Similarity lcsRatio() {
        return Similarity::lcsRatioOf;
    }

    private static double jaroWinklerRatio(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        var window = Math.max(0, Math.max(a.length(), b.length()) / 2 - 1);
        var aMatched = new boolean[a.length()];
        var bMatched = new boolean[b.length()];
        int matches = 0;
        for (int i = 0; i < a.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(b.length() - 1, i + window);
            for (int j = from; j <= to; j++) {
                if (!bMatched[j] && a.charAt(i) == b.charAt(j)) {
                    aMatched[i] = true;
                    bMatched[j] = true;
                    matches++ ;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }
        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < a.length(); i++) {
            if (aMatched[i]) {
                while (!bMatched[k]) {
                    k++ ;
                }
                if (a.charAt(i) != b.charAt(k)) {
                    transpositions++ ;
                }
                k++ ;
            }
        }
        double m = matches;
        double jaro = (m / a.length() + m / b.length() + (m - transpositions / 2.0) / m) / 3.0;
        int prefix = 0;
        while (prefix < Math.min(4, Math.min(a.length(), b.length())) && a.charAt(prefix) == b.charAt(prefix)) {
            prefix++ ;
        }
        return jaro + prefix * 0.1 * (1.0 - jaro);
    }

    private static double lcsRatioOf(String a, String b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        var lengths = new int[a.length() + 1][b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                lengths[i][j] = a.charAt(i - 1) == b.charAt(j - 1)
                                ? lengths[i - 1][j - 1] + 1
                                : Math.max(lengths[i - 1][j], lengths[i][j - 1]);
            }
        }
        return 2.0 * lengths[a.length()][b.length()] / (a.length() + b.length());
    }
}
