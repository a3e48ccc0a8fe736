package com.tripflow.server.intent;

/**
 * 粗粒度气候带，月均最高/最低气温按北半球月份排列（1 月在前）。
 * 南半球目的地在使用时平移 6 个月。
 */
public enum ClimateZone {

    TROPICAL(
            new double[]{31, 32, 33, 34, 33, 32, 32, 32, 31, 31, 31, 31},
            new double[]{23, 24, 25, 26, 26, 26, 25, 25, 25, 25, 24, 23},
            new int[]{10, 10, 15, 30, 60, 65, 65, 70, 75, 65, 40, 15}),
    TEMPERATE(
            new double[]{9, 10, 14, 19, 23, 26, 29, 30, 27, 21, 16, 11},
            new double[]{2, 3, 6, 10, 15, 19, 23, 24, 20, 14, 8, 4},
            new int[]{30, 35, 40, 40, 45, 55, 50, 45, 50, 40, 35, 30}),
    ARID(
            new double[]{24, 26, 29, 34, 39, 41, 42, 42, 40, 36, 31, 26},
            new double[]{14, 15, 18, 22, 26, 28, 30, 30, 28, 24, 20, 16},
            new int[]{10, 10, 10, 5, 0, 0, 0, 0, 0, 0, 5, 10});

    private final double[] highs;
    private final double[] lows;
    private final int[] precipitation;

    ClimateZone(double[] highs, double[] lows, int[] precipitation) {
        this.highs = highs;
        this.lows = lows;
        this.precipitation = precipitation;
    }

    /**
     * @param month 1-12
     */
    public double averageHigh(int month, boolean southern) {
        return highs[index(month, southern)];
    }

    public double averageLow(int month, boolean southern) {
        return lows[index(month, southern)];
    }

    public int precipitationChance(int month, boolean southern) {
        return precipitation[index(month, southern)];
    }

    private int index(int month, boolean southern) {
        int m = month - 1;
        if (southern) {
            m = (m + 6) % 12;
        }
        return m;
    }
}
