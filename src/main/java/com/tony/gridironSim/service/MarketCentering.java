package com.tony.gridironSim.service;

/**
 * Recale les scores simulés sur les lignes du marché. Les moyennes de marge et de total
 * deviennent celles du marché, la forme de la distribution (variance, queues) reste celle
 * de la simulation.
 */
final class MarketCentering {

    private static final double EPS = 1e-6;

    private MarketCentering() {
    }

    record CenteredScores(double[] home, double[] away) {

        double[] margins() {
            double[] m = new double[home.length];
            for (int i = 0; i < home.length; i++) m[i] = home[i] - away[i];
            return m;
        }

        double[] totals() {
            double[] t = new double[home.length];
            for (int i = 0; i < home.length; i++) t[i] = home[i] + away[i];
            return t;
        }
    }

    /**
     * @param spread ligne domicile (-3.5 = domicile favori de 3.5, marge visée +3.5)
     * @param alpha  poids du marché dans la cible, entre 0 et 1
     */
    static CenteredScores center(double[] homeScores, double[] awayScores, double spread, double total,
                                 double alpha, double minScale, double maxScale) {
        if (homeScores.length != awayScores.length) {
            throw new IllegalArgumentException("Distributions de tailles différentes : "
                    + homeScores.length + " / " + awayScores.length);
        }
        int n = homeScores.length;
        if (n == 0) {
            return new CenteredScores(new double[0], new double[0]);
        }

        double simTotal = mean(homeScores) + mean(awayScores);
        double simMargin = mean(homeScores) - mean(awayScores);
        double targetTotal = alpha * total + (1 - alpha) * simTotal;
        double targetMargin = alpha * -spread + (1 - alpha) * simMargin;

        // 1. Mise à l'échelle vers le total visé, bornée
        double scale = Math.max(minScale, Math.min(maxScale, targetTotal / Math.max(simTotal, EPS)));
        double[] home = new double[n];
        double[] away = new double[n];
        for (int i = 0; i < n; i++) {
            home[i] = homeScores[i] * scale;
            away[i] = awayScores[i] * scale;
        }

        // 2. Décalage commun : corrige le total sans toucher à la marge
        double c = (targetTotal - (mean(home) + mean(away))) / 2.0;
        // 3. Décalage opposé : corrige la marge sans toucher au total
        double d = (targetMargin - (mean(home) - mean(away))) / 2.0;
        for (int i = 0; i < n; i++) {
            home[i] = Math.max(0.0, home[i] + c + d);
            away[i] = Math.max(0.0, away[i] + c - d);
        }
        return new CenteredScores(home, away);
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.length == 0 ? 0.0 : sum / values.length;
    }
}
